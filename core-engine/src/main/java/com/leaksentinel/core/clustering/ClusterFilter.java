package com.leaksentinel.core.clustering;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.config.TieBreak;
import com.leaksentinel.core.model.AnomalyCluster;
import com.leaksentinel.core.model.Candidate;
import com.leaksentinel.core.model.ClusterLabel;
import com.leaksentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Second stage: groups candidates by similarity and labels whole groups.
 *
 * <h3>Clustering space</h3>
 * <p>
 * Candidates are compared on their reference-standardized features passed
 * through {@code sign(x) * log(1 + |x|)}. Without the compression a few
 * extreme windows dominate the distances and everything else collapses into
 * one group.
 * </p>
 *
 * <h3>Decision rule</h3>
 * <p>
 * A cluster is {@link ClusterLabel#LEAK} when both hold:
 * </p>
 * <ul>
 * <li>its mean {@code |score|} exceeds {@code significance_ratio} times the
 * largest {@code |score|} among all candidates, and</li>
 * <li>its share of occurrences is below {@code density_ratio}.</li>
 * </ul>
 * <p>
 * An occurrence is a maximal run of time-adjacent windows of one pipeline, so
 * a long leak spanning many windows counts once. A cluster that misses only
 * by a relative margin within {@code tie_tolerance} is a tie and takes the
 * configured tie-break label; otherwise it is {@link ClusterLabel#OPERATIONAL}.
 * </p>
 *
 * <p>
 * Labels apply per cluster, not per window. A flagged leak window whose
 * features group it with operational windows, or whose cluster's mean
 * {@code |score|} stays under a threshold set by the single strongest
 * candidate, is reclassified with its cluster. Leak detection is judged per
 * event, and an event stays detected while any of its windows remains a true
 * anomaly.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusterFilter {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterFilter.class);

    private final AnalysisConfig config;
    private final AgglomerativeClusterer clusterer;

    /**
     * @param config a validated configuration
     */
    public ClusterFilter(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clusterer = new AgglomerativeClusterer(config.linkageMethod(), config.distanceMetricType());
    }

    /**
     * @param candidates flagged windows; may be empty
     * @return membership and label of every candidate
     * @throws IllegalStateException if a candidate ends up without a cluster
     */
    public ClusterFilterResult apply(List<Candidate> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        int n = candidates.size();
        if (n == 0) {
            return new ClusterFilterResult(new int[0], List.of());
        }

        double[][] points = new double[n][];
        for (int i = 0; i < n; i++) {
            points[i] = compress(candidates.get(i).getStandardized().toArray());
        }
        int[] assignments = clusterer.fit(points, config.getNClusters());
        if (assignments.length != n) {
            throw new IllegalStateException("Clustering assigned " + assignments.length
                    + " of " + n + " candidates");
        }
        int clusterCount = Arrays.stream(assignments).max().orElse(-1) + 1;

        int[] occurrences = countOccurrences(candidates, assignments, clusterCount);
        int totalOccurrences = countOccurrences(candidates, new int[n], 1)[0];

        double maxMagnitude = 0;
        double[] magnitudeSum = new double[clusterCount];
        int[] sizes = new int[clusterCount];
        for (int i = 0; i < n; i++) {
            double magnitude = Math.abs(candidates.get(i).getScore());
            maxMagnitude = Math.max(maxMagnitude, magnitude);
            magnitudeSum[assignments[i]] += magnitude;
            sizes[assignments[i]]++;
        }

        List<AnomalyCluster> clusters = new ArrayList<>(clusterCount);
        for (int c = 0; c < clusterCount; c++) {
            if (sizes[c] == 0) {
                throw new IllegalStateException("Cluster " + c + " has no members");
            }
            double meanMagnitude = magnitudeSum[c] / sizes[c];
            double share = (double) occurrences[c] / totalOccurrences;
            clusters.add(decide(c, sizes[c], occurrences[c], share, meanMagnitude, maxMagnitude));
        }

        long leakClusters = clusters.stream().filter(c -> c.getLabel() == ClusterLabel.LEAK).count();
        LOG.info("Cluster filter: {} candidate(s) in {} cluster(s), {} labelled leak",
                n, clusterCount, leakClusters);
        return new ClusterFilterResult(assignments, clusters);
    }

    AnomalyCluster decide(int id, int size, int occurrences, double share, double meanMagnitude,
            double maxMagnitude) {
        double significanceThreshold = config.getSignificanceRatio() * maxMagnitude;
        double densityThreshold = config.getDensityRatio();
        double tolerance = config.getTieTolerance();

        boolean significant = meanMagnitude > significanceThreshold;
        boolean sparse = share < densityThreshold;

        ClusterLabel label;
        boolean tie = false;
        if (significant && sparse) {
            label = ClusterLabel.LEAK;
        } else {
            boolean significanceClose = significant
                    || meanMagnitude >= significanceThreshold * (1 - tolerance);
            boolean densityClose = sparse || share < densityThreshold * (1 + tolerance);
            tie = tolerance > 0 && significanceClose && densityClose;
            if (tie) {
                label = config.tieBreakRule() == TieBreak.LEAK ? ClusterLabel.LEAK : ClusterLabel.OPERATIONAL;
            } else {
                label = ClusterLabel.OPERATIONAL;
            }
        }

        LOG.debug("Cluster {}: size={} occurrences={} share={} mean|score|={} (threshold {}) -> {}{}",
                id, size, occurrences, share, meanMagnitude, significanceThreshold, label,
                tie ? " (tie)" : "");
        return new AnomalyCluster(id, label, size, occurrences, share, meanMagnitude, tie);
    }

    /**
     * Count maximal runs of time-adjacent member windows per cluster.
     */
    static int[] countOccurrences(List<Candidate> candidates, int[] assignments, int clusterCount) {
        Map<String, Integer> pipelineOrder = new HashMap<>();
        for (Candidate c : candidates) {
            pipelineOrder.putIfAbsent(c.getWindow().getPipelineId(), pipelineOrder.size());
        }
        Integer[] order = new Integer[candidates.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator
                .<Integer>comparingInt(i -> pipelineOrder.get(candidates.get(i).getWindow().getPipelineId()))
                .thenComparingInt(i -> candidates.get(i).getWindow().getIndex()));

        int[] counts = new int[clusterCount];
        Window[] previous = new Window[clusterCount];
        for (int i : order) {
            int c = assignments[i];
            Window w = candidates.get(i).getWindow();
            Window p = previous[c];
            if (p == null || !p.getPipelineId().equals(w.getPipelineId()) || w.getIndex() != p.getIndex() + 1) {
                counts[c]++;
            }
            previous[c] = w;
        }
        return counts;
    }

    static double[] compress(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.signum(values[i]) * Math.log1p(Math.abs(values[i]));
        }
        return out;
    }
}
