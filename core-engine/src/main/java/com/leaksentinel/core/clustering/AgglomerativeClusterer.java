package com.leaksentinel.core.clustering;

import com.leaksentinel.core.config.DistanceMetricType;
import com.leaksentinel.core.config.LinkageMethod;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Bottom-up hierarchical clustering with a flat cut into a fixed number of
 * groups.
 *
 * <p>
 * The dendrogram is built with the nearest-neighbour-chain algorithm, which
 * is exact for the ward, complete, average and single linkages, updating
 * inter-cluster distances with the Lance-Williams formulas. Cutting applies
 * the {@code n - k} lowest merges. Results depend only on the input order:
 * equal distances resolve to the lowest point index and cluster ids are
 * numbered by first member.
 * </p>
 *
 * @since 1.0.0
 */
public class AgglomerativeClusterer {

    /** Largest array the JVM reliably allocates. */
    static final long MAX_CONDENSED_SIZE = Integer.MAX_VALUE - 8;

    private final LinkageMethod linkage;
    private final DistanceMetricType metric;

    public AgglomerativeClusterer(LinkageMethod linkage, DistanceMetricType metric) {
        this.linkage = Objects.requireNonNull(linkage, "linkage must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (linkage == LinkageMethod.WARD && metric != DistanceMetricType.EUCLIDEAN) {
            throw new IllegalArgumentException("Ward linkage requires the euclidean metric, got: "
                    + metric.configName());
        }
    }

    /**
     * @param points   one row per point
     * @param clusters requested number of groups; capped at the point count
     * @return cluster id per point, ids in {@code [0, min(clusters, n))}
     * @throws IllegalArgumentException if there are too many points for a
     *                                  pairwise distance matrix
     */
    public int[] fit(double[][] points, int clusters) {
        Objects.requireNonNull(points, "points must not be null");
        if (clusters < 1) {
            throw new IllegalArgumentException("clusters must be >= 1, got: " + clusters);
        }
        int n = points.length;
        if (n == 0) {
            return new int[0];
        }
        int k = Math.min(clusters, n);
        List<Merge> merges = n > 1 ? buildDendrogram(points) : List.of();
        return cut(n, merges, k);
    }

    // ---------------------------------------------------------------
    // Dendrogram
    // ---------------------------------------------------------------

    List<Merge> buildDendrogram(double[][] points) {
        int n = points.length;
        CondensedMatrix d = new CondensedMatrix(n);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                d.set(i, j, DistanceMetrics.distance(metric, points[i], points[j]));
            }
        }

        int[] size = new int[n];
        Arrays.fill(size, 1);
        boolean[] active = new boolean[n];
        Arrays.fill(active, true);
        int remaining = n;

        List<Merge> merges = new ArrayList<>(n - 1);
        int[] chain = new int[n];
        int chainLength = 0;

        while (remaining > 1) {
            if (chainLength == 0) {
                chain[chainLength++] = firstActive(active);
            }
            while (true) {
                int a = chain[chainLength - 1];
                int prev = chainLength > 1 ? chain[chainLength - 2] : -1;
                int best = prev;
                double bestDistance = prev >= 0 ? d.get(a, prev) : Double.POSITIVE_INFINITY;
                for (int c = 0; c < n; c++) {
                    if (!active[c] || c == a) {
                        continue;
                    }
                    double dc = d.get(a, c);
                    if (dc < bestDistance) {
                        bestDistance = dc;
                        best = c;
                    }
                }
                if (best == prev && prev >= 0) {
                    break;
                }
                chain[chainLength++] = best;
            }

            int a = chain[--chainLength];
            int b = chain[--chainLength];
            int i = Math.min(a, b);
            int j = Math.max(a, b);
            double dij = d.get(i, j);
            merges.add(new Merge(dij, i, j));

            int ni = size[i];
            int nj = size[j];
            for (int c = 0; c < n; c++) {
                if (!active[c] || c == i || c == j) {
                    continue;
                }
                d.set(c, i, update(d.get(c, i), d.get(c, j), dij, ni, nj, size[c]));
            }
            active[j] = false;
            size[i] = ni + nj;
            remaining--;
        }
        return merges;
    }

    /** Lance-Williams distance from cluster {@code k} to the union of i and j. */
    private double update(double dki, double dkj, double dij, int ni, int nj, int nk) {
        return switch (linkage) {
            case WARD -> Math.sqrt(Math.max(0.0,
                    ((ni + nk) * dki * dki + (nj + nk) * dkj * dkj - nk * dij * dij) / (ni + nj + nk)));
            case COMPLETE -> Math.max(dki, dkj);
            case SINGLE -> Math.min(dki, dkj);
            case AVERAGE -> (ni * dki + nj * dkj) / (ni + nj);
        };
    }

    private static int firstActive(boolean[] active) {
        for (int i = 0; i < active.length; i++) {
            if (active[i]) {
                return i;
            }
        }
        throw new IllegalStateException("No active cluster left");
    }

    // ---------------------------------------------------------------
    // Flat cut
    // ---------------------------------------------------------------

    static int[] cut(int n, List<Merge> merges, int k) {
        Integer[] order = new Integer[merges.size()];
        for (int m = 0; m < order.length; m++) {
            order[m] = m;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(m -> merges.get(m).height)
                .thenComparingInt(m -> m));

        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (int m = 0; m < n - k; m++) {
            Merge merge = merges.get(order[m]);
            int ri = find(parent, merge.left);
            int rj = find(parent, merge.right);
            parent[rj] = ri;
        }

        int[] rootIds = new int[n];
        Arrays.fill(rootIds, -1);
        int[] labels = new int[n];
        int next = 0;
        for (int x = 0; x < n; x++) {
            int root = find(parent, x);
            if (rootIds[root] < 0) {
                rootIds[root] = next++;
            }
            labels[x] = rootIds[root];
        }
        return labels;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * @return number of entries in the condensed distance matrix of
     *         {@code n} points
     * @throws IllegalArgumentException if it exceeds the largest array size
     */
    static int condensedSize(int n) {
        long size = (long) n * (n - 1) / 2;
        if (size > MAX_CONDENSED_SIZE) {
            throw new IllegalArgumentException("Too many points to cluster: " + n
                    + " points need " + size + " pairwise distances, at most "
                    + MAX_CONDENSED_SIZE + " are supported");
        }
        return (int) size;
    }

    /** Upper triangle of a symmetric matrix without its diagonal. */
    private static final class CondensedMatrix {

        private final int n;
        private final double[] values;

        CondensedMatrix(int n) {
            this.n = n;
            this.values = new double[condensedSize(n)];
        }

        double get(int i, int j) {
            return values[index(i, j)];
        }

        void set(int i, int j, double v) {
            values[index(i, j)] = v;
        }

        private int index(int i, int j) {
            int a = Math.min(i, j);
            int b = Math.max(i, j);
            return (int) ((long) n * a - (long) a * (a + 1) / 2 + (b - a - 1));
        }
    }
}
