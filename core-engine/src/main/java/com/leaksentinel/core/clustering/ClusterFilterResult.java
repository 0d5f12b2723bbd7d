package com.leaksentinel.core.clustering;

import com.leaksentinel.core.model.AnomalyCluster;
import com.leaksentinel.core.model.ClusterLabel;

import java.util.List;

/**
 * Cluster membership and labels produced by {@link ClusterFilter}.
 *
 * @since 1.0.0
 */
public final class ClusterFilterResult {

    private final int[] assignments;
    private final List<AnomalyCluster> clusters;

    ClusterFilterResult(int[] assignments, List<AnomalyCluster> clusters) {
        this.assignments = assignments;
        this.clusters = List.copyOf(clusters);
    }

    /**
     * @param candidate position of the candidate in the filtered list
     * @return cluster id of that candidate
     */
    public int clusterOf(int candidate) {
        return assignments[candidate];
    }

    public ClusterLabel labelOf(int candidate) {
        return clusters.get(assignments[candidate]).getLabel();
    }

    public int size() {
        return assignments.length;
    }

    /**
     * @return clusters indexed by id
     */
    public List<AnomalyCluster> getClusters() {
        return clusters;
    }
}
