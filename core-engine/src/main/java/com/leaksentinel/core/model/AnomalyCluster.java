package com.leaksentinel.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * Summary of one candidate cluster and the label it received.
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class AnomalyCluster {

    private final int id;
    private final ClusterLabel label;
    private final int size;
    private final int occurrences;
    private final double occurrenceShare;
    private final double meanScoreMagnitude;
    private final boolean tie;

    /**
     * @param id                 cluster id, assigned in order of first member
     * @param label              the decision for the cluster
     * @param size               number of member candidates
     * @param occurrences        number of distinct time-contiguous runs
     * @param occurrenceShare    {@code occurrences} over all candidate runs
     * @param meanScoreMagnitude mean {@code |score|} of the members
     * @param tie                whether the label came from the tie-break
     */
    public AnomalyCluster(int id, ClusterLabel label, int size, int occurrences,
            double occurrenceShare, double meanScoreMagnitude, boolean tie) {
        this.id = id;
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.size = size;
        this.occurrences = occurrences;
        this.occurrenceShare = occurrenceShare;
        this.meanScoreMagnitude = meanScoreMagnitude;
        this.tie = tie;
    }

    public int getId() {
        return id;
    }

    public ClusterLabel getLabel() {
        return label;
    }

    public int getSize() {
        return size;
    }

    public int getOccurrences() {
        return occurrences;
    }

    public double getOccurrenceShare() {
        return occurrenceShare;
    }

    public double getMeanScoreMagnitude() {
        return meanScoreMagnitude;
    }

    public boolean isTie() {
        return tie;
    }

    @Override
    public String toString() {
        return "AnomalyCluster{" +
                "id=" + id +
                ", label=" + label +
                ", size=" + size +
                ", occurrences=" + occurrences +
                ", meanScoreMagnitude=" + meanScoreMagnitude +
                ", tie=" + tie +
                '}';
    }
}
