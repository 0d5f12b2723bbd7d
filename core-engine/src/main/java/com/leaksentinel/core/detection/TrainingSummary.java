package com.leaksentinel.core.detection;

/**
 * Outcome of one solver run.
 *
 * @since 1.0.0
 */
public final class TrainingSummary {

    private final int trainingWindows;
    private final int supportVectors;
    private final int iterations;
    private final boolean converged;
    private final double gamma;
    private final double rho;

    public TrainingSummary(int trainingWindows, int supportVectors, int iterations,
            boolean converged, double gamma, double rho) {
        this.trainingWindows = trainingWindows;
        this.supportVectors = supportVectors;
        this.iterations = iterations;
        this.converged = converged;
        this.gamma = gamma;
        this.rho = rho;
    }

    public int getTrainingWindows() {
        return trainingWindows;
    }

    public int getSupportVectors() {
        return supportVectors;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * @return {@code false} if the iteration limit stopped the solver before
     *         the optimality gap fell below the tolerance
     */
    public boolean isConverged() {
        return converged;
    }

    public double getGamma() {
        return gamma;
    }

    public double getRho() {
        return rho;
    }

    @Override
    public String toString() {
        return "TrainingSummary{" +
                "trainingWindows=" + trainingWindows +
                ", supportVectors=" + supportVectors +
                ", iterations=" + iterations +
                ", converged=" + converged +
                ", gamma=" + gamma +
                ", rho=" + rho +
                '}';
    }
}
