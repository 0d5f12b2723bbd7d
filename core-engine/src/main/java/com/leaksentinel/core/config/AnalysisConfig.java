package com.leaksentinel.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Flat configuration of one analysis run.
 *
 * <p>
 * Bound from JSON request bodies and YAML defaults using snake_case keys
 * ({@code window_size}, {@code n_clusters}, ...). Unknown keys are ignored and
 * missing keys keep their defaults:
 * </p>
 *
 * <pre>
 * kernel: rbf
 * nu: 0.05
 * gamma: auto
 * window_size: 400
 * n_clusters: 10
 * linkage: ward
 * variance_threshold: 0.1
 * correlation_threshold: 0.7
 * </pre>
 *
 * <p>
 * Enumerated options are held as strings, exactly as supplied, and exposed
 * through typed accessors such as {@link #kernelType()}. Call
 * {@link #validate()} before use; the typed accessors assume a valid
 * configuration.
 * </p>
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisConfig {

    public static final String GAMMA_AUTO = "auto";
    public static final String GAMMA_SCALE = "scale";

    private static final double WHOLE_MULTIPLE_TOLERANCE = 1e-9;

    // --- Boundary classifier ---
    private String kernel = "rbf";
    private double nu = 0.05;
    private String gamma = GAMMA_AUTO;
    private int polyDegree = 3;
    private double coef0 = 0.0;
    private double convergenceTolerance = 1e-3;
    private int maxIterations = 1000;

    // --- Feature extraction ---
    /** Window length in seconds. */
    private double windowSize = 400;

    /** Nominal grid spacing in seconds. */
    private double samplingRate = 2;
    private String interpolationMethod = "linear";
    private boolean normalize = true;
    private boolean removeOutliers = false;
    private double maxGapFraction = 0.5;
    private String trailingWindowPolicy = "pad";

    // --- Training set ---
    private double referenceFraction = 1.0;
    private int minTrainingWindows = 10;
    private int maxTrainingWindows = 2000;
    private boolean reuseCachedModel = false;

    // --- Cluster filter ---
    private int nClusters = 10;
    private String linkage = "ward";
    private String distanceMetric = "euclidean";
    private double significanceRatio = 0.5;
    private double densityRatio = 0.25;
    private double tieTolerance = 0.1;
    private String tieBreak = "leak";

    // --- Multi-source correlator ---
    private double varianceThreshold = 0.1;
    private double correlationThreshold = 0.7;
    private boolean timeAlignment = true;
    private int correlationHorizonWindows = 1;

    public AnalysisConfig() {
    }

    /**
     * @return an independent copy of this configuration
     */
    public AnalysisConfig copy() {
        AnalysisConfig c = new AnalysisConfig();
        c.kernel = kernel;
        c.nu = nu;
        c.gamma = gamma;
        c.polyDegree = polyDegree;
        c.coef0 = coef0;
        c.convergenceTolerance = convergenceTolerance;
        c.maxIterations = maxIterations;
        c.windowSize = windowSize;
        c.samplingRate = samplingRate;
        c.interpolationMethod = interpolationMethod;
        c.normalize = normalize;
        c.removeOutliers = removeOutliers;
        c.maxGapFraction = maxGapFraction;
        c.trailingWindowPolicy = trailingWindowPolicy;
        c.referenceFraction = referenceFraction;
        c.minTrainingWindows = minTrainingWindows;
        c.maxTrainingWindows = maxTrainingWindows;
        c.reuseCachedModel = reuseCachedModel;
        c.nClusters = nClusters;
        c.linkage = linkage;
        c.distanceMetric = distanceMetric;
        c.significanceRatio = significanceRatio;
        c.densityRatio = densityRatio;
        c.tieTolerance = tieTolerance;
        c.tieBreak = tieBreak;
        c.varianceThreshold = varianceThreshold;
        c.correlationThreshold = correlationThreshold;
        c.timeAlignment = timeAlignment;
        c.correlationHorizonWindows = correlationHorizonWindows;
        return c;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every option and report all violations at once.
     *
     * @throws InvalidConfigurationException if any option is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkEnum(errors, "kernel", kernel, KernelType::parse);
        checkEnum(errors, "interpolation_method", interpolationMethod, InterpolationMethod::parse);
        checkEnum(errors, "trailing_window_policy", trailingWindowPolicy, TrailingWindowPolicy::parse);
        checkEnum(errors, "linkage", linkage, LinkageMethod::parse);
        checkEnum(errors, "distance_metric", distanceMetric, DistanceMetricType::parse);
        checkEnum(errors, "tie_break", tieBreak, TieBreak::parse);

        if (!(nu > 0 && nu <= 0.5)) {
            errors.add("'nu' must be in (0, 0.5], got: " + nu);
        }
        if (!isGammaValid()) {
            errors.add("'gamma' must be 'auto', 'scale' or a positive number, got: " + gamma);
        }
        if (polyDegree < 1) {
            errors.add("'poly_degree' must be >= 1, got: " + polyDegree);
        }
        if (!Double.isFinite(coef0)) {
            errors.add("'coef0' must be finite, got: " + coef0);
        }
        if (!(convergenceTolerance > 0)) {
            errors.add("'convergence_tolerance' must be > 0, got: " + convergenceTolerance);
        }
        if (maxIterations < 1) {
            errors.add("'max_iterations' must be >= 1, got: " + maxIterations);
        }

        if (!(samplingRate > 0) || !Double.isFinite(samplingRate)) {
            errors.add("'sampling_rate' must be > 0, got: " + samplingRate);
        }
        if (!(windowSize > 0) || !Double.isFinite(windowSize)) {
            errors.add("'window_size' must be > 0, got: " + windowSize);
        } else if (samplingRate > 0 && windowSize < samplingRate) {
            errors.add("'window_size' (" + windowSize + ") must be >= 'sampling_rate' ("
                    + samplingRate + ")");
        } else if (samplingRate > 0 && !isWholeMultiple(windowSize, samplingRate)) {
            errors.add("'window_size' (" + windowSize + ") must be a whole multiple of 'sampling_rate' ("
                    + samplingRate + ")");
        }
        if (!(maxGapFraction > 0)) {
            errors.add("'max_gap_fraction' must be > 0, got: " + maxGapFraction);
        }

        if (!(referenceFraction > 0 && referenceFraction <= 1)) {
            errors.add("'reference_fraction' must be in (0, 1], got: " + referenceFraction);
        }
        if (minTrainingWindows < 2) {
            errors.add("'min_training_windows' must be >= 2, got: " + minTrainingWindows);
        }
        if (maxTrainingWindows < minTrainingWindows) {
            errors.add("'max_training_windows' (" + maxTrainingWindows
                    + ") must be >= 'min_training_windows' (" + minTrainingWindows + ")");
        }

        if (nClusters < 2) {
            errors.add("'n_clusters' must be >= 2, got: " + nClusters);
        }
        if ("ward".equalsIgnoreCase(trimmed(linkage)) && !"euclidean".equalsIgnoreCase(trimmed(distanceMetric))) {
            errors.add("'linkage' ward requires 'distance_metric' euclidean, got: " + distanceMetric);
        }
        if (!(significanceRatio >= 0 && significanceRatio <= 1)) {
            errors.add("'significance_ratio' must be in [0, 1], got: " + significanceRatio);
        }
        if (!(densityRatio > 0 && densityRatio <= 1)) {
            errors.add("'density_ratio' must be in (0, 1], got: " + densityRatio);
        }
        if (!(tieTolerance >= 0 && tieTolerance < 1)) {
            errors.add("'tie_tolerance' must be in [0, 1), got: " + tieTolerance);
        }

        if (!(varianceThreshold >= 0) || !Double.isFinite(varianceThreshold)) {
            errors.add("'variance_threshold' must be >= 0, got: " + varianceThreshold);
        }
        if (!(correlationThreshold >= 0 && correlationThreshold <= 1)) {
            errors.add("'correlation_threshold' must be in [0, 1], got: " + correlationThreshold);
        }
        if (correlationHorizonWindows < 0) {
            errors.add("'correlation_horizon_windows' must be >= 0, got: " + correlationHorizonWindows);
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(errors);
        }
    }

    private static void checkEnum(List<String> errors, String key, String value,
            Function<String, ?> parser) {
        try {
            parser.apply(value);
        } catch (IllegalArgumentException e) {
            errors.add("'" + key + "': " + e.getMessage());
        }
    }

    private static boolean isWholeMultiple(double value, double step) {
        double ratio = value / step;
        return Math.abs(ratio - Math.rint(ratio)) <= WHOLE_MULTIPLE_TOLERANCE * Math.max(1.0, ratio);
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    private boolean isGammaValid() {
        if (gamma == null) {
            return false;
        }
        String g = gamma.trim().toLowerCase(Locale.ROOT);
        if (g.equals(GAMMA_AUTO) || g.equals(GAMMA_SCALE)) {
            return true;
        }
        try {
            double value = Double.parseDouble(g);
            return value > 0 && Double.isFinite(value);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------

    public KernelType kernelType() {
        return KernelType.parse(kernel);
    }

    public InterpolationMethod interpolation() {
        return InterpolationMethod.parse(interpolationMethod);
    }

    public TrailingWindowPolicy trailingPolicy() {
        return TrailingWindowPolicy.parse(trailingWindowPolicy);
    }

    public LinkageMethod linkageMethod() {
        return LinkageMethod.parse(linkage);
    }

    public DistanceMetricType distanceMetricType() {
        return DistanceMetricType.parse(distanceMetric);
    }

    public TieBreak tieBreakRule() {
        return TieBreak.parse(tieBreak);
    }

    /**
     * Resolve {@code gamma} for a feature space of {@code dimension} whose
     * overall variance is {@code variance}.
     *
     * @param dimension number of features
     * @param variance  variance of all training values taken together
     * @return the kernel coefficient
     */
    public double resolveGamma(int dimension, double variance) {
        String g = gamma.trim().toLowerCase(Locale.ROOT);
        if (g.equals(GAMMA_AUTO)) {
            return 1.0 / dimension;
        }
        if (g.equals(GAMMA_SCALE)) {
            return variance > 0 ? 1.0 / (dimension * variance) : 1.0;
        }
        return Double.parseDouble(g);
    }

    /**
     * Number of grid points in one window. {@link #validate()} guarantees the
     * window is a whole number of sampling steps, so the rounding only absorbs
     * floating-point error.
     */
    public int pointsPerWindow() {
        return Math.max(1, (int) Math.round(windowSize / samplingRate));
    }

    /**
     * Signature of every option that influences the trained model. Two
     * configurations with equal signatures train identical boundaries on the
     * same data.
     *
     * @return stable textual signature
     */
    @JsonIgnore
    public String trainingSignature() {
        return String.join("|",
                trimmed(kernel), Double.toString(nu), trimmed(gamma), Integer.toString(polyDegree),
                Double.toString(coef0), Double.toString(convergenceTolerance),
                Integer.toString(maxIterations), Double.toString(windowSize),
                Double.toString(samplingRate), trimmed(interpolationMethod),
                Boolean.toString(normalize), Boolean.toString(removeOutliers),
                Double.toString(maxGapFraction), trimmed(trailingWindowPolicy),
                Double.toString(referenceFraction), Integer.toString(minTrainingWindows),
                Integer.toString(maxTrainingWindows));
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getKernel() {
        return kernel;
    }

    public void setKernel(String kernel) {
        this.kernel = kernel;
    }

    public double getNu() {
        return nu;
    }

    public void setNu(double nu) {
        this.nu = nu;
    }

    public String getGamma() {
        return gamma;
    }

    /**
     * Accepts {@code "auto"}, {@code "scale"} or a number (given either as a
     * JSON number or as text).
     *
     * @param gamma the gamma option
     */
    public void setGamma(Object gamma) {
        this.gamma = gamma == null ? null : gamma.toString();
    }

    public int getPolyDegree() {
        return polyDegree;
    }

    public void setPolyDegree(int polyDegree) {
        this.polyDegree = polyDegree;
    }

    public double getCoef0() {
        return coef0;
    }

    public void setCoef0(double coef0) {
        this.coef0 = coef0;
    }

    public double getConvergenceTolerance() {
        return convergenceTolerance;
    }

    public void setConvergenceTolerance(double convergenceTolerance) {
        this.convergenceTolerance = convergenceTolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(double windowSize) {
        this.windowSize = windowSize;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public void setSamplingRate(double samplingRate) {
        this.samplingRate = samplingRate;
    }

    public String getInterpolationMethod() {
        return interpolationMethod;
    }

    public void setInterpolationMethod(String interpolationMethod) {
        this.interpolationMethod = interpolationMethod;
    }

    public boolean isNormalize() {
        return normalize;
    }

    public void setNormalize(boolean normalize) {
        this.normalize = normalize;
    }

    public boolean isRemoveOutliers() {
        return removeOutliers;
    }

    public void setRemoveOutliers(boolean removeOutliers) {
        this.removeOutliers = removeOutliers;
    }

    public double getMaxGapFraction() {
        return maxGapFraction;
    }

    public void setMaxGapFraction(double maxGapFraction) {
        this.maxGapFraction = maxGapFraction;
    }

    public String getTrailingWindowPolicy() {
        return trailingWindowPolicy;
    }

    public void setTrailingWindowPolicy(String trailingWindowPolicy) {
        this.trailingWindowPolicy = trailingWindowPolicy;
    }

    public double getReferenceFraction() {
        return referenceFraction;
    }

    public void setReferenceFraction(double referenceFraction) {
        this.referenceFraction = referenceFraction;
    }

    public int getMinTrainingWindows() {
        return minTrainingWindows;
    }

    public void setMinTrainingWindows(int minTrainingWindows) {
        this.minTrainingWindows = minTrainingWindows;
    }

    public int getMaxTrainingWindows() {
        return maxTrainingWindows;
    }

    public void setMaxTrainingWindows(int maxTrainingWindows) {
        this.maxTrainingWindows = maxTrainingWindows;
    }

    public boolean isReuseCachedModel() {
        return reuseCachedModel;
    }

    public void setReuseCachedModel(boolean reuseCachedModel) {
        this.reuseCachedModel = reuseCachedModel;
    }

    @JsonProperty("n_clusters")
    public int getNClusters() {
        return nClusters;
    }

    @JsonProperty("n_clusters")
    public void setNClusters(int nClusters) {
        this.nClusters = nClusters;
    }

    public String getLinkage() {
        return linkage;
    }

    public void setLinkage(String linkage) {
        this.linkage = linkage;
    }

    public String getDistanceMetric() {
        return distanceMetric;
    }

    public void setDistanceMetric(String distanceMetric) {
        this.distanceMetric = distanceMetric;
    }

    public double getSignificanceRatio() {
        return significanceRatio;
    }

    public void setSignificanceRatio(double significanceRatio) {
        this.significanceRatio = significanceRatio;
    }

    public double getDensityRatio() {
        return densityRatio;
    }

    public void setDensityRatio(double densityRatio) {
        this.densityRatio = densityRatio;
    }

    public double getTieTolerance() {
        return tieTolerance;
    }

    public void setTieTolerance(double tieTolerance) {
        this.tieTolerance = tieTolerance;
    }

    public String getTieBreak() {
        return tieBreak;
    }

    public void setTieBreak(String tieBreak) {
        this.tieBreak = tieBreak;
    }

    public double getVarianceThreshold() {
        return varianceThreshold;
    }

    public void setVarianceThreshold(double varianceThreshold) {
        this.varianceThreshold = varianceThreshold;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public void setCorrelationThreshold(double correlationThreshold) {
        this.correlationThreshold = correlationThreshold;
    }

    public boolean isTimeAlignment() {
        return timeAlignment;
    }

    public void setTimeAlignment(boolean timeAlignment) {
        this.timeAlignment = timeAlignment;
    }

    public int getCorrelationHorizonWindows() {
        return correlationHorizonWindows;
    }

    public void setCorrelationHorizonWindows(int correlationHorizonWindows) {
        this.correlationHorizonWindows = correlationHorizonWindows;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisConfig that))
            return false;
        return toString().equals(that.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toString());
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "kernel='" + kernel + '\'' +
                ", nu=" + nu +
                ", gamma='" + gamma + '\'' +
                ", polyDegree=" + polyDegree +
                ", coef0=" + coef0 +
                ", convergenceTolerance=" + convergenceTolerance +
                ", maxIterations=" + maxIterations +
                ", windowSize=" + windowSize +
                ", samplingRate=" + samplingRate +
                ", interpolationMethod='" + interpolationMethod + '\'' +
                ", normalize=" + normalize +
                ", removeOutliers=" + removeOutliers +
                ", maxGapFraction=" + maxGapFraction +
                ", trailingWindowPolicy='" + trailingWindowPolicy + '\'' +
                ", referenceFraction=" + referenceFraction +
                ", minTrainingWindows=" + minTrainingWindows +
                ", maxTrainingWindows=" + maxTrainingWindows +
                ", reuseCachedModel=" + reuseCachedModel +
                ", nClusters=" + nClusters +
                ", linkage='" + linkage + '\'' +
                ", distanceMetric='" + distanceMetric + '\'' +
                ", significanceRatio=" + significanceRatio +
                ", densityRatio=" + densityRatio +
                ", tieTolerance=" + tieTolerance +
                ", tieBreak='" + tieBreak + '\'' +
                ", varianceThreshold=" + varianceThreshold +
                ", correlationThreshold=" + correlationThreshold +
                ", timeAlignment=" + timeAlignment +
                ", correlationHorizonWindows=" + correlationHorizonWindows +
                '}';
    }
}
