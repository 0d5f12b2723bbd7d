package com.leaksentinel.core.detection;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.config.KernelType;
import libsvm.svm;
import libsvm.svm_print_interface;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tribuo.Example;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.anomaly.AnomalyFactory;
import org.tribuo.anomaly.Event;
import org.tribuo.anomaly.libsvm.LibSVMAnomalyTrainer;
import org.tribuo.anomaly.libsvm.SVMAnomalyType;
import org.tribuo.common.libsvm.SVMParameters;
import org.tribuo.datasource.ListDataSource;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trains a {@link OneClassSvmModel} with Tribuo's libsvm one-class trainer.
 *
 * <p>
 * The configured kernel, {@code nu}, {@code gamma}, {@code coef0} and
 * polynomial degree map onto the libsvm parameters, and the convergence
 * tolerance becomes the libsvm stopping tolerance {@code eps}.
 * </p>
 *
 * <h3>Iteration budget</h3>
 * <p>
 * libsvm runs its solver to the tolerance (or to its own iteration cap) and
 * reports the outcome only through its print hook. The trainer captures that
 * output for the duration of one fit and reads the iteration count, the
 * support vector count and {@code rho} from it. A fit that hit libsvm's cap,
 * or needed more iterations than {@code max_iterations}, is reported as not
 * converged; the boundary is kept either way.
 * </p>
 *
 * @since 1.0.0
 */
public class OneClassSvmTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(OneClassSvmTrainer.class);

    private static final Pattern ITERATIONS = Pattern.compile("#iter = (\\d+)");
    private static final Pattern RHO = Pattern.compile("rho = (\\S+)");
    private static final Pattern SUPPORT_VECTORS = Pattern.compile("nSV = (\\d+)");
    private static final String ITERATION_CAP_WARNING = "reaching max number of iterations";

    /** libsvm's print hook is global; fits take turns while they capture it. */
    private static final Object SOLVER_OUTPUT_LOCK = new Object();

    private static final svm_print_interface DEBUG_PRINTER = s -> {
        if (LOG.isDebugEnabled() && !s.isBlank()) {
            LOG.debug("libsvm: {}", s.trim());
        }
    };

    private final AnalysisConfig config;

    /**
     * @param config a validated configuration
     */
    public OneClassSvmTrainer(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @param x training points, one row per window; at least two rows
     * @return the trained model
     * @throws InsufficientTrainingDataException if fewer than two rows are given
     */
    public OneClassSvmModel train(double[][] x) {
        Objects.requireNonNull(x, "training data must not be null");
        int l = x.length;
        if (l < 2) {
            throw new InsufficientTrainingDataException(
                    "At least 2 training windows are required, got: " + l);
        }
        int dimension = x[0].length;
        double gamma = config.resolveGamma(dimension, variance(x));
        String[] names = featureNames(dimension);

        SVMParameters<Event> parameters = new SVMParameters<>(
                new SVMAnomalyType(SVMAnomalyType.SVMMode.ONE_CLASS), toLibSvm(config.kernelType()));
        parameters.setNu(config.getNu());
        parameters.setGamma(gamma);
        parameters.setCoeff(config.getCoef0());
        parameters.setDegree(config.getPolyDegree());
        parameters.getParameters().eps = config.getConvergenceTolerance();
        LibSVMAnomalyTrainer trainer = new LibSVMAnomalyTrainer(parameters);

        MutableDataset<Event> dataset = toDataset(x, names);
        StringBuilder output = new StringBuilder();
        Model<Event> model;
        synchronized (SOLVER_OUTPUT_LOCK) {
            svm.svm_set_print_string_function(output::append);
            try {
                model = trainer.train(dataset);
            } finally {
                svm.svm_set_print_string_function(DEBUG_PRINTER);
            }
        }

        String log = output.toString();
        int iterations = (int) parseNumber(ITERATIONS, log, -1);
        int svCount = (int) parseNumber(SUPPORT_VECTORS, log, -1);
        double rho = parseNumber(RHO, log, Double.NaN);
        int maxIterations = config.getMaxIterations();
        boolean converged = !log.contains(ITERATION_CAP_WARNING) && iterations <= maxIterations;

        TrainingSummary summary = new TrainingSummary(l, svCount, iterations, converged, gamma, rho);
        if (converged) {
            LOG.info("One-class SVM converged after {} iteration(s): {} support vector(s) of {}, rho={}",
                    iterations, svCount, l, rho);
        } else {
            LOG.warn("One-class SVM needed {} iteration(s), over the limit of {} at tolerance {};"
                    + " keeping the solver's boundary", iterations, maxIterations,
                    config.getConvergenceTolerance());
        }
        return new OneClassSvmModel(model, names, summary);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Variance of all entries of {@code x} taken together. */
    static double variance(double[][] x) {
        double[] pooled = new double[x.length * x[0].length];
        int k = 0;
        for (double[] row : x) {
            System.arraycopy(row, 0, pooled, k, row.length);
            k += row.length;
        }
        return new Variance(false).evaluate(pooled);
    }

    /** Zero-padded so that name order matches column order. */
    static String[] featureNames(int dimension) {
        String[] names = new String[dimension];
        for (int i = 0; i < dimension; i++) {
            names[i] = String.format(Locale.ROOT, "f%03d", i);
        }
        return names;
    }

    private static MutableDataset<Event> toDataset(double[][] x, String[] names) {
        AnomalyFactory factory = new AnomalyFactory();
        List<Example<Event>> examples = new ArrayList<>(x.length);
        for (double[] row : x) {
            examples.add(new ArrayExample<>(new Event(Event.EventType.EXPECTED), names, row));
        }
        SimpleDataSourceProvenance provenance = new SimpleDataSourceProvenance("reference windows", factory);
        return new MutableDataset<>(new ListDataSource<>(examples, factory, provenance));
    }

    private static org.tribuo.common.libsvm.KernelType toLibSvm(KernelType kernel) {
        switch (kernel) {
            case LINEAR:
                return org.tribuo.common.libsvm.KernelType.LINEAR;
            case POLY:
                return org.tribuo.common.libsvm.KernelType.POLY;
            case SIGMOID:
                return org.tribuo.common.libsvm.KernelType.SIGMOID;
            case RBF:
            default:
                return org.tribuo.common.libsvm.KernelType.RBF;
        }
    }

    private static double parseNumber(Pattern pattern, String log, double fallback) {
        Matcher matcher = pattern.matcher(log);
        double value = fallback;
        // libsvm prints one block per fit; the last match is the final one.
        while (matcher.find()) {
            try {
                value = Double.parseDouble(matcher.group(1).replaceAll(",$", ""));
            } catch (NumberFormatException e) {
                LOG.debug("Unparseable libsvm value '{}'", matcher.group(1));
            }
        }
        return value;
    }
}
