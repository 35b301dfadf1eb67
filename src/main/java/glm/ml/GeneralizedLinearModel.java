package glm.ml;

import glm.ml.RobustStandardErrors.CovarianceType;
import glm.ml.distribution.Distribution;
import glm.ml.distribution.GaussianDistribution;
import glm.ml.distribution.PoissonDistribution;
import glm.ml.link.IdentityLinkFunction;
import glm.ml.link.LinkFunction;
import glm.ml.link.LogLinkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Generalized linear model fitted by Iteratively Reweighted Least Squares (IRLS).
 * <p>
 * Model: g(E[y]) = Xβ, with y drawn from an exponential-family {@link Distribution} and g its link.
 * <p>
 * Each iteration linearises the link around the current mean μ:
 * <pre>
 *   z = g(μ) + g'(μ)·(y − μ)             working response
 *   w = priorWeight / (g'(μ)²·V(μ))      working weight
 *   β = (XᵗWX)⁻¹XᵗWz                     weighted least squares
 *   μ = g⁻¹(Xβ)
 * </pre>
 * and stops once the deviance changes by less than the configured tolerance.
 * The fit happens once, in the constructor; the model is immutable afterwards.
 */
public class GeneralizedLinearModel {

    private static final Logger log = LoggerFactory.getLogger(GeneralizedLinearModel.class);

    private final Distribution distribution;
    private final double[][] design;
    private final double[] response;
    private final double[] weights;
    private final int observationCount;
    private final int variableCount;
    private final int degreesOfFreedom;

    private final double[] coefficients;
    private final double[] linearPredictor;
    private final double[] fittedValues;
    private final double[] residuals;
    private final double[] responseResiduals;
    private final double sumSquaredErrors;
    private final double deviance;
    private final double logLikelihood;
    private final int iterations;
    private final boolean converged;
    private final RobustStandardErrors standardErrors;

    /** Gaussian family, identity link, no intercept. */
    public GeneralizedLinearModel(double[][] design, double[] response, double[] weights) {
        this(design, response, weights, null, false);
    }

    public GeneralizedLinearModel(double[][] design, double[] response, double[] weights,
                                  Distribution distribution) {
        this(design, response, weights, distribution, false);
    }

    public GeneralizedLinearModel(double[][] design, double[] response, double[] weights,
                                  Distribution distribution, boolean addConstant) {
        this(design, response, weights, distribution, addConstant, IrlsSettings.defaults());
    }

    /**
     * Fit the model.
     *
     * @param design       rows = observations, columns = variables (no intercept column)
     * @param response     response vector, one per row
     * @param weights      non-negative prior weights, one per row
     * @param distribution family and link; Gaussian/identity when null
     * @param addConstant  prepend a column of 1.0 for an intercept
     * @param settings     iteration cap, tolerances and failure policies
     * @throws DimensionMismatchException if design rows, response and weights differ in length, or rows are ragged
     * @throws EmptyInputException if the design has no rows
     * @throws DomainException if a weight is negative or degrees of freedom would not be positive
     * @throws SingularDesignException if the weighted design is rank deficient and no fallback is enabled
     * @throws NonConvergenceException if IRLS hits the iteration cap and the settings require convergence
     */
    public GeneralizedLinearModel(double[][] design, double[] response, double[] weights,
                                  Distribution distribution, boolean addConstant, IrlsSettings settings) {
        if (design == null || response == null || weights == null) {
            throw new IllegalArgumentException("design, response and weights must be non-null");
        }
        if (design.length != response.length) {
            throw DimensionMismatchException.of("design", design.length, "response", response.length);
        }
        if (weights.length != response.length) {
            throw DimensionMismatchException.of("weights", weights.length, "response", response.length);
        }
        if (design.length == 0) {
            throw new EmptyInputException("Design matrix has no rows");
        }
        Vectors.requireValidWeights(weights);

        this.distribution = distribution == null ? new GaussianDistribution() : distribution;
        this.design = copyDesign(design, addConstant);
        this.response = response.clone();
        this.weights = weights.clone();
        this.observationCount = this.design.length;
        this.variableCount = this.design[0].length;
        this.degreesOfFreedom = observationCount - variableCount;
        if (degreesOfFreedom <= 0) {
            throw new DomainException("Degrees of freedom must be positive: " + observationCount
                + " observations, " + variableCount + " variables");
        }

        LinkFunction link = this.distribution.getLinkFunction();
        WeightedLeastSquares wls = new WeightedLeastSquares(settings.isPseudoInverseFallback());

        double[] mean = this.distribution.initialMean(this.response);
        double currentDeviance = this.distribution.deviance(this.response, mean, this.weights, 1.0);
        double[] beta = new double[variableCount];
        double[] eta = this.distribution.predict(mean);
        double change = Double.NaN;
        int iteration = 0;
        boolean done = false;

        while (!done && iteration < settings.getMaxIterations()) {
            iteration++;
            double[] predicted = this.distribution.predict(mean);
            double[] derivative = link.firstDerivative(mean);
            double[] working = new double[observationCount];
            for (int i = 0; i < observationCount; i++) {
                working[i] = predicted[i] + derivative[i] * (this.response[i] - mean[i]);
            }
            double[] workingWeights = Vectors.multiply(this.distribution.weight(mean), this.weights);

            beta = wls.solve(this.design, working, workingWeights);
            eta = Vectors.product(this.design, beta);
            mean = this.distribution.fit(eta);

            double nextDeviance = this.distribution.deviance(this.response, mean, this.weights, 1.0);
            change = Math.abs(nextDeviance - currentDeviance);
            log.debug("IRLS iteration {}: deviance={} change={}", iteration, nextDeviance, change);
            currentDeviance = nextDeviance;
            done = change <= settings.getAbsoluteTolerance()
                || change / Math.max(Math.abs(nextDeviance), Double.MIN_NORMAL) <= settings.getTolerance();
        }

        if (!done) {
            if (settings.isFailOnNonConvergence()) {
                throw new NonConvergenceException(beta, iteration, change);
            }
            log.warn("IRLS did not converge after {} iterations (last deviance change {}); keeping last estimate",
                iteration, change);
        }

        this.iterations = iteration;
        this.converged = done;
        this.coefficients = beta;
        this.linearPredictor = eta;
        this.fittedValues = mean;
        this.deviance = currentDeviance;

        this.residuals = new double[observationCount];
        this.responseResiduals = new double[observationCount];
        double sse = 0.0;
        for (int i = 0; i < observationCount; i++) {
            residuals[i] = this.response[i] - linearPredictor[i];
            responseResiduals[i] = this.response[i] - fittedValues[i];
            sse += residuals[i] * residuals[i];
        }
        this.sumSquaredErrors = sse;
        this.logLikelihood = this.distribution.logLikelihood(this.response, fittedValues, this.weights, 1.0);
        this.standardErrors = new RobustStandardErrors(this.design, residuals, settings.isPseudoInverseFallback());

        log.info("Fitted {} in {} iterations: deviance={}, SSE={}", this.distribution, iterations, deviance, sse);
    }

    /** Gaussian family with identity link and an intercept; every weight 1. */
    public static GeneralizedLinearModel ordinaryLeastSquares(double[][] design, double[] response) {
        if (response == null) {
            throw new IllegalArgumentException("response must be non-null");
        }
        return weightedLeastSquares(design, response, Vectors.ones(response.length));
    }

    /** Gaussian family with identity link and an intercept. */
    public static GeneralizedLinearModel weightedLeastSquares(double[][] design, double[] response, double[] weights) {
        return new GeneralizedLinearModel(design, response, weights,
            new GaussianDistribution(new IdentityLinkFunction()), true);
    }

    /** Poisson family with log link and an intercept. */
    public static GeneralizedLinearModel poissonRegression(double[][] design, double[] response, double[] weights) {
        return new GeneralizedLinearModel(design, response, weights,
            new PoissonDistribution(new LogLinkFunction()), true);
    }

    private static double[][] copyDesign(double[][] design, boolean addConstant) {
        for (int i = 0; i < design.length; i++) {
            if (design[i] == null) {
                throw new IllegalArgumentException("design[" + i + "] must be non-null");
            }
        }
        int columns = design[0].length;
        int offset = addConstant ? 1 : 0;
        double[][] copy = new double[design.length][];
        for (int i = 0; i < design.length; i++) {
            if (design[i].length != columns) {
                throw DimensionMismatchException.of("design[0]", columns, "design[" + i + "]", design[i].length);
            }
            copy[i] = new double[columns + offset];
            if (addConstant) copy[i][0] = 1.0;
            System.arraycopy(design[i], 0, copy[i], offset, columns);
        }
        return copy;
    }

    /**
     * Linear predictor xᵗβ for one observation. The observation must include the
     * leading 1.0 when the model was fitted with an intercept.
     */
    public double evaluate(double[] observation) {
        if (observation.length != coefficients.length) {
            throw DimensionMismatchException.of("observation", observation.length, "coefficients", coefficients.length);
        }
        return Vectors.dot(coefficients, observation);
    }

    /** Mean response g⁻¹(xᵗβ) for one observation. */
    public double predictMean(double[] observation) {
        return distribution.getLinkFunction().inverse(evaluate(observation));
    }

    public Distribution getDistribution() { return distribution; }
    public int getObservationCount() { return observationCount; }
    /** Number of columns of the fitted design, including the intercept column if one was added. */
    public int getVariableCount() { return variableCount; }
    public int getDegreesOfFreedom() { return degreesOfFreedom; }
    public double[] getCoefficients() { return coefficients.clone(); }
    public double getSumSquaredErrors() { return sumSquaredErrors; }
    public double getMeanSquaredError() { return sumSquaredErrors / degreesOfFreedom; }
    public double getRootMeanSquaredError() { return Math.sqrt(getMeanSquaredError()); }
    public double getDeviance() { return deviance; }
    public double getLogLikelihood() { return logLikelihood; }
    public int getIterations() { return iterations; }
    public boolean isConverged() { return converged; }
    public double[] getFittedValues() { return fittedValues.clone(); }
    public double[] getLinearPredictor() { return linearPredictor.clone(); }
    /** y − Xβ, one per observation; SSE and the standard errors are built on these. */
    public double[] getResiduals() { return residuals.clone(); }
    /** y − μ̂ on the response scale. Equal to {@link #getResiduals()} for the identity link. */
    public double[] getResponseResiduals() { return responseResiduals.clone(); }

    /** Copy of the fitted design, including the intercept column if one was added. */
    public double[][] getDesign() {
        return Arrays.stream(design).map(double[]::clone).toArray(double[][]::new);
    }

    public double[] getStandardErrorsOls() { return standardErrors.getStandardErrors(CovarianceType.OLS); }
    public double[] getStandardErrorsHC0() { return standardErrors.getStandardErrors(CovarianceType.HC0); }
    public double[] getStandardErrorsHC1() { return standardErrors.getStandardErrors(CovarianceType.HC1); }
    public double[] getVarianceOls() { return standardErrors.getVariance(CovarianceType.OLS); }
    public double[] getVarianceHC0() { return standardErrors.getVariance(CovarianceType.HC0); }
    public double[] getVarianceHC1() { return standardErrors.getVariance(CovarianceType.HC1); }

    /** Full coefficient covariance matrix for the given estimator. */
    public double[][] getCovariance(CovarianceType type) { return standardErrors.getCovariance(type); }

    @Override
    public String toString() {
        double[] ols = getStandardErrorsOls();
        double[] hc0 = getStandardErrorsHC0();
        double[] hc1 = getStandardErrorsHC1();
        StringBuilder sb = new StringBuilder();
        sb.append(distribution).append('\n');
        sb.append("N: ").append(observationCount).append('\n');
        sb.append("K: ").append(variableCount).append('\n');
        sb.append("df: ").append(degreesOfFreedom).append('\n');
        sb.append("Iterations: ").append(iterations).append(converged ? "" : " (not converged)").append('\n');
        sb.append("Deviance: ").append(deviance).append('\n');
        sb.append("SSE: ").append(sumSquaredErrors).append('\n');
        sb.append("MSE: ").append(getMeanSquaredError()).append('\n');
        sb.append("Root MSE: ").append(getRootMeanSquaredError()).append('\n');
        for (int i = 0; i < coefficients.length; i++) {
            sb.append(String.format("B[%d]: %.6f (SE: %.6f) (HC0: %.6f) (HC1: %.6f)%n",
                i, coefficients[i], ols[i], hc0[i], hc1[i]));
        }
        return sb.toString();
    }
}
