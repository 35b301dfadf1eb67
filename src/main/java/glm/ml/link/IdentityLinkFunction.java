package glm.ml.link;

import glm.ml.Vectors;

/** g(μ) = μ. Canonical link of the Gaussian family. */
public final class IdentityLinkFunction implements LinkFunction {

    @Override
    public double evaluate(double mean) { return mean; }

    @Override
    public double inverse(double linearPredictor) { return linearPredictor; }

    @Override
    public double firstDerivative(double x) { return 1.0; }

    @Override
    public double secondDerivative(double x) { return 0.0; }

    /**
     * Concentrated Gaussian log-likelihood with the variance profiled out:
     * −n/2·(ln SSE + 1 + ln(π/(n/2))). Weights and scale are validated but do not enter.
     * An exact fit (SSE = 0) has unbounded likelihood and returns {@link Double#POSITIVE_INFINITY}.
     */
    @Override
    public double logLikelihood(double[] response, double[] fitted, double[] weights, double scale) {
        Vectors.requireSameLength(new String[] {"response", "fitted", "weights"}, response, fitted, weights);
        Vectors.requirePositiveScale(scale);
        double sumSquaredErrors = 0.0;
        for (int i = 0; i < response.length; i++) {
            double error = response[i] - fitted[i];
            sumSquaredErrors += error * error;
        }
        if (sumSquaredErrors == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        double halfObs = 0.5 * response.length;
        return -halfObs * (Math.log(sumSquaredErrors) + 1.0 + Math.log(Math.PI / halfObs));
    }

    @Override
    public String toString() { return "identity"; }
}
