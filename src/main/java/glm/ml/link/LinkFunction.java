package glm.ml.link;

import glm.ml.Vectors;

/**
 * Transform between the mean-response scale μ and the linear-predictor scale η = g(μ).
 * <p>
 * Implementations are stateless apart from fixed parameters. The array forms apply the
 * scalar form element-wise and return a new array of the same length.
 */
public interface LinkFunction {

    /** g(μ) */
    double evaluate(double mean);

    /** g⁻¹(η) */
    double inverse(double linearPredictor);

    /** g'(x) */
    double firstDerivative(double x);

    /** g''(x) */
    double secondDerivative(double x);

    default double[] evaluate(double[] mean) {
        double[] out = new double[mean.length];
        for (int i = 0; i < out.length; i++) out[i] = evaluate(mean[i]);
        return out;
    }

    default double[] inverse(double[] linearPredictor) {
        double[] out = new double[linearPredictor.length];
        for (int i = 0; i < out.length; i++) out[i] = inverse(linearPredictor[i]);
        return out;
    }

    default double[] firstDerivative(double[] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) out[i] = firstDerivative(x[i]);
        return out;
    }

    default double[] secondDerivative(double[] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) out[i] = secondDerivative(x[i]);
        return out;
    }

    /**
     * Gaussian-form log-likelihood: Σ −½·wᵢ·((rᵢ − fᵢ)²/scale + ln(2π·scale)).
     *
     * @throws glm.ml.DimensionMismatchException if the three vectors differ in length
     * @throws glm.ml.DomainException if scale ≤ 0
     */
    default double logLikelihood(double[] response, double[] fitted, double[] weights, double scale) {
        Vectors.requireSameLength(new String[] {"response", "fitted", "weights"}, response, fitted, weights);
        Vectors.requirePositiveScale(scale);
        double common = Math.log(2.0 * Math.PI * scale);
        double result = 0.0;
        for (int i = 0; i < response.length; i++) {
            double error = response[i] - fitted[i];
            result += -0.5 * weights[i] * (error * error / scale + common);
        }
        return result;
    }
}
