package glm.ml.distribution;

import glm.ml.link.LinkFunction;

/**
 * An exponential-family member used by IRLS. Summary statistics are fixed by the
 * distribution parameters at construction; the distribution owns exactly one link.
 */
public interface Distribution {

    LinkFunction getLinkFunction();

    double getMean();
    double getVariance();
    double getStandardDeviation();
    double getSkewness();
    double getKurtosis();
    double getEntropy();
    double getMinimum();
    double getMaximum();
    double getMode();
    double getMedian();

    double probability(double x);

    double logProbability(double x);

    /** Variance function V(μ) of the family. */
    double variance(double mean);

    /**
     * Family deviance of a fit.
     *
     * @throws glm.ml.DimensionMismatchException if the vectors differ in length
     * @throws glm.ml.DomainException if scale ≤ 0
     */
    double deviance(double[] response, double[] meanResponse, double[] weights, double scale);

    double logLikelihood(double[] response, double[] meanResponse, double[] weights, double scale);

    /**
     * IRLS starting point: each observation pulled halfway towards the sample mean.
     *
     * @throws glm.ml.EmptyInputException if the response is empty
     */
    double[] initialMean(double[] response);

    /** IRLS working weight 1 / (g'(μ)²·V(μ)) per observation. */
    double[] weight(double[] meanResponse);

    /** η = g(μ) */
    double[] predict(double[] meanResponse);

    /** μ = g⁻¹(η) */
    double[] fit(double[] linearPrediction);
}
