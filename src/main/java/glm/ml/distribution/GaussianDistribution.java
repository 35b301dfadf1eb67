package glm.ml.distribution;

import glm.ml.DomainException;
import glm.ml.link.IdentityLinkFunction;
import glm.ml.link.LinkFunction;

/**
 * Normal distribution N(μ, σ²). Default link: identity.
 * <p>
 * Deviance: Σ wᵢ(rᵢ − mᵢ)² / scale.
 */
public final class GaussianDistribution extends AbstractDistribution {

    private final double mean;
    private final double standardDeviation;
    private final double variance;
    private final double entropy;

    public GaussianDistribution() {
        this(0.0, 1.0, null);
    }

    public GaussianDistribution(LinkFunction link) {
        this(0.0, 1.0, link);
    }

    /**
     * @param link identity when null
     * @throws DomainException if standardDeviation is not positive
     */
    public GaussianDistribution(double mean, double standardDeviation, LinkFunction link) {
        super(link == null ? new IdentityLinkFunction() : link);
        if (!(standardDeviation > 0) || Double.isInfinite(standardDeviation)) {
            throw new DomainException("Standard deviation must be positive: " + standardDeviation);
        }
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.variance = standardDeviation * standardDeviation;
        this.entropy = 0.5 * (1.0 + Math.log(2.0 * Math.PI * variance));
    }

    @Override public double getMean() { return mean; }
    @Override public double getVariance() { return variance; }
    @Override public double getStandardDeviation() { return standardDeviation; }
    @Override public double getSkewness() { return 0.0; }
    @Override public double getKurtosis() { return 0.0; }
    @Override public double getEntropy() { return entropy; }
    @Override public double getMinimum() { return -Double.MAX_VALUE; }
    @Override public double getMaximum() { return Double.MAX_VALUE; }
    @Override public double getMode() { return mean; }
    @Override public double getMedian() { return mean; }

    @Override
    public double probability(double x) {
        return Math.exp(logProbability(x));
    }

    @Override
    public double logProbability(double x) {
        double z = (x - mean) / standardDeviation;
        return -0.5 * z * z - Math.log(standardDeviation) - 0.5 * Math.log(2.0 * Math.PI);
    }

    @Override
    public double variance(double mean) {
        return variance;
    }

    @Override
    public double deviance(double[] response, double[] meanResponse, double[] weights, double scale) {
        checkDevianceArguments(response, meanResponse, weights, scale);
        double result = 0.0;
        for (int i = 0; i < response.length; i++) {
            double error = response[i] - meanResponse[i];
            result += weights[i] * error * error;
        }
        return result / scale;
    }

    @Override
    public double logLikelihood(double[] response, double[] meanResponse, double[] weights, double scale) {
        return getLinkFunction().logLikelihood(response, meanResponse, weights, scale);
    }

    @Override
    public double[] weight(double[] meanResponse) {
        double[] derivative = getLinkFunction().firstDerivative(meanResponse);
        double[] weight = new double[meanResponse.length];
        for (int i = 0; i < weight.length; i++) {
            weight[i] = 1.0 / (derivative[i] * derivative[i] * variance);
        }
        return weight;
    }

    @Override
    public String toString() {
        return "GaussianDistribution{mean=" + mean + ", standardDeviation=" + standardDeviation
            + ", link=" + getLinkFunction() + "}";
    }
}
