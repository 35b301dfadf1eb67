package glm.ml.distribution;

import glm.ml.DomainException;
import glm.ml.link.LinkFunction;
import glm.ml.link.LogLinkFunction;
import glm.ml.special.FactorialCache;
import org.apache.commons.math3.special.Gamma;

/**
 * Poisson distribution with rate λ. Default link: log.
 * <p>
 * Deviance: 2·Σ wᵢ(rᵢ·ln(rᵢ/mᵢ) − rᵢ + mᵢ) / scale, with machine epsilon standing in
 * for the log argument when rᵢ ≤ 0.
 */
public final class PoissonDistribution extends AbstractDistribution {

    private static final double EPSILON = Math.ulp(1.0);

    private final double mean;
    private final double entropy;

    public PoissonDistribution() {
        this(1.0, null);
    }

    public PoissonDistribution(LinkFunction link) {
        this(1.0, link);
    }

    /**
     * @param link log when null
     * @throws DomainException if mean is not positive
     */
    public PoissonDistribution(double mean, LinkFunction link) {
        super(link == null ? new LogLinkFunction() : link);
        if (!(mean > 0) || Double.isInfinite(mean)) {
            throw new DomainException("Poisson mean must be positive: " + mean);
        }
        this.mean = mean;
        // Stirling expansion, accurate for moderate λ
        this.entropy = 0.5 * Math.log(2.0 * Math.PI * Math.E * mean)
            - 1.0 / (12.0 * mean)
            - 1.0 / (24.0 * mean * mean)
            - 19.0 / (360.0 * mean * mean * mean);
    }

    @Override public double getMean() { return mean; }
    @Override public double getVariance() { return mean; }
    @Override public double getStandardDeviation() { return Math.sqrt(mean); }
    @Override public double getSkewness() { return 1.0 / Math.sqrt(mean); }
    @Override public double getKurtosis() { return 1.0 / mean; }
    @Override public double getEntropy() { return entropy; }
    @Override public double getMinimum() { return 0.0; }
    @Override public double getMaximum() { return Double.MAX_VALUE; }
    @Override public double getMode() { return Math.floor(mean); }
    @Override public double getMedian() { return Math.floor(mean + 1.0 / 3.0 - 0.02 / mean); }

    /**
     * P(X = ⌊x⌋).
     *
     * @throws DomainException if x is outside [0, 170]
     */
    @Override
    public double probability(double x) {
        return Math.exp(logProbability(x));
    }

    @Override
    public double logProbability(double x) {
        if (!(x >= 0) || x > FactorialCache.LIMIT) {
            throw new DomainException("Argument range: [0, " + FactorialCache.LIMIT + "], got " + x);
        }
        int k = (int) x;
        double logFactorial = k == 0 ? 0.0 : FactorialCache.getLog(k);
        return k * Math.log(mean) - logFactorial - mean;
    }

    @Override
    public double variance(double mean) {
        return Math.abs(mean);
    }

    @Override
    public double deviance(double[] response, double[] meanResponse, double[] weights, double scale) {
        checkDevianceArguments(response, meanResponse, weights, scale);
        double result = 0.0;
        for (int i = 0; i < response.length; i++) {
            double r = response[i];
            double m = meanResponse[i];
            double d = Math.log(r <= 0 ? EPSILON : r / m);
            result += weights[i] * (r * d - r + m);
        }
        return 2.0 * result / scale;
    }

    /** Σ wᵢ(rᵢ ln mᵢ − mᵢ − ln Γ(rᵢ + 1)) / scale. */
    @Override
    public double logLikelihood(double[] response, double[] meanResponse, double[] weights, double scale) {
        checkDevianceArguments(response, meanResponse, weights, scale);
        double result = 0.0;
        for (int i = 0; i < response.length; i++) {
            double r = response[i];
            double m = meanResponse[i];
            double term = (r == 0 ? 0.0 : r * Math.log(m)) - m - Gamma.logGamma(r + 1.0);
            result += weights[i] * term;
        }
        return result / scale;
    }

    @Override
    public double[] weight(double[] meanResponse) {
        double[] absolute = new double[meanResponse.length];
        for (int i = 0; i < absolute.length; i++) {
            absolute[i] = Math.abs(meanResponse[i]);
        }
        double[] derivative = getLinkFunction().firstDerivative(absolute);
        double[] weight = new double[absolute.length];
        for (int i = 0; i < weight.length; i++) {
            double denominator = derivative[i] * derivative[i] * absolute[i];
            // μ underflowed to 0: the observation carries no information
            weight[i] = denominator > 0 && Double.isFinite(denominator) ? 1.0 / denominator : 0.0;
        }
        return weight;
    }

    @Override
    public String toString() {
        return "PoissonDistribution{mean=" + mean + ", link=" + getLinkFunction() + "}";
    }
}
