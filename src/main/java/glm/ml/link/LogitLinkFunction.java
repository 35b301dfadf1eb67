package glm.ml.link;

import glm.ml.DomainException;

/**
 * Scaled logit: g(μ) = (ln(μ/(1−μ)) − b)/a, g⁻¹(η) = 1/(1 + e^−(aη + b)).
 * With a = 1, b = 0 this is the ordinary logit.
 */
public final class LogitLinkFunction implements LinkFunction {

    private final double slope;
    private final double intercept;

    public LogitLinkFunction() {
        this(1.0, 0.0);
    }

    public LogitLinkFunction(double slope, double intercept) {
        if (slope == 0 || Double.isNaN(slope)) {
            throw new DomainException("Logit slope must be non-zero: " + slope);
        }
        this.slope = slope;
        this.intercept = intercept;
    }

    @Override
    public double evaluate(double mean) {
        return (Math.log(mean / (1.0 - mean)) - intercept) / slope;
    }

    @Override
    public double inverse(double linearPredictor) {
        return 1.0 / (1.0 + Math.exp(-(slope * linearPredictor + intercept)));
    }

    @Override
    public double firstDerivative(double x) {
        return 1.0 / (slope * x * (1.0 - x));
    }

    @Override
    public double secondDerivative(double x) {
        double q = x * (1.0 - x);
        return (2.0 * x - 1.0) / (slope * q * q);
    }

    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }

    @Override
    public String toString() { return "logit"; }
}
