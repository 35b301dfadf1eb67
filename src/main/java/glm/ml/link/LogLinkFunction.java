package glm.ml.link;

/**
 * g(μ) = ln μ. Canonical link of the Poisson family.
 * Non-positive arguments are clamped to {@link Double#MIN_VALUE} before the log or the division.
 */
public final class LogLinkFunction implements LinkFunction {

    @Override
    public double evaluate(double mean) { return Math.log(clamp(mean)); }

    @Override
    public double inverse(double linearPredictor) { return Math.exp(linearPredictor); }

    @Override
    public double firstDerivative(double x) { return 1.0 / clamp(x); }

    @Override
    public double secondDerivative(double x) {
        double c = clamp(x);
        return -1.0 / (c * c);
    }

    private static double clamp(double x) {
        return x > Double.MIN_VALUE ? x : Double.MIN_VALUE;
    }

    @Override
    public String toString() { return "log"; }
}
