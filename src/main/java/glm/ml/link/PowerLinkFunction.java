package glm.ml.link;

import glm.ml.DomainException;

/**
 * g(μ) = μᵖ for p ≠ 0. Power 1 is the identity, power −1 the reciprocal link
 * (canonical for the Gamma family), power ½ the square-root link.
 */
public final class PowerLinkFunction implements LinkFunction {

    private final double power;

    public PowerLinkFunction(double power) {
        if (power == 0 || !Double.isFinite(power)) {
            throw new DomainException("Power must be finite and non-zero, use the log link for 0: " + power);
        }
        this.power = power;
    }

    /** g(μ) = 1/μ, g⁻¹(η) = 1/η. */
    public static PowerLinkFunction reciprocal() {
        return new PowerLinkFunction(-1.0);
    }

    @Override
    public double evaluate(double mean) { return Math.pow(mean, power); }

    @Override
    public double inverse(double linearPredictor) { return Math.pow(linearPredictor, 1.0 / power); }

    @Override
    public double firstDerivative(double x) { return power * Math.pow(x, power - 1.0); }

    @Override
    public double secondDerivative(double x) { return power * (power - 1.0) * Math.pow(x, power - 2.0); }

    public double getPower() { return power; }

    @Override
    public String toString() {
        return power == -1.0 ? "reciprocal" : "power(" + power + ")";
    }
}
