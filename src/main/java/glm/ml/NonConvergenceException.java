package glm.ml;

/**
 * Thrown when IRLS reaches its iteration cap without meeting the deviance
 * tolerance and the settings ask for a strict fit. Carries the last estimate
 * so the caller can still inspect or accept it.
 */
public class NonConvergenceException extends ModelFitException {

    private final double[] lastCoefficients;
    private final int iterations;
    private final double lastDevianceChange;

    public NonConvergenceException(double[] lastCoefficients, int iterations, double lastDevianceChange) {
        super("IRLS did not converge after " + iterations + " iterations (last deviance change "
            + lastDevianceChange + ")");
        this.lastCoefficients = lastCoefficients.clone();
        this.iterations = iterations;
        this.lastDevianceChange = lastDevianceChange;
    }

    public double[] getLastCoefficients() { return lastCoefficients.clone(); }
    public int getIterations() { return iterations; }
    public double getLastDevianceChange() { return lastDevianceChange; }
}
