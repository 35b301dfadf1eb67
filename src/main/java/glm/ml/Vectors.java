package glm.ml;

/**
 * Small element-wise vector helpers and argument checks shared by the solver,
 * the distributions and the link functions.
 */
public final class Vectors {

    private Vectors() { }

    /** Fails with {@link DimensionMismatchException} unless every vector has the length of the first. */
    public static void requireSameLength(String[] names, double[]... vectors) {
        for (int i = 1; i < vectors.length; i++) {
            if (vectors[i].length != vectors[0].length) {
                throw DimensionMismatchException.of(names[0], vectors[0].length, names[i], vectors[i].length);
            }
        }
    }

    public static void requirePositiveScale(double scale) {
        if (!(scale > 0)) {
            throw new DomainException("Scale must be positive: " + scale);
        }
    }

    /** Weights must be finite and non-negative. */
    public static void requireValidWeights(double[] weights) {
        for (int i = 0; i < weights.length; i++) {
            if (!(weights[i] >= 0) || Double.isInfinite(weights[i])) {
                throw new DomainException("Weight " + i + " must be finite and non-negative: " + weights[i]);
            }
        }
    }

    public static double mean(double[] x) {
        if (x.length == 0) {
            throw new EmptyInputException("Argument vector is empty");
        }
        double sum = 0;
        for (double v : x) sum += v;
        return sum / x.length;
    }

    public static double[] ones(int n) {
        double[] out = new double[n];
        java.util.Arrays.fill(out, 1.0);
        return out;
    }

    public static double[] multiply(double[] a, double[] b) {
        requireSameLength(new String[] {"a", "b"}, a, b);
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) out[i] = a[i] * b[i];
        return out;
    }

    public static double dot(double[] a, double[] b) {
        requireSameLength(new String[] {"a", "b"}, a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    /** X·β for a row-major design. */
    public static double[] product(double[][] design, double[] beta) {
        double[] out = new double[design.length];
        for (int i = 0; i < design.length; i++) {
            out[i] = dot(design[i], beta);
        }
        return out;
    }
}
