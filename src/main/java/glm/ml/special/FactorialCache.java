package glm.ml.special;

import glm.ml.DomainException;

/**
 * n! and ln(n!) for n in [0, 170]; 171! overflows a double.
 * Both tables are filled once when the class is initialised and never change.
 */
public final class FactorialCache {

    public static final int LIMIT = 170;

    private static final double[] FACTORIALS = new double[LIMIT + 1];
    private static final double[] LOG_FACTORIALS = new double[LIMIT + 1];

    static {
        FACTORIALS[0] = 1.0;
        for (int i = 1; i <= LIMIT; i++) {
            FACTORIALS[i] = FACTORIALS[i - 1] * i;
            LOG_FACTORIALS[i] = Math.log(FACTORIALS[i]);
        }
    }

    private FactorialCache() { }

    /** n! for n in [0, 170]. */
    public static double get(int n) {
        if (n < 0 || n > LIMIT) {
            throw new DomainException("Argument range: [0, " + LIMIT + "], got " + n);
        }
        return FACTORIALS[n];
    }

    /** ln(n!) for n in (0, 170]. */
    public static double getLog(int n) {
        if (n <= 0 || n > LIMIT) {
            throw new DomainException("Argument range: (0, " + LIMIT + "], got " + n);
        }
        return LOG_FACTORIALS[n];
    }
}
