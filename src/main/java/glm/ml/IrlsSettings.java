package glm.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable IRLS solver settings.
 * <p>
 * Defaults: 100 iterations, relative deviance tolerance 1e-8, absolute tolerance 1e-12,
 * singular designs rejected, non-convergence accepted with a warning.
 * {@link #fromEnvironment()} overlays GLM_MAX_ITERATIONS, GLM_TOLERANCE, GLM_ABSOLUTE_TOLERANCE,
 * GLM_PSEUDO_INVERSE and GLM_FAIL_ON_NON_CONVERGENCE.
 */
public final class IrlsSettings {

    private static final Logger log = LoggerFactory.getLogger(IrlsSettings.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-8;
    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-12;

    private static final IrlsSettings DEFAULTS =
        new IrlsSettings(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, DEFAULT_ABSOLUTE_TOLERANCE, false, false);

    private final int maxIterations;
    private final double tolerance;
    private final double absoluteTolerance;
    private final boolean pseudoInverseFallback;
    private final boolean failOnNonConvergence;

    private IrlsSettings(int maxIterations, double tolerance, double absoluteTolerance,
                         boolean pseudoInverseFallback, boolean failOnNonConvergence) {
        if (maxIterations < 1) {
            throw new DomainException("maxIterations must be at least 1: " + maxIterations);
        }
        if (!(tolerance >= 0) || !(absoluteTolerance >= 0)) {
            throw new DomainException("Tolerances must be non-negative");
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.absoluteTolerance = absoluteTolerance;
        this.pseudoInverseFallback = pseudoInverseFallback;
        this.failOnNonConvergence = failOnNonConvergence;
    }

    public static IrlsSettings defaults() {
        return DEFAULTS;
    }

    /** Defaults overridden by GLM_* environment variables; unparseable values are logged and ignored. */
    public static IrlsSettings fromEnvironment() {
        IrlsSettings s = DEFAULTS;
        String v = System.getenv("GLM_MAX_ITERATIONS");
        if (v != null && !v.isBlank()) {
            try {
                s = s.withMaxIterations(Integer.parseInt(v.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring GLM_MAX_ITERATIONS={}: {}", v, e.getMessage());
            }
        }
        v = System.getenv("GLM_TOLERANCE");
        if (v != null && !v.isBlank()) {
            try {
                s = s.withTolerance(Double.parseDouble(v.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring GLM_TOLERANCE={}: {}", v, e.getMessage());
            }
        }
        v = System.getenv("GLM_ABSOLUTE_TOLERANCE");
        if (v != null && !v.isBlank()) {
            try {
                s = s.withAbsoluteTolerance(Double.parseDouble(v.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring GLM_ABSOLUTE_TOLERANCE={}: {}", v, e.getMessage());
            }
        }
        v = System.getenv("GLM_PSEUDO_INVERSE");
        if (v != null && !v.isBlank()) {
            s = s.withPseudoInverseFallback(Boolean.parseBoolean(v.trim()));
        }
        v = System.getenv("GLM_FAIL_ON_NON_CONVERGENCE");
        if (v != null && !v.isBlank()) {
            s = s.withFailOnNonConvergence(Boolean.parseBoolean(v.trim()));
        }
        return s;
    }

    public IrlsSettings withMaxIterations(int maxIterations) {
        return new IrlsSettings(maxIterations, tolerance, absoluteTolerance, pseudoInverseFallback, failOnNonConvergence);
    }

    public IrlsSettings withTolerance(double tolerance) {
        return new IrlsSettings(maxIterations, tolerance, absoluteTolerance, pseudoInverseFallback, failOnNonConvergence);
    }

    public IrlsSettings withAbsoluteTolerance(double absoluteTolerance) {
        return new IrlsSettings(maxIterations, tolerance, absoluteTolerance, pseudoInverseFallback, failOnNonConvergence);
    }

    public IrlsSettings withPseudoInverseFallback(boolean pseudoInverseFallback) {
        return new IrlsSettings(maxIterations, tolerance, absoluteTolerance, pseudoInverseFallback, failOnNonConvergence);
    }

    public IrlsSettings withFailOnNonConvergence(boolean failOnNonConvergence) {
        return new IrlsSettings(maxIterations, tolerance, absoluteTolerance, pseudoInverseFallback, failOnNonConvergence);
    }

    public int getMaxIterations() { return maxIterations; }
    public double getTolerance() { return tolerance; }
    public double getAbsoluteTolerance() { return absoluteTolerance; }
    public boolean isPseudoInverseFallback() { return pseudoInverseFallback; }
    public boolean isFailOnNonConvergence() { return failOnNonConvergence; }

    @Override
    public String toString() {
        return "IrlsSettings{maxIterations=" + maxIterations + ", tolerance=" + tolerance
            + ", absoluteTolerance=" + absoluteTolerance + ", pseudoInverseFallback=" + pseudoInverseFallback
            + ", failOnNonConvergence=" + failOnNonConvergence + "}";
    }
}
