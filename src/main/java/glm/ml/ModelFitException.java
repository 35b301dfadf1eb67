package glm.ml;

/**
 * Base class for fitting failures a caller may recover from, for instance by
 * enabling the pseudo-inverse fallback or relaxing the convergence settings.
 * Input validation failures are reported as {@link IllegalArgumentException} subclasses instead.
 */
public abstract class ModelFitException extends RuntimeException {

    protected ModelFitException(String message) {
        super(message);
    }

    protected ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
