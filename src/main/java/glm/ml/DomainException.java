package glm.ml;

/**
 * Thrown when an argument falls outside the valid domain of an operation,
 * e.g. a Poisson count outside [0, 170], a non-positive scale, or a model
 * without residual degrees of freedom.
 */
public class DomainException extends IllegalArgumentException {

    public DomainException(String message) {
        super(message);
    }
}
