package glm.ml;

/** Thrown when a response vector or design matrix has no observations. */
public class EmptyInputException extends IllegalArgumentException {

    public EmptyInputException(String message) {
        super(message);
    }
}
