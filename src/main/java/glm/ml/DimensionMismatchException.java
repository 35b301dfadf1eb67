package glm.ml;

/**
 * Thrown when vectors or matrices passed to the same operation do not conform in length.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    public static DimensionMismatchException of(String leftName, int left, String rightName, int right) {
        return new DimensionMismatchException(
            "Argument lengths differ: " + leftName + "[" + left + "], " + rightName + "[" + right + "]");
    }
}
