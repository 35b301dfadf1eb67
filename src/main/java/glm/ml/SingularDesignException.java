package glm.ml;

/** Thrown when the normal-equations matrix XᵗWX (or XᵗX) cannot be inverted. */
public class SingularDesignException extends ModelFitException {

    private final int rank;
    private final int columns;

    public SingularDesignException(int rank, int columns) {
        super("Design matrix is rank deficient: rank " + rank + " < " + columns + " columns");
        this.rank = rank;
        this.columns = columns;
    }

    public SingularDesignException(String message) {
        super(message);
        this.rank = -1;
        this.columns = -1;
    }

    /** Numerical rank of the design, or -1 when it was not computed. */
    public int getRank() { return rank; }

    public int getColumns() { return columns; }
}
