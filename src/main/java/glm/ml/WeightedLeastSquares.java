package glm.ml;

import org.apache.commons.math3.linear.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted least squares: β = (XᵗWX)⁻¹XᵗWy with W = diag(w).
 * <p>
 * Solved as the ordinary least-squares problem on √W·X and √W·y through a singular value
 * decomposition, which avoids squaring the condition number of X the way forming XᵗWX does.
 * A rank-deficient weighted design is rejected with {@link SingularDesignException}, or
 * answered with the minimum-norm pseudo-inverse solution when the fallback is enabled.
 */
public final class WeightedLeastSquares {

    private static final Logger log = LoggerFactory.getLogger(WeightedLeastSquares.class);

    private final boolean pseudoInverseFallback;

    public WeightedLeastSquares() {
        this(false);
    }

    public WeightedLeastSquares(boolean pseudoInverseFallback) {
        this.pseudoInverseFallback = pseudoInverseFallback;
    }

    /** Ordinary least squares, i.e. every weight 1. */
    public double[] solve(double[][] design, double[] response) {
        return solve(design, response, Vectors.ones(response.length));
    }

    /**
     * @param design   row-major design matrix (rows = observations)
     * @param response working response, one per row
     * @param weights  non-negative weights, one per row
     * @return coefficient vector of length = number of design columns
     */
    public double[] solve(double[][] design, double[] response, double[] weights) {
        if (design.length != response.length) {
            throw DimensionMismatchException.of("design", design.length, "response", response.length);
        }
        if (weights.length != response.length) {
            throw DimensionMismatchException.of("weights", weights.length, "response", response.length);
        }
        if (design.length == 0) {
            throw new EmptyInputException("Design matrix has no rows");
        }
        Vectors.requireValidWeights(weights);

        int n = design.length;
        int p = design[0].length;
        double[][] weightedDesign = new double[n][p];
        double[] weightedResponse = new double[n];
        for (int i = 0; i < n; i++) {
            if (design[i].length != p) {
                throw DimensionMismatchException.of("design[0]", p, "design[" + i + "]", design[i].length);
            }
            double root = Math.sqrt(weights[i]);
            weightedResponse[i] = root * response[i];
            for (int j = 0; j < p; j++) {
                weightedDesign[i][j] = root * design[i][j];
            }
        }

        RealMatrix X = MatrixUtils.createRealMatrix(weightedDesign);
        RealVector y = MatrixUtils.createRealVector(weightedResponse);

        SingularValueDecomposition svd = new SingularValueDecomposition(X);
        int rank = svd.getRank();
        if (rank < p) {
            if (!pseudoInverseFallback) {
                throw new SingularDesignException(rank, p);
            }
            log.warn("Weighted design has rank {} < {} columns; using pseudo-inverse solution", rank, p);
        }
        double[] beta = svd.getSolver().solve(y).toArray();
        for (double b : beta) {
            if (!Double.isFinite(b)) {
                throw new SingularDesignException("Weighted least squares produced a non-finite coefficient");
            }
        }
        return beta;
    }

    public boolean isPseudoInverseFallback() {
        return pseudoInverseFallback;
    }
}
