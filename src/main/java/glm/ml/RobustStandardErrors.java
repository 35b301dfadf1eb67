package glm.ml;

import org.apache.commons.math3.linear.*;

/**
 * Coefficient covariance estimators computed once from the design X and residuals e:
 * <ul>
 *   <li>OLS: σ̂²·(XᵗX)⁻¹, σ̂² = Σeᵢ² / (n − p)</li>
 *   <li>HC0 (White, 1980): (XᵗX)⁻¹ Xᵗ diag(eᵢ²) X (XᵗX)⁻¹</li>
 *   <li>HC1: HC0 · n / (n − p)</li>
 * </ul>
 * All three share a single inversion of XᵗX: LU for a full-rank design, or the SVD
 * pseudo-inverse for a rank-deficient one when the fallback is enabled.
 */
public final class RobustStandardErrors {

    public enum CovarianceType { OLS, HC0, HC1 }

    private final RealMatrix covarianceOls;
    private final RealMatrix covarianceHc0;
    private final RealMatrix covarianceHc1;
    private final double[] standardErrorsOls;
    private final double[] standardErrorsHc0;
    private final double[] standardErrorsHc1;
    private final double smallSampleFactor;

    /**
     * @param design    row-major design matrix, n × p
     * @param residuals residual per row
     * @throws DimensionMismatchException if residuals and rows differ in count
     * @throws DomainException if n ≤ p
     * @throws SingularDesignException if XᵗX is singular
     */
    public RobustStandardErrors(double[][] design, double[] residuals) {
        this(design, residuals, false);
    }

    /**
     * @param pseudoInverseFallback use the pseudo-inverse of XᵗX when X is rank deficient
     */
    public RobustStandardErrors(double[][] design, double[] residuals, boolean pseudoInverseFallback) {
        if (design.length != residuals.length) {
            throw DimensionMismatchException.of("design", design.length, "residuals", residuals.length);
        }
        if (design.length == 0) {
            throw new EmptyInputException("Design matrix has no rows");
        }
        int n = design.length;
        int p = design[0].length;
        if (n - p <= 0) {
            throw new DomainException("Degrees of freedom must be positive: n=" + n + ", p=" + p);
        }

        RealMatrix X = MatrixUtils.createRealMatrix(design);
        RealMatrix Xt = X.transpose();
        RealMatrix XtX = Xt.multiply(X);
        int rank = new SingularValueDecomposition(X).getRank();
        RealMatrix inverse;
        if (rank < p) {
            if (!pseudoInverseFallback) {
                throw new SingularDesignException(rank, p);
            }
            inverse = new SingularValueDecomposition(XtX).getSolver().getInverse();
        } else {
            DecompositionSolver solver = new LUDecomposition(XtX).getSolver();
            if (!solver.isNonSingular()) {
                throw new SingularDesignException("X'X is singular; cannot compute (X'X)⁻¹");
            }
            inverse = solver.getInverse();
        }

        double sumSquaredErrors = 0.0;
        double[][] scaled = new double[n][p];
        for (int i = 0; i < n; i++) {
            double e2 = residuals[i] * residuals[i];
            sumSquaredErrors += e2;
            for (int j = 0; j < p; j++) {
                scaled[i][j] = e2 * design[i][j];
            }
        }

        // Xᵗ diag(e²) X
        RealMatrix meat = Xt.multiply(MatrixUtils.createRealMatrix(scaled));

        smallSampleFactor = (double) n / (n - p);
        covarianceOls = inverse.scalarMultiply(sumSquaredErrors / (n - p));
        covarianceHc0 = inverse.multiply(meat).multiply(inverse);
        covarianceHc1 = covarianceHc0.scalarMultiply(smallSampleFactor);

        standardErrorsOls = sqrtDiagonal(covarianceOls);
        standardErrorsHc0 = sqrtDiagonal(covarianceHc0);
        double root = Math.sqrt(smallSampleFactor);
        standardErrorsHc1 = new double[p];
        for (int j = 0; j < p; j++) {
            standardErrorsHc1[j] = standardErrorsHc0[j] * root;
        }
    }

    private static double[] sqrtDiagonal(RealMatrix m) {
        double[] out = new double[m.getRowDimension()];
        for (int i = 0; i < out.length; i++) {
            // round-off can push a zero variance slightly negative
            out[i] = Math.sqrt(Math.max(0.0, m.getEntry(i, i)));
        }
        return out;
    }

    private static double[] diagonal(RealMatrix m) {
        double[] out = new double[m.getRowDimension()];
        for (int i = 0; i < out.length; i++) out[i] = m.getEntry(i, i);
        return out;
    }

    public double[][] getCovariance(CovarianceType type) {
        switch (type) {
            case OLS: return covarianceOls.getData();
            case HC0: return covarianceHc0.getData();
            case HC1: return covarianceHc1.getData();
            default: throw new IllegalArgumentException("Unknown covariance type " + type);
        }
    }

    public double[] getVariance(CovarianceType type) {
        switch (type) {
            case OLS: return diagonal(covarianceOls);
            case HC0: return diagonal(covarianceHc0);
            case HC1: return diagonal(covarianceHc1);
            default: throw new IllegalArgumentException("Unknown covariance type " + type);
        }
    }

    public double[] getStandardErrors(CovarianceType type) {
        switch (type) {
            case OLS: return standardErrorsOls.clone();
            case HC0: return standardErrorsHc0.clone();
            case HC1: return standardErrorsHc1.clone();
            default: throw new IllegalArgumentException("Unknown covariance type " + type);
        }
    }

    /** n / (n − p) */
    public double getSmallSampleFactor() {
        return smallSampleFactor;
    }
}
