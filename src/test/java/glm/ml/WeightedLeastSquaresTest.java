package glm.ml;

import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightedLeastSquaresTest {

    private static final double[][] DESIGN = {
        {1, 1.0, 3.0},
        {1, 2.0, 1.0},
        {1, 3.0, 4.0},
        {1, 4.0, 1.5},
        {1, 5.0, 5.0},
        {1, 6.0, 2.0},
        {1, 7.0, 6.5},
    };
    private static final double[] RESPONSE = {4.1, 4.9, 9.2, 7.8, 13.1, 10.7, 17.0};

    @Test
    @DisplayName("unit weights should reproduce ordinary least squares")
    void unitWeightsMatchOls() {
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.setNoIntercept(true);
        ols.newSampleData(RESPONSE, DESIGN);

        double[] beta = new WeightedLeastSquares().solve(DESIGN, RESPONSE, Vectors.ones(RESPONSE.length));

        assertThat(beta).containsExactly(ols.estimateRegressionParameters(), within(1e-10));
    }

    @Test
    @DisplayName("an integer weight should act like a repeated observation")
    void integerWeightEqualsReplication() {
        double[] weights = Vectors.ones(RESPONSE.length);
        weights[2] = 3.0;
        double[][] replicated = new double[DESIGN.length + 2][];
        double[] replicatedResponse = new double[RESPONSE.length + 2];
        for (int i = 0; i < DESIGN.length; i++) {
            replicated[i] = DESIGN[i];
            replicatedResponse[i] = RESPONSE[i];
        }
        replicated[DESIGN.length] = DESIGN[2];
        replicated[DESIGN.length + 1] = DESIGN[2];
        replicatedResponse[DESIGN.length] = RESPONSE[2];
        replicatedResponse[DESIGN.length + 1] = RESPONSE[2];

        WeightedLeastSquares wls = new WeightedLeastSquares();

        assertThat(wls.solve(DESIGN, RESPONSE, weights))
            .containsExactly(wls.solve(replicated, replicatedResponse), within(1e-10));
    }

    @Test
    @DisplayName("a zero weight should drop the observation")
    void zeroWeightDropsRow() {
        double[] weights = Vectors.ones(RESPONSE.length);
        weights[6] = 0.0;
        double[][] kept = new double[6][];
        double[] keptResponse = new double[6];
        System.arraycopy(DESIGN, 0, kept, 0, 6);
        System.arraycopy(RESPONSE, 0, keptResponse, 0, 6);

        WeightedLeastSquares wls = new WeightedLeastSquares();

        assertThat(wls.solve(DESIGN, RESPONSE, weights)).containsExactly(wls.solve(kept, keptResponse), within(1e-10));
    }

    @Test
    @DisplayName("should reject a rank-deficient design instead of returning garbage")
    void rejectsSingularDesign() {
        double[][] collinear = {{1, 1, 2}, {1, 2, 4}, {1, 3, 6}, {1, 4, 8}};

        assertThatThrownBy(() -> new WeightedLeastSquares().solve(collinear, new double[] {1, 2, 3, 5}))
            .isInstanceOf(SingularDesignException.class)
            .satisfies(e -> assertThat(((SingularDesignException) e).getRank()).isEqualTo(2));
    }

    @Test
    @DisplayName("pseudo-inverse fallback should return the minimum-norm solution")
    void pseudoInverseFallback() {
        double[][] collinear = {{1, 2}, {2, 4}, {3, 6}};
        double[] response = {5, 10, 15};

        double[] beta = new WeightedLeastSquares(true).solve(collinear, response);

        // y = 5x = b1·x + b2·2x with minimum ‖b‖: b = (1, 2)
        assertThat(beta).containsExactly(new double[] {1.0, 2.0}, within(1e-10));
    }

    @Test
    @DisplayName("should validate shapes and weights before solving")
    void validation() {
        WeightedLeastSquares wls = new WeightedLeastSquares();

        assertThatThrownBy(() -> wls.solve(DESIGN, new double[] {1, 2}))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> wls.solve(DESIGN, RESPONSE, new double[] {1}))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> wls.solve(new double[0][], new double[0], new double[0]))
            .isInstanceOf(EmptyInputException.class);
        double[] negative = Vectors.ones(RESPONSE.length);
        negative[0] = -1.0;
        assertThatThrownBy(() -> wls.solve(DESIGN, RESPONSE, negative))
            .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> wls.solve(new double[][] {{1, 2}, {1}}, new double[] {1, 2}))
            .isInstanceOf(DimensionMismatchException.class);
    }
}
