package glm.ml.distribution;

import glm.ml.DimensionMismatchException;
import glm.ml.DomainException;
import glm.ml.link.LogLinkFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PoissonDistributionTest {

    @Test
    @DisplayName("should default to the log link")
    void defaultLink() {
        assertThat(new PoissonDistribution().getLinkFunction()).isInstanceOf(LogLinkFunction.class);
    }

    @Test
    @DisplayName("probabilities over 0..30 should sum to one for mean 5")
    void probabilitiesSumToOne() {
        PoissonDistribution d = new PoissonDistribution(5.0, null);

        double sum = 0.0;
        for (int x = 0; x <= 30; x++) {
            sum += d.probability(x);
        }

        assertThat(sum).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("probability mass should agree with commons-math")
    void agreesWithCommonsMath() {
        PoissonDistribution d = new PoissonDistribution(3.7, null);
        org.apache.commons.math3.distribution.PoissonDistribution reference =
            new org.apache.commons.math3.distribution.PoissonDistribution(3.7);

        for (int x = 0; x <= 20; x++) {
            assertThat(d.probability(x)).isCloseTo(reference.probability(x), within(1e-12));
        }
    }

    @Test
    @DisplayName("should reject counts outside [0, 170]")
    void rejectsOutOfRange() {
        PoissonDistribution d = new PoissonDistribution();

        assertThatThrownBy(() -> d.probability(-1)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> d.probability(171)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> d.logProbability(170.5)).isInstanceOf(DomainException.class);
        assertThat(d.logProbability(170)).isFinite();
    }

    @Test
    @DisplayName("should derive summary statistics from the rate")
    void summaryStatistics() {
        PoissonDistribution d = new PoissonDistribution(4.0, null);

        assertThat(d.getVariance()).isEqualTo(4.0);
        assertThat(d.getStandardDeviation()).isEqualTo(2.0);
        assertThat(d.getSkewness()).isEqualTo(0.5);
        assertThat(d.getKurtosis()).isEqualTo(0.25);
        assertThat(d.getMode()).isEqualTo(4.0);
        assertThat(d.getMedian()).isEqualTo(4.0);
        assertThat(d.getMinimum()).isZero();
        assertThat(d.getEntropy()).isCloseTo(
            0.5 * Math.log(2 * Math.PI * Math.E * 4.0) - 1.0 / 48 - 1.0 / 384 - 19.0 / 23040, within(1e-15));
        assertThatThrownBy(() -> new PoissonDistribution(0.0, null)).isInstanceOf(DomainException.class);
    }

    @Test
    @DisplayName("deviance should vanish at the response, zeros included")
    void zeroDevianceAtResponse() {
        double[] r = {0, 1, 4, 9};

        double deviance = new PoissonDistribution().deviance(r, r, new double[] {1, 1, 1, 1}, 1.0);

        assertThat(deviance).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("deviance should be non-negative and match the closed form")
    void devianceClosedForm() {
        double[] r = {0, 2, 5};
        double[] m = {0.5, 3.0, 4.0};
        double[] w = {1, 2, 1};
        double expected = 2.0 * (1 * 0.5
            + 2 * (2 * Math.log(2.0 / 3.0) - 2 + 3)
            + 1 * (5 * Math.log(5.0 / 4.0) - 5 + 4));

        double deviance = new PoissonDistribution().deviance(r, m, w, 1.0);

        assertThat(deviance).isGreaterThanOrEqualTo(0.0);
        assertThat(deviance).isCloseTo(expected, within(1e-12));
        assertThat(new PoissonDistribution().deviance(r, m, w, 2.0)).isCloseTo(expected / 2, within(1e-12));
    }

    @Test
    @DisplayName("deviance should validate lengths and scale")
    void devianceValidation() {
        PoissonDistribution d = new PoissonDistribution();

        assertThatThrownBy(() -> d.deviance(new double[] {1}, new double[] {1, 2}, new double[] {1}, 1.0))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> d.deviance(new double[] {1}, new double[] {1}, new double[] {1}, -1.0))
            .isInstanceOf(DomainException.class);
    }

    @Test
    @DisplayName("working weight under the log link should be |mu|")
    void workingWeight() {
        double[] weight = new PoissonDistribution().weight(new double[] {2.0, -3.0, 0.5});

        assertThat(weight).containsExactly(new double[] {2.0, 3.0, 0.5}, within(1e-12));
    }

    @Test
    @DisplayName("log-likelihood should sum the log mass of each count")
    void logLikelihood() {
        PoissonDistribution d = new PoissonDistribution();
        double[] r = {0, 3};
        double[] m = {2.0, 2.0};
        PoissonDistribution atTwo = new PoissonDistribution(2.0, null);

        double ll = d.logLikelihood(r, m, new double[] {1, 1}, 1.0);

        assertThat(ll).isCloseTo(atTwo.logProbability(0) + atTwo.logProbability(3), within(1e-12));
    }
}
