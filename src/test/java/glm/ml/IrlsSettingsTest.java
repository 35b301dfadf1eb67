package glm.ml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IrlsSettingsTest {

    @Test
    void defaults() {
        IrlsSettings settings = IrlsSettings.defaults();

        assertThat(settings.getMaxIterations()).isEqualTo(100);
        assertThat(settings.getTolerance()).isEqualTo(1e-8);
        assertThat(settings.getAbsoluteTolerance()).isEqualTo(1e-12);
        assertThat(settings.isPseudoInverseFallback()).isFalse();
        assertThat(settings.isFailOnNonConvergence()).isFalse();
    }

    @Test
    void withersReturnModifiedCopies() {
        IrlsSettings base = IrlsSettings.defaults();
        IrlsSettings changed = base.withMaxIterations(5).withTolerance(1e-6).withPseudoInverseFallback(true);

        assertThat(changed.getMaxIterations()).isEqualTo(5);
        assertThat(changed.getTolerance()).isEqualTo(1e-6);
        assertThat(changed.isPseudoInverseFallback()).isTrue();
        assertThat(base.getMaxIterations()).isEqualTo(100);
        assertThat(changed.toString()).contains("5");
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> IrlsSettings.defaults().withMaxIterations(0))
            .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> IrlsSettings.defaults().withTolerance(-1))
            .isInstanceOf(DomainException.class);
    }
}
