package io.github.yok.dispersion.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.dispersion.core.law.DispersionDomainException;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class CauchyDispersionTest {

    @Test
    void constantTermOnly() {
        CauchyDispersion cauchy = new CauchyDispersion(1.5, 0.0, 0.0);
        assertThat(cauchy.dielectric(632.8)).isEqualTo(new Complex(2.25, 0.0));
    }

    @Test
    void dispersiveTermsUseNanometreScaling() {
        // λ = 100 nm: n = 1 + 1e2·1/1e4 + 1e7·1/1e8 = 1.11
        CauchyDispersion cauchy = new CauchyDispersion(1.0, 1.0, 1.0, 0.0, 0.0, 0.0);
        Complex n = cauchy.refractiveIndex(100.0);
        assertThat(n.getReal()).isCloseTo(1.11, within(1e-12));
        assertThat(n.getImaginary()).isCloseTo(0.0, within(1e-15));
    }

    @Test
    void extinctionTermsBuildImaginaryIndex() {
        CauchyDispersion cauchy = new CauchyDispersion(2.0, 0.0, 0.0, 0.1, 0.0, 0.0);
        Complex eps = cauchy.dielectric(500.0);
        assertThat(eps.getReal()).isCloseTo(3.99, within(1e-12));
        assertThat(eps.getImaginary()).isCloseTo(0.4, within(1e-12));
    }

    @Test
    void rejectsInvalidWavelength() {
        CauchyDispersion cauchy = new CauchyDispersion(1.5, 0.0, 0.0);
        assertThatThrownBy(() -> cauchy.dielectric(0.0))
                .isInstanceOf(DispersionDomainException.class);
    }
}
