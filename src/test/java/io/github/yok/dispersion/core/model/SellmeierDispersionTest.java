package io.github.yok.dispersion.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.SellmeierTerm;
import java.util.Arrays;
import java.util.Collections;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class SellmeierDispersionTest {

    @Test
    void singleTermAtOneMicron() {
        SellmeierDispersion sellmeier =
                new SellmeierDispersion(Collections.singletonList(new SellmeierTerm(1.1, 0.0)));
        Complex eps = sellmeier.dielectric(1000.0);
        assertThat(eps.getReal()).isCloseTo(2.1, within(1e-12));
        assertThat(eps.getImaginary()).isEqualTo(0.0);
    }

    @Test
    void fusedSilicaIndexAtHeliumNeonLine() {
        // Malitson (1965) の溶融石英
        SellmeierDispersion silica = new SellmeierDispersion(Arrays.asList(
                new SellmeierTerm(0.6961663, 0.0684043 * 0.0684043),
                new SellmeierTerm(0.4079426, 0.1162414 * 0.1162414),
                new SellmeierTerm(0.8974794, 9.896161 * 9.896161)));
        assertThat(silica.refractiveIndex(632.8).getReal()).isCloseTo(1.4570, within(1e-4));
    }

    @Test
    void resonanceGivesNonFiniteValueWithoutThrowing() {
        SellmeierDispersion sellmeier =
                new SellmeierDispersion(Collections.singletonList(new SellmeierTerm(1.0, 0.25)));
        double real = sellmeier.dielectric(500.0).getReal();
        assertThat(Double.isFinite(real)).isFalse();
    }

    @Test
    void rejectsEmptyTerms() {
        assertThatThrownBy(() -> new SellmeierDispersion(Collections.emptyList()))
                .isInstanceOf(DispersionConfigurationException.class);
    }

    @Test
    void modifiedSellmeierPolynomialAndPole() {
        ModifiedSellmeierDispersion modified =
                new ModifiedSellmeierDispersion(2.0, 0.1, 0.01, 1.0, 0.5);
        // λ = 1 µm: 2 + 0.1 + 0.01 + 1/(1 - 0.5)
        assertThat(modified.dielectric(1000.0).getReal()).isCloseTo(4.11, within(1e-12));
    }
}
