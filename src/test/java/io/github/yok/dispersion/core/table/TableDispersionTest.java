package io.github.yok.dispersion.core.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionDomainException;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class TableDispersionTest {

    private static final double[] LBDA = {300.0, 400.0, 500.0, 600.0, 700.0};

    private static final Complex[] INDEX = {new Complex(2.6, 0.3), new Complex(2.4, 0.1),
            new Complex(2.3, 0.02), new Complex(2.25, 0.0), new Complex(2.2, 0.0)};

    @Test
    void indexTableStoresSquaredIndex() {
        TableIndexDispersion table = new TableIndexDispersion(LBDA, INDEX);

        for (int i = 0; i < LBDA.length; i++) {
            Complex expected = INDEX[i].multiply(INDEX[i]);
            assertThat(table.dielectric(LBDA[i]).subtract(expected).abs()).isLessThan(1e-12);
            assertThat(table.refractiveIndex(LBDA[i]).subtract(INDEX[i]).abs()).isLessThan(1e-12);
        }
    }

    @Test
    void epsilonTableStoresSamplesAsIs() {
        Complex[] eps = new Complex[INDEX.length];
        for (int i = 0; i < eps.length; i++) {
            eps[i] = INDEX[i].multiply(INDEX[i]);
        }
        TableEpsilonDispersion byEpsilon = new TableEpsilonDispersion(LBDA, eps);
        TableIndexDispersion byIndex = new TableIndexDispersion(LBDA, INDEX);

        Complex a = byEpsilon.dielectric(450.0);
        Complex b = byIndex.dielectric(450.0);
        assertThat(a.getReal()).isCloseTo(b.getReal(), within(1e-12));
        assertThat(a.getImaginary()).isCloseTo(b.getImaginary(), within(1e-12));
        assertThat(byEpsilon.getInterpolation().getUpperBound()).isEqualTo(700.0);
    }

    @Test
    void bothVariantsRefuseToExtrapolate() {
        TableIndexDispersion byIndex = new TableIndexDispersion(LBDA, INDEX);
        TableEpsilonDispersion byEpsilon = new TableEpsilonDispersion(LBDA, INDEX);

        assertThatThrownBy(() -> byIndex.dielectric(250.0))
                .isInstanceOf(DispersionDomainException.class);
        assertThatThrownBy(() -> byEpsilon.dielectric(new double[] {400.0, 750.0}))
                .isInstanceOf(DispersionDomainException.class).hasMessageContaining("index=1");
    }

    @Test
    void rejectsNullIndexEntries() {
        Complex[] withNull = INDEX.clone();
        withNull[2] = null;
        assertThatThrownBy(() -> new TableIndexDispersion(LBDA, withNull))
                .isInstanceOf(DispersionConfigurationException.class);
        assertThatThrownBy(() -> new TableIndexDispersion(LBDA, null))
                .isInstanceOf(DispersionConfigurationException.class);
    }
}
