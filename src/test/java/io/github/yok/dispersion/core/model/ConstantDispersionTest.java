package io.github.yok.dispersion.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class ConstantDispersionTest {

    @Test
    void dielectricIsSquareOfIndex() {
        ConstantDispersion glass = new ConstantDispersion(1.5);
        assertThat(glass.dielectric(500.0)).isEqualTo(new Complex(2.25, 0.0));
        assertThat(glass.refractiveIndex(500.0)).isEqualTo(new Complex(1.5, 0.0));
    }

    @Test
    void complexIndexGivesAbsorption() {
        ConstantDispersion absorbing = new ConstantDispersion(new Complex(2.0, 0.5));
        Complex eps = absorbing.dielectric(800.0);
        assertThat(eps.getReal()).isEqualTo(3.75);
        assertThat(eps.getImaginary()).isEqualTo(2.0);
    }

    @Test
    void acceptsAnyWavelength() {
        ConstantDispersion glass = new ConstantDispersion(1.5);
        assertThat(glass.dielectric(-1.0)).isEqualTo(glass.dielectric(1.0));
        assertThat(glass.dielectric(new double[] {0.0, 1e9})).hasSize(2);
    }
}
