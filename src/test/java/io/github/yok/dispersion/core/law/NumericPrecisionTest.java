package io.github.yok.dispersion.core.law;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class NumericPrecisionTest {

    @Test
    void doubleKeepsValue() {
        Complex value = new Complex(0.1, 1.0 / 3.0);
        assertThat(NumericPrecision.DOUBLE.apply(value)).isSameAs(value);
    }

    @Test
    void singleRoundsEachComponentToFloat() {
        Complex rounded = NumericPrecision.SINGLE.apply(new Complex(0.1, 1.0 / 3.0));
        assertThat(rounded.getReal()).isEqualTo((double) 0.1f);
        assertThat(rounded.getImaginary()).isEqualTo((double) (float) (1.0 / 3.0));
    }
}
