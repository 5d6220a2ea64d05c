package io.github.yok.dispersion.core.law;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.dispersion.core.unit.PhotonEnergy;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class DispersionSumTest {

    /**
     * ε = (E, 1/λ) を返すテスト用の分散則です。
     */
    private static final DispersionLaw PROBE =
            lbda -> new Complex(PhotonEnergy.wavelengthToEnergy(lbda), 1.0 / lbda);

    private static DispersionLaw constant(double re, double im) {
        Complex value = new Complex(re, im);
        return lbda -> value;
    }

    @Test
    void sumIsPointwiseSum() {
        DispersionLaw a = constant(2.0, 0.1);
        DispersionLaw sum = a.plus(PROBE);

        for (double lbda : new double[] {300.0, 600.0, 900.0}) {
            assertThat(sum.dielectric(lbda)).isEqualTo(a.dielectric(lbda).add(PROBE.dielectric(lbda)));
        }
    }

    @Test
    void plusLeavesOperandsUntouched() {
        DispersionLaw a = constant(1.0, 0.0);
        DispersionLaw b = constant(0.5, 0.5);
        DispersionSum sum = (DispersionSum) a.plus(b);

        assertThat(sum.getLeft()).isSameAs(a);
        assertThat(sum.getRight()).isSameAs(b);
        assertThat(a.dielectric(500.0)).isEqualTo(new Complex(1.0, 0.0));
    }

    @Test
    void arrayEvaluationMatchesScalarEvaluation() {
        DispersionLaw sum = constant(1.0, 0.0).plus(PROBE).plus(constant(0.0, 2.0));
        double[] grid = {250.0, 500.0, 750.0};

        Complex[] values = sum.dielectric(grid);

        assertThat(values).hasSize(3);
        for (int i = 0; i < grid.length; i++) {
            assertThat(values[i]).isEqualTo(sum.dielectric(grid[i]));
        }
    }

    @Test
    void flattenReturnsLeavesInEvaluationOrder() {
        DispersionLaw a = constant(1.0, 0.0);
        DispersionLaw b = constant(2.0, 0.0);
        DispersionLaw c = constant(3.0, 0.0);
        DispersionLaw d = constant(4.0, 0.0);

        DispersionSum sum = (DispersionSum) a.plus(b.plus(c)).plus(d);

        assertThat(sum.flatten()).containsExactly(a, b, c, d);
    }

    @Test
    void deepChainDoesNotOverflowStack() {
        DispersionLaw one = constant(1.0, 0.0);
        DispersionLaw chain = one;
        for (int i = 1; i < 100_000; i++) {
            chain = chain.plus(one);
        }

        assertThat(chain.dielectric(500.0).getReal()).isEqualTo(100_000.0);
        assertThat(chain.dielectric(new double[] {400.0, 800.0})[1].getReal())
                .isEqualTo(100_000.0);
    }

    @Test
    void nanFromOneOperandPropagates() {
        DispersionLaw sum = constant(1.0, 0.0).plus(lbda -> Complex.NaN);
        assertThat(sum.dielectric(500.0).isNaN()).isTrue();
    }

    @Test
    void rejectsNullOperand() {
        assertThatThrownBy(() -> constant(1.0, 0.0).plus(null))
                .isInstanceOf(NullPointerException.class);
    }
}
