package io.github.yok.dispersion.core.special;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.Test;

class SpecialFunctionsTest {

    // -- Dawson ---------------------------------------------------------------

    @Test
    void dawsonMatchesReferenceValues() {
        assertThat(SpecialFunctions.dawson(0.0)).isEqualTo(0.0);
        assertThat(SpecialFunctions.dawson(0.5)).isCloseTo(0.4244363835020223, within(1e-13));
        assertThat(SpecialFunctions.dawson(1.0)).isCloseTo(0.5380795069127684, within(1e-13));
        assertThat(SpecialFunctions.dawson(2.0)).isCloseTo(0.30134038892379196, within(1e-13));
        // 漸近展開側
        assertThat(SpecialFunctions.dawson(10.0)).isCloseTo(0.050253847187598594, within(1e-13));
    }

    @Test
    void dawsonIsOdd() {
        for (double x : new double[] {0.3, 1.7, 5.9, 6.1, 25.0}) {
            assertThat(SpecialFunctions.dawson(-x)).isEqualTo(-SpecialFunctions.dawson(x));
        }
    }

    @Test
    void dawsonIsContinuousAcrossAsymptoticThreshold() {
        assertThat(SpecialFunctions.dawson(6.0 - 1e-9))
                .isCloseTo(SpecialFunctions.dawson(6.0 + 1e-9), within(1e-10));
    }

    @Test
    void dawsonPropagatesNaN() {
        assertThat(SpecialFunctions.dawson(Double.NaN)).isNaN();
        assertThat(SpecialFunctions.dawson(Double.POSITIVE_INFINITY)).isEqualTo(0.0);
    }

    // -- Gamma ----------------------------------------------------------------

    @Test
    void gammaOfIntegersIsFactorial() {
        assertThat(SpecialFunctions.gamma(new Complex(5.0, 0.0)).getReal()).isCloseTo(24.0,
                within(1e-11));
        assertThat(SpecialFunctions.gamma(Complex.ONE).getReal()).isCloseTo(1.0, within(1e-13));
    }

    @Test
    void gammaUsesReflectionForNegativeReal() {
        Complex g = SpecialFunctions.gamma(new Complex(-0.5, 0.0));
        assertThat(g.getReal()).isCloseTo(-2.0 * FastMath.sqrt(FastMath.PI), within(1e-12));
        assertThat(g.getImaginary()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void gammaOfComplexArgument() {
        Complex g = SpecialFunctions.gamma(new Complex(0.5, 1.0));
        assertThat(g.getReal()).isCloseTo(0.30069461726065627, within(1e-12));
        assertThat(g.getImaginary()).isCloseTo(-0.42496787943312353, within(1e-12));
    }

    @Test
    void gammaSatisfiesRecurrence() {
        Complex z = new Complex(1.3, -2.1);
        Complex lhs = SpecialFunctions.gamma(z.add(1.0));
        Complex rhs = z.multiply(SpecialFunctions.gamma(z));
        assertThat(lhs.subtract(rhs).abs()).isLessThan(1e-12 * rhs.abs());
    }

    // -- Digamma --------------------------------------------------------------

    @Test
    void digammaMatchesReferenceValues() {
        assertThat(SpecialFunctions.digamma(Complex.ONE).getReal())
                .isCloseTo(-0.5772156649015329, within(1e-12));
        assertThat(SpecialFunctions.digamma(new Complex(0.5, 0.0)).getReal())
                .isCloseTo(-1.9635100260214235, within(1e-12));
        assertThat(SpecialFunctions.digamma(new Complex(-0.5, 0.0)).getReal())
                .isCloseTo(0.03648997397857652, within(1e-12));
    }

    @Test
    void digammaSatisfiesRecurrence() {
        Complex z = new Complex(2.0, 3.0);
        Complex lhs = SpecialFunctions.digamma(z.add(1.0));
        Complex rhs = SpecialFunctions.digamma(z).add(z.reciprocal());
        assertThat(lhs.subtract(rhs).abs()).isLessThan(1e-13);
        assertThat(SpecialFunctions.digamma(z).getReal()).isCloseTo(1.2079807107101623,
                within(1e-12));
        assertThat(SpecialFunctions.digamma(z).getImaginary()).isCloseTo(1.1041296805875722,
                within(1e-12));
    }

    @Test
    void nanArgumentsPropagate() {
        assertThat(SpecialFunctions.gamma(Complex.NaN).isNaN()).isTrue();
        assertThat(SpecialFunctions.digamma(Complex.NaN).isNaN()).isTrue();
    }
}
