package io.github.yok.dispersion.core.spectrum;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class WavelengthGridTest {

    @Test
    void defaultGridSpans200To1000With500Points() {
        double[] grid = WavelengthGrid.defaultGrid();

        assertThat(grid).hasSize(500);
        assertThat(grid[0]).isEqualTo(200.0);
        assertThat(grid[499]).isEqualTo(1000.0);
        assertThat(grid[1] - grid[0]).isCloseTo(800.0 / 499.0, within(1e-12));
    }

    @Test
    void linspaceIncludesBothEnds() {
        assertThat(WavelengthGrid.linspace(400.0, 800.0, 5))
                .containsExactly(400.0, 500.0, 600.0, 700.0, 800.0);
    }

    @Test
    void rejectsTooFewPoints() {
        assertThatThrownBy(() -> WavelengthGrid.linspace(400.0, 800.0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonFiniteRange() {
        assertThatThrownBy(() -> WavelengthGrid.linspace(Double.NaN, 800.0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
