package io.github.yok.dispersion.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.dispersion.app.DispersionProperties.ModelDefinition;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.NumericPrecision;
import io.github.yok.dispersion.core.model.DrudeEnergyDispersion;
import io.github.yok.dispersion.core.spectrum.Spectrum;
import io.github.yok.dispersion.out.ResultWriter;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispersionCliRunnerTest {

    /**
     * 受け取った結果を保持するだけの出力先です。
     */
    private static final class CapturingWriter implements ResultWriter {

        private String name;
        private Spectrum dielectric;
        private Spectrum refractiveIndex;
        private Boolean conjugate;

        @Override
        public void write(String name, Spectrum dielectric, Spectrum refractiveIndex,
                boolean conjugate) {
            this.name = name;
            this.dielectric = dielectric;
            this.refractiveIndex = refractiveIndex;
            this.conjugate = conjugate;
        }
    }

    private final DispersionLaw drude = new DrudeEnergyDispersion(1.0, 2.0, 0.1);

    private DispersionProperties properties;

    private CapturingWriter writer;

    @BeforeEach
    void setUp() {
        properties = new DispersionProperties();
        ModelDefinition model = new ModelDefinition();
        model.setType(ModelDefinition.Type.DRUDE_ENERGY);
        model.setParameters(Arrays.asList(1.0, 2.0, 0.1));
        properties.setModels(Collections.singletonList(model));
        properties.getWavelength().setStart(400.0);
        properties.getWavelength().setEnd(800.0);
        properties.getWavelength().setPoints(5);
        properties.getOutput().setName("drude");
        writer = new CapturingWriter();
    }

    @Test
    void evaluatesConfiguredGridAndWritesResult() {
        new DispersionCliRunner(properties, drude, writer).run();

        assertThat(writer.name).isEqualTo("drude");
        assertThat(writer.conjugate).isFalse();
        assertThat(writer.dielectric.wavelengths()).containsExactly(400.0, 500.0, 600.0, 700.0,
                800.0);
        assertThat(writer.dielectric.valueAt(2)).isEqualTo(drude.dielectric(600.0));
        assertThat(writer.refractiveIndex.valueAt(2)).isEqualTo(drude.refractiveIndex(600.0));
    }

    @Test
    void conjugateConventionFlipsImaginaryParts() {
        properties.setConjugate(true);

        new DispersionCliRunner(properties, drude, writer).run();

        assertThat(writer.conjugate).isTrue();
        for (double k : writer.refractiveIndex.imaginary()) {
            assertThat(k).isNegative();
        }
        assertThat(writer.dielectric.valueAt(0)).isEqualTo(drude.dielectricConjugate(400.0));
    }

    @Test
    void singlePrecisionRoundsWrittenValues() {
        properties.setPrecision(NumericPrecision.SINGLE);

        new DispersionCliRunner(properties, drude, writer).run();

        for (int row = 0; row < writer.dielectric.size(); row++) {
            double re = writer.dielectric.valueAt(row).getReal();
            assertThat(re).isEqualTo((double) (float) re);
        }
    }
}
