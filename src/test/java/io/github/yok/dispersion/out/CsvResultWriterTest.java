package io.github.yok.dispersion.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.dispersion.core.spectrum.Spectrum;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path tempDir;

    private static final Spectrum EPS = new Spectrum(new double[] {400.0, 500.0},
            new Complex[] {new Complex(4.0, 0.5), new Complex(2.25, 0.0)});

    private static final Spectrum N = new Spectrum(new double[] {400.0, 500.0},
            new Complex[] {new Complex(2.0, 0.125), new Complex(1.5, 0.0)});

    @Test
    void writesDielectricRefractiveIndexAndMetaFiles() throws IOException {
        Path out = tempDir.resolve("nested");
        new CsvResultWriter(out.toString()).write("TiO2", EPS, N, false);

        List<String> eps =
                Files.readAllLines(out.resolve("dispersion_dielectric_TiO2.csv"), StandardCharsets.UTF_8);
        assertThat(eps).containsExactly("Wavelength,ϵ1,ϵ2", "400.0,4.0,0.5", "500.0,2.25,0.0");

        List<String> n = Files.readAllLines(out.resolve("dispersion_refractiveIndex_TiO2.csv"),
                StandardCharsets.UTF_8);
        assertThat(n).containsExactly("Wavelength,n,k", "400.0,2.0,0.125", "500.0,1.5,0.0");

        List<String> meta =
                Files.readAllLines(out.resolve("dispersion_meta_TiO2.csv"), StandardCharsets.UTF_8);
        assertThat(meta).containsExactly("key,value", "convention,eps1+i*eps2", "points,2",
                "wavelength.start,400.0", "wavelength.end,500.0");
    }

    @Test
    void metaRecordsConjugateConvention() throws IOException {
        new CsvResultWriter(tempDir.toString()).write("conj", EPS, N, true);

        List<String> meta = Files.readAllLines(tempDir.resolve("dispersion_meta_conj.csv"),
                StandardCharsets.UTF_8);
        assertThat(meta).contains("convention,eps1-i*eps2");
    }

    @Test
    void rejectsInvalidArguments() {
        CsvResultWriter writer = new CsvResultWriter(tempDir.toString());
        Spectrum shorter = new Spectrum(new double[] {400.0}, new Complex[] {Complex.ONE});

        assertThatThrownBy(() -> writer.write("", EPS, N, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.write("x", EPS, shorter, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CsvResultWriter(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wrapsIoFailureInIllegalStateException() throws IOException {
        Path file = Files.createFile(tempDir.resolve("not-a-directory"));

        assertThatThrownBy(() -> new CsvResultWriter(file.toString()).write("x", EPS, N, false))
                .isInstanceOf(IllegalStateException.class).hasCauseInstanceOf(IOException.class);
    }
}
