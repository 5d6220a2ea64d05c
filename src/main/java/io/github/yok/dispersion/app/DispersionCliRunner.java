package io.github.yok.dispersion.app;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.NumericPrecision;
import io.github.yok.dispersion.core.spectrum.Spectrum;
import io.github.yok.dispersion.core.spectrum.WavelengthGrid;
import io.github.yok.dispersion.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で分散則を評価して出力するクラスです。
 *
 * <p>
 * 設定された波長グリッド上で誘電率と屈折率を評価し、指定の数値精度と符号規約で出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispersionCliRunner implements CommandLineRunner {

    /**
     * dispersion-law の設定値（dispersion.*）です。
     */
    private final DispersionProperties properties;

    /**
     * 全モデル定義の和となる分散則です。
     */
    private final DispersionLaw dispersionLaw;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== dispersion-law start: evaluate dielectric function ===");
        System.out.print(properties.toMultilineString());

        DispersionProperties.Wavelength w = properties.getWavelength();
        double[] grid = WavelengthGrid.linspace(w.getStart(), w.getEnd(), w.getPoints());

        boolean conjugate = properties.isConjugate();
        NumericPrecision precision = properties.getPrecision();

        Spectrum dielectric =
                withPrecision(dispersionLaw.tabulateDielectric(grid, conjugate), precision);
        Spectrum refractiveIndex =
                withPrecision(dispersionLaw.tabulateRefractiveIndex(grid, conjugate), precision);

        resultWriter.write(properties.getOutput().getName(), dielectric, refractiveIndex,
                conjugate);

        log.debug("評価が完了しました。点数={}、precision={}", grid.length, precision);

        int last = grid.length - 1;
        System.out.println("結果: λ=" + fmt5(grid[0]) + " nm, ε=" + fmt5(dielectric.valueAt(0))
                + ", N=" + fmt5(refractiveIndex.valueAt(0)));
        System.out.println("結果: λ=" + fmt5(grid[last]) + " nm, ε="
                + fmt5(dielectric.valueAt(last)) + ", N=" + fmt5(refractiveIndex.valueAt(last)));
    }

    /**
     * スペクトルの各値に数値精度を適用します。
     *
     * @param spectrum スペクトルです
     * @param precision 数値精度です
     * @return 精度を適用したスペクトルです
     */
    private static Spectrum withPrecision(Spectrum spectrum, NumericPrecision precision) {
        Complex[] values = new Complex[spectrum.size()];
        for (int row = 0; row < values.length; row++) {
            values[row] = precision.apply(spectrum.valueAt(row));
        }
        return new Spectrum(spectrum.wavelengths(), values);
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 複素数を a+bi 形式で小数点以下5桁までの文字列に整形します。
     *
     * @param c 複素数です
     * @return 整形した文字列です
     */
    private static String fmt5(Complex c) {
        return String.format(Locale.ROOT, "%.5f%+.5fi", c.getReal(), c.getImaginary());
    }
}
