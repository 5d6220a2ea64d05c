package io.github.yok.dispersion.core.spectrum;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.commons.math3.complex.Complex;

/**
 * 波長ごとの複素数値（誘電率または屈折率）を保持する表です。
 *
 * <p>
 * 生成時に配列を複製するため、外部から内容を変更できません。
 * </p>
 */
public final class Spectrum {

    /**
     * 波長配列（nm）です。
     */
    private final double[] wavelengths;

    /**
     * 各波長に対応する複素数値です。
     */
    private final Complex[] values;

    /**
     * 表を生成します。
     *
     * @param wavelengths 波長配列（nm）です（null 不可）
     * @param values 複素数値配列です（null 不可、波長配列と同じ長さ）
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    public Spectrum(double[] wavelengths, Complex[] values) {
        checkNotNull(wavelengths, "wavelengths は null 不可です");
        checkNotNull(values, "values は null 不可です");
        checkArgument(wavelengths.length == values.length,
                "wavelengths と values の長さが一致しません: %s != %s", wavelengths.length,
                values.length);
        this.wavelengths = wavelengths.clone();
        this.values = values.clone();
    }

    /**
     * 行数を返します。
     *
     * @return 行数です
     */
    public int size() {
        return wavelengths.length;
    }

    /**
     * 指定行の波長を返します。
     *
     * @param row 行番号です
     * @return 波長（nm）です
     */
    public double wavelengthAt(int row) {
        return wavelengths[row];
    }

    /**
     * 指定行の複素数値を返します。
     *
     * @param row 行番号です
     * @return 複素数値です
     */
    public Complex valueAt(int row) {
        return values[row];
    }

    /**
     * 波長配列の複製を返します。
     *
     * @return 波長配列です
     */
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    /**
     * 実部の配列を返します。
     *
     * @return 実部（ε1 または n）の配列です
     */
    public double[] real() {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i].getReal();
        }
        return out;
    }

    /**
     * 虚部の配列を返します。
     *
     * @return 虚部（ε2 または k）の配列です
     */
    public double[] imaginary() {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i].getImaginary();
        }
        return out;
    }
}
