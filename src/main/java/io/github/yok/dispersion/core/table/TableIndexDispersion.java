package io.github.yok.dispersion.core.table;

import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionLaw;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * 屈折率のテーブルから補間する分散則です。
 *
 * <p>
 * 屈折率 n+ik（吸収のある材料では k &gt; 0）を 2 乗した誘電率を補間します。 範囲外の波長では例外とします。
 * </p>
 */
@Slf4j
public final class TableIndexDispersion implements DispersionLaw {

    /**
     * 誘電率（n²）の補間関数です。
     */
    @Getter
    private final ComplexCubicSpline interpolation;

    /**
     * 屈折率のテーブルから分散則を生成します。
     *
     * @param lbda 波長配列（nm）です（狭義単調増加、4 点以上）
     * @param n 屈折率 n+ik の配列です（波長配列と同じ長さ）
     * @throws DispersionConfigurationException 標本が不正な場合に発生します
     */
    public TableIndexDispersion(double[] lbda, Complex[] n) {
        this.interpolation = new ComplexCubicSpline(lbda, square(n));
        log.debug("屈折率テーブルを補間しました。点数={}、範囲=[{}, {}] nm", lbda.length,
                interpolation.getLowerBound(), interpolation.getUpperBound());
    }

    @Override
    public Complex dielectric(double lbda) {
        return interpolation.value(lbda);
    }

    /**
     * 屈折率の配列を誘電率（n²）の配列に変換します。
     *
     * @param n 屈折率の配列です
     * @return 誘電率の配列です
     * @throws DispersionConfigurationException 配列が null または null 要素を含む場合に発生します
     */
    private static Complex[] square(Complex[] n) {
        if (n == null) {
            throw new DispersionConfigurationException("テーブルの屈折率は null 不可です");
        }
        Complex[] epsilon = new Complex[n.length];
        for (int i = 0; i < n.length; i++) {
            if (n[i] == null) {
                throw new DispersionConfigurationException("テーブルの屈折率に null が含まれています: index=" + i);
            }
            epsilon[i] = n[i].multiply(n[i]);
        }
        return epsilon;
    }
}
