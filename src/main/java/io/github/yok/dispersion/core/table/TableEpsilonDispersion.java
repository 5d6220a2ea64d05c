package io.github.yok.dispersion.core.table;

import io.github.yok.dispersion.core.law.DispersionLaw;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * 誘電率のテーブルから補間する分散則です。
 *
 * <p>
 * 生成時に 3 次スプラインを構築し、標本そのものは保持しません。範囲外の波長では例外とします。
 * </p>
 */
@Slf4j
public final class TableEpsilonDispersion implements DispersionLaw {

    /**
     * 誘電率の補間関数です。
     */
    @Getter
    private final ComplexCubicSpline interpolation;

    /**
     * 誘電率のテーブルから分散則を生成します。
     *
     * @param lbda 波長配列（nm）です（狭義単調増加、4 点以上）
     * @param epsilon 誘電率 ε1+iε2 の配列です（波長配列と同じ長さ）
     * @throws io.github.yok.dispersion.core.law.DispersionConfigurationException 標本が不正な場合に発生します
     */
    public TableEpsilonDispersion(double[] lbda, Complex[] epsilon) {
        this.interpolation = new ComplexCubicSpline(lbda, epsilon);
        log.debug("誘電率テーブルを補間しました。点数={}、範囲=[{}, {}] nm", lbda.length,
                interpolation.getLowerBound(), interpolation.getUpperBound());
    }

    @Override
    public Complex dielectric(double lbda) {
        return interpolation.value(lbda);
    }
}
