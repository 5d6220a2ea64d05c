package io.github.yok.dispersion.core.table;

import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionDomainException;
import lombok.Getter;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.complex.Complex;

/**
 * 複素数値の標本を実部・虚部ごとに 3 次自然スプラインで補間するクラスです。
 *
 * <p>
 * 端点条件は両端の 2 階微分を 0 とする自然境界です。補間は標本点を厳密に通ります。標本の波長範囲外での評価は外挿せず、{@link DispersionDomainException} とします。
 * </p>
 */
public final class ComplexCubicSpline {

    /**
     * 3 次補間に必要な最小標本数です。
     */
    public static final int MIN_SAMPLES = 4;

    /**
     * 実部の補間関数です。
     */
    private final PolynomialSplineFunction realPart;

    /**
     * 虚部の補間関数です。
     */
    private final PolynomialSplineFunction imaginaryPart;

    /**
     * 標本の最小波長（nm）です。
     */
    @Getter
    private final double lowerBound;

    /**
     * 標本の最大波長（nm）です。
     */
    @Getter
    private final double upperBound;

    /**
     * 標本から補間関数を構築します。
     *
     * @param lbda 波長配列（nm）です（狭義単調増加、4 点以上）
     * @param values 複素数値配列です（波長配列と同じ長さ）
     * @throws DispersionConfigurationException 標本が不正な場合に発生します
     */
    public ComplexCubicSpline(double[] lbda, Complex[] values) {
        validate(lbda, values);

        double[] re = new double[values.length];
        double[] im = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            re[i] = values[i].getReal();
            im[i] = values[i].getImaginary();
        }

        SplineInterpolator interpolator = new SplineInterpolator();
        this.realPart = interpolator.interpolate(lbda, re);
        this.imaginaryPart = interpolator.interpolate(lbda, im);
        this.lowerBound = lbda[0];
        this.upperBound = lbda[lbda.length - 1];
    }

    /**
     * 指定波長の補間値を返します。
     *
     * @param lbda 波長（nm）です
     * @return 補間値です
     * @throws DispersionDomainException 波長が標本範囲外、または NaN の場合に発生します
     */
    public Complex value(double lbda) {
        if (!(lbda >= lowerBound && lbda <= upperBound)) {
            throw new DispersionDomainException("波長がテーブルの範囲外です: " + lbda + " nm（範囲 ["
                    + lowerBound + ", " + upperBound + "] nm）");
        }
        return new Complex(realPart.value(lbda), imaginaryPart.value(lbda));
    }

    /**
     * 標本の形状と値を検査します。
     *
     * @param lbda 波長配列です
     * @param values 複素数値配列です
     * @throws DispersionConfigurationException 標本が不正な場合に発生します
     */
    private static void validate(double[] lbda, Complex[] values) {
        if (lbda == null || values == null) {
            throw new DispersionConfigurationException("テーブルの波長と値は null 不可です");
        }
        if (lbda.length != values.length) {
            throw new DispersionConfigurationException(
                    "テーブルの波長と値の長さが一致しません: " + lbda.length + " != " + values.length);
        }
        if (lbda.length < MIN_SAMPLES) {
            throw new DispersionConfigurationException(
                    "テーブルは " + MIN_SAMPLES + " 点以上が必要です: " + lbda.length);
        }
        for (int i = 0; i < lbda.length; i++) {
            if (!Double.isFinite(lbda[i])) {
                throw new DispersionConfigurationException(
                        "テーブルの波長は有限値である必要があります: index=" + i + ", lbda=" + lbda[i]);
            }
            if (values[i] == null || values[i].isNaN() || values[i].isInfinite()) {
                throw new DispersionConfigurationException(
                        "テーブルの値は有限の複素数である必要があります: index=" + i + ", value=" + values[i]);
            }
            if (i > 0 && !(lbda[i] > lbda[i - 1])) {
                throw new DispersionConfigurationException("テーブルの波長は狭義単調増加である必要があります: index=" + i
                        + ", " + lbda[i - 1] + " >= " + lbda[i]);
            }
        }
    }
}
