package io.github.yok.dispersion.core.law;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.dispersion.core.spectrum.Spectrum;
import org.apache.commons.math3.complex.Complex;

/**
 * 波長から複素誘電率を評価する分散則を表すインタフェースです。
 *
 * <p>
 * 実装は生成後に不変であり、評価に副作用を持ちません。値は ε1+iε2（n+ik）規約で返します。 波長の単位は nm です。
 * </p>
 *
 * <p>
 * 共鳴点での発散は例外にせず、NaN/Infinity をそのまま返します。
 * </p>
 */
public interface DispersionLaw {

    /**
     * 指定波長の誘電率 ε1+iε2 を返します。
     *
     * @param lbda 波長（nm）です
     * @return 誘電率です
     * @throws DispersionDomainException 波長が有効領域外の場合に発生します
     */
    Complex dielectric(double lbda);

    /**
     * 波長配列の各要素について誘電率 ε1+iε2 を返します。
     *
     * @param lbda 波長配列（nm）です（null 不可）
     * @return 同じ長さ・順序の誘電率配列です
     * @throws DispersionDomainException 有効領域外の波長を含む場合に発生します
     */
    default Complex[] dielectric(double[] lbda) {
        checkNotNull(lbda, "lbda は null 不可です");
        Complex[] values = new Complex[lbda.length];
        for (int i = 0; i < lbda.length; i++) {
            try {
                values[i] = dielectric(lbda[i]);
            } catch (DispersionDomainException e) {
                throw new DispersionDomainException(
                        "波長配列の要素が有効領域外です: index=" + i + ", " + e.getMessage(), e);
            }
        }
        return values;
    }

    /**
     * 波長配列の各要素について、指定精度で誘電率 ε1+iε2 を返します。
     *
     * @param lbda 波長配列（nm）です（null 不可）
     * @param precision 出力精度です（null 不可）
     * @return 同じ長さ・順序の誘電率配列です
     */
    default Complex[] dielectric(double[] lbda, NumericPrecision precision) {
        checkNotNull(precision, "precision は null 不可です");
        Complex[] values = dielectric(lbda);
        for (int i = 0; i < values.length; i++) {
            values[i] = precision.apply(values[i]);
        }
        return values;
    }

    /**
     * 指定波長の誘電率を ε1-iε2 規約で返します。
     *
     * @param lbda 波長（nm）です
     * @return {@link #dielectric(double)} の複素共役です
     */
    default Complex dielectricConjugate(double lbda) {
        return SignConvention.toConjugate(dielectric(lbda));
    }

    /**
     * 波長配列の各要素について誘電率を ε1-iε2 規約で返します。
     *
     * @param lbda 波長配列（nm）です
     * @return {@link #dielectric(double[])} の要素ごとの複素共役です
     */
    default Complex[] dielectricConjugate(double[] lbda) {
        Complex[] values = dielectric(lbda);
        for (int i = 0; i < values.length; i++) {
            values[i] = SignConvention.toConjugate(values[i]);
        }
        return values;
    }

    /**
     * 指定波長の屈折率 n+ik を返します。
     *
     * @param lbda 波長（nm）です
     * @return 誘電率の主値平方根です
     */
    default Complex refractiveIndex(double lbda) {
        return SignConvention.refractiveIndex(dielectric(lbda));
    }

    /**
     * 波長配列の各要素について屈折率 n+ik を返します。
     *
     * @param lbda 波長配列（nm）です
     * @return 同じ長さ・順序の屈折率配列です
     */
    default Complex[] refractiveIndex(double[] lbda) {
        Complex[] values = dielectric(lbda);
        for (int i = 0; i < values.length; i++) {
            values[i] = SignConvention.refractiveIndex(values[i]);
        }
        return values;
    }

    /**
     * 指定波長の屈折率を n-ik 規約で返します。
     *
     * @param lbda 波長（nm）です
     * @return {@link #refractiveIndex(double)} の複素共役です
     */
    default Complex refractiveIndexConjugate(double lbda) {
        return SignConvention.toConjugate(refractiveIndex(lbda));
    }

    /**
     * 波長配列の各要素について屈折率を n-ik 規約で返します。
     *
     * @param lbda 波長配列（nm）です
     * @return {@link #refractiveIndex(double[])} の要素ごとの複素共役です
     */
    default Complex[] refractiveIndexConjugate(double[] lbda) {
        Complex[] values = refractiveIndex(lbda);
        for (int i = 0; i < values.length; i++) {
            values[i] = SignConvention.toConjugate(values[i]);
        }
        return values;
    }

    /**
     * この分散則と other の和を表す分散則を返します。
     *
     * <p>
     * どちらのオペランドも変更しません。
     * </p>
     *
     * @param other 加える分散則です（null 不可）
     * @return 和の分散則です
     */
    default DispersionLaw plus(DispersionLaw other) {
        return new DispersionSum(this, other);
    }

    /**
     * 誘電率を波長ごとの表として返します。
     *
     * @param lbda 波長配列（nm）です
     * @param conjugate true の場合は ε1-iε2 規約で返します
     * @return 誘電率の表です
     */
    default Spectrum tabulateDielectric(double[] lbda, boolean conjugate) {
        Complex[] values = conjugate ? dielectricConjugate(lbda) : dielectric(lbda);
        return new Spectrum(lbda, values);
    }

    /**
     * 屈折率を波長ごとの表として返します。
     *
     * @param lbda 波長配列（nm）です
     * @param conjugate true の場合は n-ik 規約で返します
     * @return 屈折率の表です
     */
    default Spectrum tabulateRefractiveIndex(double[] lbda, boolean conjugate) {
        Complex[] values = conjugate ? refractiveIndexConjugate(lbda) : refractiveIndex(lbda);
        return new Spectrum(lbda, values);
    }
}
