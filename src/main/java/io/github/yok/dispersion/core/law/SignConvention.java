package io.github.yok.dispersion.core.law;

import org.apache.commons.math3.complex.Complex;

/**
 * 符号規約（ε1+iε2 と ε1-iε2）の変換と、誘電率から屈折率を導く処理をまとめたクラスです。
 *
 * <p>
 * 内部の値は常に ε1+iε2（n+ik）規約です。ε1-iε2 規約の値は複素共役として都度導出します。
 * </p>
 */
public final class SignConvention {

    private SignConvention() {}

    /**
     * ε1+iε2 規約の値を ε1-iε2 規約に変換します（複素共役）。
     *
     * @param value ε1+iε2 規約の値です
     * @return 複素共役です
     */
    public static Complex toConjugate(Complex value) {
        return value.conjugate();
    }

    /**
     * 誘電率から屈折率 n+ik を求めます。
     *
     * <p>
     * 主値の平方根を用います。虚部が符号付きゼロ（-0.0）の場合は +0 とみなし、 吸収のない負の誘電率でも k ≥ 0 となるようにします。 NaN/Infinity
     * はそのまま伝播します。
     * </p>
     *
     * @param dielectric ε1+iε2 規約の誘電率です
     * @return n+ik 規約の屈折率です
     */
    public static Complex refractiveIndex(Complex dielectric) {
        if (dielectric.isNaN()) {
            return Complex.NaN;
        }
        double imaginary = dielectric.getImaginary();
        if (imaginary == 0.0) {
            return new Complex(dielectric.getReal(), 0.0).sqrt();
        }
        return dielectric.sqrt();
    }
}
