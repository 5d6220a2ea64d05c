package io.github.yok.dispersion.core.model;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.dispersion.core.law.DispersionLaw;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * 波長に依存しない一定の屈折率を持つ分散則です。
 *
 * <p>
 * ε = n²（n は複素数可、吸収のある材料では k &gt; 0）
 * </p>
 */
@Getter
public final class ConstantDispersion implements DispersionLaw {

    /**
     * 屈折率 n です。
     */
    private final Complex n;

    /**
     * 誘電率 n² です。
     */
    private final Complex epsilon;

    /**
     * 複素屈折率から分散則を生成します。
     *
     * @param n 屈折率です（null 不可）
     */
    public ConstantDispersion(Complex n) {
        this.n = checkNotNull(n, "n は null 不可です");
        this.epsilon = n.multiply(n);
    }

    /**
     * 実数の屈折率から分散則を生成します。
     *
     * @param n 屈折率です
     */
    public ConstantDispersion(double n) {
        this(new Complex(n, 0.0));
    }

    /**
     * 波長によらず n² を返します。
     *
     * @param lbda 波長（nm）です（値は参照しません）
     * @return 誘電率です
     */
    @Override
    public Complex dielectric(double lbda) {
        return epsilon;
    }
}
