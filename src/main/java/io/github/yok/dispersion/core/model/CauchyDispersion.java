package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * Cauchy の分散式です。
 *
 * <p>
 * 係数は λ（nm）に対して定義します。
 * </p>
 *
 * <pre>
 * n(λ) = n0 + 1e2 · n1 / λ² + 1e7 · n2 / λ⁴
 * k(λ) = k0 + 1e2 · k1 / λ² + 1e7 · k2 / λ⁴
 * ε = (n + ik)²
 * </pre>
 */
@Getter
public final class CauchyDispersion implements DispersionLaw {

    private final double n0;
    private final double n1;
    private final double n2;
    private final double k0;
    private final double k1;
    private final double k2;

    /**
     * Cauchy の分散式を生成します。
     *
     * @param n0 屈折率の定数項です
     * @param n1 屈折率の 1/λ² 項の係数です
     * @param n2 屈折率の 1/λ⁴ 項の係数です
     * @param k0 消衰係数の定数項です
     * @param k1 消衰係数の 1/λ² 項の係数です
     * @param k2 消衰係数の 1/λ⁴ 項の係数です
     */
    public CauchyDispersion(double n0, double n1, double n2, double k0, double k1, double k2) {
        this.n0 = n0;
        this.n1 = n1;
        this.n2 = n2;
        this.k0 = k0;
        this.k1 = k1;
        this.k2 = k2;
    }

    /**
     * 透明な Cauchy の分散式（k0 = k1 = k2 = 0）を生成します。
     *
     * @param n0 屈折率の定数項です
     * @param n1 屈折率の 1/λ² 項の係数です
     * @param n2 屈折率の 1/λ⁴ 項の係数です
     */
    public CauchyDispersion(double n0, double n1, double n2) {
        this(n0, n1, n2, 0.0, 0.0, 0.0);
    }

    @Override
    public Complex dielectric(double lbda) {
        PhotonEnergy.checkWavelength(lbda);
        double inv2 = 1.0 / (lbda * lbda);
        double inv4 = inv2 * inv2;
        double n = n0 + 1e2 * n1 * inv2 + 1e7 * n2 * inv4;
        double k = k0 + 1e2 * k1 * inv2 + 1e7 * k2 * inv4;
        Complex refractive = new Complex(n, k);
        return refractive.multiply(refractive);
    }
}
