package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * Sellmeier 式の変形版（MgO 型）です。
 *
 * <p>
 * ε(λ) = c0 + c1 λ² + c2 λ⁴ + c3 / (λ² - c4)（λ は µm）
 * </p>
 */
@Getter
public final class ModifiedSellmeierDispersion implements DispersionLaw {

    private final double c0;
    private final double c1;
    private final double c2;
    private final double c3;
    private final double c4;

    /**
     * 変形 Sellmeier 式を生成します。
     *
     * @param c0 定数項です
     * @param c1 λ² 項の係数です
     * @param c2 λ⁴ 項の係数です
     * @param c3 極の強度です
     * @param c4 極の位置（µm²）です
     */
    public ModifiedSellmeierDispersion(double c0, double c1, double c2, double c3, double c4) {
        this.c0 = c0;
        this.c1 = c1;
        this.c2 = c2;
        this.c3 = c3;
        this.c4 = c4;
    }

    @Override
    public Complex dielectric(double lbda) {
        double um = PhotonEnergy.checkWavelength(lbda) / 1e3;
        double um2 = um * um;
        double eps = c0 + c1 * um2 + c2 * um2 * um2 + c3 / (um2 - c4);
        return new Complex(eps, 0.0);
    }
}
