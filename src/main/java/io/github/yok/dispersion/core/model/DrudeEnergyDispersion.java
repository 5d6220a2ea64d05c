package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * エネルギー表示のパラメータを持つ Drude の分散式です。
 *
 * <p>
 * ε(E) = ε∞ + A / (E² - iΓE)
 * </p>
 */
@Getter
public final class DrudeEnergyDispersion implements DispersionLaw {

    /**
     * 高周波誘電率 ε∞ です。
     */
    private final double epsInf;

    /**
     * Drude 振動子の振幅 A（eV²）です。
     */
    private final double amplitude;

    /**
     * Drude 振動子の広がり Γ（eV）です。
     */
    private final double broadening;

    /**
     * Drude の分散式を生成します。
     *
     * @param epsInf 高周波誘電率 ε∞ です
     * @param amplitude 振幅 A（eV²）です
     * @param broadening 広がり Γ（eV）です（有限の実数）
     * @throws io.github.yok.dispersion.core.law.DispersionConfigurationException Γ が有限でない場合に発生します
     */
    public DrudeEnergyDispersion(double epsInf, double amplitude, double broadening) {
        this.epsInf = epsInf;
        this.amplitude = amplitude;
        this.broadening = ModelPreconditions.requireFinite(broadening, "Drude の広がり Γ");
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        Complex denominator = new Complex(e * e, -broadening * e);
        return new Complex(amplitude, 0.0).divide(denominator).add(epsInf);
    }
}
