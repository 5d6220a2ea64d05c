package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * 光学抵抗率と散乱時間をパラメータに持つ Drude の分散式です。
 *
 * <p>
 * ε(E) = ε∞ + ħ² / (ε0 · ρ · (τE² - iħE))
 * </p>
 *
 * <p>
 * ħ は eV·s、ε0 は F/cm、ρ は Ω·cm、τ は s の単位で扱います。
 * </p>
 */
@Getter
public final class DrudeResistivityDispersion implements DispersionLaw {

    /**
     * 換算プランク定数 ħ（eV·s）です。
     */
    public static final double HBAR_EV_S = 4.135667696e-15 / (2.0 * Math.PI);

    /**
     * 真空の誘電率 ε0（F/cm）です。
     */
    public static final double EPS0_F_PER_CM = 8.8541878128e-12 * 1e-2;

    /**
     * 高周波誘電率 ε∞ です。
     */
    private final double epsInf;

    /**
     * 光学抵抗率 ρ（Ω·cm）です。
     */
    private final double resistivity;

    /**
     * 平均散乱時間 τ（s）です。
     */
    private final double scatteringTime;

    /**
     * Drude の分散式を生成します。
     *
     * @param epsInf 高周波誘電率 ε∞ です
     * @param resistivity 光学抵抗率 ρ（Ω·cm）です（正）
     * @param scatteringTime 平均散乱時間 τ（s）です（正）
     * @throws DispersionConfigurationException ρ または τ が正の有限値でない場合に発生します
     */
    public DrudeResistivityDispersion(double epsInf, double resistivity, double scatteringTime) {
        if (!(resistivity > 0.0) || Double.isInfinite(resistivity)) {
            throw new DispersionConfigurationException("光学抵抗率 ρ は正の有限値である必要があります: " + resistivity);
        }
        if (!(scatteringTime > 0.0) || Double.isInfinite(scatteringTime)) {
            throw new DispersionConfigurationException(
                    "散乱時間 τ は正の有限値である必要があります: " + scatteringTime);
        }
        this.epsInf = epsInf;
        this.resistivity = resistivity;
        this.scatteringTime = scatteringTime;
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        Complex denominator = new Complex(scatteringTime * e * e, -HBAR_EV_S * e)
                .multiply(EPS0_F_PER_CM * resistivity);
        return new Complex(HBAR_EV_S * HBAR_EV_S, 0.0).divide(denominator).add(epsInf);
    }
}
