package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * 測定域より高エネルギー側のバンド間遷移を表す分散式です。
 *
 * <pre>
 * ε = A · (εr + iεi)
 * a = -(Eξ - E)² / E³、 b = (Eξ + E)² / E³
 * εr = 3Eξ / (πE²) · (a ln|1 - E/Eξ| + b ln|1 + E/Eξ| - 2/(3Eξ) - 2Eξ/E²)
 * εi = 3Eξ (|E| - Eξ)² / E⁵ · H(|E| - Eξ)
 * </pre>
 *
 * <p>
 * εi はしきい値 Eξ 以下で厳密に 0 です。E = Eξ では対数が発散し Infinity/NaN を返します。
 * </p>
 */
@Getter
public final class HighEnergyBandsDispersion implements DispersionLaw {

    /**
     * 振幅 A です。
     */
    private final double amplitude;

    /**
     * 吸収しきい値エネルギー Eξ（eV）です。
     */
    private final double thresholdEnergy;

    /**
     * 高エネルギーバンドの分散式を生成します。
     *
     * @param amplitude 振幅 A です
     * @param thresholdEnergy 吸収しきい値エネルギー Eξ（eV）です
     */
    public HighEnergyBandsDispersion(double amplitude, double thresholdEnergy) {
        this.amplitude = amplitude;
        this.thresholdEnergy = thresholdEnergy;
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        double ex = thresholdEnergy;
        double e2 = e * e;
        double e3 = e2 * e;

        double a = -(ex - e) * (ex - e) / e3;
        double b = (ex + e) * (ex + e) / e3;
        double real = 3.0 * ex / (FastMath.PI * e2)
                * (a * FastMath.log(FastMath.abs(1.0 - e / ex))
                        + b * FastMath.log(FastMath.abs(1.0 + e / ex)) - 2.0 / (3.0 * ex)
                        - 2.0 * ex / e2);

        double above = FastMath.abs(e) - ex;
        double imaginary = (above > 0.0) ? 3.0 * ex * above * above / (e3 * e2) : 0.0;

        return new Complex(amplitude * real, amplitude * imaginary);
    }
}
