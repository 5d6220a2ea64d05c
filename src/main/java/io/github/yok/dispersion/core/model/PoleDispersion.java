package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * 測定波長域の外側にある UV / IR の極を表す分散式です。
 *
 * <p>
 * ε(E) = A_ir / E² + A_uv / (E_uv² - E²)
 * </p>
 */
@Getter
public final class PoleDispersion implements DispersionLaw {

    /**
     * IR 極の強度です。
     */
    private final double amplitudeIr;

    /**
     * UV 極の強度です。
     */
    private final double amplitudeUv;

    /**
     * UV 極のエネルギー（eV）です。
     */
    private final double energyUv;

    /**
     * 極の分散式を生成します。
     *
     * @param amplitudeIr IR 極の強度です
     * @param amplitudeUv UV 極の強度です
     * @param energyUv UV 極のエネルギー（eV）です
     */
    public PoleDispersion(double amplitudeIr, double amplitudeUv, double energyUv) {
        this.amplitudeIr = amplitudeIr;
        this.amplitudeUv = amplitudeUv;
        this.energyUv = energyUv;
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        double e2 = e * e;
        return new Complex(amplitudeIr / e2 + amplitudeUv / (energyUv * energyUv - e2), 0.0);
    }
}
