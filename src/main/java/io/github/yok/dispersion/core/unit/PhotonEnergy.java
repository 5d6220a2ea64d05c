package io.github.yok.dispersion.core.unit;

import io.github.yok.dispersion.core.law.DispersionDomainException;

/**
 * 波長（nm）と光子エネルギー（eV）を相互変換するユーティリティです。
 *
 * <p>
 * E = hc / λ を用います。エネルギー表示の分散則はすべて {@link #wavelengthToEnergy(double)} を経由して変換します。
 * </p>
 */
public final class PhotonEnergy {

    /**
     * hc（eV・nm）です。
     *
     * <p>
     * SI の定義値 h, c, e から h·c/e·1e9 として求めた値です。
     * </p>
     */
    public static final double HC_EV_NM = 1239.8419843320026;

    private PhotonEnergy() {}

    /**
     * 波長が正の有限値であることを検査します。
     *
     * @param lbda 波長（nm）です
     * @return 検査済みの波長です
     * @throws DispersionDomainException 波長が正の有限値でない場合に発生します
     */
    public static double checkWavelength(double lbda) {
        if (!(lbda > 0.0) || Double.isInfinite(lbda)) {
            throw new DispersionDomainException("波長は正の有限値である必要があります: " + lbda);
        }
        return lbda;
    }

    /**
     * 波長（nm）を光子エネルギー（eV）に変換します。
     *
     * @param lbda 波長（nm）です（正の有限値）
     * @return 光子エネルギー（eV）です
     * @throws DispersionDomainException 波長が正の有限値でない場合に発生します
     */
    public static double wavelengthToEnergy(double lbda) {
        return HC_EV_NM / checkWavelength(lbda);
    }

    /**
     * 波長配列（nm）を光子エネルギー配列（eV）に変換します。
     *
     * @param lbda 波長配列（nm）です
     * @return 同じ長さ・順序の光子エネルギー配列です
     * @throws DispersionDomainException 正の有限値でない波長を含む場合に発生します
     */
    public static double[] wavelengthToEnergy(double[] lbda) {
        double[] energies = new double[lbda.length];
        for (int i = 0; i < lbda.length; i++) {
            energies[i] = wavelengthToEnergy(lbda[i]);
        }
        return energies;
    }

    /**
     * 光子エネルギー（eV）を波長（nm）に変換します。
     *
     * @param energy 光子エネルギー（eV）です（正の有限値）
     * @return 波長（nm）です
     * @throws DispersionDomainException エネルギーが正の有限値でない場合に発生します
     */
    public static double energyToWavelength(double energy) {
        if (!(energy > 0.0) || Double.isInfinite(energy)) {
            throw new DispersionDomainException("光子エネルギーは正の有限値である必要があります: " + energy);
        }
        return HC_EV_NM / energy;
    }
}
