package io.github.yok.dispersion.core.model;

import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.special.SpecialFunctions;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;

/**
 * 分数次元の励起子を扱う Tanguy の分散式です。
 *
 * <pre>
 * ε(E) = 1 + a/(b - E²) + A · R^(d/2-1) / (E + iγ)² · [g(ξ(E + iγ)) + g(ξ(-E - iγ)) - 2g(ξ(0))]
 * ξ(z) = √(R / (Eg - z))
 * </pre>
 *
 * <p>
 * g は次元 d により 3 通りに分岐します（d == 2、d == 3、それ以外）。 d = 2 の閉形式は 1/π で規格化し、一般形の d → 2 の極限と一致させています。
 * </p>
 *
 * <p>
 * 参考: C. Tanguy, Phys. Rev. B 60, 10660 (1999)
 * </p>
 */
@Slf4j
@Getter
public final class TanguyDispersion implements DispersionLaw {

    /**
     * 振幅 A（eV）です。
     */
    private final double amplitude;

    /**
     * 次元 d（1 &lt; d ≤ 3）です。
     */
    private final double dimension;

    /**
     * 励起子の広がり γ（eV）です。
     */
    private final double broadening;

    /**
     * 励起子の束縛エネルギー R（eV）です。
     */
    private final double bindingEnergy;

    /**
     * 光学バンドギャップ Eg（eV）です。
     */
    private final double bandGap;

    /**
     * 背景誘電率の Sellmeier 係数 a（eV²）です。
     */
    private final double backgroundA;

    /**
     * 背景誘電率の Sellmeier 係数 b（eV²）です。
     */
    private final double backgroundB;

    /**
     * 波長に依存しない項 g(ξ(0)) です。
     */
    private final Complex gAtZero;

    /**
     * Tanguy の分散式を生成します。
     *
     * @param amplitude 振幅 A（eV）です
     * @param dimension 次元 d です（1 &lt; d ≤ 3）
     * @param broadening 励起子の広がり γ（eV）です（0 以上）
     * @param bindingEnergy 励起子の束縛エネルギー R（eV）です（正）
     * @param bandGap 光学バンドギャップ Eg（eV）です
     * @param backgroundA 背景誘電率の Sellmeier 係数 a（eV²）です
     * @param backgroundB 背景誘電率の Sellmeier 係数 b（eV²）です
     * @throws DispersionConfigurationException パラメータが有効範囲外の場合に発生します
     */
    public TanguyDispersion(double amplitude, double dimension, double broadening,
            double bindingEnergy, double bandGap, double backgroundA, double backgroundB) {
        if (!(dimension > 1.0 && dimension <= 3.0)) {
            throw new DispersionConfigurationException("次元 d は (1, 3] の範囲である必要があります: " + dimension);
        }
        if (!(bindingEnergy > 0.0) || Double.isInfinite(bindingEnergy)) {
            throw new DispersionConfigurationException("束縛エネルギー R は正の有限値である必要があります: " + bindingEnergy);
        }
        if (!(broadening >= 0.0) || Double.isInfinite(broadening)) {
            throw new DispersionConfigurationException("広がり γ は 0 以上の有限値である必要があります: " + broadening);
        }
        this.amplitude = amplitude;
        this.dimension = dimension;
        this.broadening = broadening;
        this.bindingEnergy = bindingEnergy;
        this.bandGap = ModelPreconditions.requireFinite(bandGap, "バンドギャップ Eg");
        this.backgroundA = backgroundA;
        this.backgroundB = backgroundB;
        this.gAtZero = g(xsi(Complex.ZERO, bindingEnergy, bandGap), dimension);

        log.debug("Tanguy モデルを生成しました。d={}、g の分岐={}", dimension, branchName(dimension));
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        Complex z = new Complex(e, broadening);

        Complex excitonic = g(xsi(z, bindingEnergy, bandGap), dimension)
                .add(g(xsi(z.negate(), bindingEnergy, bandGap), dimension))
                .subtract(gAtZero.multiply(2.0));
        double prefactor = amplitude * FastMath.pow(bindingEnergy, dimension / 2.0 - 1.0);

        Complex background = new Complex(1.0 + backgroundA / (backgroundB - e * e), 0.0);
        return background.add(excitonic.multiply(prefactor).divide(z.multiply(z)));
    }

    /**
     * ξ(z) = √(R / (Eg - z)) を返します（主値）。
     *
     * @param z 複素エネルギーです
     * @param bindingEnergy 束縛エネルギー R です
     * @param bandGap バンドギャップ Eg です
     * @return ξ(z) です
     */
    static Complex xsi(Complex z, double bindingEnergy, double bandGap) {
        return new Complex(bindingEnergy, 0.0).divide(new Complex(bandGap, 0.0).subtract(z)).sqrt();
    }

    /**
     * 次元 d の励起子関数 g(ξ) を返します。
     *
     * <ul>
     * <li>d == 2: (2 ln ξ - 2ψ(1/2 - ξ)) / π</li>
     * <li>d == 3: 2 ln ξ - 2ψ(1 - ξ) - 1/ξ</li>
     * <li>それ以外: 2π Γ(D/2 + ξ) / (Γ(D/2)² Γ(1 - D/2 + ξ) ξ^(d-2)) · [cot(π(D/2 - ξ)) - cot(πD)]、D = d - 1</li>
     * </ul>
     *
     * @param xi ξ です
     * @param d 次元です
     * @return g(ξ) です
     */
    static Complex g(Complex xi, double d) {
        if (d == 2.0) {
            Complex value = xi.log().multiply(2.0)
                    .subtract(SpecialFunctions.digamma(new Complex(0.5, 0.0).subtract(xi)).multiply(2.0));
            return value.divide(FastMath.PI);
        }
        if (d == 3.0) {
            return xi.log().multiply(2.0)
                    .subtract(SpecialFunctions.digamma(Complex.ONE.subtract(xi)).multiply(2.0))
                    .subtract(xi.reciprocal());
        }

        double halfD = (d - 1.0) / 2.0;
        double gammaHalfD = Gamma.gamma(halfD);
        Complex ratio = SpecialFunctions.gamma(xi.add(halfD))
                .divide(SpecialFunctions.gamma(xi.add(1.0 - halfD)))
                .divide(gammaHalfD * gammaHalfD)
                .divide(xi.pow(d - 2.0));
        Complex cot = new Complex(halfD, 0.0).subtract(xi).multiply(FastMath.PI).tan().reciprocal();
        double cotPiD = 1.0 / FastMath.tan(FastMath.PI * (d - 1.0));
        return ratio.multiply(cot.subtract(cotPiD)).multiply(2.0 * FastMath.PI);
    }

    /**
     * ログ出力用に g の分岐名を返します。
     *
     * @param d 次元です
     * @return 分岐名です
     */
    private static String branchName(double d) {
        if (d == 2.0) {
            return "2D 閉形式";
        }
        if (d == 3.0) {
            return "3D 閉形式";
        }
        return "分数次元の一般形";
    }
}
