package io.github.yok.dispersion.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.Oscillator;
import io.github.yok.dispersion.core.special.SpecialFunctions;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import java.util.List;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * ガウス型振動子の分散式です。
 *
 * <p>
 * ε2 をガウス関数の反対称和とし、ε1 を Kramers-Kronig 変換に相当する Dawson 積分で与えます。 広がり Γᵢ は半値全幅で、係数
 * 2√(ln 2) で変換します。
 * </p>
 *
 * <pre>
 * ε1 = ε∞ + Σ 2Aᵢ/√π · [F(f(E+Eᵢ)/Γᵢ) - F(f(E-Eᵢ)/Γᵢ)]
 * ε2 = Σ Aᵢ · [exp(-(f(E-Eᵢ)/Γᵢ)²) - exp(-(f(E+Eᵢ)/Γᵢ)²)]
 * f = 2√(ln 2)、F は Dawson 積分
 * </pre>
 *
 * <p>
 * 参考: D. De Sousa Meneses, M. Malki, P. Echegut, J. Non-Cryst. Solids 351, 769-776 (2006)、 K.-E. Peiponen,
 * E.M. Vartiainen, Phys. Rev. B 44, 8301 (1991)
 * </p>
 */
@Getter
public final class GaussDispersion implements DispersionLaw {

    /**
     * 半値全幅から指数の幅への変換係数 2√(ln 2) です。
     */
    static final double FWHM_TO_SIGMA = 2.0 * FastMath.sqrt(FastMath.log(2.0));

    /**
     * 2/√π です。
     */
    private static final double TWO_OVER_SQRT_PI = 2.0 / FastMath.sqrt(FastMath.PI);

    /**
     * 高周波誘電率 ε∞ です。
     */
    private final double epsInf;

    /**
     * 振動子（Aᵢ, Eᵢ, Γᵢ）の一覧です。
     */
    private final ImmutableList<Oscillator> oscillators;

    /**
     * ガウス型振動子の分散式を生成します。
     *
     * @param epsInf 高周波誘電率 ε∞ です
     * @param oscillators 振動子（振幅 Aᵢ、中心エネルギー Eᵢ（eV）、半値全幅 Γᵢ（eV））の一覧です（1 項以上）
     */
    public GaussDispersion(double epsInf, List<Oscillator> oscillators) {
        this.epsInf = epsInf;
        this.oscillators = ModelPreconditions.requireTerms(oscillators, "ガウス振動子");
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        double real = epsInf;
        double imaginary = 0.0;
        for (Oscillator o : oscillators) {
            double amplitude = o.getAmplitude();
            double plus = FWHM_TO_SIGMA * (e + o.getPosition()) / o.getBroadening();
            double minus = FWHM_TO_SIGMA * (e - o.getPosition()) / o.getBroadening();

            real += amplitude * TWO_OVER_SQRT_PI
                    * (SpecialFunctions.dawson(plus) - SpecialFunctions.dawson(minus));
            imaginary += amplitude * (FastMath.exp(-minus * minus) - FastMath.exp(-plus * plus));
        }
        return new Complex(real, imaginary);
    }
}
