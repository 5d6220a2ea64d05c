package io.github.yok.dispersion.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.Oscillator;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import java.util.List;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * Jellison と Modine による Tauc-Lorentz の分散式です。
 *
 * <p>
 * ε2 はバンドギャップ Eg 以下で 0、それ以上で Tauc 則と Lorentz 振動子の積です。 ε1 は ε2 の Kramers-Kronig 積分の閉形式で与えます。
 * </p>
 *
 * <pre>
 * ε2(E) = Σ Aᵢ Eᵢ Cᵢ (E - Eg)² / ((E² - Eᵢ²)² + Cᵢ² E²) / E   (E &gt; Eg)
 *       = 0                                                  (E ≤ Eg)
 * </pre>
 *
 * <p>
 * 文献の閉形式に現れる ln|E - Eg| の 2 項は係数 -(E - Eg)²/E にまとめて評価するため、 ε1 は E = Eg でも有限かつ連続です。
 * </p>
 *
 * <p>
 * 参考: G.E. Jellison and F.A. Modine, Appl. Phys. Lett. 69 (3), 371-374 (1996)、 Erratum, Appl. Phys. Lett.
 * 69 (14), 2137 (1996)
 * </p>
 */
@Getter
public final class TaucLorentzDispersion implements DispersionLaw {

    /**
     * 光学バンドギャップ Eg（eV）です。
     */
    private final double bandGap;

    /**
     * 高周波誘電率 ε∞ です。
     */
    private final double epsInf;

    /**
     * 振動子（強度 Aᵢ（eV）、共鳴エネルギー Eᵢ（eV）、広がり Cᵢ（eV））の一覧です。
     */
    private final ImmutableList<Oscillator> oscillators;

    /**
     * Tauc-Lorentz の分散式を生成します。
     *
     * @param bandGap 光学バンドギャップ Eg（eV）です（0 以上）
     * @param epsInf 高周波誘電率 ε∞ です
     * @param oscillators 振動子の一覧です（1 項以上、各項 Eg &lt; Eᵢ かつ 0 &lt; Cᵢ &lt; 2Eᵢ）
     * @throws DispersionConfigurationException パラメータが上記の条件を満たさない場合に発生します
     */
    public TaucLorentzDispersion(double bandGap, double epsInf, List<Oscillator> oscillators) {
        if (!(bandGap >= 0.0) || Double.isInfinite(bandGap)) {
            throw new DispersionConfigurationException("バンドギャップ Eg は 0 以上の有限値である必要があります: " + bandGap);
        }
        ImmutableList<Oscillator> terms =
                ModelPreconditions.requireTerms(oscillators, "Tauc-Lorentz 振動子");
        for (int i = 0; i < terms.size(); i++) {
            Oscillator o = terms.get(i);
            if (!(o.getPosition() > bandGap)) {
                throw new DispersionConfigurationException("共鳴エネルギー Eᵢ はバンドギャップ Eg より大きい必要があります: index="
                        + i + ", Ei=" + o.getPosition() + ", Eg=" + bandGap);
            }
            if (!(o.getBroadening() > 0.0 && o.getBroadening() < 2.0 * o.getPosition())) {
                throw new DispersionConfigurationException("広がり Cᵢ は 0 < Ci < 2Ei の範囲である必要があります: index=" + i
                        + ", Ci=" + o.getBroadening() + ", Ei=" + o.getPosition());
            }
        }
        this.bandGap = bandGap;
        this.epsInf = epsInf;
        this.oscillators = terms;
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        double real = epsInf;
        double imaginary = 0.0;
        for (Oscillator o : oscillators) {
            real += eps1(e, o.getAmplitude(), o.getPosition(), o.getBroadening());
            imaginary += eps2(e, o.getAmplitude(), o.getPosition(), o.getBroadening());
        }
        return new Complex(real, imaginary);
    }

    /**
     * 1 振動子分の ε2 を返します（E ≤ Eg では厳密に 0）。
     *
     * @param e 光子エネルギーです
     * @param a 強度です
     * @param e0 共鳴エネルギーです
     * @param c 広がりです
     * @return ε2 です
     */
    private double eps2(double e, double a, double e0, double c) {
        if (!(e > bandGap)) {
            return 0.0;
        }
        double gap = e - bandGap;
        double lorentz = (e * e - e0 * e0) * (e * e - e0 * e0) + c * c * e * e;
        return a * e0 * c * gap * gap / lorentz / e;
    }

    /**
     * 1 振動子分の ε1 の寄与（ε∞ を除く）を返します。
     *
     * @param e 光子エネルギーです
     * @param a 強度です
     * @param e0 共鳴エネルギーです
     * @param c 広がりです
     * @return ε1 の寄与です
     */
    private double eps1(double e, double a, double e0, double c) {
        final double pi = FastMath.PI;
        double eg = bandGap;
        double e2 = e * e;
        double eg2 = eg * eg;
        double e02 = e0 * e0;
        double c2 = c * c;

        double gamma2 = e02 - c2 / 2.0;
        double alpha = FastMath.sqrt(4.0 * e02 - c2);
        double aL = (eg2 - e02) * e2 + eg2 * c2 - e02 * (e02 + 3.0 * eg2);
        double aA = (e2 - e02) * (e02 + eg2) + eg2 * c2;
        double zeta4 = (e2 - gamma2) * (e2 - gamma2) + alpha * alpha * c2 / 4.0;

        double term1 = a * c * aL / (2.0 * pi * zeta4 * alpha * e0)
                * FastMath.log((e02 + eg2 + alpha * eg) / (e02 + eg2 - alpha * eg));
        double term2 = -a * aA / (pi * zeta4 * e0)
                * (pi - FastMath.atan((2.0 * eg + alpha) / c) + FastMath.atan((alpha - 2.0 * eg) / c));
        double term3 = 2.0 * a * e0 * eg / (pi * zeta4 * alpha) * (e2 - gamma2)
                * (pi + 2.0 * FastMath.atan(2.0 * (gamma2 - eg2) / (alpha * c)));

        // ln|E-Eg| の係数は -(E-Eg)²/E にまとまり、E→Eg で 0 に収束します。
        double gap = e - eg;
        double nearGap = (gap == 0.0) ? 0.0 : -(gap * gap / e) * FastMath.log(FastMath.abs(gap));
        double scale = FastMath.sqrt((e02 - eg2) * (e02 - eg2) + eg2 * c2);
        double term45 = a * e0 * c / (pi * zeta4) * (nearGap
                + ((e2 + eg2) / e + 2.0 * eg) * FastMath.log(e + eg) - 2.0 * eg * FastMath.log(scale));

        return term1 + term2 + term3 + term45;
    }
}
