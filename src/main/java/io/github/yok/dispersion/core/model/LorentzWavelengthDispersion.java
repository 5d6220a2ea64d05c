package io.github.yok.dispersion.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.Oscillator;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import java.util.List;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * 波長表示の係数を持つ Lorentz の分散式です。
 *
 * <p>
 * ε(λ) = 1 + Σ Aᵢ λ² / (λ² - λᵢ² - i ζᵢ λ)
 * </p>
 *
 * <p>
 * 振動子の共鳴位置 λᵢ と広がり ζᵢ は nm です。
 * </p>
 */
@Getter
public final class LorentzWavelengthDispersion implements DispersionLaw {

    /**
     * 振動子の一覧です。
     */
    private final ImmutableList<Oscillator> oscillators;

    /**
     * Lorentz の分散式を生成します。
     *
     * @param oscillators 振動子（Aᵢ, λᵢ, ζᵢ）の一覧です（1 項以上）
     */
    public LorentzWavelengthDispersion(List<Oscillator> oscillators) {
        this.oscillators = ModelPreconditions.requireTerms(oscillators, "Lorentz 振動子");
    }

    @Override
    public Complex dielectric(double lbda) {
        PhotonEnergy.checkWavelength(lbda);
        double lbda2 = lbda * lbda;
        Complex eps = Complex.ONE;
        for (Oscillator o : oscillators) {
            double resonance = o.getPosition();
            Complex denominator =
                    new Complex(lbda2 - resonance * resonance, -o.getBroadening() * lbda);
            eps = eps.add(new Complex(o.getAmplitude() * lbda2, 0.0).divide(denominator));
        }
        return eps;
    }
}
