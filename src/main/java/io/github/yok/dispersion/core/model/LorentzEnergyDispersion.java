package io.github.yok.dispersion.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.Oscillator;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import java.util.List;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * エネルギー表示の係数を持つ Lorentz の分散式です。
 *
 * <p>
 * ε(E) = 1 + Σ Aᵢ / (Eᵢ² - E² - iΓᵢE)
 * </p>
 */
@Getter
public final class LorentzEnergyDispersion implements DispersionLaw {

    /**
     * 振動子（Aᵢ, Eᵢ, Γᵢ）の一覧です。
     */
    private final ImmutableList<Oscillator> oscillators;

    /**
     * Lorentz の分散式を生成します。
     *
     * @param oscillators 振動子（Aᵢ, Eᵢ, Γᵢ）の一覧です（1 項以上）
     */
    public LorentzEnergyDispersion(List<Oscillator> oscillators) {
        this.oscillators = ModelPreconditions.requireTerms(oscillators, "Lorentz 振動子");
    }

    @Override
    public Complex dielectric(double lbda) {
        double e = PhotonEnergy.wavelengthToEnergy(lbda);
        Complex eps = Complex.ONE;
        for (Oscillator o : oscillators) {
            double resonance = o.getPosition();
            Complex denominator =
                    new Complex(resonance * resonance - e * e, -o.getBroadening() * e);
            eps = eps.add(new Complex(o.getAmplitude(), 0.0).divide(denominator));
        }
        return eps;
    }
}
