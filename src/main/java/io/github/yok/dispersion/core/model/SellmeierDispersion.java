package io.github.yok.dispersion.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.SellmeierTerm;
import io.github.yok.dispersion.core.unit.PhotonEnergy;
import java.util.List;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

/**
 * Sellmeier の分散式です。
 *
 * <p>
 * ε(λ) = 1 + Σ Aᵢ λ² / (λ² - Bᵢ)（λ は µm、Bᵢ は µm²）
 * </p>
 *
 * <p>
 * λ² = Bᵢ では Infinity/NaN を返します。
 * </p>
 */
@Getter
public final class SellmeierDispersion implements DispersionLaw {

    /**
     * Sellmeier 項の一覧です。
     */
    private final ImmutableList<SellmeierTerm> terms;

    /**
     * Sellmeier の分散式を生成します。
     *
     * @param terms Sellmeier 項の一覧です（1 項以上）
     * @throws io.github.yok.dispersion.core.law.DispersionConfigurationException 一覧が空の場合に発生します
     */
    public SellmeierDispersion(List<SellmeierTerm> terms) {
        this.terms = ModelPreconditions.requireTerms(terms, "Sellmeier 項");
    }

    @Override
    public Complex dielectric(double lbda) {
        double um = PhotonEnergy.checkWavelength(lbda) / 1e3;
        double um2 = um * um;
        double eps = 1.0;
        for (SellmeierTerm term : terms) {
            eps += term.getA() * um2 / (um2 - term.getB());
        }
        return new Complex(eps, 0.0);
    }
}
