package io.github.yok.dispersion.app;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.github.yok.dispersion.app.DispersionProperties.ModelDefinition;
import io.github.yok.dispersion.core.law.DispersionConfigurationException;
import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.core.law.Oscillator;
import io.github.yok.dispersion.core.law.SellmeierTerm;
import io.github.yok.dispersion.core.model.CauchyDispersion;
import io.github.yok.dispersion.core.model.ConstantDispersion;
import io.github.yok.dispersion.core.model.DrudeEnergyDispersion;
import io.github.yok.dispersion.core.model.DrudeResistivityDispersion;
import io.github.yok.dispersion.core.model.GaussDispersion;
import io.github.yok.dispersion.core.model.HighEnergyBandsDispersion;
import io.github.yok.dispersion.core.model.LorentzEnergyDispersion;
import io.github.yok.dispersion.core.model.LorentzWavelengthDispersion;
import io.github.yok.dispersion.core.model.ModifiedSellmeierDispersion;
import io.github.yok.dispersion.core.model.PoleDispersion;
import io.github.yok.dispersion.core.model.SellmeierDispersion;
import io.github.yok.dispersion.core.model.TanguyDispersion;
import io.github.yok.dispersion.core.model.TaucLorentzDispersion;
import io.github.yok.dispersion.core.table.TableEpsilonDispersion;
import io.github.yok.dispersion.core.table.TableIndexDispersion;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * 設定値のモデル定義から分散則を組み立てるクラスです。
 *
 * <p>
 * 複数の定義は定義順に {@link DispersionLaw#plus(DispersionLaw)} で足し合わせます。 係数の並びは
 * {@link ModelDefinition.Type} を参照してください。
 * </p>
 */
@Slf4j
public class DispersionLawFactory {

    /**
     * 定義一覧から、全定義の和となる分散則を生成します。
     *
     * @param definitions モデル定義の一覧です（1 件以上）
     * @return 分散則です
     * @throws DispersionConfigurationException 定義が不正な場合に発生します
     */
    public DispersionLaw create(List<ModelDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new DispersionConfigurationException("dispersion.models は 1 件以上指定してください");
        }
        DispersionLaw total = null;
        for (int i = 0; i < definitions.size(); i++) {
            ModelDefinition definition = definitions.get(i);
            if (definition == null) {
                throw new DispersionConfigurationException("models[" + i + "] が null です");
            }
            DispersionLaw law;
            try {
                law = create(definition);
            } catch (IllegalArgumentException e) {
                throw new DispersionConfigurationException(
                        "models[" + i + "] の定義が不正です: " + e.getMessage(), e);
            }
            total = (total == null) ? law : total.plus(law);
        }
        log.info("分散則を構築しました。モデル数={}", definitions.size());
        return total;
    }

    /**
     * 1 件の定義から分散則を生成します。
     *
     * @param definition モデル定義です（null 不可）
     * @return 分散則です
     * @throws DispersionConfigurationException 定義が不正な場合に発生します
     */
    public DispersionLaw create(ModelDefinition definition) {
        checkNotNull(definition, "definition は null 不可です");
        ModelDefinition.Type type = definition.getType();
        if (type == null) {
            throw new DispersionConfigurationException("type は必須です");
        }
        List<Double> p = nonNull(definition.getParameters());

        log.debug("分散則を生成します。type={}, parameters={}", type, p);

        switch (type) {
            case CONSTANT: {
                requireSizeBetween(type, p, 1, 2);
                return new ConstantDispersion(new Complex(at(p, 0), p.size() > 1 ? at(p, 1) : 0.0));
            }
            case CAUCHY: {
                requireSizeBetween(type, p, 1, 6);
                return new CauchyDispersion(at(p, 0), optional(p, 1), optional(p, 2), optional(p, 3),
                        optional(p, 4), optional(p, 5));
            }
            case SELLMEIER:
                return new SellmeierDispersion(sellmeierTerms(definition));
            case MODIFIED_SELLMEIER: {
                requireSizeBetween(type, p, 5, 5);
                return new ModifiedSellmeierDispersion(at(p, 0), at(p, 1), at(p, 2), at(p, 3),
                        at(p, 4));
            }
            case DRUDE_ENERGY: {
                requireSizeBetween(type, p, 3, 3);
                return new DrudeEnergyDispersion(at(p, 0), at(p, 1), at(p, 2));
            }
            case DRUDE_RESISTIVITY: {
                requireSizeBetween(type, p, 3, 3);
                return new DrudeResistivityDispersion(at(p, 0), at(p, 1), at(p, 2));
            }
            case LORENTZ_WAVELENGTH:
                return new LorentzWavelengthDispersion(oscillators(definition));
            case LORENTZ_ENERGY:
                return new LorentzEnergyDispersion(oscillators(definition));
            case GAUSS: {
                requireSizeBetween(type, p, 1, 1);
                return new GaussDispersion(at(p, 0), oscillators(definition));
            }
            case TAUC_LORENTZ: {
                requireSizeBetween(type, p, 2, 2);
                return new TaucLorentzDispersion(at(p, 0), at(p, 1), oscillators(definition));
            }
            case HIGH_ENERGY_BANDS: {
                requireSizeBetween(type, p, 2, 2);
                return new HighEnergyBandsDispersion(at(p, 0), at(p, 1));
            }
            case TANGUY: {
                requireSizeBetween(type, p, 7, 7);
                return new TanguyDispersion(at(p, 0), at(p, 1), at(p, 2), at(p, 3), at(p, 4),
                        at(p, 5), at(p, 6));
            }
            case POLES: {
                requireSizeBetween(type, p, 3, 3);
                return new PoleDispersion(at(p, 0), at(p, 1), at(p, 2));
            }
            case TABLE_INDEX:
                return new TableIndexDispersion(tableWavelengths(definition),
                        tableValues(definition));
            case TABLE_EPSILON:
                return new TableEpsilonDispersion(tableWavelengths(definition),
                        tableValues(definition));
            default:
                throw new DispersionConfigurationException("未対応の type です: " + type);
        }
    }

    /**
     * oscillators の各行を (振幅, 位置, 広がり) の振動子に変換します。
     *
     * @param definition モデル定義です
     * @return 振動子の一覧です
     */
    private static List<Oscillator> oscillators(ModelDefinition definition) {
        List<List<Double>> rows = nonNull(definition.getOscillators());
        ImmutableList.Builder<Oscillator> out = ImmutableList.builder();
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = requireRow(definition.getType(), rows.get(i), i, 3);
            out.add(new Oscillator(at(row, 0), at(row, 1), at(row, 2)));
        }
        return out.build();
    }

    /**
     * oscillators の各行を (A, B) の Sellmeier 項に変換します。
     *
     * @param definition モデル定義です
     * @return Sellmeier 項の一覧です
     */
    private static List<SellmeierTerm> sellmeierTerms(ModelDefinition definition) {
        List<List<Double>> rows = nonNull(definition.getOscillators());
        ImmutableList.Builder<SellmeierTerm> out = ImmutableList.builder();
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = requireRow(definition.getType(), rows.get(i), i, 2);
            out.add(new SellmeierTerm(at(row, 0), at(row, 1)));
        }
        return out.build();
    }

    /**
     * テーブル型の定義から table を取り出します。
     *
     * @param definition モデル定義です
     * @return table です
     * @throws DispersionConfigurationException table が指定されていない場合に発生します
     */
    private static DispersionProperties.Table table(ModelDefinition definition) {
        DispersionProperties.Table table = definition.getTable();
        if (table == null) {
            throw new DispersionConfigurationException(
                    definition.getType() + " には table の指定が必要です");
        }
        return table;
    }

    private static double[] tableWavelengths(ModelDefinition definition) {
        List<Double> lbda = nonNull(table(definition).getWavelengths());
        double[] out = new double[lbda.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = at(lbda, i);
        }
        return out;
    }

    /**
     * table.real と table.imag を複素数配列にまとめます。imag が空の場合は 0 とします。
     *
     * @param definition モデル定義です
     * @return 複素数配列です
     */
    private static Complex[] tableValues(ModelDefinition definition) {
        DispersionProperties.Table table = table(definition);
        List<Double> real = nonNull(table.getReal());
        List<Double> imag = nonNull(table.getImag());
        if (!imag.isEmpty() && imag.size() != real.size()) {
            throw new DispersionConfigurationException("table.real と table.imag の長さが一致しません: "
                    + real.size() + " != " + imag.size());
        }
        Complex[] out = new Complex[real.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = new Complex(at(real, i), imag.isEmpty() ? 0.0 : at(imag, i));
        }
        return out;
    }

    private static void requireSizeBetween(ModelDefinition.Type type, List<Double> p, int min,
            int max) {
        if (p.size() < min || p.size() > max) {
            String expected = (min == max) ? String.valueOf(min) : min + "〜" + max;
            throw new DispersionConfigurationException(
                    type + " の parameters は " + expected + " 個必要です: " + p.size());
        }
    }

    private static List<Double> requireRow(ModelDefinition.Type type, List<Double> row, int index,
            int size) {
        if (row == null || row.size() != size) {
            throw new DispersionConfigurationException(type + " の oscillators[" + index + "] は "
                    + size + " 要素必要です: " + row);
        }
        return row;
    }

    private static double at(List<Double> values, int index) {
        Double v = values.get(index);
        if (v == null) {
            throw new DispersionConfigurationException("係数に null が含まれています: index=" + index);
        }
        return v.doubleValue();
    }

    private static double optional(List<Double> values, int index) {
        return index < values.size() ? at(values, index) : 0.0;
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? ImmutableList.of() : values;
    }
}
