package io.github.yok.dispersion.app;

import io.github.yok.dispersion.core.law.NumericPrecision;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * dispersion-law の設定値（dispersion.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の分散則の組み立てと評価に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "dispersion")
public class DispersionProperties {

    /**
     * 出力値の数値精度です。
     */
    @NotNull
    private NumericPrecision precision = NumericPrecision.DOUBLE;

    /**
     * true の場合、ε1-iε2（n-ik）規約で出力します。
     */
    private boolean conjugate = false;

    /**
     * 評価する波長グリッドの設定です。
     */
    @Valid
    private Wavelength wavelength = new Wavelength();

    /**
     * 足し合わせる分散則の定義一覧です。
     */
    @Valid
    @NotEmpty
    private List<ModelDefinition> models = new ArrayList<>();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "dispersion")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Wavelength w = getWavelength();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "evaluation",
                // precision: 出力値の数値精度（DOUBLE/SINGLE）
                "precision", getPrecision(),
                // conjugate: ε1-iε2 規約で出力するかどうか
                "conjugate", isConjugate());

        appendSection(sb, nl, "wavelength",
                // start: 開始波長（nm）
                "start", w.getStart(),
                // end: 終了波長（nm）
                "end", w.getEnd(),
                // points: 点数
                "points", w.getPoints());

        for (int i = 0; i < getModels().size(); i++) {
            ModelDefinition m = getModels().get(i);
            appendSection(sb, nl, "models[" + i + "]",
                    // type: 分散則の種類
                    "type", m.getType(),
                    // parameters: スカラー係数
                    "parameters", m.getParameters(),
                    // oscillators: 振動子の係数（行ごと）
                    "oscillators", m.getOscillators(),
                    // table.points: テーブルの点数
                    "table.points", tablePoints(m));
        }

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir(),
                // name: 出力名
                "name", o.getName());

        return sb.toString();
    }

    /**
     * テーブルの点数を返します。table や wavelengths が未指定の場合は 0 です。
     *
     * @param m モデル定義です
     * @return テーブルの点数です
     */
    private static int tablePoints(ModelDefinition m) {
        Table t = m.getTable();
        return (t == null || t.getWavelengths() == null) ? 0 : t.getWavelengths().size();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Wavelength {

        /**
         * 開始波長（nm）です。
         */
        private double start = 200.0;

        /**
         * 終了波長（nm）です。
         */
        private double end = 1000.0;

        /**
         * 点数です。
         */
        @Min(2)
        private int points = 500;
    }

    @Data
    public static class ModelDefinition {

        /**
         * 分散則の種類です。
         */
        @NotNull
        private Type type;

        /**
         * スカラー係数です（並びは種類ごとに異なります）。
         */
        private List<Double> parameters = new ArrayList<>();

        /**
         * 振動子（または Sellmeier 項）の係数です。1 行が 1 項です。
         */
        private List<List<Double>> oscillators = new ArrayList<>();

        /**
         * テーブル型の分散則の標本です。
         */
        @Valid
        private Table table = new Table();

        /**
         * 分散則の種類です。
         *
         * <p>
         * 係数の並びは次のとおりです。
         * </p>
         *
         * <ul>
         * <li>CONSTANT: parameters = [n] または [n, k]</li>
         * <li>CAUCHY: parameters = [n0, n1, n2, k0, k1, k2]（省略分は 0）</li>
         * <li>SELLMEIER: oscillators = [[A, B], ...]</li>
         * <li>MODIFIED_SELLMEIER: parameters = [c0, c1, c2, c3, c4]</li>
         * <li>DRUDE_ENERGY: parameters = [ε∞, A, Γ]</li>
         * <li>DRUDE_RESISTIVITY: parameters = [ε∞, ρ, τ]</li>
         * <li>LORENTZ_WAVELENGTH / LORENTZ_ENERGY: oscillators = [[A, 位置, 広がり], ...]</li>
         * <li>GAUSS: parameters = [ε∞]、oscillators = [[A, E, Γ], ...]</li>
         * <li>TAUC_LORENTZ: parameters = [Eg, ε∞]、oscillators = [[A, E, C], ...]</li>
         * <li>HIGH_ENERGY_BANDS: parameters = [A, Eξ]</li>
         * <li>TANGUY: parameters = [A, d, γ, R, Eg, a, b]</li>
         * <li>POLES: parameters = [A_ir, A_uv, E_uv]</li>
         * <li>TABLE_INDEX / TABLE_EPSILON: table.wavelengths, table.real, table.imag</li>
         * </ul>
         */
        public enum Type {
            CONSTANT, CAUCHY, SELLMEIER, MODIFIED_SELLMEIER, DRUDE_ENERGY, DRUDE_RESISTIVITY,
            LORENTZ_WAVELENGTH, LORENTZ_ENERGY, GAUSS, TAUC_LORENTZ, HIGH_ENERGY_BANDS, TANGUY,
            POLES, TABLE_INDEX, TABLE_EPSILON
        }
    }

    @Data
    public static class Table {

        /**
         * 波長（nm）です。
         */
        private List<Double> wavelengths = new ArrayList<>();

        /**
         * 実部（n または ε1）です。
         */
        private List<Double> real = new ArrayList<>();

        /**
         * 虚部（k または ε2）です。空の場合は 0 とみなします。
         */
        private List<Double> imag = new ArrayList<>();
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";

        /**
         * 出力名（ファイル名の識別子）です。
         */
        @NotBlank
        private String name = "model";
    }
}
