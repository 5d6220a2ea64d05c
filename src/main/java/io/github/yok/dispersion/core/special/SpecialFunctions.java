package io.github.yok.dispersion.core.special;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * 分散則で使用する特殊関数（Dawson 積分、複素ガンマ関数、複素ディガンマ関数）を提供するクラスです。
 *
 * <p>
 * commons-math3 の {@code Gamma} は実引数のみを扱うため、Tanguy モデルで必要となる複素引数版をここで実装します。
 * </p>
 */
public final class SpecialFunctions {

    /**
     * Lanczos 近似の g パラメータです。
     */
    private static final double LANCZOS_G = 7.0;

    /**
     * Lanczos 近似の係数（g=7, n=9）です。
     */
    private static final double[] LANCZOS_COEFFICIENTS = {0.99999999999980993,
            676.5203681218851, -1259.1392167224028, 771.32342877765313, -176.61502916214059,
            12.507343278686905, -0.13857109526572012, 9.9843695780195716e-6,
            1.5056327351493116e-7};

    /**
     * √(2π) です。
     */
    private static final double SQRT_TWO_PI = FastMath.sqrt(2.0 * FastMath.PI);

    /**
     * Dawson 積分で漸近展開に切り替える |x| の閾値です。
     */
    private static final double DAWSON_ASYMPTOTIC_THRESHOLD = 6.0;

    /**
     * ディガンマ関数で漸近展開を使う実部の下限です。
     */
    private static final double DIGAMMA_ASYMPTOTIC_THRESHOLD = 10.0;

    /**
     * 級数の打ち切りに使う相対誤差です。
     */
    private static final double SERIES_EPSILON = 1e-17;

    /**
     * 級数の最大項数です。
     */
    private static final int SERIES_MAX_TERMS = 600;

    private SpecialFunctions() {}

    /**
     * Dawson 積分 F(x) = exp(-x²) ∫₀ˣ exp(t²) dt を返します。
     *
     * <p>
     * |x| &lt; 6 では正項級数 exp(-x²) Σ x^(2n+1) / (n! (2n+1)) を、 それ以上では漸近展開 1/(2x) Σ (2n-1)!! / (2x²)^n
     * を用います。F は奇関数です。
     * </p>
     *
     * @param x 引数です
     * @return Dawson 積分の値です（x が NaN の場合は NaN）
     */
    public static double dawson(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (Double.isInfinite(x)) {
            return 0.0;
        }
        double ax = FastMath.abs(x);
        double value = (ax < DAWSON_ASYMPTOTIC_THRESHOLD) ? dawsonSeries(ax) : dawsonAsymptotic(ax);
        return (x < 0.0) ? -value : value;
    }

    /**
     * 正項級数で Dawson 積分を評価します（x ≥ 0）。
     *
     * @param x 引数です
     * @return Dawson 積分の値です
     */
    private static double dawsonSeries(double x) {
        double x2 = x * x;
        double power = x;
        double sum = x;
        for (int n = 1; n < SERIES_MAX_TERMS; n++) {
            // power = x^(2n+1) / n!
            power *= x2 / n;
            double term = power / (2 * n + 1);
            sum += term;
            if (term < SERIES_EPSILON * sum) {
                break;
            }
        }
        return FastMath.exp(-x2) * sum;
    }

    /**
     * 漸近展開で Dawson 積分を評価します（x ≥ 6）。
     *
     * @param x 引数です
     * @return Dawson 積分の値です
     */
    private static double dawsonAsymptotic(double x) {
        double twoX2 = 2.0 * x * x;
        double term = 1.0;
        double sum = 1.0;
        for (int n = 1; n < SERIES_MAX_TERMS; n++) {
            double next = term * (2 * n - 1) / twoX2;
            // 漸近級数は最小項の手前で打ち切ります。
            if (next > term || next < SERIES_EPSILON) {
                break;
            }
            term = next;
            sum += term;
        }
        return sum / (2.0 * x);
    }

    /**
     * 複素ガンマ関数 Γ(z) を返します。
     *
     * <p>
     * Re z &lt; 1/2 では相反公式 Γ(z)Γ(1-z) = π / sin(πz) を用い、それ以外は Lanczos 近似で評価します。 非正の整数（極）では
     * Infinity/NaN を返します。
     * </p>
     *
     * @param z 引数です
     * @return Γ(z) です
     */
    public static Complex gamma(Complex z) {
        if (z.isNaN()) {
            return Complex.NaN;
        }
        if (z.getReal() < 0.5) {
            Complex sinPiZ = z.multiply(FastMath.PI).sin();
            return new Complex(FastMath.PI, 0.0).divide(sinPiZ.multiply(gamma(Complex.ONE.subtract(z))));
        }

        Complex shifted = z.subtract(1.0);
        Complex series = new Complex(LANCZOS_COEFFICIENTS[0], 0.0);
        for (int i = 1; i < LANCZOS_COEFFICIENTS.length; i++) {
            series = series.add(new Complex(LANCZOS_COEFFICIENTS[i], 0.0).divide(shifted.add(i)));
        }

        Complex t = shifted.add(LANCZOS_G + 0.5);
        // t^(z-1/2) * exp(-t) を対数で合成して、途中のオーバーフローを避けます。
        Complex logPart = shifted.add(0.5).multiply(t.log()).subtract(t);
        return logPart.exp().multiply(series).multiply(SQRT_TWO_PI);
    }

    /**
     * 複素ディガンマ関数 ψ(z) = Γ'(z)/Γ(z) を返します。
     *
     * <p>
     * Re z &lt; 1/2 では相反公式 ψ(z) = ψ(1-z) - π cot(πz) を用います。 その後、漸化式 ψ(z) = ψ(z+1) - 1/z で Re z ≥ 10
     * まで移動し、漸近展開で評価します。
     * </p>
     *
     * @param z 引数です
     * @return ψ(z) です
     */
    public static Complex digamma(Complex z) {
        if (z.isNaN()) {
            return Complex.NaN;
        }
        if (z.getReal() < 0.5) {
            Complex cotPiZ = z.multiply(FastMath.PI).tan().reciprocal();
            return digamma(Complex.ONE.subtract(z)).subtract(cotPiZ.multiply(FastMath.PI));
        }

        Complex shift = Complex.ZERO;
        Complex w = z;
        while (w.getReal() < DIGAMMA_ASYMPTOTIC_THRESHOLD) {
            shift = shift.subtract(w.reciprocal());
            w = w.add(1.0);
        }

        Complex inv2 = w.multiply(w).reciprocal();
        // Σ B_2n / (2n w^2n) を Horner 法で評価します。
        Complex tail = inv2.multiply(1.0 / 132.0);
        tail = inv2.multiply(new Complex(1.0 / 240.0, 0.0).subtract(tail));
        tail = inv2.multiply(new Complex(1.0 / 252.0, 0.0).subtract(tail));
        tail = inv2.multiply(new Complex(1.0 / 120.0, 0.0).subtract(tail));
        tail = inv2.multiply(new Complex(1.0 / 12.0, 0.0).subtract(tail));

        Complex asymptotic = w.log().subtract(w.reciprocal().multiply(0.5)).subtract(tail);
        return shift.add(asymptotic);
    }
}
