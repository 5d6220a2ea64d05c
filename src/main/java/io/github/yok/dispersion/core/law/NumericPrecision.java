package io.github.yok.dispersion.core.law;

import org.apache.commons.math3.complex.Complex;

/**
 * 評価結果の数値精度です。
 *
 * <p>
 * 評価呼び出しに明示的に渡して使用します（プロセス全体の設定値としては保持しません）。
 * </p>
 */
public enum NumericPrecision {

    /**
     * 倍精度のまま返します。
     */
    DOUBLE {
        @Override
        public Complex apply(Complex value) {
            return value;
        }
    },

    /**
     * 実部・虚部をそれぞれ単精度に丸めて返します。
     */
    SINGLE {
        @Override
        public Complex apply(Complex value) {
            return new Complex((float) value.getReal(), (float) value.getImaginary());
        }
    };

    /**
     * 複素数値に精度を適用します。
     *
     * @param value 複素数値です
     * @return 精度を適用した値です
     */
    public abstract Complex apply(Complex value);
}
