package io.github.yok.dispersion.core.law;

/**
 * 評価入力が分散則の有効領域外にあるときに発生する例外です。
 *
 * <p>
 * 例: 正でない波長、テーブルの標本範囲外の波長。共鳴点での発散は本例外ではなく NaN/Infinity として返します。
 * </p>
 */
public class DispersionDomainException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DispersionDomainException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public DispersionDomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
