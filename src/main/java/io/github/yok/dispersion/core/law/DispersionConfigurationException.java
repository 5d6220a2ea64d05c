package io.github.yok.dispersion.core.law;

/**
 * 分散則の生成時に、構造的に不正なパラメータが渡されたときに発生する例外です。
 *
 * <p>
 * 例: 長さの異なる/単調でないテーブル標本、Tanguy の次元 d が (1, 3] の範囲外、 Tauc-Lorentz の共鳴エネルギーがバンドギャップ以下。
 * </p>
 */
public class DispersionConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DispersionConfigurationException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public DispersionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
