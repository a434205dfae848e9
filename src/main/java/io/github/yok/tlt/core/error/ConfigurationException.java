package io.github.yok.tlt.core.error;

/**
 * 計算パラメータが欠落している、または不正な場合に発生する例外です。
 *
 * <p>
 * 結合定数・乱れ強度の配列長が 3 でない場合や、温度・散乱率などが正でない場合に使用します。 計算開始前に検出されることを前提とします。
 * </p>
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
