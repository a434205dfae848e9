package io.github.yok.tlt.core.error;

/**
 * 数値計算が破綻した場合に発生する例外です。
 *
 * <p>
 * ハミルトニアンに非有限値が含まれる場合や、固有分解に失敗した場合に使用します。 NaN/Inf を黙って平均に流さないための例外です。
 * </p>
 */
public class NumericalException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public NumericalException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public NumericalException(String message, Throwable cause) {
        super(message, cause);
    }
}
