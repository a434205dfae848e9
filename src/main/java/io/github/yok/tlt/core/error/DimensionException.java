package io.github.yok.tlt.core.error;

/**
 * 格子・スーパーセルの次元が不正な場合に発生する例外です。
 *
 * <p>
 * 複製数が 1 未満、格子ベクトルが 3×3 でない、原子リストが空、などが該当します。
 * </p>
 */
public class DimensionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DimensionException(String message) {
        super(message);
    }
}
