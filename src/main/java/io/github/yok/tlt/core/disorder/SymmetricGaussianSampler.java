package io.github.yok.tlt.core.disorder;

import java.util.Random;
import org.ejml.data.DMatrixRMaj;

/**
 * 対称ガウス乱数行列（静的乱れの 1 サンプル）を生成するクラスです。
 *
 * <p>
 * N×N の標準正規乱数を行優先で引き、下三角（対角を含む）を残して上三角へ折り返します。 得られる行列 G は厳密に対称で、各成分の分散は 1 です。
 * 乱数源は呼び出し側が明示的に渡します。
 * </p>
 */
public final class SymmetricGaussianSampler {

    /**
     * 対称ガウス乱数行列を 1 つ生成します。
     *
     * @param size 行列次元 N です（1 以上）
     * @param random 乱数源です（null 不可）
     * @return N×N の対称行列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public DMatrixRMaj sample(int size, Random random) {
        if (size <= 0) {
            throw new IllegalArgumentException("size は 1 以上が必要です: " + size);
        }
        if (random == null) {
            throw new IllegalArgumentException("random は null 不可です");
        }

        DMatrixRMaj g = new DMatrixRMaj(size, size);
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                g.set(row, col, random.nextGaussian());
            }
        }

        // 下三角を上三角へ折り返します。
        for (int row = 0; row < size; row++) {
            for (int col = row + 1; col < size; col++) {
                g.set(row, col, g.get(col, row));
            }
        }
        return g;
    }
}
