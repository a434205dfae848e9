package io.github.yok.tlt.core.lattice;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 相互作用の分類結果（種別コード行列と補正後の変位ベクトル）を保持するクラスです。
 *
 * <p>
 * いずれも N×N の対称（変位は反対称）な配列です。呼び出し元が所有する一時データのため、配列はそのまま公開します。
 * </p>
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public final class InteractionTopology {

    /**
     * 種別コード行列（N×N、0 は相互作用なし）です。
     */
    private final int[][] typeCodes;

    /**
     * 補正後の変位ベクトル（N×N×3）です。
     */
    private final double[][][] displacements;

    /**
     * 補正後の距離行列（N×N）です。
     */
    private final double[][] distances;

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    public int siteCount() {
        return typeCodes.length;
    }

    /**
     * 指定ペアの種別コードを返します。
     *
     * @param i 行インデックスです
     * @param j 列インデックスです
     * @return 種別コードです
     */
    public int typeOf(int i, int j) {
        return typeCodes[i][j];
    }
}
