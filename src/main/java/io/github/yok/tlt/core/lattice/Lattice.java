package io.github.yok.tlt.core.lattice;

import org.ejml.data.DMatrixRMaj;

/**
 * 移動度計算で使用する格子（分子サイト集合）を表すインタフェースです。
 *
 * <p>
 * ソルバ側は格子の生成方法を意識せず、サイト数と座標のみを利用します。
 * </p>
 */
public interface Lattice {

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    int siteCount();

    /**
     * サイト座標（N×3、格子定数単位の分率座標）を返します。
     *
     * @return サイト座標です
     */
    DMatrixRMaj positions();

    /**
     * デカルト座標（N×3）を返します。
     *
     * @return デカルト座標です
     */
    DMatrixRMaj cartesianPositions();
}
