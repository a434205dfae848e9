package io.github.yok.tlt.core.model;

import java.util.Random;
import org.ejml.data.DMatrixRMaj;

/**
 * 静的乱れの 1 実現ごとにタイトバインディング・ハミルトニアンを構築するモデルを表すインタフェースです。
 *
 * <p>
 * 結合の与え方や乱れの統計を差し替えるための境界です。
 * </p>
 */
public interface HamiltonianModel {

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    int siteCount();

    /**
     * 乱れを 1 回引き、N×N の実対称ハミルトニアンを構築して返します。
     *
     * <p>
     * 返却する行列は呼び出しごとに新しく生成され、再利用されません。
     * </p>
     *
     * @param random 乱数源です
     * @return ハミルトニアンです
     */
    DMatrixRMaj sampleHamiltonian(Random random);
}
