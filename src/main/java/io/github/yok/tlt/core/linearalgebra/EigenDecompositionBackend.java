package io.github.yok.tlt.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実対称行列の固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用する線形代数ライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * <p>
     * 入力行列は変更しません。
     * </p>
     *
     * @param symmetricMatrix 実対称行列です
     * @return 固有値昇順の固有系です
     * @throws io.github.yok.tlt.core.error.NumericalException 固有分解に失敗した場合に発生します
     */
    Eigensystem decomposeSymmetric(DMatrixRMaj symmetricMatrix);

    /**
     * 固有分解の結果（昇順の固有値・正規直交な固有ベクトル）を保持するクラスです。
     *
     * <p>
     * 固有ベクトル行列 V は「列が固有ベクトル」で、列 n が固有値 {@code energies[n]} に対応します。
     * </p>
     */
    @Value
    class Eigensystem {

        /**
         * 昇順の固有値（エネルギー E_n）です。
         */
        double[] energies;

        /**
         * 固有ベクトル行列 V です（列が固有ベクトルです）。
         */
        DMatrixRMaj eigenvectors;

        /**
         * 固有値の個数 N を返します。
         *
         * @return 固有値の個数です
         */
        public int size() {
            return energies.length;
        }
    }
}
