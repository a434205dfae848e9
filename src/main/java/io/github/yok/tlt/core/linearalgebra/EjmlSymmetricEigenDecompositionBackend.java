package io.github.yok.tlt.core.linearalgebra;

import io.github.yok.tlt.core.error.NumericalException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、実対称行列（ハミルトニアン）の固有分解を行うクラスです。
 *
 * <p>
 * 固有値を昇順に並べ替え、固有ベクトルも同じ順序に揃えて返します。 EJML が入力を書き換える分解器の場合はコピーを分解します。
 * </p>
 */
public final class EjmlSymmetricEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param symmetricMatrix 実対称行列です（正方行列）
     * @return 固有値昇順の固有系です
     * @throws IllegalArgumentException symmetricMatrix が null または正方でない場合に発生します
     * @throws NumericalException 非有限値を含む、または固有分解に失敗した場合に発生します
     */
    @Override
    public Eigensystem decomposeSymmetric(DMatrixRMaj symmetricMatrix) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new IllegalArgumentException("symmetricMatrix は正方行列が必要です: "
                    + symmetricMatrix.numRows + "x" + symmetricMatrix.numCols);
        }
        if (MatrixFeatures_DDRM.hasUncountable(symmetricMatrix)) {
            throw new NumericalException("固有分解の入力に NaN/Inf が含まれています");
        }

        int dim = symmetricMatrix.numRows;

        // 対称行列用（第 3 引数 true）の分解器を生成します。
        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, true);

        DMatrixRMaj input =
                decomposition.inputModified() ? symmetricMatrix.copy() : symmetricMatrix;
        if (!decomposition.decompose(input)) {
            throw new NumericalException("固有分解に失敗しました（EJML）: dim=" + dim);
        }

        double[] rawValues = new double[dim];
        for (int col = 0; col < dim; col++) {
            // 実対称のため固有値は実数部のみを使います。
            rawValues[col] = decomposition.getEigenvalue(col).getReal();
        }

        // argsort（昇順）
        int[] order = IntStream.range(0, dim).boxed()
                .sorted(Comparator.comparingDouble(i -> rawValues[i]))
                .mapToInt(Integer::intValue).toArray();

        double[] energies = new double[dim];
        DMatrixRMaj eigenvectors = new DMatrixRMaj(dim, dim);

        for (int newCol = 0; newCol < dim; newCol++) {
            int oldCol = order[newCol];
            energies[newCol] = rawValues[oldCol];

            DMatrixRMaj vec = decomposition.getEigenVector(oldCol);
            if (vec == null) {
                throw new NumericalException("固有ベクトルが取得できません: col=" + oldCol);
            }
            for (int row = 0; row < dim; row++) {
                eigenvectors.set(row, newCol, vec.get(row, 0));
            }
        }

        if (MatrixFeatures_DDRM.hasUncountable(eigenvectors)
                || Arrays.stream(energies).anyMatch(e -> !Double.isFinite(e))) {
            throw new NumericalException("固有分解の結果に NaN/Inf が含まれています: dim=" + dim);
        }

        return new Eigensystem(energies, eigenvectors);
    }
}
