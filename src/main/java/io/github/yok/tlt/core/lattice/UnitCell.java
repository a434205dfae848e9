package io.github.yok.tlt.core.lattice;

import io.github.yok.tlt.core.error.DimensionException;
import org.ejml.data.DMatrixRMaj;

/**
 * 結晶の単位胞（分率座標の原子列と格子ベクトル）を表すクラスです。
 *
 * <p>
 * 格子ベクトル行列は「行 = 格子ベクトル」で保持します。 生成後は不変で、取得メソッドはコピーを返します。
 * </p>
 */
public final class UnitCell {

    /**
     * 原子の分率座標（K×3）です。
     */
    private final DMatrixRMaj atoms;

    /**
     * 格子ベクトル（3×3、行 = 格子ベクトル）です。
     */
    private final DMatrixRMaj latticeVectors;

    /**
     * 単位胞を生成します。
     *
     * @param atoms 原子の分率座標です（各行の長さは 3、1 行以上）
     * @param latticeVectors 格子ベクトルです（3×3）
     * @throws DimensionException 形状が不正な場合に発生します
     */
    public UnitCell(double[][] atoms, double[][] latticeVectors) {
        if (atoms == null || atoms.length == 0) {
            throw new DimensionException("atoms は 1 原子以上が必要です");
        }
        for (int i = 0; i < atoms.length; i++) {
            if (atoms[i] == null || atoms[i].length != 3) {
                throw new DimensionException("atoms の各行は 3 成分が必要です: row=" + i);
            }
        }
        if (latticeVectors == null || latticeVectors.length != 3) {
            throw new DimensionException("latticeVectors は 3×3 が必要です");
        }
        for (int i = 0; i < 3; i++) {
            if (latticeVectors[i] == null || latticeVectors[i].length != 3) {
                throw new DimensionException("latticeVectors は 3×3 が必要です: row=" + i);
            }
        }
        // DMatrixRMaj(double[][]) は行ごとにコピーします。
        this.atoms = new DMatrixRMaj(atoms);
        this.latticeVectors = new DMatrixRMaj(latticeVectors);
    }

    /**
     * 単位胞内の原子数 K を返します。
     *
     * @return 原子数です
     */
    public int atomCount() {
        return atoms.numRows;
    }

    /**
     * 原子の分率座標（K×3）のコピーを返します。
     *
     * @return 分率座標です
     */
    public DMatrixRMaj atoms() {
        return atoms.copy();
    }

    /**
     * 格子ベクトル（3×3）のコピーを返します。
     *
     * @return 格子ベクトルです
     */
    public DMatrixRMaj latticeVectors() {
        return latticeVectors.copy();
    }

    /**
     * 格子ベクトル行列の対角成分（軸方向の格子長）を返します。
     *
     * @param axis 軸インデックスです（0, 1, 2）
     * @return 格子長です
     */
    public double axisLength(int axis) {
        return latticeVectors.get(axis, axis);
    }
}
