package io.github.yok.tlt.core.lattice;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 単位胞を (nx, ny, nz) 回複製したスーパーセル格子を表すクラスです。
 *
 * <p>
 * 行の並びは外側ループ a∈[0,nx), b∈[0,ny), c∈[0,nz)、内側ループが単位胞内の原子です。 インデックス変換は
 * {@code index = ((a * ny + b) * nz + c) * K + atom} です。
 * </p>
 */
public final class SupercellLattice implements Lattice {

    /**
     * 元の単位胞です。
     */
    @Getter
    private final UnitCell unitCell;

    /**
     * 複製数です。
     */
    @Getter
    private final Supercell supercell;

    /**
     * 分率座標（N×3）です。
     */
    private final DMatrixRMaj positions;

    /**
     * デカルト座標（N×3）です。
     */
    private final DMatrixRMaj cartesian;

    /**
     * スーパーセル格子を生成します。
     *
     * @param unitCell 単位胞です
     * @param supercell 複製数です
     * @param positions 分率座標（N×3）です
     */
    SupercellLattice(UnitCell unitCell, Supercell supercell, DMatrixRMaj positions) {
        this.unitCell = unitCell;
        this.supercell = supercell;
        this.positions = positions;

        // cart = positions · latticeVectors^T
        this.cartesian = new DMatrixRMaj(positions.numRows, 3);
        CommonOps_DDRM.multTransB(positions, unitCell.latticeVectors(), cartesian);
    }

    /**
     * サイト数 N（K·nx·ny·nz）を返します。
     *
     * @return サイト数です
     */
    @Override
    public int siteCount() {
        return positions.numRows;
    }

    /**
     * 分率座標（N×3）のコピーを返します。
     *
     * @return 分率座標です
     */
    @Override
    public DMatrixRMaj positions() {
        return positions.copy();
    }

    /**
     * デカルト座標（N×3）のコピーを返します。
     *
     * @return デカルト座標です
     */
    @Override
    public DMatrixRMaj cartesianPositions() {
        return cartesian.copy();
    }

    /**
     * セル位置 (a, b, c) と単位胞内原子番号からサイトインデックスを返します。
     *
     * @param a x 方向のセル番号です（0 以上 nx 未満）
     * @param b y 方向のセル番号です（0 以上 ny 未満）
     * @param c z 方向のセル番号です（0 以上 nz 未満）
     * @param atom 単位胞内の原子番号です（0 以上 K 未満）
     * @return サイトインデックスです
     */
    public int indexOf(int a, int b, int c, int atom) {
        return ((a * supercell.getNy() + b) * supercell.getNz() + c) * unitCell.atomCount() + atom;
    }

    /**
     * スーパーセル全体の指定軸方向の箱の長さ（複製数 × 格子長）を返します。
     *
     * @param axis 軸インデックスです（0, 1, 2）
     * @return 箱の長さです
     */
    public double boxLength(int axis) {
        return supercell.countAlong(axis) * unitCell.axisLength(axis);
    }
}
