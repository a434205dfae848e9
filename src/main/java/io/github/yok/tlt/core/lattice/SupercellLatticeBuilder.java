package io.github.yok.tlt.core.lattice;

import io.github.yok.tlt.core.error.DimensionException;
import org.ejml.data.DMatrixRMaj;

/**
 * 単位胞をスーパーセル格子に複製するクラスです。
 *
 * <p>
 * 各行は元の原子の分率座標にセルオフセット (a, b, c) を加えたものです。乱数は使用しません。
 * </p>
 */
public final class SupercellLatticeBuilder {

    /**
     * スーパーセル格子を生成します。
     *
     * @param unitCell 単位胞です（null 不可）
     * @param supercell 複製数です（null 不可）
     * @return スーパーセル格子です
     * @throws DimensionException unitCell または supercell が null の場合に発生します
     */
    public SupercellLattice build(UnitCell unitCell, Supercell supercell) {
        if (unitCell == null) {
            throw new DimensionException("unitCell は null 不可です");
        }
        if (supercell == null) {
            throw new DimensionException("supercell は null 不可です");
        }

        DMatrixRMaj atoms = unitCell.atoms();
        int atomCount = atoms.numRows;
        DMatrixRMaj positions = new DMatrixRMaj(atomCount * supercell.cellCount(), 3);

        int row = 0;
        for (int a = 0; a < supercell.getNx(); a++) {
            for (int b = 0; b < supercell.getNy(); b++) {
                for (int c = 0; c < supercell.getNz(); c++) {
                    for (int atom = 0; atom < atomCount; atom++) {
                        positions.set(row, 0, atoms.get(atom, 0) + a);
                        positions.set(row, 1, atoms.get(atom, 1) + b);
                        positions.set(row, 2, atoms.get(atom, 2) + c);
                        row++;
                    }
                }
            }
        }

        return new SupercellLattice(unitCell, supercell, positions);
    }
}
