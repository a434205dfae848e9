package io.github.yok.tlt.core.lattice;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.tlt.core.error.DimensionException;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class SupercellLatticeBuilderTest {

    private static final double[][] CUBIC = {{2.0, 0.0, 0.0}, {0.0, 3.0, 0.0}, {0.0, 0.0, 4.0}};

    private final SupercellLatticeBuilder builder = new SupercellLatticeBuilder();

    @Test
    void testRowCountIsAtomsTimesCells() {
        UnitCell cell = new UnitCell(new double[][] {{0.0, 0.0, 0.0}, {0.5, 0.5, 0.0}}, CUBIC);
        SupercellLattice lattice = builder.build(cell, new Supercell(3, 2, 1));

        assertEquals(12, lattice.siteCount());
        assertEquals(12, lattice.positions().numRows);
        assertEquals(3, lattice.positions().numCols);
    }

    @Test
    void testRowOrderFollowsCellThenAtom() {
        UnitCell cell = new UnitCell(new double[][] {{0.0, 0.0, 0.0}, {0.5, 0.25, 0.0}}, CUBIC);
        SupercellLattice lattice = builder.build(cell, new Supercell(2, 2, 2));
        DMatrixRMaj pos = lattice.positions();

        for (int a = 0; a < 2; a++) {
            for (int b = 0; b < 2; b++) {
                for (int c = 0; c < 2; c++) {
                    int row = lattice.indexOf(a, b, c, 1);
                    assertEquals(0.5 + a, pos.get(row, 0), 0.0);
                    assertEquals(0.25 + b, pos.get(row, 1), 0.0);
                    assertEquals(c, pos.get(row, 2), 0.0);
                }
            }
        }
        // 先頭 2 行はセル (0,0,0) の 2 原子、次はセル (0,0,1)
        assertEquals(0, lattice.indexOf(0, 0, 0, 0));
        assertEquals(2, lattice.indexOf(0, 0, 1, 0));
        assertEquals(15, lattice.indexOf(1, 1, 1, 1));
    }

    @Test
    void testCartesianPositionsUseLatticeRows() {
        double[][] oblique = {{2.0, 0.0, 0.0}, {1.0, 3.0, 0.0}, {0.0, 0.0, 4.0}};
        UnitCell cell = new UnitCell(new double[][] {{0.5, 0.5, 0.0}}, oblique);
        SupercellLattice lattice = builder.build(cell, new Supercell(1, 1, 1));

        // cart = 0.5·a1 + 0.5·a2
        DMatrixRMaj cart = lattice.cartesianPositions();
        assertArrayEquals(new double[] {1.5, 1.5, 0.0},
                new double[] {cart.get(0, 0), cart.get(0, 1), cart.get(0, 2)}, 1e-12);
    }

    @Test
    void testBoxLengthScalesWithCount() {
        UnitCell cell = new UnitCell(new double[][] {{0.0, 0.0, 0.0}}, CUBIC);
        SupercellLattice lattice = builder.build(cell, new Supercell(3, 2, 1));

        assertEquals(6.0, lattice.boxLength(0), 0.0);
        assertEquals(6.0, lattice.boxLength(1), 0.0);
        assertEquals(4.0, lattice.boxLength(2), 0.0);
    }

    @Test
    void testInvalidShapes() {
        assertThrows(DimensionException.class, () -> new Supercell(0, 1, 1));
        assertThrows(DimensionException.class, () -> new UnitCell(new double[0][], CUBIC));
        assertThrows(DimensionException.class,
                () -> new UnitCell(new double[][] {{0.0, 0.0}}, CUBIC));
        assertThrows(DimensionException.class,
                () -> new UnitCell(new double[][] {{0.0, 0.0, 0.0}}, new double[2][3]));
        assertThrows(DimensionException.class, () -> builder.build(null, new Supercell(1, 1, 1)));
    }
}
