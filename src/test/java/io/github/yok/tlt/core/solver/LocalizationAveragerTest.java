package io.github.yok.tlt.core.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.tlt.core.disorder.SymmetricGaussianSampler;
import io.github.yok.tlt.core.error.NumericalException;
import io.github.yok.tlt.core.lattice.InteractionClassifier;
import io.github.yok.tlt.core.lattice.InteractionTable;
import io.github.yok.tlt.core.lattice.MinimumImageMode;
import io.github.yok.tlt.core.lattice.Supercell;
import io.github.yok.tlt.core.lattice.SupercellLattice;
import io.github.yok.tlt.core.lattice.SupercellLatticeBuilder;
import io.github.yok.tlt.core.lattice.TransportPlane;
import io.github.yok.tlt.core.lattice.UnitCell;
import io.github.yok.tlt.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.tlt.core.model.CouplingParameters;
import io.github.yok.tlt.core.model.HamiltonianModel;
import io.github.yok.tlt.core.model.StaticDisorderHamiltonianModel;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocalizationAveragerTest {

    private static final TransportPlane XY = new TransportPlane(0, 1);

    private SupercellLattice lattice;

    private HamiltonianModel model;

    private LocalizationSolver solver;

    @BeforeEach
    void setUp() {
        double[][] vectors = {{7.18, 0.0, 0.0}, {0.0, 14.43, 0.0}, {0.0, 0.0, 26.9}};
        UnitCell cell = new UnitCell(new double[][] {{0.0, 0.0, 0.0}, {0.5, 0.5, 0.0}}, vectors);
        lattice = new SupercellLatticeBuilder().build(cell, new Supercell(3, 2, 1));
        model = new StaticDisorderHamiltonianModel(
                new InteractionClassifier(new InteractionTable(List.of(8.05880419), 7.18), XY,
                        MinimumImageMode.PER_PAIR).classify(lattice),
                new CouplingParameters(0.0, new double[] {0.019, 0.019, 0.134}, 0.0,
                        new double[] {0.007, 0.007, 0.03}),
                new SymmetricGaussianSampler());
        solver = new LocalizationSolver(lattice, XY,
                new ThermalParameters(300.0, 0.005, CarrierType.HOLE),
                new EjmlSymmetricEigenDecompositionBackend());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testSameSeedIsIndependentOfParallelism() {
        AveragedLocalization sequential =
                new LocalizationAverager(model, solver, new MonteCarloSettings(40, 42L, 1))
                        .average();
        AveragedLocalization parallel =
                new LocalizationAverager(model, solver, new MonteCarloSettings(40, 42L, 4))
                        .average();

        assertEquals(42L, sequential.getSeed());
        assertArrayEquals(sequential.getLx2Samples(), parallel.getLx2Samples(), 0.0);
        assertArrayEquals(sequential.getLy2Samples(), parallel.getLy2Samples(), 0.0);
        assertEquals(sequential.getMeanLx2(), parallel.getMeanLx2(), 0.0);
        assertEquals(sequential.getStandardErrorLy2(), parallel.getStandardErrorLy2(), 0.0);
    }

    @Test
    void testMeanAndStandardErrorOfSamples() {
        AveragedLocalization result =
                new LocalizationAverager(model, solver, new MonteCarloSettings(30, 7L, 1))
                        .average();

        double[] lx2 = result.getLx2Samples();
        assertEquals(30, lx2.length);
        double sum = 0.0;
        for (double v : lx2) {
            assertTrue(v > 0.0);
            sum += v;
        }
        double mean = sum / lx2.length;
        double sumSq = 0.0;
        for (double v : lx2) {
            sumSq += (v - mean) * (v - mean);
        }
        assertEquals(mean, result.getMeanLx2(), 1e-12 * mean);
        assertEquals(Math.sqrt(sumSq / 29 / 30), result.getStandardErrorLx2(), 1e-12 * mean);
    }

    @Test
    void testSingleRealizationHasZeroStandardError() {
        AveragedLocalization result =
                new LocalizationAverager(model, solver, new MonteCarloSettings(1, 3L, 1))
                        .average();

        assertEquals(1, result.getRealizations());
        assertEquals(0.0, result.getStandardErrorLx2(), 0.0);
        assertEquals(0.0, result.getStandardErrorLy2(), 0.0);
    }

    @Test
    void testStandardErrorShrinksWithRealizations() {
        AveragedLocalization few =
                new LocalizationAverager(model, solver, new MonteCarloSettings(50, 1L, 2))
                        .average();
        AveragedLocalization many =
                new LocalizationAverager(model, solver, new MonteCarloSettings(800, 1L, 2))
                        .average();

        // 期待値は √(800/50) = 4
        double ratio = few.getStandardErrorLx2() / many.getStandardErrorLx2();
        assertTrue(ratio > 2.0 && ratio < 8.0, "ratio=" + ratio);
    }

    @Test
    void testFailingRealizationAbortsAverage() {
        HamiltonianModel failing = failingModel(5);

        assertThrows(NumericalException.class, () -> new LocalizationAverager(failing, solver,
                new MonteCarloSettings(20, 1L, 1)).average());
        assertThrows(NumericalException.class, () -> new LocalizationAverager(failingModel(5),
                solver, new MonteCarloSettings(20, 1L, 3)).average());
    }

    @Test
    void testInterruptedThreadCancelsAverage() {
        LocalizationAverager sequential =
                new LocalizationAverager(model, solver, new MonteCarloSettings(20, 1L, 1));
        Thread.currentThread().interrupt();
        assertThrows(CancellationException.class, sequential::average);
        assertTrue(Thread.interrupted());

        LocalizationAverager parallel =
                new LocalizationAverager(model, solver, new MonteCarloSettings(20, 1L, 2));
        Thread.currentThread().interrupt();
        assertThrows(CancellationException.class, parallel::average);
        assertTrue(Thread.interrupted());
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void testUncoupledLatticeGivesZeroMobility() {
        double[][] cubic = {{1.0, 0.0, 0.0}, {0.0, 1.0, 0.0}, {0.0, 0.0, 1.0}};
        SupercellLattice square = new SupercellLatticeBuilder().build(
                new UnitCell(new double[][] {{0.0, 0.0, 0.0}}, cubic), new Supercell(2, 2, 1));
        HamiltonianModel uncoupled = new StaticDisorderHamiltonianModel(
                new InteractionClassifier(new InteractionTable(List.of(1.0), 1.0), XY,
                        MinimumImageMode.PER_PAIR).classify(square),
                new CouplingParameters(0.0, new double[3], 0.0, new double[3]),
                new SymmetricGaussianSampler());
        ThermalParameters thermal = new ThermalParameters(300.0, 0.005, CarrierType.HOLE);
        LocalizationSolver squareSolver = new LocalizationSolver(square, XY, thermal,
                new EjmlSymmetricEigenDecompositionBackend());

        DMatrixRMaj h = uncoupled.sampleHamiltonian(new Random(9L));
        assertEquals(4, h.numRows);
        assertTrue(MatrixFeatures_DDRM.isZeros(h, 0.0));

        AveragedLocalization averaged = new LocalizationAverager(uncoupled, squareSolver,
                new MonteCarloSettings(5, 9L, 2)).average();
        MobilityResult mobility = new MobilityCalculator().calculate(averaged, thermal);

        assertEquals(0.0, averaged.getMeanLx2(), 0.0);
        assertEquals(0.0, averaged.getMeanLy2(), 0.0);
        assertEquals(0.0, mobility.getMobilityX(), 0.0);
        assertEquals(0.0, mobility.getMobilityY(), 0.0);
        assertEquals(0.0, mobility.getMobilityAverage(), 0.0);
    }

    @Test
    void testSiteCountMismatchIsRejected() {
        HamiltonianModel small = new HamiltonianModel() {
            @Override
            public int siteCount() {
                return 2;
            }

            @Override
            public DMatrixRMaj sampleHamiltonian(Random random) {
                return new DMatrixRMaj(2, 2);
            }
        };

        assertThrows(IllegalArgumentException.class,
                () -> new LocalizationAverager(small, solver, MonteCarloSettings.sequential(1)));
    }

    /**
     * 指定回目の呼び出しで非有限値を含むハミルトニアンを返すモデルです。
     */
    private HamiltonianModel failingModel(int failAt) {
        AtomicInteger calls = new AtomicInteger();
        return new HamiltonianModel() {
            @Override
            public int siteCount() {
                return model.siteCount();
            }

            @Override
            public DMatrixRMaj sampleHamiltonian(Random random) {
                DMatrixRMaj h = model.sampleHamiltonian(random);
                if (calls.incrementAndGet() == failAt) {
                    h.set(0, 0, Double.NaN);
                }
                return h;
            }
        };
    }
}
