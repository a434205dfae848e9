package io.github.yok.tlt.app;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.github.yok.tlt.core.lattice.SupercellLattice;
import io.github.yok.tlt.core.lattice.TransportPlane;
import io.github.yok.tlt.core.solver.LocalizationAverager;
import io.github.yok.tlt.core.solver.LocalizationSolver;
import io.github.yok.tlt.core.solver.MobilityCalculator;
import io.github.yok.tlt.core.solver.ThermalParameters;
import io.github.yok.tlt.out.ResultWriter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TltCliRunnerTest {

    @Mock
    private ResultWriter resultWriter;

    private TltProperties properties;

    private TltCliRunner runner;

    private ThermalParameters thermal;

    @BeforeEach
    void setUp() {
        properties = new TltProperties();
        properties.getCrystal().setAtoms(List.of(List.of(0.0, 0.0, 0.0), List.of(0.5, 0.5, 0.0)));
        properties.getCrystal().setLatticeVectors(List.of(List.of(7.18, 0.0, 0.0),
                List.of(0.0, 14.43, 0.0), List.of(0.0, 0.0, 26.9)));
        properties.getSupercell().setNx(3);
        properties.getSupercell().setNy(2);
        properties.getTransport().setPlane(List.of(0, 1));
        properties.getInteraction().setDistances(List.of(8.05880419));
        properties.getInteraction().setTranslationDistance(7.18);
        properties.getCoupling().setJij(List.of(0.019, 0.019, 0.134));
        properties.getCoupling().setSigmaIj(List.of(0.007, 0.007, 0.03));
        properties.getMonteCarlo().setRealizations(5);
        properties.getMonteCarlo().setSeed(3L);

        TltMobilityConfiguration c = new TltMobilityConfiguration(properties);
        SupercellLattice lattice = c.supercellLattice(c.unitCell());
        TransportPlane plane = c.transportPlane();
        thermal = c.thermalParameters();
        LocalizationSolver solver =
                c.localizationSolver(lattice, plane, thermal, c.eigenDecompositionBackend());
        LocalizationAverager averager =
                c.localizationAverager(c.hamiltonianModel(c.interactionTopology(lattice, plane)),
                        solver);
        runner = new TltCliRunner(properties, lattice, thermal, averager, new MobilityCalculator(),
                resultWriter);
    }

    @Test
    void testRunWritesResults() {
        runner.run();

        verify(resultWriter).write(any(), any(), same(thermal));
    }

    @Test
    void testRunSkipsOutputWhenDisabled() {
        properties.getOutput().setEnabled(false);
        runner.run();

        verify(resultWriter, never()).write(any(), any(), any());
    }
}
