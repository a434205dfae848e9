package io.github.yok.tlt.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.tlt.core.error.ConfigurationException;
import io.github.yok.tlt.core.error.DimensionException;
import io.github.yok.tlt.core.lattice.InteractionTopology;
import io.github.yok.tlt.core.lattice.SupercellLattice;
import io.github.yok.tlt.core.lattice.TransportPlane;
import io.github.yok.tlt.core.lattice.UnitCell;
import io.github.yok.tlt.core.model.HamiltonianModel;
import io.github.yok.tlt.core.solver.AveragedLocalization;
import io.github.yok.tlt.core.solver.CarrierType;
import io.github.yok.tlt.core.solver.LocalizationAverager;
import io.github.yok.tlt.core.solver.LocalizationSolver;
import io.github.yok.tlt.core.solver.ThermalParameters;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TltMobilityConfigurationTest {

    private TltProperties properties;

    private TltMobilityConfiguration configuration;

    @BeforeEach
    void setUp() {
        properties = new TltProperties();
        properties.getCrystal().setAtoms(List.of(List.of(0.2, 0.0, 0.0), List.of(0.0, 0.2, 0.0)));
        properties.getCrystal().setLatticeVectors(List.of(List.of(10.0, 0.0, 0.0),
                List.of(0.0, 10.0, 0.0), List.of(0.0, 0.0, 10.0)));
        properties.getTransport().setPlane(List.of(0, 1));
        properties.getInteraction().setDistances(List.of(2.8284271));
        properties.getInteraction().setTranslationDistance(10.0);
        properties.getCoupling().setJij(List.of(0.1, 0.0, 0.0));
        properties.getCoupling().setSigmaIj(List.of(0.0, 0.0, 0.0));
        properties.getMonteCarlo().setRealizations(4);
        properties.getMonteCarlo().setSeed(11L);
        configuration = new TltMobilityConfiguration(properties);
    }

    private LocalizationAverager wire() {
        UnitCell cell = configuration.unitCell();
        SupercellLattice lattice = configuration.supercellLattice(cell);
        TransportPlane plane = configuration.transportPlane();
        InteractionTopology topology = configuration.interactionTopology(lattice, plane);
        HamiltonianModel model = configuration.hamiltonianModel(topology);
        ThermalParameters thermal = configuration.thermalParameters();
        LocalizationSolver solver = configuration.localizationSolver(lattice, plane, thermal,
                configuration.eigenDecompositionBackend());
        return configuration.localizationAverager(model, solver);
    }

    @Test
    void testWiredPipelineReproducesDimer() {
        AveragedLocalization result = wire().average();

        assertEquals(4, result.getRealizations());
        assertEquals(11L, result.getSeed());
        assertEquals(0.0008 / 0.040025, result.getMeanLx2(), 1e-12);
        assertEquals(0.0, result.getStandardErrorLx2(), 1e-15);
    }

    @Test
    void testCarrierFollowsHoleFlag() {
        assertEquals(CarrierType.HOLE, configuration.thermalParameters().getCarrierType());
        properties.getThermal().setHole(false);
        assertEquals(CarrierType.ELECTRON, configuration.thermalParameters().getCarrierType());
    }

    @Test
    void testMissingTranslationDistance() {
        properties.getInteraction().setTranslationDistance(null);
        SupercellLattice lattice = configuration.supercellLattice(configuration.unitCell());

        assertThrows(ConfigurationException.class,
                () -> configuration.interactionTopology(lattice, configuration.transportPlane()));
    }

    @Test
    void testCouplingWithWrongLength() {
        properties.getCoupling().setJij(List.of(0.1, 0.2));
        SupercellLattice lattice = configuration.supercellLattice(configuration.unitCell());
        InteractionTopology topology =
                configuration.interactionTopology(lattice, configuration.transportPlane());

        assertThrows(ConfigurationException.class, () -> configuration.hamiltonianModel(topology));
    }

    @Test
    void testInvalidSections() {
        properties.getTransport().setPlane(List.of(2, 2));
        assertThrows(ConfigurationException.class, () -> configuration.transportPlane());

        properties.getThermal().setInverseHtau(0.0);
        assertThrows(ConfigurationException.class, () -> configuration.thermalParameters());

        properties.getSupercell().setNx(0);
        UnitCell cell = configuration.unitCell();
        assertThrows(DimensionException.class, () -> configuration.supercellLattice(cell));

        properties.getCrystal().setAtoms(List.of(List.of(0.0, 0.0)));
        assertThrows(DimensionException.class, () -> configuration.unitCell());
    }

    @Test
    void testMissingRequiredListsHaveNoDefaults() {
        TltProperties empty = new TltProperties();
        TltMobilityConfiguration c = new TltMobilityConfiguration(empty);

        assertThrows(ConfigurationException.class, () -> c.unitCell());
        assertThrows(ConfigurationException.class, () -> c.transportPlane());

        properties.getInteraction().setDistances(null);
        SupercellLattice lattice = configuration.supercellLattice(configuration.unitCell());
        assertThrows(ConfigurationException.class,
                () -> configuration.interactionTopology(lattice, configuration.transportPlane()));
    }

    @Test
    void testToMatrixRejectsNullRows() {
        assertThrows(ConfigurationException.class,
                () -> TltMobilityConfiguration.toMatrix("crystal.atoms", null));
        assertThrows(ConfigurationException.class, () -> TltMobilityConfiguration
                .toMatrix("crystal.atoms", Arrays.asList(List.of(0.0, 0.0, 0.0), null)));
    }
}
