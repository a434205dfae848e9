package io.github.yok.tlt.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import io.github.yok.tlt.core.lattice.SupercellLattice;
import io.github.yok.tlt.core.solver.AveragedLocalization;
import io.github.yok.tlt.core.solver.LocalizationAverager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("smoke")
class TltMobilityApplicationSmokeTest {

    @Autowired
    private TltProperties properties;

    @Autowired
    private SupercellLattice lattice;

    @Autowired
    private LocalizationAverager averager;

    @Test
    void testContextBindsPropertiesAndRunsAverage() {
        assertEquals(2, lattice.siteCount());
        assertEquals(42L, properties.getMonteCarlo().getSeed());
        assertFalse(properties.getOutput().isEnabled());

        AveragedLocalization result = averager.average();
        assertEquals(3, result.getRealizations());
        assertEquals(0.0008 / 0.040025, result.getMeanLx2(), 1e-12);
        assertEquals(0.0008 / 0.040025, result.getMeanLy2(), 1e-12);
    }
}
