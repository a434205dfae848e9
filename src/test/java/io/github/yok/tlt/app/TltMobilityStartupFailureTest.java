package io.github.yok.tlt.app;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.tlt.TltMobilityApplication;
import io.github.yok.tlt.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;

class TltMobilityStartupFailureTest {

    private static void assertStartupFailsWithConfigurationException(String... args) {
        SpringApplicationBuilder app = new SpringApplicationBuilder(TltMobilityApplication.class)
                .profiles("smoke").web(WebApplicationType.NONE);

        RuntimeException e = assertThrows(RuntimeException.class, () -> app.run(args));
        assertTrue(hasConfigurationException(e), "原因に ConfigurationException がありません: " + e);
    }

    private static boolean hasConfigurationException(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConfigurationException) {
                return true;
            }
        }
        return false;
    }

    @Test
    void testMissingDistancesFailsStartup() {
        assertStartupFailsWithConfigurationException("--tlt.interaction.distances=");
    }

    @Test
    void testMissingPlaneFailsStartup() {
        assertStartupFailsWithConfigurationException("--tlt.transport.plane=");
    }

    @Test
    void testMissingAtomsFailsStartup() {
        assertStartupFailsWithConfigurationException("--tlt.crystal.atoms=");
    }

    @Test
    void testMissingLatticeVectorsFailsStartup() {
        assertStartupFailsWithConfigurationException("--tlt.crystal.lattice-vectors=");
    }
}
