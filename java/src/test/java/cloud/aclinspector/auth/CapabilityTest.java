package cloud.aclinspector.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityTest {

    @Test
    void detectsCapabilityFromScope() {
        assertEquals(Capability.FULL, Capability.fromScope("Files.ReadWrite.All Sites.Manage.All offline_access"));
        assertEquals(Capability.FULL, Capability.fromScope("files.readwrite"));
        assertEquals(Capability.READ_ONLY, Capability.fromScope("Files.Read User.Read offline_access"));
        assertEquals(Capability.READ_ONLY, Capability.fromScope("Files.Read.All"));
        assertEquals(Capability.UNKNOWN, Capability.fromScope("User.Read offline_access"));
        assertEquals(Capability.UNKNOWN, Capability.fromScope(null));
        assertEquals(Capability.UNKNOWN, Capability.fromScope("  "));
    }

    @Test
    void fullSatisfiesEveryRequirement() {
        assertTrue(Capability.FULL.satisfies(Capability.FULL));
        assertTrue(Capability.FULL.satisfies(Capability.READ_ONLY));
        assertTrue(Capability.FULL.satisfies(null));
    }

    @Test
    void lowerCapabilitiesDoNotSatisfyFull() {
        assertFalse(Capability.READ_ONLY.satisfies(Capability.FULL));
        assertFalse(Capability.UNKNOWN.satisfies(Capability.FULL));
        assertFalse(Capability.INSUFFICIENT.satisfies(null));
        assertTrue(Capability.UNKNOWN.satisfies(null));
        assertTrue(Capability.READ_ONLY.satisfies(Capability.READ_ONLY));
    }

    @Test
    void labelsAreLowerCase() {
        assertEquals("read-only", Capability.READ_ONLY.label());
        assertEquals("full", Capability.FULL.label());
    }
}
