package org.autosemi.asi;

import org.autosemi.Configuration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationGateTest {

    private static final ProjectSettings SETTINGS = ProjectSettings.fromYaml(
            "asi:\n  enabled: false\n  probe-budget: 500\npackages:\n  modern/: true\n  modern/legacy/: false\n");

    @Test
    public void testDefaultIsEnabled() {
        ConfigurationGate gate = ConfigurationGate.resolve(ProjectSettings.EMPTY, "a.src", null);
        assertTrue(gate.isEnabled());
        assertEquals(AsiConfig.DEFAULT, gate.config());
        assertEquals(Configuration.DEFAULT_PROBE_BUDGET, gate.config().probeBudget);
        assertEquals("default", gate.source());
    }

    @Test
    public void testProjectSetting() {
        ConfigurationGate gate = ConfigurationGate.resolve(SETTINGS, "src/a.src", null);
        assertFalse(gate.isEnabled());
        assertEquals(500, gate.config().probeBudget);
        assertEquals("project settings", gate.source());
    }

    @Test
    public void testPackageOverridesProject() {
        ConfigurationGate modern = ConfigurationGate.resolve(SETTINGS, "modern/a.src", null);
        assertTrue(modern.isEnabled());
        assertEquals("package 'modern/'", modern.source());

        ConfigurationGate legacy = ConfigurationGate.resolve(SETTINGS, "modern/legacy/b.src", null);
        assertFalse(legacy.isEnabled());
        assertEquals("package 'modern/legacy/'", legacy.source());
    }

    @Test
    public void testCommandLineOverridesEverything() {
        ConfigurationGate on = ConfigurationGate.resolve(SETTINGS, "modern/legacy/b.src", Boolean.TRUE);
        assertTrue(on.isEnabled());
        assertEquals(500, on.config().probeBudget);
        assertEquals("command line", on.source());

        ConfigurationGate off = ConfigurationGate.resolve(ProjectSettings.EMPTY, null, Boolean.FALSE);
        assertFalse(off.isEnabled());
    }

    @Test
    public void testConfigValues() {
        assertEquals(new AsiConfig(false, 10), new AsiConfig(true, 10).withEnabled(false));
        assertSame(AsiConfig.DEFAULT, AsiConfig.DEFAULT.withEnabled(true));
        assertThrows(IllegalArgumentException.class, () -> new AsiConfig(true, 0));
    }
}
