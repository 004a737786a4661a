package com.brewuv.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path workingDir;

    @Test
    void builtInDefaultsApplyWhenNothingIsSet() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of());

        assertEquals(300.0, config.getDouble("default.ozone", -1.0), 1e-12);
        assertEquals(0.9, config.getDouble("correction.cloud_threshold", -1.0), 1e-12);
        assertEquals(3, config.getInt("arf.column", -1));
        assertFalse(config.getBoolean("eubrewnet.enabled", true));
        assertEquals(workingDir.resolve("input"), config.getPath("input.dir"));
    }

    @Test
    void nestedMapsAreFlattenedWithDots() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of(
                "correction", Map.of("cloud_threshold", 0.75, "enabled", false),
                "solver", Map.of("command", "docker run uvspec")));

        assertEquals(0.75, config.getDouble("correction.cloud_threshold", -1.0), 1e-12);
        assertFalse(config.getBoolean("correction.enabled", true));
        assertEquals("docker run uvspec", config.getString("solver.command"));
    }

    @Test
    void workingDirectoryFileOverridesClasspathDefaults() throws Exception {
        Files.writeString(workingDir.resolve("config.properties"), "default.ozone=275\nscan.threads=6\n");

        Config config = Config.load(workingDir);

        assertEquals(275.0, config.getDouble("default.ozone", -1.0), 1e-12);
        assertEquals(6, config.getInt("scan.threads", -1));
        assertEquals(20, config.getInt("scan.threads.max", -1));
    }

    @Test
    void optionalDoubleTreatsNoneAndGarbageAsUnset() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of(
                "a", "none",
                "b", "0.4",
                "c", "cloudy"));

        assertNull(config.getOptionalDouble("a"));
        assertEquals(0.4, config.getOptionalDouble("b"), 1e-12);
        assertNull(config.getOptionalDouble("c"));
        assertEquals(0.0, config.getOptionalDouble("correction.default_cloud_cover"), 1e-12);
    }

    @Test
    void blankValuesFallBack() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of("scan.threads", "  ", "x.flag", "yes"));

        assertEquals(0, config.getInt("scan.threads", -1));
        assertTrue(config.getBoolean("x.flag", false));
        assertEquals(7, config.getInt("missing.key", 7));
        assertEquals("", config.getString("cloud.api_key"));
        assertEquals("fallback", config.getString("cloud.api_key", "fallback"));
    }
}
