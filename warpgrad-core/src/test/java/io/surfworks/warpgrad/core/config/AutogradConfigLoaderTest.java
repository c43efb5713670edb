package io.surfworks.warpgrad.core.config;

import io.surfworks.warpgrad.core.error.NaNPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AutogradConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        assertEquals(AutogradConfig.defaults(), AutogradConfigLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void saveThenLoad() throws IOException {
        Path file = tempDir.resolve("nested/autograd.json");
        AutogradConfig config = AutogradConfig.defaults().withTrain(false).withNanPolicy(NaNPolicy.WARN);

        AutogradConfigLoader.save(config, file);

        assertTrue(Files.exists(file));
        assertEquals(config, AutogradConfigLoader.load(file));
    }

    @Test
    void partialFileKeepsDefaultsForMissingFields() throws IOException {
        Path file = tempDir.resolve("autograd.json");
        Files.writeString(file, "{\"debug\": true, \"nanPolicy\": \"error\"}");

        AutogradConfig config = AutogradConfigLoader.load(file);

        assertTrue(config.debug());
        assertEquals(NaNPolicy.ERROR, config.nanPolicy());
        assertTrue(config.enableBackprop());
        assertTrue(config.train());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertEquals(AutogradConfig.defaults(), AutogradConfigLoader.load(file));
    }

    @Test
    void unknownPolicyFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("policy.json");
        Files.writeString(file, "{\"nanPolicy\": \"sometimes\"}");

        assertEquals(AutogradConfig.defaults(), AutogradConfigLoader.load(file));
    }

    @Test
    void classpathResource() {
        AutogradConfig config = AutogradConfigLoader.loadResource("autograd-test.json");

        assertFalse(config.typeCheck());
        assertTrue(config.debug());
    }

    @Test
    void missingResourceYieldsDefaults() {
        assertEquals(AutogradConfig.defaults(), AutogradConfigLoader.loadResource("no-such-config.json"));
    }
}
