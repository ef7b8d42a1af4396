package org.simforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.simforge.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. Environment variables
 * 2. System properties
 * 3. Configuration file
 * 4. Default reference configuration
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("simforge.backend.model-frame");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Missing configuration file falls back to reference defaults")
    void load_shouldUseDefaultsWhenFileIsMissing(@TempDir Path dir) {
        // Act
        Config config = ConfigLoader.load(dir.resolve("absent.conf").toFile());

        // Assert
        assertEquals("recording", config.getString("simforge.backend.type"));
        assertEquals("warn_and_continue", config.getString("simforge.error-handling.on-creation-error"));
        assertTrue(config.hasPath("simforge.mapping.resource-mappings.conveyor"));
    }

    @Test
    @DisplayName("Configuration file overrides reference defaults")
    void load_fileShouldOverrideDefaults(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, "simforge.backend { type = remote, model-frame = \".Models.FromFile\" }");

        // Act
        Config config = ConfigLoader.load(file.toFile());

        // Assert
        assertEquals("remote", config.getString("simforge.backend.type"));
        assertEquals(".Models.FromFile", config.getString("simforge.backend.model-frame"));
        assertEquals(".MaterialFlow.Connector", config.getString("simforge.backend.connector"));
    }

    @Test
    @DisplayName("System property overrides the configuration file")
    void load_systemPropertyShouldOverrideFile(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, "simforge.backend.model-frame = \".Models.FromFile\"");
        System.setProperty("simforge.backend.model-frame", ".Models.FromSystem");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file.toFile());

        // Assert
        assertEquals(".Models.FromSystem", config.getString("simforge.backend.model-frame"));
    }

    @Test
    @DisplayName("A directory in place of the configuration file is ignored")
    void load_shouldIgnoreDirectory(@TempDir Path dir) {
        File directory = dir.toFile();

        Config config = ConfigLoader.load(directory);

        assertEquals(".Models.Model", config.getString("simforge.backend.model-frame"));
    }

    @Test
    @DisplayName("Classpath resource is layered over reference defaults without system properties")
    void load_resourceShouldLayerOverDefaults() {
        // Arrange
        System.setProperty("simforge.backend.model-frame", ".Models.FromSystem");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load("test-layout.conf");

        // Assert
        assertEquals("in-process", config.getString("simforge.backend.type"));
        assertEquals(".Models.Test", config.getString("simforge.backend.model-frame"));
        assertEquals("ignore", config.getString("simforge.error-handling.on-connection-error"));
        assertEquals("warn_and_continue", config.getString("simforge.error-handling.on-property-error"));
        assertFalse(config.getBoolean("simforge.backend.remote.verify-templates"));
    }
}
