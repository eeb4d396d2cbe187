package org.metadump.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Verifies the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("metadump.workers");
        System.clearProperty("dumpRoot");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should layer the file over reference defaults")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("metadump.outputDirectory")).isEqualTo("custom-backup");
        assertThat(config.getInt("metadump.workers")).isEqualTo(2);
        assertThat(config.getString("metadump.tocFile")).isEqualTo("toc.json");
        assertThat(config.getString("metadump.sections.predata")).isEqualTo("metadata_predata.sql");
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("metadump.workers", "1");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getInt("metadump.workers")).isEqualTo(1);
        assertThat(config.getString("metadump.outputDirectory")).isEqualTo("custom-backup");
    }

    @Test
    @DisplayName("Substitutions resolve after all layers are composed")
    void loadFromFile_shouldResolveReferencesAgainstOverrides() {
        Config fileOnly = ConfigLoader.loadFromFile(testResource("references-config.conf"));
        assertThat(fileOnly.getString("metadump.outputDirectory")).isEqualTo("/srv/dumps/nightly");

        System.setProperty("dumpRoot", "/mnt/backup");
        ConfigFactory.invalidateCaches();
        Config overridden = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertThat(overridden.getString("metadump.outputDirectory")).isEqualTo("/mnt/backup/nightly");
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnValidConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(config.getString("metadump.outputDirectory")).isEqualTo("backup");
        assertThat(config.getInt("metadump.workers")).isEqualTo(3);
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    @DisplayName("Explicit config file is used and reported")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertThat(config.getInt("metadump.workers")).isEqualTo(2);
        assertThat(messages).singleElement().asString().startsWith("INFO Using configuration file specified via --config");
    }

    @Test
    @DisplayName("Missing explicit config file is rejected")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/metadump.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, (level, message) -> { }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
