package com.solfmt.config;

import static com.google.common.truth.Truth.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ConfigurationLoader}. */
@RunWith(JUnit4.class)
public final class ConfigurationLoaderTest {
    @Rule public final TemporaryFolder tmp = new TemporaryFolder();

    private Path writeConfig(String... lines) throws Exception {
        Path path = tmp.getRoot().toPath().resolve(ConfigurationLoader.CONFIG_FILE_NAME);
        Files.write(path, Arrays.asList(lines), StandardCharsets.UTF_8);
        return path;
    }

    @Test
    public void defaultConfigHasSolidityDefaults() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getGeneralConfig("lineLength", 0)).isEqualTo(80);
        assertThat(config.getGeneralConfig("tabWidth", 0)).isEqualTo(4);
        assertThat(config.getPluginConfig("solidity", "bracketSpacing", true)).isFalse();
        assertThat(config.getIgnoreFiles()).contains("node_modules/**");
    }

    @Test
    public void loadsYamlFile() throws Exception {
        Path path = writeConfig(
                "general:",
                "  lineLength: 120",
                "  ignoreFiles:",
                "    - \"test/**\"",
                "plugins:",
                "  solidity:",
                "    bracketSpacing: true",
                "    tabWidth: 2");

        FormatterConfig config = ConfigurationLoader.loadConfig(path);

        assertThat(config.getGeneralConfig("lineLength", 0)).isEqualTo(120);
        assertThat(config.getGeneralConfig("tabWidth", 0)).isEqualTo(4);
        assertThat(config.getIgnoreFiles()).containsExactly("test/**");
        assertThat(config.getPluginConfig("solidity", "bracketSpacing", false)).isTrue();
        assertThat(config.getPluginConfig("solidity", "tabWidth", 0)).isEqualTo(2);
    }

    @Test
    public void outOfRangeValuesFallBackToDefaults() throws Exception {
        Path path = writeConfig(
                "general:",
                "  lineLength: 5",
                "  tabWidth: 12",
                "plugins:",
                "  solidity:",
                "    lineLength: 1000",
                "    tabWidth: wide");

        FormatterConfig config = ConfigurationLoader.loadConfig(path);

        assertThat(config.getGeneralConfig("lineLength", 0)).isEqualTo(80);
        assertThat(config.getGeneralConfig("tabWidth", 0)).isEqualTo(4);
        assertThat(config.getPluginConfig("solidity", "lineLength", -1)).isEqualTo(-1);
        assertThat(config.getPluginConfig("solidity", "tabWidth", -1)).isEqualTo(-1);
    }

    @Test
    public void missingOrBrokenFilesFallBackToDefaults() throws Exception {
        FormatterConfig missing = ConfigurationLoader.loadConfig(tmp.getRoot().toPath().resolve("absent.yml"));
        assertThat(missing.getGeneralConfig("lineLength", 0)).isEqualTo(80);

        FormatterConfig broken = ConfigurationLoader.loadConfig(writeConfig("general: [unclosed"));
        assertThat(broken.getGeneralConfig("lineLength", 0)).isEqualTo(80);

        FormatterConfig empty = ConfigurationLoader.loadConfig(writeConfig(""));
        assertThat(empty.getGeneralConfig("lineLength", 0)).isEqualTo(80);

        assertThat(ConfigurationLoader.loadConfig(null).getGeneralConfig("tabWidth", 0)).isEqualTo(4);
    }

    @Test
    public void invalidSectionsAreReplaced() throws Exception {
        FormatterConfig config = ConfigurationLoader.loadConfig(writeConfig(
                "general: 42",
                "plugins:",
                "  solidity: yes"));

        assertThat(config.getGeneralConfig("lineLength", 0)).isEqualTo(80);
        assertThat(config.getPluginConfig("solidity", "bracketSpacing", true)).isFalse();
    }

    @Test
    public void findsConfigInParentDirectories() throws Exception {
        Path config = writeConfig("general:", "  lineLength: 100");
        Path nested = tmp.newFolder("src", "tokens").toPath();

        assertThat(ConfigurationLoader.findConfig(nested)).hasValue(config.toAbsolutePath());
    }

    @Test
    public void savedConfigLoadsBack() throws Exception {
        Path path = tmp.getRoot().toPath().resolve("out").resolve("saved.yml");

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), path);
        FormatterConfig reloaded = ConfigurationLoader.loadConfig(path);

        assertThat(Files.readString(path)).contains("bracketSpacing: false");
        assertThat(reloaded.getGeneralConfig("lineLength", 0)).isEqualTo(80);
        assertThat(reloaded.getIgnoreFiles()).isEqualTo(ConfigurationLoader.loadDefaultConfig().getIgnoreFiles());
    }
}
