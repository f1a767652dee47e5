package com.raditha.armmerge.config;

import com.github.javaparser.ParserConfiguration;
import com.raditha.armmerge.cli.MergeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Loads merge configuration from a YAML file (arm-merger.yml) with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments &gt; arm-merger.yml &gt; defaults
 * <pre>
 * merge_arms:
 *   language_level: JAVA_21
 *   mode: dry-run
 *   context_lines: 3
 *   backup: true
 * </pre>
 */
public class MergeSettings {

    public static final String DEFAULT_CONFIG_FILE = "arm-merger.yml";
    private static final String CONFIG_KEY = "merge_arms";

    private static final Logger logger = LoggerFactory.getLogger(MergeSettings.class);

    private MergeSettings() {
        /* this is only a utility class */
    }

    /**
     * Read the {@code merge_arms} section of a YAML file.
     *
     * @param configFile the file to read, or null to use arm-merger.yml in the working
     *                   directory when it exists
     * @return the raw section, empty when there is no file or no section
     * @throws IOException if the file cannot be read
     */
    public static Map<String, Object> loadConfigMap(Path configFile) throws IOException {
        Path file = configFile != null ? configFile : Path.of(DEFAULT_CONFIG_FILE);
        if (!Files.exists(file)) {
            if (configFile != null) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            logger.debug("No {} found, using defaults", DEFAULT_CONFIG_FILE);
            return Map.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Object root = new Yaml().load(in);
            if (!(root instanceof Map)) {
                return Map.of();
            }
            Object section = ((Map<?, ?>) root).get(CONFIG_KEY);
            if (!(section instanceof Map)) {
                return Map.of();
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            logger.debug("Loaded {} from {}", CONFIG_KEY, file);
            return config;
        }
    }

    /**
     * Build the configuration, applying CLI overrides where provided.
     *
     * @param config          the raw YAML section (may be empty)
     * @param modeCLI         CLI mode (null = use YAML/default)
     * @param contextLinesCLI CLI context lines (null = use YAML/default)
     * @param noBackupCLI     true when --no-backup was given
     * @return Complete merge configuration
     */
    public static MergeConfig loadConfig(Map<String, Object> config, MergeMode modeCLI, Integer contextLinesCLI,
            boolean noBackupCLI) {
        MergeConfig defaults = MergeConfig.defaults();

        ParserConfiguration.LanguageLevel languageLevel = getLanguageLevel(config, defaults.languageLevel());

        MergeMode mode = modeCLI;
        if (mode == null) {
            String yamlMode = getString(config, "mode", null);
            mode = yamlMode != null ? MergeMode.fromString(yamlMode) : defaults.mode();
        }

        int contextLines = contextLinesCLI != null
                ? contextLinesCLI
                : getInt(config, "context_lines", defaults.contextLines());

        boolean backup = !noBackupCLI && getBoolean(config, "backup", defaults.backup());

        return new MergeConfig(languageLevel, mode, contextLines, backup);
    }

    private static ParserConfiguration.LanguageLevel getLanguageLevel(Map<String, Object> map,
            ParserConfiguration.LanguageLevel defaultValue) {
        String value = getString(map, "language_level", null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return ParserConfiguration.LanguageLevel.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown language_level: " + value, e);
        }
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
