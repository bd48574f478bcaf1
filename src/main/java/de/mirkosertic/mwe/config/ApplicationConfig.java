package de.mirkosertic.mwe.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the MWE recognizer.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.mwe/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_ENABLED = "MWE_ENABLED";
    private static final String ENV_DEFAULT_LANGUAGE = "DEFAULT_LANGUAGE";
    private static final String ENV_MAX_LENGTH = "MWE_MAX_LENGTH";
    private static final String ENV_DATABASE_PATH = "MWE_DATABASE_PATH";
    private static final String ENV_LEMMA_DICT_PATH = "LEMMA_DICT_PATH";
    private static final String PROP_INPUT_FORMAT = "mwe.input";
    private static final String CONFIG_DIR = ".mwe";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    /**
     * Dictionary locations of one language. Either path may be {@code null}.
     */
    public record LanguageSettings(@Nullable String databasePath, @Nullable String lemmaDictPath) {

        LanguageSettings withDatabasePath(final String path) {
            return new LanguageSettings(path, lemmaDictPath);
        }

        LanguageSettings withLemmaDictPath(final String path) {
            return new LanguageSettings(databasePath, path);
        }
    }

    public enum InputFormat {
        TEXT,
        JSON
    }

    private boolean enabled = true;
    private String defaultLanguage = "portuguese";
    private int maxLength = 10;
    private long cacheSize = 100_000;
    private final Map<String, LanguageSettings> languages = new LinkedHashMap<>();

    private InputFormat inputFormat = InputFormat.TEXT;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();
        config.applySystemProperties();

        logger.info("Configuration loaded: enabled={}, defaultLanguage={}, languages={}, maxLength={}",
                config.enabled, config.defaultLanguage, config.languages.keySet(), config.maxLength);

        return config;
    }

    /**
     * Configuration from a single YAML document, without user file or environment overrides.
     */
    public static ApplicationConfig fromYaml(final InputStream yamlStream) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlStream);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> mweConfig = (Map<String, Object>) config.get("mwe");
        if (mweConfig == null) {
            return;
        }

        if (mweConfig.containsKey("enabled")) {
            this.enabled = (Boolean) mweConfig.get("enabled");
        }
        if (mweConfig.containsKey("default-language")) {
            this.defaultLanguage = normalizeLanguage(mweConfig.get("default-language").toString());
        }
        if (mweConfig.containsKey("max-length")) {
            this.maxLength = ((Number) mweConfig.get("max-length")).intValue();
        }
        if (mweConfig.containsKey("cache-size")) {
            this.cacheSize = ((Number) mweConfig.get("cache-size")).longValue();
        }

        final Map<String, Object> languagesConfig = (Map<String, Object>) mweConfig.get("languages");
        if (languagesConfig != null) {
            for (final Map.Entry<String, Object> entry : languagesConfig.entrySet()) {
                final Map<String, Object> languageConfig = entry.getValue() instanceof Map
                        ? (Map<String, Object>) entry.getValue()
                        : Map.of();
                final Object database = languageConfig.get("database");
                final Object lemmaDict = languageConfig.get("lemma-dict");
                languages.put(normalizeLanguage(entry.getKey()), new LanguageSettings(
                        database != null ? resolveVariables(database.toString()) : null,
                        lemmaDict != null ? resolveVariables(lemmaDict.toString()) : null));
            }
        }
    }

    private void applyEnvironmentOverrides() {
        final String envEnabled = System.getenv(ENV_ENABLED);
        if (envEnabled != null && !envEnabled.trim().isEmpty()) {
            this.enabled = parseFlag(envEnabled);
        }

        final String envLanguage = System.getenv(ENV_DEFAULT_LANGUAGE);
        if (envLanguage != null && !envLanguage.trim().isEmpty()) {
            this.defaultLanguage = normalizeLanguage(envLanguage);
        }

        final String envMaxLength = System.getenv(ENV_MAX_LENGTH);
        if (envMaxLength != null && !envMaxLength.trim().isEmpty()) {
            try {
                this.maxLength = Integer.parseInt(envMaxLength.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}: {}", ENV_MAX_LENGTH, envMaxLength);
            }
        }

        // Dictionary paths from environment apply to the default language
        final String envDatabase = System.getenv(ENV_DATABASE_PATH);
        if (envDatabase != null && !envDatabase.trim().isEmpty()) {
            languages.put(defaultLanguage, getLanguageSettings(defaultLanguage).withDatabasePath(envDatabase.trim()));
            logger.info("MWE database path from environment: {}", envDatabase.trim());
        }
        final String envLemmaDict = System.getenv(ENV_LEMMA_DICT_PATH);
        if (envLemmaDict != null && !envLemmaDict.trim().isEmpty()) {
            languages.put(defaultLanguage, getLanguageSettings(defaultLanguage).withLemmaDictPath(envLemmaDict.trim()));
            logger.info("Lemma dictionary path from environment: {}", envLemmaDict.trim());
        }
    }

    private void applySystemProperties() {
        final String format = System.getProperty(PROP_INPUT_FORMAT);
        if (format != null && !format.isEmpty()) {
            try {
                this.inputFormat = InputFormat.valueOf(format.trim().toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException e) {
                logger.warn("Unknown input format '{}', using {}", format, inputFormat);
            }
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    private static boolean parseFlag(final String value) {
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
    }

    private static String normalizeLanguage(final String language) {
        return language.trim().toLowerCase(Locale.ROOT);
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public boolean isEnabled() {
        return enabled;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public Map<String, LanguageSettings> getLanguages() {
        return Collections.unmodifiableMap(languages);
    }

    public LanguageSettings getLanguageSettings(final String language) {
        return languages.getOrDefault(normalizeLanguage(language), new LanguageSettings(null, null));
    }

    public InputFormat getInputFormat() {
        return inputFormat;
    }
}
