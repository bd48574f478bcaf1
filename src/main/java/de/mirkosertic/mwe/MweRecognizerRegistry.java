package de.mirkosertic.mwe;

import de.mirkosertic.mwe.config.ApplicationConfig;
import de.mirkosertic.mwe.dictionary.ExpressionSource;
import de.mirkosertic.mwe.dictionary.LemmaSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One {@link MweRecognizer} per language, built once at startup and handed to the code that
 * processes requests. The registry itself is immutable; dictionary changes happen inside the
 * individual recognizers.
 */
public final class MweRecognizerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(MweRecognizerRegistry.class);

    private final String defaultLanguage;
    private final Map<String, MweRecognizer> recognizers;

    public MweRecognizerRegistry(final String defaultLanguage, final Map<String, MweRecognizer> recognizers) {
        final Map<String, MweRecognizer> byLanguage = new LinkedHashMap<>();
        recognizers.forEach((language, recognizer) -> byLanguage.put(key(language), recognizer));
        if (!byLanguage.containsKey(key(defaultLanguage))) {
            throw new IllegalArgumentException("No recognizer for default language " + defaultLanguage);
        }
        this.defaultLanguage = key(defaultLanguage);
        this.recognizers = Collections.unmodifiableMap(byLanguage);
    }

    /**
     * Builds a recognizer for every configured language, plus the default language if it has
     * no dictionary settings. Missing or broken dictionary files leave the affected recognizer
     * disabled.
     */
    public static MweRecognizerRegistry fromConfig(final ApplicationConfig config) {
        final Map<String, ApplicationConfig.LanguageSettings> languages = new LinkedHashMap<>(config.getLanguages());
        languages.putIfAbsent(config.getDefaultLanguage(), config.getLanguageSettings(config.getDefaultLanguage()));

        final Map<String, MweRecognizer> recognizers = new LinkedHashMap<>();
        for (final Map.Entry<String, ApplicationConfig.LanguageSettings> entry : languages.entrySet()) {
            final ApplicationConfig.LanguageSettings settings = entry.getValue();
            final ExpressionSource expressions = config.isEnabled() && settings.databasePath() != null
                    ? ExpressionSource.fromJsonFile(Paths.get(settings.databasePath()))
                    : ExpressionSource.empty();
            final LemmaSource lemmas = config.isEnabled() && settings.lemmaDictPath() != null
                    ? LemmaSource.fromJsonFile(Paths.get(settings.lemmaDictPath()))
                    : LemmaSource.empty();

            recognizers.put(entry.getKey(), new MweRecognizer(
                    entry.getKey(), expressions, lemmas, config.getMaxLength(), config.getCacheSize()));
        }

        if (!config.isEnabled()) {
            logger.info("MWE recognition disabled by configuration");
        }
        return new MweRecognizerRegistry(config.getDefaultLanguage(), recognizers);
    }

    public Optional<MweRecognizer> find(final String language) {
        return Optional.ofNullable(recognizers.get(key(language)));
    }

    public MweRecognizer get(final String language) {
        return find(language).orElseThrow(() -> new IllegalArgumentException(
                "Unsupported language: " + language + ". Supported: " + recognizers.keySet()));
    }

    public MweRecognizer getDefault() {
        return recognizers.get(defaultLanguage);
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public Set<String> languages() {
        return recognizers.keySet();
    }

    private static String key(final String language) {
        return language.trim().toLowerCase(Locale.ROOT);
    }
}
