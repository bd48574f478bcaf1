package de.mirkosertic.mwe.dictionary;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Kind of multiword expression, following the Universal Dependencies relation names.
 */
public enum MweType {
    FIXED,
    FLAT,
    COMPOUND,
    OTHER;

    /**
     * Parses a type name case-insensitively. {@code null} or blank yields {@link #FIXED},
     * unknown names yield {@link #OTHER}.
     */
    public static MweType parse(final @Nullable String value) {
        if (value == null || value.isBlank()) {
            return FIXED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            return OTHER;
        }
    }

    /**
     * The lowercase name used in JSON documents and statistics.
     */
    public String externalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return externalName();
    }
}
