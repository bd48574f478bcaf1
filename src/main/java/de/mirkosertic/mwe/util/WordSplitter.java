package de.mirkosertic.mwe.util;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Splits dictionary surface forms and plain text input lines into words.
 *
 * <p>Any Unicode whitespace separates words, including the no-break space U+00A0 that
 * dictionaries exported from word processors and web pages often contain. Leading and
 * trailing whitespace produce no empty words.</p>
 */
public final class WordSplitter {

    private static final String[] NO_WORDS = new String[0];

    /**
     * One or more Unicode whitespace characters. {@code \s} alone only covers ASCII whitespace.
     */
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private WordSplitter() {
        // Utility class, no instances
    }

    /**
     * @param text the text to split, never null
     * @return the words in order, empty if the text holds nothing but whitespace
     */
    public static String[] split(final String text) {
        final String[] parts = WHITESPACE.split(text);
        if (parts.length > 0 && parts[0].isEmpty()) {
            return parts.length == 1 ? NO_WORDS : Arrays.copyOfRange(parts, 1, parts.length);
        }
        return parts;
    }

    public static boolean isBlank(final String text) {
        return split(text).length == 0;
    }
}
