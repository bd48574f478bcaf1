package de.mirkosertic.mwe;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Portuguese plural and gerund suffix rewriting plus the preposition/article contraction table.
 *
 * <p>Suffix rules are checked in a fixed order and the first matching rule wins, because several
 * suffixes overlap ({@code -es} is contained in {@code -res}, {@code -s} in everything):</p>
 * <ol>
 *   <li>{@code -ões}, {@code -ães}, {@code -ãos} → {@code -ão} (limões → limão)</li>
 *   <li>{@code -eis} → {@code -l} after a vowel, otherwise {@code -il}</li>
 *   <li>{@code -óis} → {@code -ol} (sóis → sol)</li>
 *   <li>{@code -res}, {@code -ses}, {@code -zes} → drop the final {@code -es} (luzes → luz)</li>
 *   <li>{@code -ns} → {@code -m} (jardins → jardim)</li>
 *   <li>{@code -s} → dropped for words longer than two characters (cafés → café)</li>
 *   <li>{@code -ando} → {@code -ar}, {@code -endo}/{@code -indo} → {@code -er}</li>
 * </ol>
 *
 * <p>Irregular forms belong in the override dictionary.</p>
 */
public final class PortugueseRules implements LanguageRules {

    public static final PortugueseRules INSTANCE = new PortugueseRules();

    private static final String VOWELS = "aeiouáéíóú";

    private static final Map<String, List<String>> CONTRACTIONS = Map.ofEntries(
            entry("da", List.of("de", "a")),
            entry("do", List.of("de", "o")),
            entry("das", List.of("de", "as")),
            entry("dos", List.of("de", "os")),
            entry("na", List.of("em", "a")),
            entry("no", List.of("em", "o")),
            entry("nas", List.of("em", "as")),
            entry("nos", List.of("em", "os")),
            entry("ao", List.of("a", "o")),
            entry("aos", List.of("a", "os")),
            entry("à", List.of("a", "a")),
            entry("às", List.of("a", "as")),
            entry("pela", List.of("por", "a")),
            entry("pelo", List.of("por", "o")),
            entry("pelas", List.of("por", "as")),
            entry("pelos", List.of("por", "os")),
            entry("dum", List.of("de", "um")),
            entry("duma", List.of("de", "uma")),
            entry("duns", List.of("de", "uns")),
            entry("dumas", List.of("de", "umas")),
            entry("num", List.of("em", "um")),
            entry("numa", List.of("em", "uma")),
            entry("nuns", List.of("em", "uns")),
            entry("numas", List.of("em", "umas"))
    );

    private PortugueseRules() {
    }

    @Override
    public String lemmatize(final String word) {
        if (word.endsWith("ões") || word.endsWith("ães") || word.endsWith("ãos")) {
            return stem(word, 3) + "ão";
        }
        if (word.endsWith("eis")) {
            if (word.length() > 4 && VOWELS.indexOf(word.charAt(word.length() - 4)) >= 0) {
                return stem(word, 3) + "l";
            }
            return stem(word, 3) + "il";
        }
        if (word.endsWith("óis")) {
            return stem(word, 3) + "ol";
        }
        if (word.endsWith("res") || word.endsWith("ses") || word.endsWith("zes")) {
            return stem(word, 2);
        }
        if (word.endsWith("ns")) {
            return stem(word, 2) + "m";
        }
        if (word.endsWith("s") && word.length() > 2) {
            return stem(word, 1);
        }

        // Gerunds
        if (word.endsWith("ando")) {
            return stem(word, 4) + "ar";
        }
        if (word.endsWith("endo") || word.endsWith("indo")) {
            return stem(word, 4) + "er";
        }
        return word;
    }

    @Override
    public List<String> expandContraction(final String word) {
        final List<String> expansion = CONTRACTIONS.get(word.toLowerCase(Locale.ROOT));
        return expansion != null ? expansion : List.of(word);
    }

    private static String stem(final String word, final int suffixLength) {
        return word.substring(0, word.length() - suffixLength);
    }

    @Override
    public String toString() {
        return "PortugueseRules";
    }
}
