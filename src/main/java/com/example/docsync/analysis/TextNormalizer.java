package com.example.docsync.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns code or prose into a stream of comparable tokens.
 * <p>
 * Steps:
 * <ul>
 *   <li>lowercase</li>
 *   <li>underscores become spaces, so {@code calc_price} and "calc price" tokenize the same way</li>
 *   <li>structural punctuation becomes spaces (never deleted, so tokens are not fused)</li>
 *   <li>whitespace split; single-character tokens, stopwords and tokens without letters are dropped</li>
 * </ul>
 */
public final class TextNormalizer {

    /** Characters replaced by a space before splitting. */
    private static final String STRUCTURAL_CHARS = "()[]{}:,.=;\"'";

    /** English function words plus software-generic nouns that carry no domain meaning. */
    static final Set<String> DEFAULT_STOPWORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could", "should",
            "may", "might", "must", "shall", "can",
            "and", "but", "or", "nor", "for", "so", "as", "if", "when", "where",
            "what", "which", "who", "whom", "whose", "why", "how", "while",
            "that", "this", "these", "those", "then", "than", "there", "here",
            "in", "on", "at", "by", "with", "about", "into", "through", "to", "from",
            "of", "up", "out", "over", "under", "again",
            "we", "our", "you", "your", "he", "she", "it", "its", "they", "them", "their",
            "all", "each", "some", "such", "no", "not", "only", "any", "both", "also", "just",
            // software-generic nouns
            "function", "functions", "module", "modules", "class", "classes",
            "method", "methods", "return", "returns", "value", "values",
            "self", "def", "none", "null", "true", "false"
    );

    private final Set<String> stopwords;

    public TextNormalizer(Collection<String> extraStopwords) {
        Set<String> all = new HashSet<>(DEFAULT_STOPWORDS);
        if (extraStopwords != null) {
            extraStopwords.forEach(w -> all.add(w.toLowerCase(Locale.ROOT)));
        }
        this.stopwords = Set.copyOf(all);
    }

    public static TextNormalizer withDefaults() {
        return new TextNormalizer(List.of());
    }

    /**
     * Normalizes text into tokens, in order of appearance (duplicates kept).
     *
     * @param text raw text, may be null
     * @return tokens; empty for null or blank input
     */
    public List<String> normalize(String text) {
        if (text == null || text.isBlank()) return List.of();

        StringBuilder cleaned = new StringBuilder(text.length());
        String lower = text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == '_' || STRUCTURAL_CHARS.indexOf(c) >= 0) {
                cleaned.append(' ');
            } else {
                cleaned.append(c);
            }
        }

        List<String> tokens = new ArrayList<>();
        for (String token : cleaned.toString().split("\\s+")) {
            if (token.length() <= 1) continue;
            if (stopwords.contains(token)) continue;
            if (!containsLetter(token)) continue;
            tokens.add(token);
        }
        return tokens;
    }

    public boolean isStopword(String token) {
        return token != null && stopwords.contains(token.toLowerCase(Locale.ROOT));
    }

    private static boolean containsLetter(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (Character.isLetter(token.charAt(i))) return true;
        }
        return false;
    }
}
