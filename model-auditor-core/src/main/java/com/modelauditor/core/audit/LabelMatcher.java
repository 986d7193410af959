package com.modelauditor.core.audit;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive matching of row labels and sheet names against synonym lists.
 */
public final class LabelMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private LabelMatcher() {
        // Utility class
    }

    /**
     * Lower-cases a label, collapses whitespace and drops a trailing colon.
     *
     * @param label raw label, may be null
     * @return normalized label, empty for null
     */
    public static String normalize(String label) {
        if (label == null) {
            return "";
        }
        String text = WHITESPACE.matcher(label.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        return text.endsWith(":") ? text.substring(0, text.length() - 1).trim() : text;
    }

    /**
     * Returns true if the normalized label contains any of the phrases as a substring.
     *
     * @param label label text
     * @param phrases lower-case phrases
     * @return true on a match
     */
    public static boolean containsAny(String label, List<String> phrases) {
        String text = normalize(label);
        return !text.isEmpty() && phrases.stream().anyMatch(text::contains);
    }

    /**
     * Returns true if the phrase occurs in the text on word boundaries, so that
     * {@code bs} matches "BS" and "BS - Consolidated" but not "Jobs".
     *
     * @param text text to search
     * @param phrase lower-case phrase
     * @return true on a match
     */
    public static boolean containsWords(String text, String phrase) {
        String haystack = " " + String.join(" ", words(text)) + " ";
        String needle = " " + String.join(" ", words(phrase)) + " ";
        return needle.trim().length() > 0 && haystack.contains(needle);
    }

    /**
     * Splits text into lower-case words of letters and digits.
     *
     * @param text text
     * @return words
     */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
            .filter(w -> !w.isEmpty())
            .toList();
    }
}
