package com.entity.blocking.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw field values into the token lists that TF-IDF indices work on.
 * Token lists are sorted so that equal bags of tokens map to the same document.
 */
public final class Tokenizers {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int NGRAM_SIZE = 3;

    private Tokenizers() {
    }

    /**
     * Lower-cased alphanumeric word tokens.
     */
    public static List<String> words(Object value) {
        List<String> tokens = new ArrayList<>();
        if (value == null) {
            return tokens;
        }
        for (String token : NON_WORD.split(value.toString().toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        Collections.sort(tokens);
        return tokens;
    }

    /**
     * Character trigrams of the lower-cased, space-padded value.
     */
    public static List<String> trigrams(Object value) {
        List<String> grams = new ArrayList<>();
        if (value == null) {
            return grams;
        }
        String cleaned = value.toString().toLowerCase(Locale.ROOT).trim();
        if (cleaned.isEmpty()) {
            return grams;
        }
        String padded = " " + cleaned + " ";
        if (padded.length() < NGRAM_SIZE) {
            grams.add(padded);
            return grams;
        }
        for (int i = 0; i + NGRAM_SIZE <= padded.length(); i++) {
            grams.add(padded.substring(i, i + NGRAM_SIZE));
        }
        Collections.sort(grams);
        return grams;
    }

    /**
     * The non-empty elements of a set-valued field, sorted. A scalar value is treated as a singleton set.
     */
    public static List<String> elements(Object value) {
        List<String> tokens = setElements(value);
        Collections.sort(tokens);
        return tokens;
    }

    /**
     * The non-empty elements of a set-valued field, in iteration order.
     */
    public static List<String> setElements(Object value) {
        List<String> tokens = new ArrayList<>();
        if (value == null) {
            return tokens;
        }
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && !element.toString().isEmpty()) {
                    tokens.add(element.toString());
                }
            }
        } else if (!value.toString().isEmpty()) {
            tokens.add(value.toString());
        }
        return tokens;
    }
}
