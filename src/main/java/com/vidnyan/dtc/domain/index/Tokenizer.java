package com.vidnyan.dtc.domain.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared tokenization for indexing and querying: lower case, split on
 * non-alphanumeric characters, drop tokens shorter than {@value #MIN_TOKEN_LENGTH}.
 */
public final class Tokenizer {

    public static final int MIN_TOKEN_LENGTH = 2;

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{IsAlphabetic}\\p{IsDigit}]+");

    private Tokenizer() {
    }

    /**
     * Tokens in text order, duplicates kept.
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (part.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(part);
            }
        }
        return tokens;
    }
}
