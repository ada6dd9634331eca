package de.bsommerfeld.pseat.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits the stored {@code prefixes} column into tokens. The column is
 * written by hand through chat commands, so both {@code "a b"} and
 * {@code "a, b"} have to be accepted.
 */
public final class PrefixParser {

    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]+");

    private PrefixParser() {
    }

    /**
     * Splits on any run of commas and whitespace. Blank input yields an empty
     * list, empty tokens are dropped.
     *
     * @param text the raw column value, may be {@code null}
     * @return unmodifiable token list in input order
     */
    public static List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATORS.split(text.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return Collections.unmodifiableList(tokens);
    }
}
