package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.InvalidSharedStringIndexException;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a raw cell into its text value: shared-string lookup for {@code t="s"},
 * the raw token otherwise, then optional sanitization.
 */
class CellValueResolver {

    static final String TYPE_SHARED_STRING = "s";

    private static final char NEXT_LINE = '\u0085';

    private final List<String> sharedStrings;
    private final boolean sanitize;

    CellValueResolver(List<String> sharedStrings, boolean sanitize) {
        this.sharedStrings = sharedStrings;
        this.sanitize = sanitize;
    }

    String resolve(RawCell cell) {
        String value = cell.getValue();
        if (value == null) {
            return null;
        }
        if (TYPE_SHARED_STRING.equals(cell.getType())) {
            value = sharedStrings.get(sharedStringIndex(cell));
        }
        return sanitize ? sanitize(value) : value;
    }

    private int sharedStringIndex(RawCell cell) {
        String raw = cell.getValue().trim();
        int index;
        try {
            index = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            index = -1;
        }
        if (index < 0 || index >= sharedStrings.size()) {
            throw new InvalidSharedStringIndexException(cell.getReference(), raw, sharedStrings.size());
        }
        return index;
    }

    /**
     * Trims the value, splits it on line terminators, drops empty fragments and joins
     * the rest with single spaces. Idempotent; null stays null.
     * <p>
     * Trimming also removes space separators and NEL, which {@link String#strip()} keeps.
     */
    static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(trim(value).split("\\R"))
                .filter(fragment -> !fragment.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isBlank(value.charAt(start))) {
            start++;
        }
        while (end > start && isBlank(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == NEXT_LINE;
    }
}
