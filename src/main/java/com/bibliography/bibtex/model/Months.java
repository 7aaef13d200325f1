package com.bibliography.bibtex.model;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Month name recognition.
 */
public final class Months {

    private Months() {}

    /** Macro names for the twelve months, in calendar order. */
    public static final List<String> MACRO_NAMES = List.of(
            "jan", "feb", "mar", "apr", "may", "jun",
            "jul", "aug", "sep", "oct", "nov", "dec");

    private static final List<String> FULL_NAMES = List.of(
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december");

    private static final int MIN_PREFIX = 3;

    /**
     * Parse a month value to 1..12.
     *
     * <p>Accepts any prefix of a full month name of at least three letters, in any case,
     * optionally followed by one period: "Jan", "jan.", "Sept.", "JANUARY". The earliest
     * month whose name starts with the value wins.
     */
    public static OptionalInt parse(String raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        String value = raw.strip();
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        value = value.toLowerCase(Locale.ROOT);
        if (value.length() < MIN_PREFIX) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < FULL_NAMES.size(); i++) {
            if (FULL_NAMES.get(i).startsWith(value)) {
                return OptionalInt.of(i + 1);
            }
        }
        return OptionalInt.empty();
    }
}
