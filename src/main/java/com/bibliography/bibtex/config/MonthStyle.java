package com.bibliography.bibtex.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.bibliography.bibtex.model.Months;

/**
 * How the standard month macros ({@code jan} .. {@code dec}) are seeded into a new parser.
 * These are normally provided by the style file, not the database.
 */
public enum MonthStyle {
    /** Full month names, e.g. {@code jan} expands to "January". */
    FULL("January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"),
    /** abbrv.bst-style abbreviations, e.g. {@code jan} expands to "Jan.". */
    ABBRV("Jan.", "Feb.", "Mar.", "Apr.", "May", "June",
            "July", "Aug.", "Sept.", "Oct.", "Nov.", "Dec."),
    /** No month macros. */
    NONE();

    private final Map<String, String> macros;

    MonthStyle(String... expansions) {
        Map<String, String> table = new LinkedHashMap<>();
        for (int i = 0; i < expansions.length; i++) {
            table.put(Months.MACRO_NAMES.get(i), expansions[i]);
        }
        this.macros = Map.copyOf(table);
    }

    /**
     * The macro table this style seeds, keyed by lower-case macro name.
     */
    public Map<String, String> getMacros() {
        return macros;
    }

    /**
     * Resolve a style by its configuration name: {@code full}, {@code abbrv} or {@code none}.
     * A null name means no month macros.
     */
    public static MonthStyle fromName(String name) {
        if (name == null) {
            return NONE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "full" -> FULL;
            case "abbrv" -> ABBRV;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unknown month style " + name);
        };
    }
}
