package com.bibliography.bibtex.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import com.bibliography.bibtex.diagnostics.BibInputException;
import com.bibliography.bibtex.diagnostics.SourcePosition;

import lombok.Getter;

/**
 * An entry in a BibTeX database: an ordered map of lower-cased field names to field
 * values, plus the entry type, its database key and where it came from.
 *
 * <p>Field values are as a .bst style would see them: white space is cleaned up, but
 * macros have been expanded and TeX markup is kept as written.
 *
 * <p>Two entries are equal if they have the same fields in the same order, the same
 * type and the same key. Positions do not take part in equality.
 */
@Getter
public class BibEntry {

    public static final String CROSSREF = "crossref";

    /** Entry type, lower case, e.g. "article". */
    private final String type;
    /** Database key, case preserved. Compare keys case-insensitively. */
    private final String key;
    /** Position of the {@code @} that opened the entry; null for entries built in code. */
    private final SourcePosition position;

    private final LinkedHashMap<String, String> fields;
    private final Map<String, SourcePosition> fieldPositions;

    public BibEntry(String type, String key, SourcePosition position,
                    Map<String, String> fields, Map<String, SourcePosition> fieldPositions) {
        this.type = type;
        this.key = key;
        this.position = position;
        this.fields = new LinkedHashMap<>(fields);
        this.fieldPositions = new HashMap<>(fieldPositions);
    }

    public BibEntry(String type, String key, Map<String, String> fields) {
        this(type, key, null, fields, Map.of());
    }

    /**
     * Read-only view of the fields in source order.
     */
    public Map<String, String> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Read-only view of where each field's name appeared in the source.
     */
    public Map<String, SourcePosition> getFieldPositions() {
        return Collections.unmodifiableMap(fieldPositions);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public Optional<String> find(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * The value of a field.
     *
     * @throws MissingFieldException if this entry has no such field
     */
    public String get(String field) {
        String value = fields.get(field);
        if (value == null) {
            throw new MissingFieldException(this, field);
        }
        return value;
    }

    /**
     * Position of a field's name in the source, or the entry position if unknown.
     */
    public SourcePosition getFieldPosition(String field) {
        SourcePosition pos = fieldPositions.get(field);
        return pos != null ? pos : position;
    }

    public BibEntry copy() {
        return new BibEntry(type, key, position, fields, fieldPositions);
    }

    /**
     * Return an entry with the fields of its cross-referenced entry merged in.
     *
     * <p>Fields this entry defines itself are never overwritten, and the result has no
     * {@code crossref} field. Neither this entry nor the target is modified. An entry
     * without a crossref is returned as is.
     *
     * @param database the database holding the cross-referenced entry; its existence
     *                 is checked when the database is finalized
     * @throws IllegalStateException if the target is not in the database
     */
    public BibEntry resolveCrossref(BibDatabase database) {
        String crossref = fields.get(CROSSREF);
        if (crossref == null) {
            return this;
        }
        BibEntry source = database.get(crossref);
        if (source == null) {
            throw new IllegalStateException(this + ": crossref `" + crossref + "' is not in the database");
        }

        Map<String, String> merged = new LinkedHashMap<>(fields);
        Map<String, SourcePosition> mergedPositions = new HashMap<>(fieldPositions);
        for (Map.Entry<String, String> field : source.fields.entrySet()) {
            if (!merged.containsKey(field.getKey())) {
                merged.put(field.getKey(), field.getValue());
                SourcePosition pos = source.fieldPositions.get(field.getKey());
                if (pos != null) {
                    mergedPositions.put(field.getKey(), pos);
                }
            }
        }
        merged.remove(CROSSREF);
        mergedPositions.remove(CROSSREF);
        return new BibEntry(type, key, position, merged, mergedPositions);
    }

    /**
     * Sort key for ordering entries by date.
     *
     * @return empty, (year) or (year, month) depending on which fields are present
     * @throws BibInputException if the year is not a number, the month has no year,
     *                           or the month cannot be parsed
     */
    public DateKey dateKey() {
        String year = fields.get("year");
        String month = fields.get("month");
        if (year == null) {
            if (month != null) {
                throw new BibInputException(getFieldPosition("month"), "month without year");
            }
            return DateKey.EMPTY;
        }
        int yearNumber = parseYear(year);
        if (month == null) {
            return DateKey.of(yearNumber);
        }
        return DateKey.of(yearNumber, monthNumber());
    }

    public int monthNumber() {
        return monthNumber("month");
    }

    /**
     * Convert a month field to a number in [1, 12], accepting every standard month
     * macro style (see {@link Months#parse(String)}).
     *
     * @throws MissingFieldException if the field is absent
     * @throws BibInputException     if the value is not a month
     */
    public int monthNumber(String field) {
        String value = get(field);
        OptionalInt month = Months.parse(value);
        if (month.isEmpty()) {
            throw new BibInputException(getFieldPosition(field), "invalid month `" + value + "'");
        }
        return month.getAsInt();
    }

    private int parseYear(String year) {
        if (year.isEmpty() || !year.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new BibInputException(getFieldPosition("year"), "invalid year `" + year + "'");
        }
        try {
            return Integer.parseInt(year);
        } catch (NumberFormatException e) {
            throw new BibInputException(getFieldPosition("year"), "invalid year `" + year + "'");
        }
    }

    String lowerKey() {
        return key.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BibEntry)) return false;
        BibEntry other = (BibEntry) o;
        return Objects.equals(type, other.type)
                && Objects.equals(key, other.key)
                && new ArrayList<>(fields.entrySet()).equals(new ArrayList<>(other.fields.entrySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, key, fields);
    }

    @Override
    public String toString() {
        return "`" + key + "' at " + position;
    }
}
