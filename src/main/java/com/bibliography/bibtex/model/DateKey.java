package com.bibliography.bibtex.model;

import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Chronological sort key of an entry: empty, (year) or (year, month).
 *
 * <p>Ordered like a tuple: element by element, with a shorter key sorting before any
 * longer key it is a prefix of.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DateKey implements Comparable<DateKey> {

    public static final DateKey EMPTY = new DateKey(List.of());

    List<Integer> parts;

    public static DateKey of(int year) {
        return new DateKey(List.of(year));
    }

    public static DateKey of(int year, int month) {
        return new DateKey(List.of(year, month));
    }

    @Override
    public int compareTo(DateKey other) {
        int common = Math.min(parts.size(), other.parts.size());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(parts.get(i), other.parts.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(parts.size(), other.parts.size());
    }

    @Override
    public String toString() {
        return parts.toString();
    }
}
