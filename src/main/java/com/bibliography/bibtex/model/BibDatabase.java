package com.bibliography.bibtex.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered, read-only mapping from lower-cased database keys to entries, in the
 * order the entries were parsed.
 */
public class BibDatabase implements Iterable<BibEntry> {

    private final Map<String, BibEntry> entries;

    public BibDatabase(Map<String, BibEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Build a database from entries in order. Keys are lower-cased; a later entry with a
     * key already present replaces the earlier one.
     */
    public static BibDatabase of(Collection<BibEntry> entries) {
        Map<String, BibEntry> byKey = new LinkedHashMap<>();
        for (BibEntry entry : entries) {
            byKey.put(entry.lowerKey(), entry);
        }
        return new BibDatabase(byKey);
    }

    /**
     * Look up an entry by key, ignoring case.
     *
     * @return the entry, or null if there is none
     */
    public BibEntry get(String key) {
        return entries.get(key.toLowerCase(Locale.ROOT));
    }

    public Optional<BibEntry> find(String key) {
        return Optional.ofNullable(get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Lower-cased keys in parse order. */
    public Set<String> keys() {
        return entries.keySet();
    }

    public Collection<BibEntry> entries() {
        return entries.values();
    }

    /**
     * A new database in which every entry has its cross-referenced fields merged in.
     */
    public BibDatabase resolveCrossrefs() {
        Map<String, BibEntry> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, BibEntry> entry : entries.entrySet()) {
            resolved.put(entry.getKey(), entry.getValue().resolveCrossref(this));
        }
        return new BibDatabase(resolved);
    }

    @Override
    public Iterator<BibEntry> iterator() {
        return entries.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BibDatabase)) return false;
        BibDatabase other = (BibDatabase) o;
        return new ArrayList<>(entries.entrySet()).equals(new ArrayList<>(other.entries.entrySet()));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "BibDatabase" + entries.keySet();
    }
}
