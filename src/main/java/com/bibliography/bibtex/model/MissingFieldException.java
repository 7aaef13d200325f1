package com.bibliography.bibtex.model;

import java.util.NoSuchElementException;

/**
 * Raised when a field is looked up on an entry that does not define it.
 */
public class MissingFieldException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;
    private final String field;

    public MissingFieldException(BibEntry entry, String field) {
        super(entry + ": missing field `" + field + "'");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
