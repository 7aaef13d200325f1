package com.bibliography.bibtex.diagnostics;

/**
 * A hard error in .bib input, tagged with the position it was detected at.
 */
public class BibInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient SourcePosition position;
    private final String detail;

    public BibInputException(SourcePosition position, String detail) {
        super(position == null ? detail : position + ": " + detail);
        this.position = position;
        this.detail = detail;
    }

    /**
     * The position of the error, or null for entries that were not parsed from a source.
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * The message without its position prefix.
     */
    public String getDetail() {
        return detail;
    }
}
