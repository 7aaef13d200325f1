package com.bibliography.bibtex.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A location in a parsed .bib source: source name, 1-based line and column, and the
 * character offset into the (whitespace-stripped) text.
 *
 * <p>Positions created while parsing carry the session's {@link ParseDiagnostics}, so
 * warnings reported later against an entry or field still reach the same sink.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class SourcePosition {
    private static final Logger log = LoggerFactory.getLogger(SourcePosition.class);

    private final String sourceName;
    private final int line;
    private final int column;
    private final int offset;

    @EqualsAndHashCode.Exclude
    @Getter(AccessLevel.NONE)
    private final ParseDiagnostics diagnostics;

    public SourcePosition(String sourceName, int line, int column, int offset) {
        this(sourceName, line, column, offset, null);
    }

    /**
     * Build a hard error tagged with this position. Callers throw the result.
     */
    public BibInputException error(String message) {
        return new BibInputException(this, message);
    }

    /**
     * Report a non-fatal problem at this position.
     */
    public void warn(String message) {
        log.warn("{}: {}", this, message);
        if (diagnostics != null) {
            diagnostics.addWarning(this, message);
        }
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
