package com.bibliography.bibtex.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and errors accumulated by one parse session.
 *
 * Pure structure only: logging happens at the position that reports the diagnostic.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void addWarning(SourcePosition position, String message) {
        warnings.add(position + ": " + message);
    }

    public void addErrors(List<BibInputException> raised) {
        for (BibInputException e : raised) {
            errors.add(e.getMessage());
        }
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
