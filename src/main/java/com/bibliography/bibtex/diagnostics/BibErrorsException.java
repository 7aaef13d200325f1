package com.bibliography.bibtex.diagnostics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Single exception that bundles every input error raised during one parse or finalize call.
 */
public class BibErrorsException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<BibInputException> errors;

    public BibErrorsException(List<BibInputException> errors) {
        super(errors.stream()
                .map(BibInputException::getMessage)
                .collect(Collectors.joining(System.lineSeparator())));
        this.errors = List.copyOf(errors);
    }

    public List<BibInputException> getErrors() {
        return errors;
    }
}
