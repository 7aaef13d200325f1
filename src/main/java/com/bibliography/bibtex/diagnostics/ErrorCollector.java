package com.bibliography.bibtex.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects input errors from a sequence of independent steps and raises them together.
 *
 * A failing step only aborts itself; other exception types propagate unchanged.
 */
public class ErrorCollector {
    private static final Logger log = LoggerFactory.getLogger(ErrorCollector.class);

    private final List<BibInputException> errors = new ArrayList<>();

    /**
     * Run one step, recording its input error if it raises one.
     *
     * @return true if the step completed normally
     */
    public boolean run(Runnable step) {
        try {
            step.run();
            return true;
        } catch (BibInputException e) {
            log.debug("Recovered from input error: {}", e.getMessage());
            errors.add(e);
            return false;
        }
    }

    public void add(BibInputException error) {
        errors.add(error);
    }

    public List<BibInputException> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Throw a {@link BibErrorsException} holding everything recorded so far, if anything was.
     */
    public void rethrow() {
        if (!errors.isEmpty()) {
            throw new BibErrorsException(errors);
        }
    }
}
