package com.bibliography.bibtex.parser;

import java.util.List;

import com.bibliography.bibtex.diagnostics.BibInputException;
import com.bibliography.bibtex.model.BibDatabase;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of loading a set of .bib files into one database.
 *
 * The database holds every construct that parsed, even when some failed.
 */
@Value
@Builder
public class BibLoadResult {
    BibDatabase database;
    int filesParsed;
    @Singular
    List<BibInputException> errors;
    @Singular
    List<String> warnings;

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
