package com.bibliography.bibtex.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bibliography.bibtex.config.ParserConfig;
import com.bibliography.bibtex.diagnostics.BibErrorsException;
import com.bibliography.bibtex.model.BibDatabase;

import lombok.RequiredArgsConstructor;

/**
 * Loads several .bib files, in order, into one database.
 *
 * Later files see the strings of earlier ones, and cross-references are checked
 * across all of them once every file is read.
 */
@RequiredArgsConstructor
public class BibLoadingService {
    private static final Logger log = LoggerFactory.getLogger(BibLoadingService.class);

    private final ParserConfig config;

    public BibLoadingService() {
        this(ParserConfig.defaults());
    }

    /**
     * Parse every file and finalize. Errors in one file do not stop the others.
     */
    public BibLoadResult loadAll(List<Path> files) throws IOException {
        BibParser parser = new BibParser(config);
        BibLoadResult.BibLoadResultBuilder result = BibLoadResult.builder();

        int parsed = 0;
        for (Path path : files) {
            try {
                parser.parse(path);
            } catch (BibErrorsException e) {
                log.warn("{}: {} error(s)", path, e.getErrors().size());
                result.errors(e.getErrors());
            }
            parsed++;
        }

        BibDatabase database;
        try {
            database = parser.finalizeDatabase();
        } catch (BibErrorsException e) {
            log.warn("Cross-reference check failed with {} error(s)", e.getErrors().size());
            result.errors(e.getErrors());
            database = parser.snapshot();
        }

        log.info("Loaded {} entries from {} file(s)", database.size(), parsed);
        return result
                .database(database)
                .filesParsed(parsed)
                .warnings(parser.getDiagnostics().getWarnings())
                .build();
    }

    /**
     * Parse every file and finalize, failing if any file had errors.
     *
     * @throws BibErrorsException holding the errors of all files
     */
    public BibDatabase load(List<Path> files) throws IOException {
        BibLoadResult result = loadAll(files);
        if (!result.isSuccess()) {
            throw new BibErrorsException(result.getErrors());
        }
        return result.getDatabase();
    }
}
