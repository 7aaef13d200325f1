package com.bibliography.bibtex.diagnostics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for offset to line/column resolution and position-tagged diagnostics.
 */
class PositionResolverTest {

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();
    private final PositionResolver resolver = new PositionResolver("refs.bib", "ab\ncd\n\nef", diagnostics);

    @ParameterizedTest
    @CsvSource({
            "0, 1, 1",
            "1, 1, 2",
            "2, 1, 3",
            "3, 2, 1",
            "4, 2, 2",
            "6, 3, 1",
            "7, 4, 1",
            "9, 4, 3"
    })
    void testResolve(int offset, int line, int column) {
        SourcePosition pos = resolver.resolve(offset);

        assertThat(pos.getLine()).isEqualTo(line);
        assertThat(pos.getColumn()).isEqualTo(column);
        assertThat(pos.getOffset()).isEqualTo(offset);
        assertThat(pos.getSourceName()).isEqualTo("refs.bib");
    }

    @Test
    void testResolveEmptyText() {
        SourcePosition pos = new PositionResolver("empty.bib", "", null).resolve(0);

        assertThat(pos).hasToString("empty.bib:1:1");
    }

    @Test
    void testWarningReachesDiagnostics() {
        resolver.resolve(4).warn("something odd");

        assertThat(diagnostics.getWarnings()).containsExactly("refs.bib:2:2: something odd");
        assertThat(diagnostics.hasWarnings()).isTrue();
    }

    @Test
    void testErrorCarriesPosition() {
        BibInputException error = resolver.resolve(3).error("bad thing");

        assertThat(error).hasMessage("refs.bib:2:1: bad thing");
        assertThat(error.getDetail()).isEqualTo("bad thing");
        assertThat(error.getPosition()).isEqualTo(new SourcePosition("refs.bib", 2, 1, 3));
    }

    @Test
    void testErrorWithoutPosition() {
        BibInputException error = new BibInputException(null, "no position");

        assertThat(error).hasMessage("no position");
        assertThat(error.getPosition()).isNull();
    }
}
