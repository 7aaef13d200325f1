package com.bibliography.bibtex.diagnostics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ErrorCollector and the bundled error it raises.
 */
class ErrorCollectorTest {

    private static final SourcePosition POS = new SourcePosition("refs.bib", 1, 1, 0);

    @Test
    void testCollectsInputErrorsAndContinues() {
        ErrorCollector collector = new ErrorCollector();

        boolean first = collector.run(() -> {
            throw POS.error("first");
        });
        boolean second = collector.run(() -> { });
        boolean third = collector.run(() -> {
            throw POS.error("third");
        });

        assertThat(first).isFalse();
        assertThat(second).isTrue();
        assertThat(third).isFalse();
        assertThat(collector.getErrors()).extracting(BibInputException::getDetail)
                .containsExactly("first", "third");
    }

    @Test
    void testRethrowBundlesErrors() {
        ErrorCollector collector = new ErrorCollector();
        collector.add(POS.error("one"));
        collector.add(POS.error("two"));

        assertThatThrownBy(collector::rethrow)
                .isInstanceOfSatisfying(BibErrorsException.class, e -> {
                    assertThat(e.getErrors()).hasSize(2);
                    assertThat(e).hasMessage("refs.bib:1:1: one" + System.lineSeparator() + "refs.bib:1:1: two");
                });
    }

    @Test
    void testRethrowWithoutErrorsDoesNothing() {
        ErrorCollector collector = new ErrorCollector();
        collector.run(() -> { });

        assertThatCode(collector::rethrow).doesNotThrowAnyException();
        assertThat(collector.hasErrors()).isFalse();
    }

    @Test
    void testOtherExceptionsPropagate() {
        ErrorCollector collector = new ErrorCollector();

        assertThatThrownBy(() -> collector.run(() -> {
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(collector.hasErrors()).isFalse();
    }
}
