package com.bibliography.bibtex.parser;

import com.bibliography.bibtex.diagnostics.BibInputException;
import com.bibliography.bibtex.diagnostics.ParseDiagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the BibScanner token primitives.
 */
class BibScannerTest {

    private static final Pattern ABC = Pattern.compile("abc");

    @Test
    void testTryTokenSkipsSpaceTabAndNewline() {
        BibScanner scanner = scanner("abc\n \t x");

        assertThat(scanner.tryToken(ABC)).isEqualTo("abc");
        assertThat(scanner.offset()).isEqualTo(7);
    }

    @Test
    void testTryTokenDoesNotSkipOtherWhitespace() {
        BibScanner scanner = scanner("abc\u00a0x");

        assertThat(scanner.tryToken(ABC)).isEqualTo("abc");
        assertThat(scanner.offset()).isEqualTo(3);
    }

    @Test
    void testTryTokenWithoutSkippingSpace() {
        BibScanner scanner = scanner("abc  x");

        assertThat(scanner.tryToken(ABC, false)).isEqualTo("abc");
        assertThat(scanner.offset()).isEqualTo(3);
    }

    @Test
    void testTryTokenNoMatchLeavesCursor() {
        BibScanner scanner = scanner("  abc");

        assertThat(scanner.tryToken(ABC)).isNull();
        assertThat(scanner.offset()).isZero();
    }

    @Test
    void testTokenFailsWithMessage() {
        BibScanner scanner = scanner("xyz");

        assertThatThrownBy(() -> scanner.token(ABC, "expected abc"))
                .isInstanceOfSatisfying(BibInputException.class, e -> {
                    assertThat(e.getDetail()).isEqualTo("expected abc");
                    assertThat(e.getPosition().getLine()).isEqualTo(1);
                    assertThat(e.getPosition().getColumn()).isEqualTo(1);
                });
    }

    @Test
    void testBalancedTextKeepsInnerBraces() {
        BibScanner scanner = scanner("a{b}c} rest");

        assertThat(scanner.scanBalancedText('}')).isEqualTo("a{b}c");
        assertThat(scanner.getSource().substring(scanner.offset())).isEqualTo("rest");
    }

    @Test
    void testQuoteTerminatorOnlyAtLevelZero() {
        BibScanner scanner = scanner("a{\"}\" x");

        assertThat(scanner.scanBalancedText('"')).isEqualTo("a{\"}");
    }

    @Test
    void testUnexpectedCloseBrace() {
        BibScanner scanner = scanner("a}b\"");

        assertThatThrownBy(() -> scanner.scanBalancedText('"'))
                .isInstanceOfSatisfying(BibInputException.class, e -> {
                    assertThat(e.getDetail()).isEqualTo("unexpected }");
                    assertThat(e.getPosition().getColumn()).isEqualTo(2);
                });
    }

    @Test
    void testUnterminatedString() {
        BibScanner scanner = scanner("{abc}");

        assertThatThrownBy(() -> scanner.scanBalancedText('}'))
                .isInstanceOf(BibInputException.class)
                .hasMessageContaining("unterminated string");
    }

    @Test
    void testStripTrailingSpacePerLine() {
        assertThat(BibScanner.stripTrailingSpace("a \t\nb  \n\tc\t")).isEqualTo("a\nb\n\tc");
    }

    @Test
    void testStripTrailingSpaceOnlyBreaksOnNewline() {
        assertThat(BibScanner.stripTrailingSpace("a \r\nb")).isEqualTo("a \r\nb");
    }

    @Test
    void testScannerWorksOnStrippedSource() {
        BibScanner scanner = scanner("abc   \nx");

        assertThat(scanner.getSource()).isEqualTo("abc\nx");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "foo-bar:baz|foo-bar:baz",
            "key=value|key",
            "a'b|a",
            "name{x}|name",
            "x#y|x",
            "pre%post|pre",
            "author and|author"
    })
    void testIdentifierCharacters(String input, String expected) {
        assertThat(scanner(input).tryToken(BibScanner.IDENTIFIER)).isEqualTo(expected);
    }

    @Test
    void testIdentifierMayNotStartWithDigit() {
        assertThat(scanner("1abc").tryToken(BibScanner.IDENTIFIER)).isNull();
        assertThat(scanner("a1bc").tryToken(BibScanner.IDENTIFIER)).isEqualTo("a1bc");
    }

    @Test
    void testIdentifierExcludesNonAscii() {
        assertThat(scanner("caf\u00e9").tryToken(BibScanner.IDENTIFIER)).isEqualTo("caf");
    }

    private static BibScanner scanner(String text) {
        return new BibScanner(text, "test.bib", new ParseDiagnostics());
    }
}
