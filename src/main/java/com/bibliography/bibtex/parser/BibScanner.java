package com.bibliography.bibtex.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.bibliography.bibtex.diagnostics.BibInputException;
import com.bibliography.bibtex.diagnostics.ParseDiagnostics;
import com.bibliography.bibtex.diagnostics.PositionResolver;
import com.bibliography.bibtex.diagnostics.SourcePosition;

/**
 * Cursor over the text of one .bib source, with the token-level primitives the grammar
 * is built from. These are the only methods that touch the text directly.
 *
 * <p>Only space, tab and newline count as white space.
 */
public class BibScanner {

    /**
     * Printable ASCII except space, tab and {@code "#%'(),={}}; the first character
     * may not be a digit.
     */
    public static final Pattern IDENTIFIER =
            Pattern.compile("(?![0-9])(?:(?![ \\t\"#%'(),={}])[\\x20-\\x7f])+");

    private static final Pattern SPACE = Pattern.compile("[ \\t\\n]*");
    private static final Pattern TRAILING_SPACE =
            Pattern.compile("[ \\t]+$", Pattern.MULTILINE | Pattern.UNIX_LINES);

    private final String source;
    private final PositionResolver positions;
    private int pos = 0;

    public BibScanner(String text, String sourceName, ParseDiagnostics diagnostics) {
        this.source = stripTrailingSpace(text);
        this.positions = new PositionResolver(sourceName, source, diagnostics);
    }

    /**
     * Remove runs of spaces and tabs at the end of every line, as BibTeX does when it
     * reads input lines.
     */
    public static String stripTrailingSpace(String text) {
        return TRAILING_SPACE.matcher(text).replaceAll("");
    }

    public boolean atEnd() {
        return pos >= source.length();
    }

    public int offset() {
        return pos;
    }

    /**
     * The text being scanned, after trailing white space was stripped from each line.
     */
    public String getSource() {
        return source;
    }

    public String getSourceName() {
        return positions.getSourceName();
    }

    /**
     * Match a token at the cursor and skip the white space after it.
     *
     * @return the matched text, or null if the token is not at the cursor
     */
    public String tryToken(Pattern token) {
        return tryToken(token, true);
    }

    /**
     * Match a token at the cursor. On a match the cursor moves past it and, if
     * {@code skipSpace} is set, past the white space after it.
     *
     * @return the matched text, or null if the token is not at the cursor
     */
    public String tryToken(Pattern token, boolean skipSpace) {
        Matcher matcher = token.matcher(source);
        matcher.region(pos, source.length());
        if (!matcher.lookingAt()) {
            return null;
        }
        pos = matcher.end();
        if (skipSpace) {
            skipSpace();
        }
        return matcher.group();
    }

    /**
     * Match a token at the cursor or fail with the given message.
     */
    public String token(Pattern token, String failMessage) {
        String text = tryToken(token);
        if (text == null) {
            throw error(failMessage);
        }
        return text;
    }

    /**
     * Scan brace-balanced text up to {@code terminator} at nesting level zero, starting
     * just after the opening delimiter. Returns the text before the terminator and
     * leaves the cursor after the terminator and any following white space.
     */
    public String scanBalancedText(char terminator) {
        int start = pos;
        int level = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (level == 0 && c == terminator) {
                String text = source.substring(start, pos);
                pos++;
                skipSpace();
                return text;
            } else if (c == '{') {
                level++;
            } else if (c == '}') {
                level--;
                if (level < 0) {
                    throw error("unexpected }");
                }
            }
            pos++;
        }
        throw error("unterminated string");
    }

    public void skipSpace() {
        Matcher matcher = SPACE.matcher(source);
        matcher.region(pos, source.length());
        matcher.lookingAt();
        pos = matcher.end();
    }

    public SourcePosition positionAt(int offset) {
        return positions.resolve(offset);
    }

    public SourcePosition position() {
        return positionAt(pos);
    }

    /**
     * A hard error at the cursor. Callers throw the result.
     */
    public BibInputException error(String message) {
        return position().error(message);
    }

    public void warn(String message) {
        position().warn(message);
    }

    public void warn(String message, int offset) {
        positionAt(offset).warn(message);
    }
}
