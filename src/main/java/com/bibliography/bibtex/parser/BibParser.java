package com.bibliography.bibtex.parser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bibliography.bibtex.config.ParserConfig;
import com.bibliography.bibtex.diagnostics.BibErrorsException;
import com.bibliography.bibtex.diagnostics.BibInputException;
import com.bibliography.bibtex.diagnostics.ErrorCollector;
import com.bibliography.bibtex.diagnostics.ParseDiagnostics;
import com.bibliography.bibtex.diagnostics.SourcePosition;
import com.bibliography.bibtex.model.BibDatabase;
import com.bibliography.bibtex.model.BibEntry;

/**
 * Parser for .bib BibTeX database files.
 *
 * Follows the database-reading rules of BibTeX itself, including its quirks:
 * - text outside of {@code @} commands is ignored, and so is the body of {@code @comment}
 * - {@code @string} defines macros usable by later values, in this and later sources
 * - {@code @preamble} values are scanned and discarded
 * - field values are concatenations of numbers, braced or quoted strings and macro names
 *
 * An error aborts only the command or entry it occurs in; parsing resumes at the next
 * {@code @}. The errors of one {@link #parse} call are raised together when it ends.
 *
 * The parser is a session: {@link #parse} may be called several times, each call adding
 * to the same macro table and entries, and {@link #finalizeDatabase()} then checks
 * cross-references and returns the database. Not thread-safe.
 */
public class BibParser {
    private static final Logger log = LoggerFactory.getLogger(BibParser.class);

    private static final Pattern SKIP_TO_COMMAND = Pattern.compile("[^@]*");
    private static final Pattern AT = Pattern.compile("@");
    private static final Pattern OPEN = Pattern.compile("[{(]");
    private static final Pattern CLOSE_BRACE = Pattern.compile("\\}");
    private static final Pattern CLOSE_PAREN = Pattern.compile("\\)");
    private static final Pattern EQUALS = Pattern.compile("=");
    private static final Pattern COMMA = Pattern.compile(",");
    private static final Pattern CONCAT = Pattern.compile("#");
    private static final Pattern NUMBER = Pattern.compile("[0-9]+");
    private static final Pattern OPEN_BRACE = Pattern.compile("\\{");
    private static final Pattern QUOTE = Pattern.compile("\"");
    // Keys may be empty and, in parenthesized entries, may contain ')'
    private static final Pattern PAREN_KEY = Pattern.compile("[^, \\t\\n]*");
    private static final Pattern BRACE_KEY = Pattern.compile("[^, \\t}\\n]*");
    private static final Pattern WHITE_SPACE = Pattern.compile("[ \\t\\n]+");
    private static final Pattern LINE_ENDING = Pattern.compile("\\r\\n?");

    private final ParserConfig config;
    private final Map<String, String> macros = new HashMap<>();
    private final Map<String, BibEntry> entries = new LinkedHashMap<>();
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();
    private boolean finalized;

    public BibParser() {
        this(ParserConfig.defaults());
    }

    public BibParser(ParserConfig config) {
        this.config = config;
        this.macros.putAll(config.getMonthStyle().getMacros());
    }

    /**
     * Declare a macro, just like an {@code @string} command. Redefinition is allowed.
     */
    public BibParser declareString(String name, String value) {
        macros.put(name.toLowerCase(Locale.ROOT), value);
        return this;
    }

    public BibParser parse(String text) {
        return parse(text, config.getDefaultSourceName());
    }

    public BibParser parse(Path path) throws IOException {
        log.info("Parsing bib file: {}", path);
        return parse(normalizeLineEndings(Files.readString(path, StandardCharsets.UTF_8)), path.toString());
    }

    public BibParser parse(Reader reader, String name) throws IOException {
        StringWriter text = new StringWriter();
        reader.transferTo(text);
        return parse(normalizeLineEndings(text.toString()), name);
    }

    /**
     * Parse one source into this session. Macros and entries from earlier calls are
     * visible, so later sources may use strings defined in earlier ones.
     *
     * @param text the .bib text
     * @param name the source name used in diagnostics
     * @return this parser
     * @throws BibErrorsException if the source had errors; every construct that parsed
     *                            cleanly, before or after an error, is still kept
     */
    public BibParser parse(String text, String name) {
        if (finalized) {
            throw new IllegalStateException("Parser already finalized");
        }
        BibScanner in = new BibScanner(text, name != null ? name : config.getDefaultSourceName(), diagnostics);

        ErrorCollector collector = new ErrorCollector();
        while (!in.atEnd()) {
            collector.run(() -> scanCommandOrEntry(in));
        }
        if (collector.hasErrors()) {
            diagnostics.addErrors(collector.getErrors());
            log.debug("{}: {} error(s)", in.getSourceName(), collector.getErrors().size());
        }
        collector.rethrow();
        return this;
    }

    /**
     * Check cross-references and return the database.
     *
     * @return the entries parsed so far, keyed by lower-cased key, in parse order
     * @throws BibErrorsException if any entry cross-references a key not in the database
     */
    public BibDatabase finalizeDatabase() {
        finalized = true;
        ErrorCollector collector = new ErrorCollector();
        for (BibEntry entry : entries.values()) {
            String crossref = entry.getFields().get(BibEntry.CROSSREF);
            if (crossref != null && !entries.containsKey(crossref.toLowerCase(Locale.ROOT))) {
                collector.add(new BibInputException(entry.getPosition(), "unknown crossref `" + crossref + "'"));
            }
        }
        if (collector.hasErrors()) {
            diagnostics.addErrors(collector.getErrors());
        }
        collector.rethrow();
        return snapshot();
    }

    /**
     * The entries parsed so far, without cross-reference checks.
     */
    public BibDatabase snapshot() {
        return new BibDatabase(entries);
    }

    public Map<String, String> getMacros() {
        return Collections.unmodifiableMap(macros);
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Text read from files and readers gets {@code \r\n} and lone {@code \r} turned
     * into {@code \n}. Strings passed to {@link #parse(String)} are scanned as given.
     */
    static String normalizeLineEndings(String text) {
        return LINE_ENDING.matcher(text).replaceAll("\n");
    }

    // Productions

    private void scanCommandOrEntry(BibScanner in) {
        // Everything up to the next @ is ignored, including @comment bodies
        in.tryToken(SKIP_TO_COMMAND);
        SourcePosition pos = in.position();
        if (in.tryToken(AT) == null) {
            return;
        }

        String type = scanIdentifier(in).toLowerCase(Locale.ROOT);

        // BibTeX treats what follows @comment like any other text between entries
        if (type.equals("comment")) {
            return;
        }

        boolean paren = in.token(OPEN, "expected { or ( after entry type").equals("(");
        Pattern close = paren ? CLOSE_PAREN : CLOSE_BRACE;
        String right = paren ? ")" : "}";

        if (type.equals("preamble")) {
            scanFieldValue(in);
            in.token(close, "expected " + right);
            log.debug("Skipped preamble at {}", pos);
            return;
        }

        if (type.equals("string")) {
            scanString(in, close, right);
            return;
        }

        scanEntry(in, type, pos, paren, close, right);
    }

    private void scanString(BibScanner in, Pattern close, String right) {
        String name = scanIdentifier(in).toLowerCase(Locale.ROOT);
        if (macros.containsKey(name)) {
            in.warn("macro `" + name + "' redefined");
        }
        in.token(EQUALS, "expected = after string name");
        String value = scanFieldValue(in);
        in.token(close, "expected " + right);
        macros.put(name, value);
        log.debug("Defined macro {}", name);
    }

    private void scanEntry(BibScanner in, String type, SourcePosition pos,
                           boolean paren, Pattern close, String right) {
        String key = in.tryToken(paren ? PAREN_KEY : BRACE_KEY);

        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, SourcePosition> fieldPositions = new HashMap<>();
        while (true) {
            if (in.tryToken(close) != null) {
                break;
            }
            in.token(COMMA, "expected " + right + " or ,");
            // Trailing comma
            if (in.tryToken(close) != null) {
                break;
            }

            int fieldOffset = in.offset();
            String field = scanIdentifier(in).toLowerCase(Locale.ROOT);
            in.token(EQUALS, "expected = after field name");
            String value = scanFieldValue(in);

            // A repeated field keeps its first slot and takes the last value
            fields.put(field, value);
            fieldPositions.put(field, in.positionAt(fieldOffset));
        }

        String lowerKey = key.toLowerCase(Locale.ROOT);
        if (entries.containsKey(lowerKey)) {
            throw in.error("repeated entry");
        }
        entries.put(lowerKey, new BibEntry(type, key, pos, fields, fieldPositions));
        log.debug("Parsed {} entry {} at {}", type, key, pos);
    }

    private String scanIdentifier(BibScanner in) {
        return in.token(BibScanner.IDENTIFIER, "expected identifier");
    }

    private String scanFieldValue(BibScanner in) {
        StringBuilder value = new StringBuilder(scanFieldPiece(in));
        while (in.tryToken(CONCAT) != null) {
            value.append(scanFieldPiece(in));
        }
        // BibTeX compresses white space as it goes; the end result is the same
        String compressed = WHITE_SPACE.matcher(value).replaceAll(" ");
        return stripSpaces(compressed);
    }

    private String scanFieldPiece(BibScanner in) {
        String piece = in.tryToken(NUMBER);
        if (piece != null) {
            return piece;
        }
        if (in.tryToken(OPEN_BRACE, false) != null) {
            return in.scanBalancedText('}');
        }
        if (in.tryToken(QUOTE, false) != null) {
            return in.scanBalancedText('"');
        }
        int macroOffset = in.offset();
        String name = in.tryToken(BibScanner.IDENTIFIER);
        if (name != null) {
            String value = macros.get(name.toLowerCase(Locale.ROOT));
            if (value == null) {
                in.warn("unknown macro `" + name + "'", macroOffset);
                return "";
            }
            return value;
        }
        throw in.error("expected string, number, or macro name");
    }

    /**
     * Strip leading and trailing spaces only; tabs and newlines are kept.
     */
    static String stripSpaces(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == ' ') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == ' ') {
            end--;
        }
        return value.substring(start, end);
    }
}
