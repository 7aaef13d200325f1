package com.bibliography.bibtex.config;

import lombok.Builder;
import lombok.Value;

/**
 * Construction-time configuration for a {@code BibParser}. Fixed for the parser's lifetime.
 */
@Value
@Builder(toBuilder = true)
public class ParserConfig {

    /**
     * Which month macros to seed the macro table with.
     */
    @Builder.Default
    MonthStyle monthStyle = MonthStyle.FULL;

    /**
     * Source name used in diagnostics when text is parsed without a name.
     */
    @Builder.Default
    String defaultSourceName = "<string>";

    public static ParserConfig defaults() {
        return ParserConfig.builder().build();
    }
}
