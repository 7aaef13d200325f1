package com.bibliography.bibtex.diagnostics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps character offsets of one source text to {@link SourcePosition}s.
 */
public class PositionResolver {

    private final String sourceName;
    private final int[] lineStarts;
    private final ParseDiagnostics diagnostics;

    public PositionResolver(String sourceName, String text, ParseDiagnostics diagnostics) {
        this.sourceName = sourceName;
        this.diagnostics = diagnostics;
        this.lineStarts = computeLineStarts(text);
    }

    public SourcePosition resolve(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        if (index < 0) {
            index = -index - 2;
        }
        int column = offset - lineStarts[index] + 1;
        return new SourcePosition(sourceName, index + 1, column, offset, diagnostics);
    }

    public String getSourceName() {
        return sourceName;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
