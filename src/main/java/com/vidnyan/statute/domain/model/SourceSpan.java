package com.vidnyan.statute.domain.model;

/**
 * Position in statute source text. Lines and columns are 1-based.
 */
public record SourceSpan(
    int line,
    int column
) {

    public static final SourceSpan UNKNOWN = new SourceSpan(0, 0);

    /**
     * Create a span at the given position.
     */
    public static SourceSpan at(int line, int column) {
        return new SourceSpan(line, column);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return line + ":" + column;
    }
}
