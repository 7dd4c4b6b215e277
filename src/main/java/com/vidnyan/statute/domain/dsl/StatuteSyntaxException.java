package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;

/**
 * Base type for errors raised while reading statute source text.
 * Messages are prefixed with {@code line:column}.
 */
public class StatuteSyntaxException extends RuntimeException {

    private final SourceSpan span;
    private final String detail;

    public StatuteSyntaxException(SourceSpan span, String detail) {
        super(span.format() + ": " + detail);
        this.span = span;
        this.detail = detail;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Message without the position prefix.
     */
    public String getDetail() {
        return detail;
    }
}
