package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;

/**
 * Lexed token with its source text and position.
 */
public record SpannedToken(
    TokenType type,
    String text,
    SourceSpan span
) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Form used in "found ..." diagnostics.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
