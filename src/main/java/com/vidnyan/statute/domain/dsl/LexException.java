package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;

/**
 * Unrecognized input while tokenizing.
 */
public class LexException extends StatuteSyntaxException {

    private final char unexpectedChar;

    public LexException(char unexpectedChar, SourceSpan position, String message) {
        super(position, message);
        this.unexpectedChar = unexpectedChar;
    }

    public char getUnexpectedChar() {
        return unexpectedChar;
    }

    public SourceSpan getPosition() {
        return getSpan();
    }
}
