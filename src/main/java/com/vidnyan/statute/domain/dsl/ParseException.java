package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Token stream does not match the statute grammar.
 */
public class ParseException extends StatuteSyntaxException {

    private final List<String> expected;
    private final String found;
    private final String suggestion;

    public ParseException(List<String> expected, String found, SourceSpan span, String suggestion) {
        super(span, buildMessage(expected, found, suggestion));
        this.expected = List.copyOf(expected);
        this.found = found;
        this.suggestion = suggestion;
    }

    /**
     * Semantic error at a position, with no expected-token set.
     */
    public static ParseException semantic(String message, SourceSpan span) {
        return new ParseException(List.of(), message, span, null);
    }

    public List<String> getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public Optional<String> getSuggestion() {
        return Optional.ofNullable(suggestion);
    }

    private static String buildMessage(List<String> expected, String found, String suggestion) {
        if (expected.isEmpty()) {
            return found;
        }
        StringBuilder sb = new StringBuilder("expected ");
        sb.append(expected.size() == 1 ? expected.get(0) : "one of " + String.join(", ", expected));
        sb.append(", found ").append(found);
        if (suggestion != null) {
            sb.append(" (did you mean ").append(suggestion).append("?)");
        }
        return sb.toString();
    }
}
