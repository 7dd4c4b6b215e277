package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatuteLexerTest {

    private static List<TokenType> types(String source) {
        return StatuteLexer.tokenize(source).stream().map(SpannedToken::type).toList();
    }

    @Nested
    @DisplayName("Tokens")
    class Tokens {

        @Test
        void tokenize_ShouldRecognizeStatuteHeader() {
            List<TokenType> types = types("STATUTE VOTE-1: \"Right to vote\" {");

            assertEquals(List.of(TokenType.STATUTE, TokenType.IDENT, TokenType.COLON, TokenType.STRING,
                    TokenType.LBRACE, TokenType.EOF), types);
        }

        @Test
        void tokenize_ShouldAlwaysEndWithEof() {
            List<SpannedToken> tokens = StatuteLexer.tokenize("");

            assertEquals(1, tokens.size());
            assertEquals(TokenType.EOF, tokens.get(0).type());
        }

        @Test
        void tokenize_ShouldTreatLowercaseKeywordAsIdentifier() {
            assertEquals(List.of(TokenType.IDENT, TokenType.EOF), types("when"));
        }

        @Test
        void tokenize_ShouldReadAllOperators() {
            List<SpannedToken> tokens = StatuteLexer.tokenize("= == != <> < <= > >= ≠ ≤ ≥");

            List<String> texts = tokens.stream()
                    .filter(t -> t.is(TokenType.OPERATOR))
                    .map(SpannedToken::text)
                    .toList();
            assertEquals(List.of("=", "==", "!=", "<>", "<", "<=", ">", ">=", "≠", "≤", "≥"), texts);
        }

        @Test
        void tokenize_ShouldDistinguishDatesFromNumbers() {
            List<SpannedToken> tokens = StatuteLexer.tokenize("2024-01-31 2024 -5 3.5");

            assertEquals(TokenType.DATE_LITERAL, tokens.get(0).type());
            assertEquals("2024-01-31", tokens.get(0).text());
            assertEquals(TokenType.NUMBER, tokens.get(1).type());
            assertEquals("-5", tokens.get(2).text());
            assertEquals("3.5", tokens.get(3).text());
        }

        @Test
        void tokenize_ShouldDecodeStringEscapes() {
            SpannedToken token = StatuteLexer.tokenize("\"a \\\"quoted\\\" \\\\ line\\nnext\\ttab\"").get(0);

            assertEquals("a \"quoted\" \\ line\nnext\ttab", token.text());
        }

        @Test
        void tokenize_ShouldSkipComments() {
            String source = """
                    // leading comment
                    WHEN /* inline
                       block */ THEN
                    """;

            assertEquals(List.of(TokenType.WHEN, TokenType.THEN, TokenType.EOF), types(source));
        }
    }

    @Nested
    @DisplayName("Spans")
    class Spans {

        @Test
        void tokenize_ShouldTrackLineAndColumn() {
            List<SpannedToken> tokens = StatuteLexer.tokenize("WHEN\n  AGE >= 18");

            assertEquals(SourceSpan.at(1, 1), tokens.get(0).span());
            assertEquals(SourceSpan.at(2, 3), tokens.get(1).span());
            assertEquals(SourceSpan.at(2, 7), tokens.get(2).span());
            assertEquals(SourceSpan.at(2, 10), tokens.get(3).span());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void tokenize_ShouldRejectUnknownCharacter() {
            LexException e = assertThrows(LexException.class, () -> StatuteLexer.tokenize("WHEN\n  AGE # 3"));

            assertEquals('#', e.getUnexpectedChar());
            assertEquals(SourceSpan.at(2, 7), e.getPosition());
            assertTrue(e.getMessage().startsWith("2:7:"));
        }

        @Test
        void tokenize_ShouldRejectLoneBang() {
            LexException e = assertThrows(LexException.class, () -> StatuteLexer.tokenize("AGE ! 3"));

            assertEquals('!', e.getUnexpectedChar());
        }

        @Test
        void tokenize_ShouldRejectUnterminatedString() {
            assertThrows(LexException.class, () -> StatuteLexer.tokenize("\"open"));
        }

        @Test
        void tokenize_ShouldRejectInvalidEscape() {
            LexException e = assertThrows(LexException.class, () -> StatuteLexer.tokenize("\"bad \\q\""));

            assertEquals('q', e.getUnexpectedChar());
        }

        @Test
        void tokenize_ShouldRejectUnterminatedBlockComment() {
            assertThrows(LexException.class, () -> StatuteLexer.tokenize("WHEN /* never closed"));
        }

        @Test
        void tokenize_ShouldRejectImpossibleDate() {
            assertThrows(LexException.class, () -> StatuteLexer.tokenize("2024-02-30"));
        }
    }
}
