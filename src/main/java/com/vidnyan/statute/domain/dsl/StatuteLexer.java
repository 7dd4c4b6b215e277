package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for statute DSL source.
 * The returned list always ends with an {@link TokenType#EOF} token.
 * Any input it cannot classify raises {@link LexException}.
 */
public final class StatuteLexer {

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    private StatuteLexer(String source) {
        this.source = source;
    }

    public static List<SpannedToken> tokenize(String source) {
        return new StatuteLexer(source).run();
    }

    private List<SpannedToken> run() {
        List<SpannedToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (atEnd()) {
                tokens.add(new SpannedToken(TokenType.EOF, "", SourceSpan.at(line, column)));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private SpannedToken nextToken() {
        SourceSpan start = SourceSpan.at(line, column);
        char c = peek();

        if (c == '"') {
            return new SpannedToken(TokenType.STRING, readString(start), start);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekAt(1)))) {
            return readNumberOrDate(start);
        }
        if (Character.isLetter(c) || c == '_') {
            String word = readIdentifier();
            TokenType type = TokenType.keyword(word).orElse(TokenType.IDENT);
            return new SpannedToken(type, word, start);
        }

        switch (c) {
            case '{': advance(); return new SpannedToken(TokenType.LBRACE, "{", start);
            case '}': advance(); return new SpannedToken(TokenType.RBRACE, "}", start);
            case '(': advance(); return new SpannedToken(TokenType.LPAREN, "(", start);
            case ')': advance(); return new SpannedToken(TokenType.RPAREN, ")", start);
            case ',': advance(); return new SpannedToken(TokenType.COMMA, ",", start);
            case ':': advance(); return new SpannedToken(TokenType.COLON, ":", start);
            case '≠':
            case '≤':
            case '≥':
                advance();
                return new SpannedToken(TokenType.OPERATOR, String.valueOf(c), start);
            case '=':
                advance();
                if (peek() == '=') {
                    advance();
                    return new SpannedToken(TokenType.OPERATOR, "==", start);
                }
                return new SpannedToken(TokenType.OPERATOR, "=", start);
            case '!':
                advance();
                if (peek() == '=') {
                    advance();
                    return new SpannedToken(TokenType.OPERATOR, "!=", start);
                }
                throw new LexException('!', start, "unexpected character '!' (did you mean '!='?)");
            case '<':
                advance();
                if (peek() == '=') {
                    advance();
                    return new SpannedToken(TokenType.OPERATOR, "<=", start);
                }
                if (peek() == '>') {
                    advance();
                    return new SpannedToken(TokenType.OPERATOR, "<>", start);
                }
                return new SpannedToken(TokenType.OPERATOR, "<", start);
            case '>':
                advance();
                if (peek() == '=') {
                    advance();
                    return new SpannedToken(TokenType.OPERATOR, ">=", start);
                }
                return new SpannedToken(TokenType.OPERATOR, ">", start);
            default:
                throw new LexException(c, start, "unexpected character '" + c + "'");
        }
    }

    private void skipWhitespaceAndComments() {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (!atEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                SourceSpan start = SourceSpan.at(line, column);
                advance();
                advance();
                while (!(peek() == '*' && peekAt(1) == '/')) {
                    if (atEnd()) {
                        throw new LexException('/', start, "unterminated block comment");
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private String readString(SourceSpan start) {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw new LexException('"', start, "unterminated string literal");
            }
            char c = advance();
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                if (atEnd()) {
                    throw new LexException('\\', start, "unterminated string literal");
                }
                SourceSpan escapeAt = SourceSpan.at(line, column);
                char escaped = advance();
                switch (escaped) {
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    default:
                        throw new LexException(escaped, escapeAt, "invalid escape sequence '\\" + escaped + "'");
                }
            } else {
                sb.append(c);
            }
        }
    }

    private SpannedToken readNumberOrDate(SourceSpan start) {
        StringBuilder sb = new StringBuilder();
        if (peek() == '-') {
            sb.append(advance());
        }
        readDigits(sb);

        // YYYY-MM-DD
        if (sb.length() == 4 && sb.charAt(0) != '-' && peek() == '-'
                && isDigit(peekAt(1)) && isDigit(peekAt(2)) && peekAt(3) == '-'
                && isDigit(peekAt(4)) && isDigit(peekAt(5))) {
            for (int i = 0; i < 6; i++) {
                sb.append(advance());
            }
            String text = sb.toString();
            try {
                LocalDate.parse(text);
            } catch (DateTimeException e) {
                throw new LexException(text.charAt(0), start, "invalid date '" + text + "'");
            }
            return new SpannedToken(TokenType.DATE_LITERAL, text, start);
        }

        if (peek() == '.' && isDigit(peekAt(1))) {
            sb.append(advance());
            readDigits(sb);
        }
        if (Character.isLetter(peek()) || peek() == '_') {
            throw new LexException(peek(), SourceSpan.at(line, column),
                    "unexpected character '" + peek() + "' in number");
        }
        return new SpannedToken(TokenType.NUMBER, sb.toString(), start);
    }

    private void readDigits(StringBuilder sb) {
        while (isDigit(peek())) {
            sb.append(advance());
        }
    }

    private String readIdentifier() {
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = peek();
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
                sb.append(advance());
            } else {
                break;
            }
        }
        return sb.toString();
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
