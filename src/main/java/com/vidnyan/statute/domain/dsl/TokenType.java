package com.vidnyan.statute.domain.dsl;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Token kinds produced by {@link StatuteLexer}.
 */
public enum TokenType {
    // keywords
    STATUTE(true), WHEN(true), THEN(true), AND(true), OR(true), NOT(true),
    EXCEPTION(true), DISCRETION(true), AMENDMENT(true), SUPERSEDES(true),
    JURISDICTION(true), VERSION(true), EFFECTIVE_DATE(true), EXPIRY_DATE(true),
    GRANT(true), REVOKE(true), OBLIGATION(true), PROHIBITION(true),
    BETWEEN(true), IN(true), LIKE(true), HAS(true),
    AGE(true), INCOME(true), DATE(true), REGION(true),
    IMPORT(true), AS(true),

    // literals
    IDENT(false), STRING(false), NUMBER(false), DATE_LITERAL(false),

    // punctuation
    OPERATOR(false), LBRACE(false), RBRACE(false), LPAREN(false), RPAREN(false),
    COMMA(false), COLON(false),

    EOF(false);

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        for (TokenType type : values()) {
            if (type.keyword) {
                keywords.put(type.name(), type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final boolean keyword;

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Look up a keyword by its exact (upper-case) spelling.
     */
    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }

    public static Set<TokenType> effectKinds() {
        return EnumSet.of(GRANT, REVOKE, OBLIGATION, PROHIBITION, DISCRETION);
    }

    /**
     * Human-readable name used in diagnostics.
     */
    public String displayName() {
        if (keyword) {
            return name();
        }
        return switch (this) {
            case IDENT -> "identifier";
            case STRING -> "string";
            case NUMBER -> "number";
            case DATE_LITERAL -> "date";
            case OPERATOR -> "comparison operator";
            case LBRACE -> "'{'";
            case RBRACE -> "'}'";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            case COMMA -> "','";
            case COLON -> "':'";
            default -> "end of input";
        };
    }
}
