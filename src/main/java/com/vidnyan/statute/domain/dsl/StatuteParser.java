package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.EffectKind;
import com.vidnyan.statute.domain.model.RegionType;
import com.vidnyan.statute.domain.model.SourceSpan;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.model.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser for statute DSL.
 *
 * <pre>
 * unit      := import* statute*
 * import    := IMPORT STRING [AS IDENT]
 * statute   := STATUTE IDENT ':' STRING '{' body '}'
 * body      := metadata* WHEN or_expr THEN effect [EXCEPTION WHEN or_expr] [DISCRETION STRING]
 * or_expr   := and_expr (OR and_expr)*
 * and_expr  := unary (AND unary)*
 * unary     := NOT unary | '(' or_expr ')' | primary
 * </pre>
 *
 * Metadata clauses may appear anywhere in the body, each at most once.
 * Chains of the same connective are flattened; parentheses always produce nesting.
 * Cross-statute references are stored as ids and never resolved here.
 */
public final class StatuteParser {

    private static final List<TokenType> BODY_CLAUSES = List.of(
            TokenType.JURISDICTION, TokenType.VERSION, TokenType.EFFECTIVE_DATE, TokenType.EXPIRY_DATE,
            TokenType.SUPERSEDES, TokenType.AMENDMENT, TokenType.WHEN, TokenType.EXCEPTION,
            TokenType.DISCRETION, TokenType.RBRACE);

    private static final List<TokenType> PRIMARY_STARTS = List.of(
            TokenType.NOT, TokenType.LPAREN, TokenType.AGE, TokenType.INCOME, TokenType.HAS,
            TokenType.DATE, TokenType.REGION, TokenType.IDENT);

    private static final List<TokenType> EFFECT_KINDS = List.of(
            TokenType.GRANT, TokenType.REVOKE, TokenType.OBLIGATION, TokenType.PROHIBITION,
            TokenType.DISCRETION);

    /** Deepest NOT / parenthesis nesting accepted in one condition. */
    public static final int MAX_NESTING = 256;

    private final List<SpannedToken> tokens;
    private int pos;
    private int depth;

    public StatuteParser(List<SpannedToken> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Tokenize and wrap source text.
     */
    public static StatuteParser forSource(String source) {
        return new StatuteParser(StatuteLexer.tokenize(source));
    }

    /**
     * Parse every statute in the source text.
     */
    public static List<Statute> parseStatutes(String source) {
        return forSource(source).parseDocument();
    }

    /**
     * Parse exactly one statute; anything after it is an error.
     */
    public Statute parseStatute() {
        Statute statute = statute();
        expect(TokenType.EOF);
        return statute;
    }

    /**
     * Parse all statutes of the unit. Leading imports are accepted and dropped.
     */
    public List<Statute> parseDocument() {
        return parseCompilationUnit().statutes();
    }

    /**
     * Parse imports and statutes of the unit. Statute ids must be unique within it.
     */
    public StatuteDocument parseCompilationUnit() {
        List<ImportDeclaration> imports = new ArrayList<>();
        while (check(TokenType.IMPORT)) {
            imports.add(importDeclaration());
        }

        List<Statute> statutes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        while (!check(TokenType.EOF)) {
            SourceSpan at = peek().span();
            Statute statute = statute();
            if (!ids.add(statute.id())) {
                throw ParseException.semantic("duplicate statute id '" + statute.id() + "'", at);
            }
            statutes.add(statute);
        }
        return new StatuteDocument(imports, statutes);
    }

    // ---------------------------------------------------------------
    // Statute structure
    // ---------------------------------------------------------------

    private ImportDeclaration importDeclaration() {
        SpannedToken keyword = expect(TokenType.IMPORT);
        String path = expect(TokenType.STRING).text();
        Optional<String> alias = Optional.empty();
        if (match(TokenType.AS)) {
            alias = Optional.of(expect(TokenType.IDENT).text());
        }
        return new ImportDeclaration(path, alias, keyword.span());
    }

    private Statute statute() {
        expect(TokenType.STATUTE);
        String id = expect(TokenType.IDENT).text();
        expect(TokenType.COLON);
        String title = expect(TokenType.STRING).text();
        expect(TokenType.LBRACE);

        Statute.Builder builder = Statute.builder().id(id).title(title);
        Set<TokenType> seen = new HashSet<>();
        LocalDate effective = null;
        LocalDate expiry = null;
        SourceSpan firstDateSpan = null;

        while (!check(TokenType.RBRACE)) {
            SpannedToken clause = peek();
            if (!BODY_CLAUSES.contains(clause.type())) {
                throw unexpected(BODY_CLAUSES);
            }
            if (clause.is(TokenType.EXCEPTION) && !seen.contains(TokenType.WHEN)) {
                throw ParseException.semantic("EXCEPTION clause must follow the WHEN clause", clause.span());
            }
            if (!seen.add(clause.type())) {
                throw ParseException.semantic("duplicate " + clause.type().name() + " clause", clause.span());
            }
            advance();
            switch (clause.type()) {
                case JURISDICTION -> builder.jurisdiction(expect(TokenType.STRING).text());
                case VERSION -> builder.version(version(expect(TokenType.NUMBER)));
                case EFFECTIVE_DATE -> {
                    effective = date(expect(TokenType.DATE_LITERAL));
                    builder.effectiveDate(effective);
                    firstDateSpan = firstDateSpan == null ? clause.span() : firstDateSpan;
                }
                case EXPIRY_DATE -> {
                    expiry = date(expect(TokenType.DATE_LITERAL));
                    builder.expiryDate(expiry);
                    firstDateSpan = firstDateSpan == null ? clause.span() : firstDateSpan;
                }
                case SUPERSEDES -> identifierList().forEach(builder::supersedes);
                case AMENDMENT -> identifierList().forEach(builder::amends);
                case WHEN -> {
                    builder.preconditions(condition());
                    expect(TokenType.THEN);
                    builder.effect(effect());
                }
                case EXCEPTION -> {
                    expect(TokenType.WHEN);
                    builder.exception(condition());
                }
                case DISCRETION -> builder.discretionNote(expect(TokenType.STRING).text());
                default -> throw unexpected(BODY_CLAUSES);
            }
        }

        if (!seen.contains(TokenType.WHEN)) {
            throw unexpected(List.of(TokenType.WHEN));
        }
        expect(TokenType.RBRACE);

        if (effective != null && expiry != null && effective.isAfter(expiry)) {
            throw ParseException.semantic("statute '" + id + "': effective date " + effective
                    + " is after expiry date " + expiry, firstDateSpan);
        }
        return builder.build();
    }

    private static int version(SpannedToken number) {
        long version = integer(number);
        if (version < 1 || version > Integer.MAX_VALUE) {
            throw ParseException.semantic("version must be a positive integer, was " + number.text(),
                    number.span());
        }
        return (int) version;
    }

    private List<String> identifierList() {
        List<String> ids = new ArrayList<>();
        ids.add(expect(TokenType.IDENT).text());
        while (match(TokenType.COMMA)) {
            ids.add(expect(TokenType.IDENT).text());
        }
        return ids;
    }

    private Effect effect() {
        SpannedToken kind = peek();
        if (!EFFECT_KINDS.contains(kind.type())) {
            throw unexpected(EFFECT_KINDS);
        }
        advance();
        String description = expect(TokenType.STRING).text();
        return new Effect(EffectKind.valueOf(kind.type().name()), description);
    }

    // ---------------------------------------------------------------
    // Conditions
    // ---------------------------------------------------------------

    private Condition condition() {
        return orExpr();
    }

    private Condition orExpr() {
        List<Condition> operands = new ArrayList<>();
        operands.add(andExpr());
        while (match(TokenType.OR)) {
            operands.add(andExpr());
        }
        return operands.size() == 1 ? operands.get(0) : new Condition.Or(operands);
    }

    private Condition andExpr() {
        List<Condition> operands = new ArrayList<>();
        operands.add(unary());
        while (match(TokenType.AND)) {
            operands.add(unary());
        }
        return operands.size() == 1 ? operands.get(0) : new Condition.And(operands);
    }

    private Condition unary() {
        if (peek().is(TokenType.NOT) || peek().is(TokenType.LPAREN)) {
            if (depth >= MAX_NESTING) {
                throw ParseException.semantic("condition nested too deeply", peek().span());
            }
            depth++;
            try {
                if (match(TokenType.NOT)) {
                    return new Condition.Not(unary());
                }
                advance();
                Condition inner = orExpr();
                expect(TokenType.RPAREN);
                return inner;
            } finally {
                depth--;
            }
        }
        return primary();
    }

    private Condition primary() {
        SpannedToken head = peek();
        return switch (head.type()) {
            case AGE -> {
                advance();
                yield numericLeaf("age", true);
            }
            case INCOME -> {
                advance();
                yield numericLeaf("income", false);
            }
            case HAS -> {
                advance();
                SpannedToken name = peek();
                if (!name.is(TokenType.IDENT) && !name.is(TokenType.STRING)) {
                    throw unexpected(List.of(TokenType.IDENT, TokenType.STRING));
                }
                advance();
                yield new Condition.HasAttribute(name.text());
            }
            case DATE -> {
                advance();
                ComparisonOp op = comparison();
                yield new Condition.DateCompare(op, date(expect(TokenType.DATE_LITERAL)));
            }
            case REGION -> {
                advance();
                RegionType region = regionType(expect(TokenType.IDENT));
                yield new Condition.Geographic(region, expect(TokenType.STRING).text());
            }
            case IDENT -> attributeLeaf();
            default -> throw unexpected(PRIMARY_STARTS);
        };
    }

    private static RegionType regionType(SpannedToken kind) {
        return RegionType.fromName(kind.text()).orElseThrow(() -> {
            List<String> names = Arrays.stream(RegionType.values())
                    .map(RegionType::attributeKey)
                    .collect(Collectors.toList());
            return new ParseException(names, kind.describe(), kind.span(),
                    Suggestions.closest(kind.text(), names).orElse(null));
        });
    }

    private Condition numericLeaf(String attribute, boolean age) {
        if (match(TokenType.BETWEEN)) {
            return between(attribute);
        }
        ComparisonOp op = comparison();
        long value = integer(expect(TokenType.NUMBER));
        return age ? new Condition.Age(op, value) : new Condition.Income(op, value);
    }

    private Condition attributeLeaf() {
        SpannedToken name = advance();
        if (match(TokenType.BETWEEN)) {
            return between(name.text());
        }
        if (match(TokenType.IN)) {
            expect(TokenType.LPAREN);
            List<Value> values = new ArrayList<>();
            values.add(value());
            while (match(TokenType.COMMA)) {
                values.add(value());
            }
            expect(TokenType.RPAREN);
            return new Condition.In(name.text(), values);
        }
        if (match(TokenType.LIKE)) {
            return new Condition.Like(name.text(), expect(TokenType.STRING).text());
        }
        if (check(TokenType.OPERATOR)) {
            // a comparison after a bare word is most likely a misspelled condition keyword
            List<String> heads = List.of(TokenType.AGE.name(), TokenType.INCOME.name(), TokenType.DATE.name());
            throw new ParseException(heads, name.describe(), name.span(),
                    Suggestions.closest(name.text(), heads).orElse(null));
        }
        throw unexpected(List.of(TokenType.BETWEEN, TokenType.IN, TokenType.LIKE));
    }

    private Condition between(String attribute) {
        SpannedToken lowToken = expect(TokenType.NUMBER);
        long low = integer(lowToken);
        expect(TokenType.AND);
        long high = integer(expect(TokenType.NUMBER));
        if (low > high) {
            throw ParseException.semantic("empty range " + low + " AND " + high, lowToken.span());
        }
        return new Condition.Between(attribute, low, high);
    }

    private Value value() {
        SpannedToken token = peek();
        Value value = switch (token.type()) {
            case STRING -> Value.of(token.text());
            case NUMBER -> Value.of(integer(token));
            case DATE_LITERAL -> Value.of(date(token));
            default -> throw unexpected(List.of(TokenType.STRING, TokenType.NUMBER, TokenType.DATE_LITERAL));
        };
        advance();
        return value;
    }

    private ComparisonOp comparison() {
        SpannedToken token = peek();
        if (!token.is(TokenType.OPERATOR)) {
            throw unexpected(List.of(TokenType.OPERATOR));
        }
        advance();
        return ComparisonOp.fromSymbol(token.text())
                .orElseThrow(() -> unexpected(List.of(TokenType.OPERATOR)));
    }

    private static long integer(SpannedToken token) {
        try {
            return Long.parseLong(token.text());
        } catch (NumberFormatException e) {
            throw new ParseException(List.of("integer"), token.describe(), token.span(), null);
        }
    }

    private static LocalDate date(SpannedToken token) {
        // the lexer has already validated the literal
        return LocalDate.parse(token.text());
    }

    // ---------------------------------------------------------------
    // Token cursor
    // ---------------------------------------------------------------

    private SpannedToken peek() {
        return tokens.get(pos);
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private SpannedToken advance() {
        SpannedToken token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private SpannedToken expect(TokenType type) {
        if (!check(type)) {
            throw unexpected(List.of(type));
        }
        return advance();
    }

    private ParseException unexpected(List<TokenType> expected) {
        SpannedToken found = peek();
        List<String> names = expected.stream()
                .map(TokenType::displayName)
                .collect(Collectors.toList());
        String suggestion = null;
        if (found.is(TokenType.IDENT)) {
            List<String> keywords = expected.stream()
                    .filter(TokenType::isKeyword)
                    .map(TokenType::name)
                    .collect(Collectors.toList());
            suggestion = Suggestions.closest(found.text(), keywords).orElse(null);
        }
        return new ParseException(names, found.describe(), found.span(), suggestion);
    }
}
