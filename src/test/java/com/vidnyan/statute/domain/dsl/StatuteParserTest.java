package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.EffectKind;
import com.vidnyan.statute.domain.model.RegionType;
import com.vidnyan.statute.domain.model.SourceSpan;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatuteParserTest {

    private static Statute parse(String source) {
        return StatuteParser.forSource(source).parseStatute();
    }

    private static Condition when(String condition) {
        return parse("STATUTE S: \"t\" { WHEN " + condition + " THEN GRANT \"x\" }").preconditions();
    }

    @Nested
    @DisplayName("Statute structure")
    class Structure {

        @Test
        void parseStatute_ShouldReadVotingRights() {
            Statute statute = parse("""
                    STATUTE VOTE-1: "Right to vote" {
                        WHEN AGE >= 18 AND HAS citizen
                        THEN GRANT "voting rights"
                    }
                    """);

            assertEquals("VOTE-1", statute.id());
            assertEquals("Right to vote", statute.title());
            assertEquals(1, statute.version());
            assertEquals(Condition.and(
                    Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18),
                    Condition.has("citizen")), statute.preconditions());
            assertEquals(Effect.grant("voting rights"), statute.primaryEffect());
            assertTrue(statute.exception().isEmpty());
            assertTrue(statute.temporalValidity().isUnbounded());
        }

        @Test
        void parseStatute_ShouldReadAllMetadata() {
            Statute statute = parse("""
                    STATUTE TAX-7: "Levy" {
                        JURISDICTION "federal"
                        VERSION 4
                        EFFECTIVE_DATE 2020-01-01
                        EXPIRY_DATE 2030-12-31
                        SUPERSEDES TAX-5, TAX-6
                        AMENDMENT TAX-1
                        WHEN INCOME > 50000
                        THEN OBLIGATION "pay levy"
                        EXCEPTION WHEN HAS exempt
                        DISCRETION "Assessor may waive"
                    }
                    """);

            assertEquals(Optional.of("federal"), statute.jurisdiction());
            assertEquals(4, statute.version());
            assertEquals(Optional.of(LocalDate.of(2020, 1, 1)), statute.temporalValidity().effectiveDate());
            assertEquals(Optional.of(LocalDate.of(2030, 12, 31)), statute.temporalValidity().expiryDate());
            assertEquals(List.of("TAX-5", "TAX-6"), statute.supersedes());
            assertEquals(List.of("TAX-1"), statute.amends());
            assertEquals(EffectKind.OBLIGATION, statute.primaryEffect().kind());
            assertEquals(Optional.of(Condition.has("exempt")), statute.exception());
            assertEquals(Optional.of("Assessor may waive"), statute.discretionNote());
        }

        @Test
        void parseStatute_ShouldAcceptMetadataAfterWhen() {
            Statute statute = parse("""
                    STATUTE S: "t" {
                        WHEN HAS a THEN REVOKE "licence"
                        VERSION 2
                    }
                    """);

            assertEquals(2, statute.version());
            assertEquals(EffectKind.REVOKE, statute.primaryEffect().kind());
        }

        @Test
        void parseDocument_ShouldReadSeveralStatutesInOrder() {
            List<Statute> statutes = StatuteParser.parseStatutes("""
                    STATUTE B: "second" { WHEN HAS x THEN GRANT "b" }
                    STATUTE A: "first" { WHEN HAS y THEN PROHIBITION "a" }
                    """);

            assertEquals(List.of("B", "A"), statutes.stream().map(Statute::id).toList());
        }

        @Test
        void parseCompilationUnit_ShouldCollectImports() {
            StatuteDocument document = StatuteParser.forSource("""
                    IMPORT "common/base.statute"
                    IMPORT "tax/levy.statute" AS levy
                    STATUTE A: "a" { WHEN HAS x THEN GRANT "a" }
                    """).parseCompilationUnit();

            assertEquals(2, document.imports().size());
            assertEquals("common/base.statute", document.imports().get(0).path());
            assertEquals(Optional.empty(), document.imports().get(0).alias());
            assertEquals(Optional.of("levy"), document.imports().get(1).alias());
            assertTrue(document.find("A").isPresent());
            assertTrue(document.find("B").isEmpty());
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        void condition_AndShouldBindTighterThanOr() {
            Condition condition = when("AGE >= 18 AND HAS x OR HAS y");

            assertEquals(Condition.or(
                    Condition.and(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18), Condition.has("x")),
                    Condition.has("y")), condition);
        }

        @Test
        void condition_ShouldFlattenChains() {
            Condition condition = when("HAS a AND HAS b AND HAS c");

            assertEquals(Condition.and(Condition.has("a"), Condition.has("b"), Condition.has("c")), condition);
        }

        @Test
        void condition_ParenthesesShouldNest() {
            Condition condition = when("(HAS a AND HAS b) AND HAS c");

            assertEquals(Condition.and(Condition.and(Condition.has("a"), Condition.has("b")), Condition.has("c")),
                    condition);
        }

        @Test
        void condition_NotShouldApplyToUnary() {
            Condition condition = when("NOT HAS a AND HAS b");

            assertEquals(Condition.and(Condition.not(Condition.has("a")), Condition.has("b")), condition);
        }

        @Test
        void condition_ShouldReadEveryLeafForm() {
            assertEquals(Condition.income(ComparisonOp.LESS_THAN, 20000), when("INCOME < 20000"));
            assertEquals(Condition.date(ComparisonOp.GREATER_OR_EQUAL, LocalDate.of(2024, 1, 1)),
                    when("DATE ≥ 2024-01-01"));
            assertEquals(Condition.has("licensed driver"), when("HAS \"licensed driver\""));
            assertEquals(Condition.region(RegionType.STATE, "Kerala"), when("REGION state \"Kerala\""));
            assertEquals(new Condition.Between("age", 18, 65), when("AGE BETWEEN 18 AND 65"));
            assertEquals(new Condition.Between("dependents", 1, 3), when("dependents BETWEEN 1 AND 3"));
            assertEquals(new Condition.In("status", List.of(Value.of("single"), Value.of("widowed"))),
                    when("status IN (\"single\", \"widowed\")"));
            assertEquals(new Condition.Like("postcode", "56%"), when("postcode LIKE \"56%\""));
        }

        @Test
        void condition_BetweenShouldNotConsumeFollowingAnd() {
            Condition condition = when("AGE BETWEEN 18 AND 65 AND HAS x");

            assertEquals(Condition.and(new Condition.Between("age", 18, 65), Condition.has("x")), condition);
        }

        @Test
        void condition_ShouldAcceptOperatorAliases() {
            assertEquals(Condition.age(ComparisonOp.EQUAL, 30), when("AGE == 30"));
            assertEquals(Condition.age(ComparisonOp.NOT_EQUAL, 30), when("AGE <> 30"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void parseStatute_ShouldReportExpectedAndFound() {
            ParseException e = assertThrows(ParseException.class,
                    () -> parse("STATUTE S \"t\" { WHEN HAS a THEN GRANT \"x\" }"));

            assertEquals(List.of("':'"), e.getExpected());
            assertEquals("string \"t\"", e.getFound());
            assertEquals(SourceSpan.at(1, 11), e.getSpan());
            assertEquals("1:11: expected ':', found string \"t\"", e.getMessage());
        }

        @Test
        void parseStatute_ShouldSuggestMisspelledKeyword() {
            ParseException e = assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { WEHN HAS a THEN GRANT \"x\" }"));

            assertEquals(Optional.of("WHEN"), e.getSuggestion());
            assertTrue(e.getMessage().contains("did you mean WHEN?"));
        }

        @Test
        void parseStatute_ShouldSuggestConditionKeywordBeforeOperator() {
            ParseException e = assertThrows(ParseException.class, () -> when("AEG >= 18"));

            assertEquals(Optional.of("AGE"), e.getSuggestion());
        }

        @Test
        void parseStatute_ShouldSuggestRegionKind() {
            ParseException e = assertThrows(ParseException.class, () -> when("REGION contry \"IN\""));

            assertEquals(Optional.of("country"), e.getSuggestion());
        }

        @Test
        void parseStatute_ShouldNotSuggestForKeywords() {
            ParseException e = assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { THEN GRANT \"x\" }"));

            assertTrue(e.getSuggestion().isEmpty());
        }

        @Test
        void parseStatute_ShouldRequireWhen() {
            ParseException e = assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { VERSION 2 }"));

            assertEquals(List.of("WHEN"), e.getExpected());
        }

        @Test
        void parseStatute_ShouldRejectDuplicateClause() {
            assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { VERSION 1 VERSION 2 WHEN HAS a THEN GRANT \"x\" }"));
        }

        @Test
        void parseStatute_ShouldRejectExceptionBeforeWhen() {
            assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { EXCEPTION WHEN HAS b WHEN HAS a THEN GRANT \"x\" }"));
        }

        @Test
        void parseStatute_ShouldRejectInvertedValidity() {
            ParseException e = assertThrows(ParseException.class, () -> parse("""
                    STATUTE S: "t" {
                        EFFECTIVE_DATE 2030-01-01
                        EXPIRY_DATE 2020-01-01
                        WHEN HAS a THEN GRANT "x"
                    }
                    """));

            assertEquals(2, e.getSpan().line());
        }

        @Test
        void parseStatute_ShouldRejectZeroVersion() {
            assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { VERSION 0 WHEN HAS a THEN GRANT \"x\" }"));
        }

        @Test
        void parseStatute_ShouldRejectEmptyRange() {
            assertThrows(ParseException.class, () -> when("AGE BETWEEN 65 AND 18"));
        }

        @Test
        void parseStatute_ShouldRejectTrailingInput() {
            assertThrows(ParseException.class,
                    () -> parse("STATUTE S: \"t\" { WHEN HAS a THEN GRANT \"x\" } extra"));
        }

        @Test
        void parseCompilationUnit_ShouldRejectDuplicateIds() {
            ParseException e = assertThrows(ParseException.class, () -> StatuteParser.parseStatutes("""
                    STATUTE A: "a" { WHEN HAS x THEN GRANT "a" }
                    STATUTE A: "b" { WHEN HAS y THEN GRANT "b" }
                    """));

            assertEquals(2, e.getSpan().line());
            assertTrue(e.getMessage().contains("duplicate statute id 'A'"));
        }

        @Test
        void parseStatute_DeepNestingShouldFailCleanly() {
            String nested = "(".repeat(20_000) + "HAS x" + ")".repeat(20_000);

            ParseException e = assertThrows(ParseException.class, () -> when(nested));

            assertTrue(e.getMessage().contains("condition nested too deeply"));
            assertEquals(1, e.getSpan().line());
            assertThrows(ParseException.class, () -> when("NOT ".repeat(20_000) + "HAS x"));
        }

        @Test
        void parseStatute_NestingUpToLimitShouldParse() {
            int depth = StatuteParser.MAX_NESTING;
            Condition parsed = when("(".repeat(depth) + "HAS x" + ")".repeat(depth));

            assertEquals(Condition.has("x"), parsed);
        }

        @Test
        void parseStatute_LexErrorsShouldSurface() {
            assertThrows(LexException.class, () -> parse("STATUTE S: \"t\" { WHEN AGE @ 3 THEN GRANT \"x\" }"));
        }
    }
}
