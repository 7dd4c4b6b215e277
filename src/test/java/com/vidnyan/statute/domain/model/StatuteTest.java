package com.vidnyan.statute.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatuteTest {

    private static Statute.Builder base() {
        return Statute.builder()
                .id("S-1")
                .title("Sample")
                .preconditions(Condition.has("x"))
                .effect(Effect.grant("benefit"));
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void validate_ShouldAcceptWellFormedStatute() {
            assertTrue(base().build().isValid());
        }

        @Test
        void validate_ShouldReportEachProblem() {
            Statute statute = base()
                    .id("1bad id")
                    .title(" ")
                    .version(0)
                    .effect(Effect.grant(""))
                    .preconditions(Condition.or(Condition.has("x"), Condition.not(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 200))))
                    .build();

            List<StatuteValidationError.Code> codes = statute.validate().stream()
                    .map(StatuteValidationError::code)
                    .toList();

            assertEquals(List.of(
                    StatuteValidationError.Code.INVALID_ID,
                    StatuteValidationError.Code.EMPTY_TITLE,
                    StatuteValidationError.Code.EMPTY_EFFECT_DESCRIPTION,
                    StatuteValidationError.Code.INVALID_VERSION,
                    StatuteValidationError.Code.UNREALISTIC_AGE), codes);
        }

        @Test
        void validate_ShouldLookInsideException() {
            Statute statute = base().exception(Condition.age(ComparisonOp.LESS_THAN, 151)).build();

            assertEquals(StatuteValidationError.Code.UNREALISTIC_AGE, statute.validate().get(0).code());
        }
    }

    @Nested
    @DisplayName("Temporal validity")
    class Temporal {

        @Test
        void isActive_ShouldIncludeBothEnds() {
            Statute statute = base()
                    .effectiveDate(LocalDate.of(2020, 1, 1))
                    .expiryDate(LocalDate.of(2020, 12, 31))
                    .build();

            assertFalse(statute.isActive(LocalDate.of(2019, 12, 31)));
            assertTrue(statute.isActive(LocalDate.of(2020, 1, 1)));
            assertTrue(statute.isActive(LocalDate.of(2020, 12, 31)));
            assertFalse(statute.isActive(LocalDate.of(2021, 1, 1)));
        }

        @Test
        void temporalValidity_ShouldRejectEffectiveAfterExpiry() {
            assertThrows(IllegalArgumentException.class,
                    () -> TemporalValidity.of(LocalDate.of(2021, 1, 1), LocalDate.of(2020, 1, 1)));
        }

        @Test
        void overlaps_ShouldTreatOpenEndsAsUnbounded() {
            TemporalValidity until2020 = TemporalValidity.of(null, LocalDate.of(2020, 1, 1));
            TemporalValidity from2021 = TemporalValidity.of(LocalDate.of(2021, 1, 1), null);
            TemporalValidity sameDay = TemporalValidity.of(LocalDate.of(2020, 1, 1), null);

            assertFalse(until2020.overlaps(from2021));
            assertTrue(until2020.overlaps(sameDay));
            assertTrue(TemporalValidity.UNBOUNDED.overlaps(from2021));
        }
    }

    @Nested
    @DisplayName("Effects")
    class Effects {

        @Test
        void conflictsWith_ShouldPairOpposingKindsOnSameSubject() {
            assertTrue(Effect.grant("Drive").conflictsWith(Effect.prohibition("drive")));
            assertTrue(Effect.prohibition("drive").conflictsWith(Effect.grant("drive")));
            assertTrue(Effect.grant("licence").conflictsWith(Effect.revoke("licence")));
            assertTrue(Effect.obligation("vote").conflictsWith(Effect.prohibition("  vote ")));
        }

        @Test
        void conflictsWith_ShouldIgnoreDifferentSubjectsOrCompatibleKinds() {
            assertFalse(Effect.grant("drive").conflictsWith(Effect.prohibition("smoke")));
            assertFalse(Effect.grant("drive").conflictsWith(Effect.grant("drive")));
            assertFalse(Effect.obligation("pay").conflictsWith(Effect.grant("pay")));
        }
    }

    @Test
    void references_ShouldListSupersededThenAmended() {
        Statute statute = base().supersedes("A").amends("B").supersedes("C").build();

        assertEquals(List.of("A", "C", "B"), statute.references());
    }

    @Test
    void legalResult_MapShouldOnlyTouchDeterministicValue() {
        LegalResult<Integer> value = LegalResult.deterministic(2);
        LegalResult<Integer> voided = LegalResult.voided("n/a");

        assertEquals(LegalResult.deterministic(4), value.map(v -> v * 2));
        assertEquals(LegalResult.voided("n/a"), voided.map(v -> v * 2));
        assertTrue(value.isDeterministic());
        assertTrue(voided.isVoid());
    }
}
