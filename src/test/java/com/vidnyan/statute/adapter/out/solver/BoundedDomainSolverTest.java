package com.vidnyan.statute.adapter.out.solver;

import com.vidnyan.statute.domain.constraint.ConstraintEncoder;
import com.vidnyan.statute.domain.constraint.ConstraintExpr;
import com.vidnyan.statute.domain.constraint.ConstraintQueries;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.SatResult;
import com.vidnyan.statute.domain.constraint.Variable;
import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.RegionType;
import com.vidnyan.statute.domain.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BoundedDomainSolverTest {

    private final ConstraintQueries queries = new ConstraintQueries(new ConstraintEncoder(), new BoundedDomainSolver());

    private static Condition age(ComparisonOp op, long value) {
        return Condition.age(op, value);
    }

    @Nested
    @DisplayName("Decidable fragment")
    class Decidable {

        @Test
        void checkSat_ShouldReturnModelWithinBounds() {
            SatResult result = queries.check(age(ComparisonOp.GREATER_OR_EQUAL, 18), Condition.has("citizen"));

            SatResult.Sat sat = assertInstanceOf(SatResult.Sat.class, result);
            assertEquals(Value.of(18), sat.model().get("age").orElseThrow());
            assertEquals(Value.of(true), sat.model().get("has:citizen").orElseThrow());
        }

        @Test
        void checkSat_AgeOutsideDomainShouldBeUnsat() {
            assertTrue(queries.check(age(ComparisonOp.GREATER_OR_EQUAL, 200)).isUnsat());
        }

        @Test
        void checkSat_ShouldDetectDirectContradiction() {
            Condition adult = age(ComparisonOp.GREATER_OR_EQUAL, 18);

            assertTrue(queries.check(adult, Condition.not(adult)).isUnsat());
            assertTrue(queries.check(Condition.has("x"), Condition.not(Condition.has("x"))).isUnsat());
        }

        @Test
        void checkSat_ShouldExploreDisjunctions() {
            Condition condition = Condition.and(
                    Condition.or(age(ComparisonOp.LESS_THAN, 10), age(ComparisonOp.GREATER_THAN, 60)),
                    age(ComparisonOp.GREATER_OR_EQUAL, 18));

            SatResult.Sat sat = assertInstanceOf(SatResult.Sat.class, queries.check(condition));
            assertEquals(Value.of(61), sat.model().get("age").orElseThrow());
        }

        @Test
        void checkSat_ShouldHonourExcludedPoints() {
            Condition condition = Condition.and(
                    new Condition.Between("age", 0, 1),
                    Condition.not(age(ComparisonOp.EQUAL, 0)),
                    Condition.not(age(ComparisonOp.EQUAL, 1)));

            assertTrue(queries.check(condition).isUnsat());
        }

        @Test
        void checkSat_ShouldHandleStringEqualities() {
            Condition india = Condition.region(RegionType.COUNTRY, "IN");
            Condition france = Condition.region(RegionType.COUNTRY, "FR");

            assertTrue(queries.check(india, france).isUnsat());
            assertTrue(queries.check(india, Condition.not(india)).isUnsat());
            SatResult.Sat sat = assertInstanceOf(SatResult.Sat.class, queries.check(Condition.not(india)));
            assertEquals(Value.of("other"), sat.model().get("region:country").orElseThrow());
        }

        @Test
        void checkSat_ShouldDecodeDates() {
            SatResult result = queries.check(Condition.date(ComparisonOp.GREATER_OR_EQUAL, LocalDate.of(2024, 1, 1)));

            SatResult.Sat sat = assertInstanceOf(SatResult.Sat.class, result);
            assertEquals(Value.of(LocalDate.of(2024, 1, 1)), sat.model().get("date").orElseThrow());
        }

        @Test
        void implies_ShouldFollowIntervals() {
            assertEquals(Optional.of(true),
                    queries.implies(age(ComparisonOp.GREATER_OR_EQUAL, 21), age(ComparisonOp.GREATER_OR_EQUAL, 18)));
            assertEquals(Optional.of(false),
                    queries.implies(age(ComparisonOp.GREATER_OR_EQUAL, 18), age(ComparisonOp.GREATER_OR_EQUAL, 21)));
            assertEquals(Optional.of(true),
                    queries.contradicts(age(ComparisonOp.LESS_THAN, 18), age(ComparisonOp.GREATER_OR_EQUAL, 18)));
        }
    }

    @Nested
    @DisplayName("Undecided answers")
    class Undecided {

        @Test
        void checkSat_OpaqueOnlyModelShouldBeUnknown() {
            assertTrue(queries.check(new Condition.Like("postcode", "56%")).isUnknown());
        }

        @Test
        void checkSat_ShouldPreferModelWithoutOpaqueAtoms() {
            Condition condition = Condition.or(new Condition.Like("postcode", "56%"), Condition.has("x"));

            assertTrue(queries.check(condition).isSat());
        }

        @Test
        void checkSat_OpaqueAtomsShouldNotHideUnsatisfiableRest() {
            Condition condition = Condition.and(new Condition.Like("postcode", "56%"), age(ComparisonOp.GREATER_THAN, 500));

            assertTrue(queries.check(condition).isUnsat());
        }

        @Test
        void checkSat_OneAttributeTypedTwoWaysShouldBeUnknown() {
            Condition number = new Condition.In("x", List.of(Value.of(1)));
            Condition text = new Condition.In("x", List.of(Value.of("a")));

            SatResult.Unknown unknown = assertInstanceOf(SatResult.Unknown.class, queries.check(number, text));
            assertTrue(unknown.reason().contains("two ways"));
            assertTrue(queries.check(number, text, age(ComparisonOp.GREATER_THAN, 500)).isUnsat());
        }

        @Test
        void checkSat_GenericDateAttributeShouldNotMergeWithDateFact() {
            Condition condition = Condition.and(
                    Condition.date(ComparisonOp.LESS_THAN, LocalDate.of(1970, 1, 3)),
                    new Condition.Between("date", 1, 5));

            assertTrue(queries.check(condition).isUnknown());
        }

        @Test
        void checkSat_ShouldPreferBranchWithSingleTypePerAttribute() {
            Condition condition = Condition.and(
                    new Condition.In("x", List.of(Value.of(1))),
                    Condition.or(new Condition.In("x", List.of(Value.of("a"))), Condition.has("y")));

            SatResult.Sat sat = assertInstanceOf(SatResult.Sat.class, queries.check(condition));
            assertEquals(Value.of(1), sat.model().get("attr:x").orElseThrow());
        }

        @Test
        void checkSat_ExhaustedBudgetShouldBeUnknown() {
            BoundedDomainSolver solver = new BoundedDomainSolver(DomainBounds.defaults(), 1, Duration.ofSeconds(5));
            ConstraintExpr expr = ConstraintExpr.and(
                    new ConstraintExpr.BoolAtom(Variable.boolVar("a")),
                    new ConstraintExpr.BoolAtom(Variable.boolVar("b")));

            SatResult.Unknown unknown = assertInstanceOf(SatResult.Unknown.class, solver.checkSat(expr));
            assertTrue(unknown.reason().contains("step budget"));
        }

        @Test
        void noSolverBackend_ShouldAlwaysBeUnknown() {
            NoSolverBackend backend = new NoSolverBackend();

            assertFalse(backend.isAvailable());
            assertTrue(backend.checkSat(ConstraintExpr.FALSE).isUnknown());
        }
    }

    @Test
    void toNnf_ShouldPushNegationToAtoms() {
        Variable age = Variable.intVar("age");
        ConstraintExpr expr = ConstraintExpr.not(ConstraintExpr.and(
                new ConstraintExpr.IntCompare(age, ComparisonOp.LESS_THAN, 18),
                new ConstraintExpr.BoolAtom(Variable.boolVar("x"))));

        ConstraintExpr nnf = BoundedDomainSolver.toNnf(expr, false);

        ConstraintExpr.Or or = assertInstanceOf(ConstraintExpr.Or.class, nnf);
        assertEquals(new ConstraintExpr.IntCompare(age, ComparisonOp.GREATER_OR_EQUAL, 18), or.operands().get(0));
        assertEquals(new ConstraintExpr.Not(new ConstraintExpr.BoolAtom(Variable.boolVar("x"))), or.operands().get(1));
    }

    @Test
    void constructor_ShouldRejectNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class,
                () -> new BoundedDomainSolver(DomainBounds.defaults(), 0, Duration.ofSeconds(1)));
    }
}
