package com.vidnyan.statute.adapter.out.solver;

import com.vidnyan.statute.domain.constraint.ConstraintEncoder;
import com.vidnyan.statute.domain.constraint.ConstraintQueries;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.SatResult;
import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.RegionType;
import com.vidnyan.statute.domain.model.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class Z3ConstraintSolverTest {

    private final Z3ConstraintSolver solver = new Z3ConstraintSolver(DomainBounds.defaults(), Duration.ofSeconds(5));
    private final ConstraintQueries queries = new ConstraintQueries(new ConstraintEncoder(), solver);

    @BeforeEach
    void requireNativeLibrary() {
        assumeTrue(solver.isAvailable(), "Z3 native library not loadable on this platform");
    }

    @Test
    void checkSat_ShouldReturnModelWithinBounds() {
        SatResult result = queries.check(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18), Condition.has("citizen"));

        SatResult.Sat sat = assertInstanceOf(SatResult.Sat.class, result);
        Value.IntValue age = assertInstanceOf(Value.IntValue.class, sat.model().get("age").orElseThrow());
        assertTrue(age.value() >= 18 && age.value() <= DomainBounds.DEFAULT_MAX_AGE);
        assertEquals(Value.of(true), sat.model().get("has:citizen").orElseThrow());
    }

    @Test
    void checkSat_ShouldRespectDomainBounds() {
        assertTrue(queries.check(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 200)).isUnsat());
        assertTrue(queries.check(Condition.income(ComparisonOp.LESS_THAN, 0)).isUnsat());
    }

    @Test
    void checkSat_ShouldDecodeStringsAndDates() {
        Condition india = Condition.region(RegionType.COUNTRY, "IN");

        assertTrue(queries.check(india, Condition.region(RegionType.COUNTRY, "FR")).isUnsat());
        SatResult.Sat other = assertInstanceOf(SatResult.Sat.class, queries.check(Condition.not(india)));
        assertEquals(Value.of("other"), other.model().get("region:country").orElseThrow());

        SatResult.Sat dated = assertInstanceOf(SatResult.Sat.class,
                queries.check(Condition.date(ComparisonOp.EQUAL, LocalDate.of(2024, 2, 29))));
        assertEquals(Value.of(LocalDate.of(2024, 2, 29)), dated.model().get("date").orElseThrow());
    }

    @Test
    void implies_ShouldAgreeWithBoundedSolver() {
        assertEquals(Optional.of(true), queries.implies(
                Condition.age(ComparisonOp.GREATER_OR_EQUAL, 21), Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18)));
        assertEquals(Optional.of(true), queries.contradicts(
                Condition.age(ComparisonOp.LESS_THAN, 18), Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18)));
    }

    @Test
    void checkSat_OpaqueAtomsShouldWithholdModelButNotUnsat() {
        Condition like = new Condition.Like("postcode", "56%");

        assertTrue(queries.check(like).isUnknown());
        assertTrue(queries.check(like, Condition.age(ComparisonOp.GREATER_THAN, 500)).isUnsat());
    }

    @Test
    void checkSat_OneAttributeTypedTwoWaysShouldBeUnknown() {
        Condition number = new Condition.In("x", List.of(Value.of(1)));
        Condition text = new Condition.In("x", List.of(Value.of("a")));

        assertTrue(queries.check(number, text).isUnknown());
    }
}
