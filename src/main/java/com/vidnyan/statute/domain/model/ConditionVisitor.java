package com.vidnyan.statute.domain.model;

/**
 * Exhaustive traversal over {@link Condition} variants.
 */
public interface ConditionVisitor<R> {

    R visitAge(Condition.Age age);

    R visitIncome(Condition.Income income);

    R visitDate(Condition.DateCompare date);

    R visitHasAttribute(Condition.HasAttribute has);

    R visitGeographic(Condition.Geographic geographic);

    R visitBetween(Condition.Between between);

    R visitIn(Condition.In in);

    R visitLike(Condition.Like like);

    R visitAnd(Condition.And and);

    R visitOr(Condition.Or or);

    R visitNot(Condition.Not not);
}
