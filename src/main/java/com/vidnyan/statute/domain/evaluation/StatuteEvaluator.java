package com.vidnyan.statute.domain.evaluation;

import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.LegalResult;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.model.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a statute to an entity and classifies the outcome.
 *
 * <p>Pure function of its inputs: no shared state, safe to call concurrently
 * for any number of (context, statute) pairs.
 */
@Slf4j
public final class StatuteEvaluator {

    public static final String NOT_IN_FORCE = "statute not in force";
    public static final String EXCEPTION_APPLIES = "exception applies";
    public static final String PRECONDITIONS_NOT_MET = "preconditions not met";
    public static final String CONTRADICTORY_FACTS = "contradictory facts";
    public static final String INSUFFICIENT_INFORMATION = "insufficient information";

    private final ConditionEvaluator conditions;

    public StatuteEvaluator() {
        this(new ConditionEvaluator());
    }

    public StatuteEvaluator(ConditionEvaluator conditions) {
        this.conditions = conditions;
    }

    /**
     * Evaluate one statute.
     *
     * <p>When the context supplies a {@code date} fact, a statute outside its
     * validity window is void. Without that fact the window is not consulted.
     */
    public LegalResult<Effect> evaluate(EvaluationContext context, Statute statute) {
        Optional<Value> asOf = context.getAttribute("date");
        if (asOf.isPresent() && asOf.get() instanceof Value.DateValue d && !statute.isActive(d.value())) {
            log.debug("Statute {} not in force on {}", statute.id(), d.value());
            return LegalResult.voided(NOT_IN_FORCE);
        }

        PartialBool preconditions = conditions.evaluate(statute.preconditions(), context);
        log.debug("Statute {} preconditions evaluated to {}", statute.id(), preconditions);

        return switch (preconditions) {
            case TRUE -> {
                boolean exceptionApplies = statute.exception()
                        .map(e -> conditions.evaluate(e, context) == PartialBool.TRUE)
                        .orElse(false);
                yield exceptionApplies
                        ? LegalResult.voided(EXCEPTION_APPLIES)
                        : LegalResult.deterministic(statute.primaryEffect());
            }
            case FALSE -> LegalResult.voided(PRECONDITIONS_NOT_MET);
            case UNKNOWN -> LegalResult.discretion(INSUFFICIENT_INFORMATION, context.contextId(),
                    statute.discretionNote());
            case CONTRADICTION -> LegalResult.voided(CONTRADICTORY_FACTS);
        };
    }

    /**
     * Evaluate every statute against the same context, keyed by statute id in input order.
     */
    public Map<String, LegalResult<Effect>> evaluateAll(EvaluationContext context, List<Statute> statutes) {
        Map<String, LegalResult<Effect>> results = new LinkedHashMap<>();
        for (Statute statute : statutes) {
            results.put(statute.id(), evaluate(context, statute));
        }
        return results;
    }
}
