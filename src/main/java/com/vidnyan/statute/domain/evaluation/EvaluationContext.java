package com.vidnyan.statute.domain.evaluation;

import com.vidnyan.statute.domain.model.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Facts about the entity a statute is applied to.
 *
 * <p>Implementations must be free of side effects and must return promptly;
 * callers that back this with I/O are responsible for their own timeouts.
 * Detecting conflicting facts for a single attribute is the implementation's concern.
 */
public interface EvaluationContext {

    /**
     * Identifier echoed into discretionary results so they can be traced back.
     */
    UUID contextId();

    Optional<Value> getAttribute(String name);
}
