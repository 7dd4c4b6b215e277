package com.vidnyan.statute.application.port.in;

import com.vidnyan.statute.domain.evaluation.EvaluationContext;
import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.LegalResult;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.verification.CancellationToken;
import com.vidnyan.statute.domain.verification.VerificationOptions;
import com.vidnyan.statute.domain.verification.VerificationResult;

import java.util.List;
import java.util.Map;

/**
 * Primary use case: read, apply and check statutes.
 * This is the main entry point to the application.
 */
public interface StatuteUseCase {

    /**
     * Parse statute DSL text.
     * @throws com.vidnyan.statute.domain.dsl.StatuteSyntaxException on malformed input
     */
    List<Statute> parseStatutes(String text);

    /**
     * Apply one statute to an entity.
     */
    LegalResult<Effect> evaluate(EvaluationContext context, Statute statute);

    /**
     * Apply several statutes to the same entity, keyed by statute id.
     */
    Map<String, LegalResult<Effect>> evaluateAll(EvaluationContext context, List<Statute> statutes);

    /**
     * Verify a statute set with the configured options.
     */
    VerificationResult verify(List<Statute> statutes);

    VerificationResult verify(List<Statute> statutes, VerificationOptions options, CancellationToken cancellation);

    /**
     * Verify every statute known to the registry.
     */
    VerificationResult verifyRegistry();

    /**
     * The statute followed by everything it transitively supersedes, as far as
     * the registry can resolve. Empty if the id is unknown.
     */
    List<Statute> resolveSupersededChain(String id);

    /**
     * Render a verification result in the configured report format.
     */
    String renderReport(VerificationResult result);
}
