package com.vidnyan.statute.application.service;

import com.vidnyan.statute.application.port.in.StatuteUseCase;
import com.vidnyan.statute.application.port.out.StatuteRegistry;
import com.vidnyan.statute.application.port.out.VerificationReportWriter;
import com.vidnyan.statute.domain.dsl.StatuteParser;
import com.vidnyan.statute.domain.dsl.StatuteSyntaxException;
import com.vidnyan.statute.domain.evaluation.EvaluationContext;
import com.vidnyan.statute.domain.evaluation.StatuteEvaluator;
import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.LegalResult;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.verification.CancellationToken;
import com.vidnyan.statute.domain.verification.Severity;
import com.vidnyan.statute.domain.verification.StatuteVerifier;
import com.vidnyan.statute.domain.verification.VerificationOptions;
import com.vidnyan.statute.domain.verification.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Application service that wires parsing, evaluation and verification together.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatuteApplicationService implements StatuteUseCase {

    private final StatuteRegistry statuteRegistry;
    private final StatuteEvaluator statuteEvaluator;
    private final StatuteVerifier statuteVerifier;
    private final VerificationOptions verificationOptions;
    private final VerificationReportWriter reportWriter;

    @Override
    public List<Statute> parseStatutes(String text) {
        try {
            List<Statute> statutes = StatuteParser.parseStatutes(text);
            log.debug("Parsed {} statutes", statutes.size());
            return statutes;
        } catch (StatuteSyntaxException e) {
            log.warn("Rejected statute source at {}: {}", e.getSpan().format(), e.getDetail());
            throw e;
        }
    }

    @Override
    public LegalResult<Effect> evaluate(EvaluationContext context, Statute statute) {
        return statuteEvaluator.evaluate(context, statute);
    }

    @Override
    public Map<String, LegalResult<Effect>> evaluateAll(EvaluationContext context, List<Statute> statutes) {
        return statuteEvaluator.evaluateAll(context, statutes);
    }

    @Override
    public VerificationResult verify(List<Statute> statutes) {
        return verify(statutes, verificationOptions, CancellationToken.none());
    }

    @Override
    public VerificationResult verify(List<Statute> statutes, VerificationOptions options,
                                     CancellationToken cancellation) {
        VerificationResult result = statuteVerifier.verify(statutes, options, cancellation);
        if (result.hasCriticalFindings()) {
            log.warn("Statute set has {} critical findings", result.findingsBySeverity().get(Severity.CRITICAL));
        }
        return result;
    }

    @Override
    public VerificationResult verifyRegistry() {
        List<Statute> statutes = statuteRegistry.findAll();
        log.info("Verifying {} registered statutes", statutes.size());
        return verify(statutes);
    }

    @Override
    public List<Statute> resolveSupersededChain(String id) {
        Optional<Statute> root = statuteRegistry.resolve(id);
        if (root.isEmpty()) {
            log.debug("Statute {} is not registered", id);
            return List.of();
        }

        List<Statute> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Statute> queue = new ArrayDeque<>();
        queue.add(root.get());
        visited.add(id);

        while (!queue.isEmpty()) {
            Statute current = queue.poll();
            chain.add(current);
            for (String superseded : current.supersedes()) {
                if (!visited.add(superseded)) {
                    continue;
                }
                Optional<Statute> resolved = statuteRegistry.resolve(superseded);
                if (resolved.isPresent()) {
                    queue.add(resolved.get());
                } else {
                    log.debug("Statute {} supersedes unknown statute {}", current.id(), superseded);
                }
            }
        }
        return chain;
    }

    @Override
    public String renderReport(VerificationResult result) {
        return reportWriter.render(result);
    }
}
