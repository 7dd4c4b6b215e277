package com.vidnyan.statute;

import com.vidnyan.statute.application.port.in.StatuteUseCase;
import com.vidnyan.statute.application.port.out.StatuteRegistry;
import com.vidnyan.statute.domain.constraint.ConstraintSolver;
import com.vidnyan.statute.domain.evaluation.MapEvaluationContext;
import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.LegalResult;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.verification.VerificationResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class StatuteEngineApplicationTest {

    @Autowired
    private StatuteUseCase statuteUseCase;

    @Autowired
    private StatuteRegistry statuteRegistry;

    @Autowired
    private ConstraintSolver constraintSolver;

    @Test
    void contextLoads_ShouldWireBoundedSolver() {
        assertTrue(constraintSolver.isAvailable());
        assertEquals("BoundedDomainSolver", constraintSolver.getName());
    }

    @Test
    void registry_ShouldLoadBundledStatutes() {
        List<String> ids = statuteRegistry.findAll().stream().map(Statute::id).toList();

        assertTrue(ids.containsAll(List.of("BEN-1", "BEN-2", "VOTE-1", "VOTE-2")), ids.toString());
    }

    @Test
    void verifyRegistry_BundledStatutesShouldPass() {
        VerificationResult result = statuteUseCase.verifyRegistry();

        assertTrue(result.passed(), result.findings().toString());
        assertTrue(result.complete());
    }

    @Test
    void evaluate_BundledVotingStatute() {
        Statute voting = statuteRegistry.resolve("VOTE-1").orElseThrow();

        LegalResult<Effect> result = statuteUseCase.evaluate(
                MapEvaluationContext.builder().age(18).attribute("citizen", true).build(), voting);

        assertEquals(LegalResult.deterministic(Effect.grant("voting rights")), result);
    }
}
