package com.vidnyan.statute.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.statute.adapter.out.solver.BoundedDomainSolver;
import com.vidnyan.statute.adapter.out.solver.NoSolverBackend;
import com.vidnyan.statute.adapter.out.solver.Z3ConstraintSolver;
import com.vidnyan.statute.domain.constraint.ConstraintEncoder;
import com.vidnyan.statute.domain.constraint.ConstraintSolver;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.Interval;
import com.vidnyan.statute.domain.evaluation.StatuteEvaluator;
import com.vidnyan.statute.domain.verification.StatuteVerifier;
import com.vidnyan.statute.domain.verification.VerificationOptions;
import com.vidnyan.statute.domain.verification.VerificationPass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring configuration for the statute engine.
 * Wires the framework-free domain classes into the application.
 */
@Slf4j
@Configuration
public class StatuteEngineConfiguration {

    /**
     * ObjectMapper for JSON reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public DomainBounds domainBounds(StatuteEngineProperties properties) {
        StatuteEngineProperties.Domain domain = properties.getDomain();
        return new DomainBounds(
                Interval.of(domain.getMinAge(), domain.getMaxAge()),
                Interval.of(domain.getMinIncome(), domain.getMaxIncome()),
                LocalDate.parse(domain.getEarliestDate()),
                LocalDate.parse(domain.getLatestDate()));
    }

    @Bean
    public ConstraintSolver constraintSolver(StatuteEngineProperties properties, DomainBounds bounds) {
        StatuteEngineProperties.Solver solver = properties.getSolver();
        ConstraintSolver backend = switch (solver.getBackend()) {
            case BOUNDED -> new BoundedDomainSolver(bounds, solver.getMaxSteps(), solver.getTimeout());
            case Z3 -> new Z3ConstraintSolver(bounds, solver.getTimeout());
            case NONE -> new NoSolverBackend();
        };
        log.info("Using constraint solver: {}", backend.getName());
        if (!backend.isAvailable()) {
            log.warn("Constraint solver {} cannot decide queries; dead statute and contradiction checks will be inconclusive",
                    backend.getName());
        }
        return backend;
    }

    @Bean
    public ConstraintEncoder constraintEncoder() {
        return new ConstraintEncoder();
    }

    @Bean
    public StatuteEvaluator statuteEvaluator() {
        return new StatuteEvaluator();
    }

    /**
     * Verifier with the built-in passes. Logs the passes on startup.
     */
    @Bean
    public StatuteVerifier statuteVerifier(ConstraintEncoder encoder, ConstraintSolver solver) {
        List<VerificationPass> passes = StatuteVerifier.defaultPasses();
        log.info("Registered {} verification passes:", passes.size());
        passes.forEach(p -> log.info("  - {}", p.getName()));
        return new StatuteVerifier(encoder, solver, passes);
    }

    @Bean
    public VerificationOptions verificationOptions(StatuteEngineProperties properties) {
        StatuteEngineProperties.Verification verification = properties.getVerification();
        return new VerificationOptions(verification.isRedundantExceptions(), verification.isUnreachableBranches());
    }
}
