package com.vidnyan.statute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the statute engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "statute")
public class StatuteEngineProperties {

    private Solver solver = new Solver();
    private Domain domain = new Domain();
    private Registry registry = new Registry();
    private Verification verification = new Verification();

    public enum SolverBackend {
        BOUNDED,
        Z3,
        NONE
    }

    @Data
    public static class Solver {
        /**
         * Which constraint backend answers verification queries.
         * Z3 needs the bundled native library; if it fails to load, queries are undecided.
         * NONE makes every query undecided, so only cycle checks report anything.
         */
        private SolverBackend backend = SolverBackend.BOUNDED;

        /**
         * Search steps allowed per query before it is reported undecided.
         */
        private long maxSteps = 100_000;

        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Domain {
        private long minAge = 0;
        private long maxAge = 150;
        private long minIncome = 0;
        private long maxIncome = 1_000_000_000_000L;

        /**
         * ISO dates bounding the {@code date} variable.
         */
        private String earliestDate = "0001-01-01";
        private String latestDate = "9999-12-31";
    }

    @Data
    public static class Registry {
        /**
         * Resource pattern for statute source files.
         */
        private String pattern = "classpath*:statutes/*.statute";
    }

    @Data
    public static class Verification {
        private boolean redundantExceptions = false;
        private boolean unreachableBranches = false;
    }
}
