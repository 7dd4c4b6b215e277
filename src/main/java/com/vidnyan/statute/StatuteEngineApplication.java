package com.vidnyan.statute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Statute engine: parses statute DSL, applies statutes to entities and
 * statically verifies statute sets.
 */
@SpringBootApplication
public class StatuteEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatuteEngineApplication.class, args);
    }
}
