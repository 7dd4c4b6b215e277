package com.vidnyan.statute.application.port.out;

import com.vidnyan.statute.domain.model.Statute;

import java.util.List;
import java.util.Optional;

/**
 * Port for looking up statutes by id across load units.
 * Implemented by adapters that read from the classpath, memory, etc.
 */
public interface StatuteRegistry {

    /**
     * Resolve a statute by id.
     */
    Optional<Statute> resolve(String id);

    /**
     * All known statutes, ordered by id.
     */
    List<Statute> findAll();

    /**
     * Statutes tagged with the given jurisdiction.
     */
    List<Statute> findByJurisdiction(String jurisdiction);
}
