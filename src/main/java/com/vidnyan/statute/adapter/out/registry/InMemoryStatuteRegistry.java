package com.vidnyan.statute.adapter.out.registry;

import com.vidnyan.statute.application.port.out.StatuteRegistry;
import com.vidnyan.statute.domain.model.Statute;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry held in memory.
 */
public class InMemoryStatuteRegistry implements StatuteRegistry {

    private final Map<String, Statute> statutes = new ConcurrentHashMap<>();

    public InMemoryStatuteRegistry() {
    }

    public InMemoryStatuteRegistry(Collection<Statute> initial) {
        initial.forEach(this::register);
    }

    /**
     * Add a statute. Returns false, leaving the registry unchanged, if the id is taken.
     */
    public boolean register(Statute statute) {
        return statutes.putIfAbsent(statute.id(), statute) == null;
    }

    /**
     * Add or replace a statute.
     */
    public void replace(Statute statute) {
        statutes.put(statute.id(), statute);
    }

    public int size() {
        return statutes.size();
    }

    @Override
    public Optional<Statute> resolve(String id) {
        return Optional.ofNullable(statutes.get(id));
    }

    @Override
    public List<Statute> findAll() {
        return statutes.values().stream()
                .sorted(Comparator.comparing(Statute::id))
                .toList();
    }

    @Override
    public List<Statute> findByJurisdiction(String jurisdiction) {
        return statutes.values().stream()
                .filter(s -> s.jurisdiction().filter(jurisdiction::equals).isPresent())
                .sorted(Comparator.comparing(Statute::id))
                .toList();
    }
}
