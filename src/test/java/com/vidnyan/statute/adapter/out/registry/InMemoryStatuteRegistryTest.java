package com.vidnyan.statute.adapter.out.registry;

import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.Effect;
import com.vidnyan.statute.domain.model.Statute;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStatuteRegistryTest {

    private static Statute statute(String id, String jurisdiction) {
        return Statute.builder()
                .id(id)
                .title(id)
                .jurisdiction(jurisdiction)
                .preconditions(Condition.has("x"))
                .effect(Effect.grant(id))
                .build();
    }

    @Test
    void register_ShouldKeepFirstDefinition() {
        InMemoryStatuteRegistry registry = new InMemoryStatuteRegistry();

        assertTrue(registry.register(statute("A", "state")));
        assertFalse(registry.register(statute("A", "city")));

        assertEquals("state", registry.resolve("A").orElseThrow().jurisdiction().orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    void replace_ShouldOverwrite() {
        InMemoryStatuteRegistry registry = new InMemoryStatuteRegistry(List.of(statute("A", "state")));

        registry.replace(statute("A", "city"));

        assertEquals("city", registry.resolve("A").orElseThrow().jurisdiction().orElseThrow());
    }

    @Test
    void findAll_ShouldOrderById() {
        InMemoryStatuteRegistry registry = new InMemoryStatuteRegistry(List.of(
                statute("C", "state"), statute("A", "city"), statute("B", "state")));

        assertEquals(List.of("A", "B", "C"), registry.findAll().stream().map(Statute::id).toList());
        assertEquals(List.of("B", "C"), registry.findByJurisdiction("state").stream().map(Statute::id).toList());
        assertTrue(registry.resolve("Z").isEmpty());
    }

    @Test
    void register_ShouldBeSafeUnderConcurrentWriters() throws InterruptedException {
        InMemoryStatuteRegistry registry = new InMemoryStatuteRegistry();
        ExecutorService executor = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 200; i++) {
            String id = "S-" + (i % 50);
            executor.submit(() -> registry.register(statute(id, "state")));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(50, registry.size());
    }
}
