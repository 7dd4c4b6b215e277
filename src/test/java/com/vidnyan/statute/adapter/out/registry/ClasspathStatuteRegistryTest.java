package com.vidnyan.statute.adapter.out.registry;

import com.vidnyan.statute.config.StatuteEngineProperties;
import com.vidnyan.statute.domain.model.Statute;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathStatuteRegistryTest {

    private ClasspathStatuteRegistry registry;

    @BeforeEach
    void setUp() {
        StatuteEngineProperties properties = new StatuteEngineProperties();
        properties.getRegistry().setPattern("classpath*:registry/*.statute");
        registry = new ClasspathStatuteRegistry(properties);
        registry.loadStatutes();
    }

    @Test
    void loadStatutes_ShouldSkipBrokenFilesAndDuplicates() {
        List<String> ids = registry.findAll().stream().map(Statute::id).toList();

        assertEquals(List.of("HOUSE-1", "HOUSE-2", "TRANSPORT-1"), ids);
        assertEquals("Housing grant", registry.resolve("HOUSE-1").orElseThrow().title());
        assertTrue(registry.resolve("BROKEN-1").isEmpty());
    }

    @Test
    void findByJurisdiction_ShouldFilter() {
        assertEquals(List.of("TRANSPORT-1"),
                registry.findByJurisdiction("city").stream().map(Statute::id).toList());
    }

    @Test
    void loadStatutes_NoMatchingResourcesShouldLeaveRegistryEmpty() {
        StatuteEngineProperties properties = new StatuteEngineProperties();
        properties.getRegistry().setPattern("classpath*:nothing-here/*.statute");
        ClasspathStatuteRegistry empty = new ClasspathStatuteRegistry(properties);

        empty.loadStatutes();

        assertTrue(empty.findAll().isEmpty());
    }
}
