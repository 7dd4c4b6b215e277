package com.vidnyan.statute.adapter.out.registry;

import com.vidnyan.statute.application.port.out.StatuteRegistry;
import com.vidnyan.statute.config.StatuteEngineProperties;
import com.vidnyan.statute.domain.dsl.StatuteParser;
import com.vidnyan.statute.domain.dsl.StatuteSyntaxException;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.model.StatuteValidationError;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Registry loaded from statute DSL files on the classpath.
 * Files that fail to parse are logged and skipped; ids already loaded from
 * another file are skipped as well.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathStatuteRegistry implements StatuteRegistry {

    private final StatuteEngineProperties properties;

    private final InMemoryStatuteRegistry statutes = new InMemoryStatuteRegistry();

    @PostConstruct
    public void loadStatutes() {
        String pattern = properties.getRegistry().getPattern();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(pattern);

            for (Resource resource : resources) {
                try {
                    load(resource);
                } catch (StatuteSyntaxException | IOException e) {
                    log.warn("Failed to load statutes from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} statutes from {}", statutes.size(), pattern);
        } catch (IOException e) {
            log.error("Failed to load statutes", e);
        }
    }

    private void load(Resource resource) throws IOException {
        String source;
        try (InputStream in = resource.getInputStream()) {
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        for (Statute statute : StatuteParser.forSource(source).parseDocument()) {
            for (StatuteValidationError error : statute.validate()) {
                log.warn("Statute {} in {}: {}", statute.id(), resource.getFilename(), error.message());
            }
            if (statutes.register(statute)) {
                log.debug("Loaded statute: {} - {}", statute.id(), statute.title());
            } else {
                log.warn("Skipping duplicate statute {} in {}", statute.id(), resource.getFilename());
            }
        }
    }

    @Override
    public Optional<Statute> resolve(String id) {
        return statutes.resolve(id);
    }

    @Override
    public List<Statute> findAll() {
        return statutes.findAll();
    }

    @Override
    public List<Statute> findByJurisdiction(String jurisdiction) {
        return statutes.findByJurisdiction(jurisdiction);
    }
}
