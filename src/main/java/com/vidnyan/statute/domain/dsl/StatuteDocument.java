package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.Statute;

import java.util.List;
import java.util.Optional;

/**
 * One parsed source unit: its imports followed by its statutes, in source order.
 */
public record StatuteDocument(
    List<ImportDeclaration> imports,
    List<Statute> statutes
) {

    public StatuteDocument {
        imports = List.copyOf(imports);
        statutes = List.copyOf(statutes);
    }

    public Optional<Statute> find(String id) {
        return statutes.stream()
                .filter(s -> s.id().equals(id))
                .findFirst();
    }
}
