package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.SourceSpan;

import java.util.Optional;

/**
 * {@code IMPORT "path" [AS alias]} clause. The path is kept opaque; resolving it is up to the caller.
 */
public record ImportDeclaration(
    String path,
    Optional<String> alias,
    SourceSpan span
) {}
