package com.example.docsync.extraction;

import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.SourceUnit;

import java.util.Set;

/**
 * Extracts named entities (functions, classes, methods, configuration keys) from source code.
 * Implementations specialize on a language family; {@link #supports(SourceUnit)} tells
 * the {@link CompositeEntityExtractor} which one to pick for a given unit.
 */
public interface EntityExtractor {

    boolean supports(SourceUnit unit);

    /**
     * @param unit decoded source file
     * @return entities in order of discovery, de-duplicated by name
     */
    Set<CodeEntity> extract(SourceUnit unit);

    default Set<CodeEntity> extractEntities(String codeText) {
        return extract(SourceUnit.of(codeText));
    }
}
