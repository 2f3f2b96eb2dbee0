package com.example.docsync.extraction;

import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.SourceUnit;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dispatches every source unit to the first specialized extractor that supports it,
 * and to the generic fallback otherwise.
 */
public final class CompositeEntityExtractor implements EntityExtractor {

    private final List<EntityExtractor> specialized;
    private final EntityExtractor fallback;

    public CompositeEntityExtractor(List<EntityExtractor> specialized, EntityExtractor fallback) {
        this.specialized = List.copyOf(specialized);
        this.fallback = fallback;
    }

    /** Java via JavaParser, everything else lexical. */
    public static CompositeEntityExtractor withDefaults() {
        LexicalEntityExtractor lexical = new LexicalEntityExtractor();
        return new CompositeEntityExtractor(List.of(new JavaEntityExtractor(lexical)), lexical);
    }

    @Override
    public boolean supports(SourceUnit unit) {
        return true;
    }

    @Override
    public Set<CodeEntity> extract(SourceUnit unit) {
        for (EntityExtractor extractor : specialized) {
            if (extractor.supports(unit)) {
                return extractor.extract(unit);
            }
        }
        return fallback.extract(unit);
    }

    /** Union of the entities of all units, in unit order. */
    public Set<CodeEntity> extractAll(List<SourceUnit> units) {
        Set<CodeEntity> all = new LinkedHashSet<>();
        for (SourceUnit unit : units) {
            all.addAll(extract(unit));
        }
        return Collections.unmodifiableSet(all);
    }
}
