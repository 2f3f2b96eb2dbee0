package com.example.docsync.analysis;

import com.example.docsync.extraction.ReferencePool;
import com.example.docsync.model.CodeEntity;
import com.example.docsync.model.EntityKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Split of the extracted entities into the ones the reference pool mentions and the ones it does not.
 * Entities are unique by case-insensitive name and sorted by it.
 */
public record EntityCoverage(List<CodeEntity> documented, List<CodeEntity> undocumented) {

    private static final Comparator<CodeEntity> BY_NAME =
            Comparator.comparing(CodeEntity::normalizedName).thenComparing(CodeEntity::name);

    public EntityCoverage {
        documented = documented.stream().sorted(BY_NAME).toList();
        undocumented = undocumented.stream().sorted(BY_NAME).toList();
    }

    public static EntityCoverage none() {
        return new EntityCoverage(List.of(), List.of());
    }

    /**
     * De-duplicates entities by case-insensitive name (first occurrence wins) and checks each one against the pool.
     */
    public static EntityCoverage of(Collection<CodeEntity> entities, ReferencePool pool) {
        Map<String, CodeEntity> unique = new LinkedHashMap<>();
        for (CodeEntity entity : entities) {
            unique.putIfAbsent(entity.normalizedName(), entity);
        }
        List<CodeEntity> documented = new ArrayList<>();
        List<CodeEntity> undocumented = new ArrayList<>();
        for (CodeEntity entity : unique.values()) {
            (pool.mentions(entity.name()) ? documented : undocumented).add(entity);
        }
        return new EntityCoverage(documented, undocumented);
    }

    public int total() {
        return documented.size() + undocumented.size();
    }

    /** Documented share of the entities, as an integer percentage. */
    public int coveragePercent() {
        return total() == 0 ? 0 : (int) ((documented.size() * 100L) / total());
    }

    public long count(EntityKind kind) {
        return documented.stream().filter(e -> e.kind() == kind).count()
                + undocumented.stream().filter(e -> e.kind() == kind).count();
    }
}
