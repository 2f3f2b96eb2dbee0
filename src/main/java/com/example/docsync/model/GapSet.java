package com.example.docsync.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Vocabulary partition between the code corpus and the documentation corpus.
 * The three sets are pairwise disjoint and together form the union of both vocabularies.
 *
 * @param common        terms present on both sides
 * @param missingInDoc  code terms the documentation never uses
 * @param missingInCode documentation terms absent from the code ("zombie" documentation)
 */
public record GapSet(
        SortedSet<String> common,
        SortedSet<String> missingInDoc,
        SortedSet<String> missingInCode
) {
    public GapSet {
        common = Collections.unmodifiableSortedSet(new TreeSet<>(common));
        missingInDoc = Collections.unmodifiableSortedSet(new TreeSet<>(missingInDoc));
        missingInCode = Collections.unmodifiableSortedSet(new TreeSet<>(missingInCode));
    }

    public static GapSet empty() {
        return new GapSet(new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
    }

    /** Every term of both vocabularies, each exactly once. */
    public Set<String> union() {
        TreeSet<String> all = new TreeSet<>(common);
        all.addAll(missingInDoc);
        all.addAll(missingInCode);
        return Collections.unmodifiableSet(all);
    }
}
