package com.example.docsync.model;

import java.util.List;

/**
 * A code operation whose trigger token appears in code while neither the trigger
 * nor any of its synonyms appears in the documentation.
 *
 * @param trigger         code-side token (e.g. "dist")
 * @param missingSynonyms synonyms that were looked for in the documentation
 */
public record OperationalGap(
        String trigger,
        List<String> missingSynonyms
) {
    public OperationalGap {
        missingSynonyms = missingSynonyms != null ? List.copyOf(missingSynonyms) : List.of();
    }

    public String message() {
        if (missingSynonyms.isEmpty()) {
            return "OPERATIONAL GAP: code performs '%s' but the documentation never mentions it."
                    .formatted(trigger);
        }
        return "OPERATIONAL GAP: code performs '%s' but the documentation never mentions it (expected one of: %s)."
                .formatted(trigger, String.join(", ", missingSynonyms));
    }
}
