package com.example.docsync.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Curated mapping from short code-operation triggers to the words documentation
 * normally uses for them.
 */
public final class OperationalTriggerTable {

    private static final Map<String, List<String>> DEFAULTS;

    static {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("dist", List.of("distance", "euclidean", "manhattan", "metric", "proximity"));
        table.put("save", List.of("persist", "store", "write", "serialize", "export"));
        table.put("load", List.of("read", "import", "deserialize", "restore", "open"));
        table.put("train", List.of("training", "fit", "learn", "optimize"));
        table.put("predict", List.of("prediction", "inference", "infer", "estimate", "forecast", "classify"));
        table.put("encrypt", List.of("encryption", "cipher", "crypto", "secure"));
        table.put("auth", List.of("authentication", "authorization", "login", "credential", "token"));
        table.put("cache", List.of("caching", "memoize", "memoization", "buffer"));
        table.put("retry", List.of("retries", "backoff", "attempt", "resilience"));
        DEFAULTS = Collections.unmodifiableMap(table);
    }

    private final Map<String, List<String>> synonyms;

    public OperationalTriggerTable(Map<String, List<String>> synonyms) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (synonyms != null) {
            synonyms.forEach((trigger, words) -> copy.put(
                    trigger.toLowerCase(Locale.ROOT),
                    words == null ? List.of() : words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList()));
        }
        this.synonyms = Collections.unmodifiableMap(copy);
    }

    public static OperationalTriggerTable defaults() {
        return new OperationalTriggerTable(DEFAULTS);
    }

    /** Triggers in table order. */
    public Map<String, List<String>> entries() {
        return synonyms;
    }

    public int size() {
        return synonyms.size();
    }
}
