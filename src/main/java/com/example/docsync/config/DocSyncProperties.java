package com.example.docsync.config;

import com.example.docsync.analysis.OperationalTriggerTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the consistency engine and its HTTP surface.
 * Every section falls back to built-in defaults when absent.
 */
@ConfigurationProperties(prefix = "docsync")
public record DocSyncProperties(
        Scoring scoring,
        Matching matching,
        Normalizer normalizer,
        Ingestion ingestion,
        Gate gate,
        Map<String, List<String>> operationalTriggers
) {

    public DocSyncProperties {
        if (scoring == null) scoring = new Scoring(null, null, null, null);
        if (matching == null) matching = new Matching(null);
        if (normalizer == null) normalizer = new Normalizer(null);
        if (ingestion == null) ingestion = new Ingestion(null, null, null, null);
        if (gate == null) gate = new Gate(null);
        if (operationalTriggers == null || operationalTriggers.isEmpty()) {
            operationalTriggers = OperationalTriggerTable.defaults().entries();
        }
    }

    public static DocSyncProperties defaults() {
        return new DocSyncProperties(null, null, null, null, null, null);
    }

    /**
     * Label bands (exclusive lower bounds on the 0-1 score) and suggestion bounds.
     *
     * @param productionQuality lower bound of PRODUCTION_QUALITY (default 0.85)
     * @param highAlignment     lower bound of HIGH_ALIGNMENT (default 0.65)
     * @param partialAlignment  lower bound of PARTIAL_ALIGNMENT (default 0.40)
     * @param suggestionLimit   items listed per suggestion group (default 5)
     */
    public record Scoring(Double productionQuality, Double highAlignment, Double partialAlignment,
                          Integer suggestionLimit) {
        public Scoring {
            if (productionQuality == null) productionQuality = 0.85;
            if (highAlignment == null) highAlignment = 0.65;
            if (partialAlignment == null) partialAlignment = 0.40;
            if (suggestionLimit == null) suggestionLimit = 5;
        }
    }

    /**
     * @param wordBoundary require entity names to appear as whole words in the documentation
     *                     (default false: plain substring search)
     */
    public record Matching(Boolean wordBoundary) {
        public Matching {
            if (wordBoundary == null) wordBoundary = false;
        }
    }

    /**
     * @param extraStopwords words ignored on top of the built-in stopword list
     */
    public record Normalizer(List<String> extraStopwords) {
        public Normalizer {
            if (extraStopwords == null) extraStopwords = List.of();
        }
    }

    /**
     * Upload handling.
     *
     * @param maxUploadBytes largest accepted upload (default 50 MB)
     * @param maxEntries     largest number of archive entries read (default 2000)
     * @param codeExtensions file extensions treated as source code
     * @param docExtensions  file extensions treated as documentation
     */
    public record Ingestion(Long maxUploadBytes, Integer maxEntries,
                            List<String> codeExtensions, List<String> docExtensions) {
        public Ingestion {
            if (maxUploadBytes == null) maxUploadBytes = 50L * 1024 * 1024;
            if (maxEntries == null) maxEntries = 2000;
            if (codeExtensions == null || codeExtensions.isEmpty()) {
                codeExtensions = List.of(".py", ".js", ".ts", ".java", ".cpp", ".cs", ".go", ".rs", ".kt");
            }
            if (docExtensions == null || docExtensions.isEmpty()) {
                docExtensions = List.of(".md", ".txt", ".rst");
            }
        }
    }

    /**
     * @param minScore minimum score a report needs to pass the CI gate (default 0.15)
     */
    public record Gate(Double minScore) {
        public Gate {
            if (minScore == null) minScore = 0.15;
        }
    }
}
