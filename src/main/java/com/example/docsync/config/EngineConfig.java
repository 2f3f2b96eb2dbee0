package com.example.docsync.config;

import com.example.docsync.analysis.GapAnalyzer;
import com.example.docsync.analysis.OperationalTriggerTable;
import com.example.docsync.analysis.ReportBuilder;
import com.example.docsync.analysis.ScoringPolicy;
import com.example.docsync.analysis.TextNormalizer;
import com.example.docsync.analysis.VectorSimilarityModel;
import com.example.docsync.extraction.CompositeEntityExtractor;
import com.example.docsync.extraction.ReferenceExtractor;
import com.example.docsync.orchestrator.ConsistencyEngine;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring of the consistency engine from {@link DocSyncProperties}.
 * The engine classes themselves carry no Spring annotations.
 */
@Configuration
public class EngineConfig {

    @Bean
    public TextNormalizer textNormalizer(DocSyncProperties properties) {
        return new TextNormalizer(properties.normalizer().extraStopwords());
    }

    @Bean
    public ScoringPolicy scoringPolicy(DocSyncProperties properties) {
        DocSyncProperties.Scoring scoring = properties.scoring();
        return new ScoringPolicy(scoring.productionQuality(), scoring.highAlignment(),
                scoring.partialAlignment(), scoring.suggestionLimit());
    }

    /**
     * Single shared engine, used concurrently by request threads.
     */
    @Bean
    public ConsistencyEngine consistencyEngine(DocSyncProperties properties,
                                               TextNormalizer normalizer,
                                               ScoringPolicy scoringPolicy) {
        return new ConsistencyEngine(
                CompositeEntityExtractor.withDefaults(),
                new ReferenceExtractor(normalizer, properties.matching().wordBoundary()),
                new VectorSimilarityModel(normalizer),
                new GapAnalyzer(normalizer, new OperationalTriggerTable(properties.operationalTriggers())),
                new ReportBuilder(scoringPolicy));
    }

    /**
     * ObjectMapper condiviso per la serializzazione JSON dei report.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
