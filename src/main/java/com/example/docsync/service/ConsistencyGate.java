package com.example.docsync.service;

import com.example.docsync.config.DocSyncProperties;
import com.example.docsync.model.ConsistencyReport;
import com.example.docsync.model.GateVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Pass/fail check for CI pipelines: a report passes when its score reaches the configured minimum.
 */
@Service
public class ConsistencyGate {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyGate.class);

    private final double minScore;

    public ConsistencyGate(DocSyncProperties properties) {
        this.minScore = properties.gate().minScore();
    }

    public GateVerdict evaluate(ConsistencyReport report) {
        boolean passed = report.score() >= minScore;
        String message = passed
                ? String.format(Locale.ROOT, "PASSED: consistency score %.4f meets the minimum of %.2f.",
                        report.score(), minScore)
                : String.format(Locale.ROOT, "FAILED: consistency score %.4f is below the minimum of %.2f. %s",
                        report.score(), minScore, report.summary());
        log.info("ConsistencyGate: {} (score {}, minimum {})", passed ? "passed" : "failed", report.score(), minScore);
        return new GateVerdict(passed, minScore, report.score(), report.label(), message, report);
    }

    public double minScore() {
        return minScore;
    }
}
