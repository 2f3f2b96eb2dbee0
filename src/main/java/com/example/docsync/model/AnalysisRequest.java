package com.example.docsync.model;

/**
 * JSON body of the text-based analysis endpoints.
 *
 * @param code          source code text (already aggregated)
 * @param documentation documentation text
 */
public record AnalysisRequest(String code, String documentation) {

    public AnalysisRequest {
        if (code == null) code = "";
        if (documentation == null) documentation = "";
    }
}
