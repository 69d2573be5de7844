package com.phillippitts.echoscribe.domain;

import java.util.Map;

/**
 * Result of the combined analysis endpoint.
 *
 * @param result type-specific payload
 */
public record AnalysisResult(
        String meetingId,
        String analysisType,
        Map<String, Object> result,
        Double confidenceScore
) {

    public AnalysisResult {
        result = Map.copyOf(result);
    }
}
