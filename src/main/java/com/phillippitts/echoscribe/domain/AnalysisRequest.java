package com.phillippitts.echoscribe.domain;

/**
 * Request to analyze a meeting transcript.
 *
 * @param text         transcript text
 * @param meetingId    optional meeting identifier, echoed in the response
 * @param analysisType kind of analysis for the combined endpoint; defaults to {@value #DEFAULT_TYPE}
 */
public record AnalysisRequest(String text, String meetingId, String analysisType) {

    public static final String DEFAULT_TYPE = "summary";

    public AnalysisRequest {
        if (analysisType == null || analysisType.isBlank()) {
            analysisType = DEFAULT_TYPE;
        }
    }
}
