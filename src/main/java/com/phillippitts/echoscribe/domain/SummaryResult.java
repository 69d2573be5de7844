package com.phillippitts.echoscribe.domain;

import java.util.List;

/**
 * Meeting summary.
 */
public record SummaryResult(
        String meetingId,
        String summary,
        List<String> keyPoints,
        List<String> participantsMentioned,
        double confidenceScore
) {

    public SummaryResult {
        keyPoints = List.copyOf(keyPoints);
        participantsMentioned = List.copyOf(participantsMentioned);
    }
}
