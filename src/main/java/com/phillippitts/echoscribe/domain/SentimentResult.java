package com.phillippitts.echoscribe.domain;

import java.util.Map;

/**
 * Sentiment of a meeting transcript.
 *
 * @param overallSentiment positive, neutral or negative
 * @param sentimentScore   strength of the overall sentiment, 0.0 to 1.0
 * @param emotions         emotion name to weight
 * @param confidenceScore  model confidence, 0.0 to 1.0
 */
public record SentimentResult(
        String meetingId,
        String overallSentiment,
        double sentimentScore,
        Map<String, Double> emotions,
        double confidenceScore
) {

    public SentimentResult {
        emotions = Map.copyOf(emotions);
    }
}
