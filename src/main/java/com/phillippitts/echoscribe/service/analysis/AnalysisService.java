package com.phillippitts.echoscribe.service.analysis;

import com.phillippitts.echoscribe.config.settings.AiServiceSettings;
import com.phillippitts.echoscribe.domain.ActionItemsResult;
import com.phillippitts.echoscribe.domain.AnalysisRequest;
import com.phillippitts.echoscribe.domain.AnalysisResult;
import com.phillippitts.echoscribe.domain.SentimentResult;
import com.phillippitts.echoscribe.domain.SummaryResult;
import com.phillippitts.echoscribe.exception.InvalidInputException;
import com.phillippitts.echoscribe.service.retry.RetryExecutor;
import com.phillippitts.echoscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Meeting-analysis operations (summary, sentiment, action items, and a combined entry point).
 *
 * <p>Model calls are not wired yet: each operation returns a fixed placeholder result. The
 * call path is the real one, though. Input is validated, then the operation runs on the AI
 * service executor under the OpenAI retry policy ({@code ai.openai.max-retries},
 * {@code ai.openai.retry-delay}) with the request timeout as overall deadline.
 */
@Service
public class AnalysisService {

    private static final Logger LOG = LogManager.getLogger(AnalysisService.class);

    static final int MIN_TEXT_LENGTH = 10;
    private static final int LOG_PREVIEW_CHARS = 40;

    private final RetryExecutor retryExecutor;
    private final Executor executor;
    private final AiServiceSettings settings;

    public AnalysisService(RetryExecutor retryExecutor,
                           @Qualifier("aiServiceExecutor") Executor executor,
                           AiServiceSettings settings) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * General analysis keyed by {@link AnalysisRequest#analysisType()}. The type is echoed back
     * unchanged; unknown types are not rejected.
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        validateInput(request);
        LOG.info("Analyzing meeting: {}, type: {}", request.meetingId(), request.analysisType());
        return run("analyze", () -> new AnalysisResult(
                request.meetingId(),
                request.analysisType(),
                Map.of(
                        "message", "Analysis service initialized",
                        "textLength", request.text().length(),
                        "analysisType", request.analysisType(),
                        "status", "placeholder"),
                0.95));
    }

    public SummaryResult summarize(AnalysisRequest request) {
        validateInput(request);
        LOG.info("Generating summary for meeting: {}", request.meetingId());
        return run("summary", () -> new SummaryResult(
                request.meetingId(),
                "This is a placeholder summary. The meeting covered project updates and next steps.",
                List.of("Project is on track", "Next milestone due in 2 weeks", "Team needs additional resources"),
                List.of(),
                0.92));
    }

    public SentimentResult analyzeSentiment(AnalysisRequest request) {
        validateInput(request);
        LOG.info("Analyzing sentiment for meeting: {}", request.meetingId());
        return run("sentiment", () -> new SentimentResult(
                request.meetingId(),
                "positive",
                0.75,
                Map.of("joy", 0.4, "trust", 0.35, "anticipation", 0.2, "surprise", 0.05),
                0.88));
    }

    public ActionItemsResult extractActionItems(AnalysisRequest request) {
        validateInput(request);
        LOG.info("Extracting action items for meeting: {}", request.meetingId());
        return run("action-items", () -> new ActionItemsResult(
                request.meetingId(),
                List.of(
                        new ActionItemsResult.ActionItem(1, "Follow up on project timeline", "high", null, null),
                        new ActionItemsResult.ActionItem(2, "Schedule next team meeting", "medium", null, null))));
    }

    /**
     * Rejects missing or too-short transcript text.
     *
     * @throws InvalidInputException if the text is null or shorter than {@value #MIN_TEXT_LENGTH}
     *         characters once trimmed
     */
    void validateInput(AnalysisRequest request) {
        if (request == null || request.text() == null) {
            throw new InvalidInputException("Text input is required");
        }
        if (request.text().strip().length() < MIN_TEXT_LENGTH) {
            throw new InvalidInputException("Text must be at least " + MIN_TEXT_LENGTH + " characters long");
        }
        LOG.debug("Accepted input: chars={}, preview='{}'", request.text().length(),
                LogSanitizer.truncate(request.text(), LOG_PREVIEW_CHARS));
    }

    private <T> T run(String operation, Supplier<T> placeholder) {
        int timeoutSeconds = settings.server().requestTimeoutSeconds();
        Duration deadline = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;
        return retryExecutor.executeAndWait(operation,
                () -> CompletableFuture.supplyAsync(placeholder, executor),
                settings.openai().retryPolicy(),
                deadline);
    }
}
