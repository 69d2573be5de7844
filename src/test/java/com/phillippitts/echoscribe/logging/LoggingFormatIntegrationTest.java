package com.phillippitts.echoscribe.logging;

import com.phillippitts.echoscribe.service.retry.DefaultRetryExecutor;
import com.phillippitts.echoscribe.testutil.InMemoryAppender;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Integration test to validate structured log context (MDC) for an analysis request.
 *
 * Verifies that:
 * - The retry executor logs the successful attempt
 * - The log event carries requestId and meetingId set by MdcFilter, although the attempt
 *   itself runs on the AI worker pool
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "ai.openai.api-key=sk-integration-test-key"
)
class LoggingFormatIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;

    @BeforeEach
    void setUpAppender() {
        appender = InMemoryAppender.attachTo(DefaultRetryExecutor.class);
    }

    @AfterEach
    void tearDownAppender() {
        appender.detach();
    }

    @Test
    void shouldIncludeRequestIdAndMeetingIdInRetryLogs() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add("X-Request-ID", "abc123");
        headers.add("X-Meeting-ID", "meeting-9");

        ResponseEntity<String> response = restTemplate.exchange(
                "/api/analysis/summary",
                HttpMethod.POST,
                new HttpEntity<>("{\"text\":\"Quarterly planning went well overall.\",\"meetingId\":\"meeting-9\"}",
                        headers),
                String.class
        );

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();

        await().atMost(3, SECONDS).until(() -> appender.getEvents().stream()
                .anyMatch(e -> e.getMessage().getFormattedMessage().contains("Operation summary attempt 1/")));

        LogEvent event = appender.getEvents().stream()
                .filter(e -> e.getMessage().getFormattedMessage().contains("Operation summary attempt 1/"))
                .findFirst()
                .orElseThrow();

        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData.<String>getValue("requestId")).isEqualTo("abc123");
        assertThat(contextData.<String>getValue("meetingId")).isEqualTo("meeting-9");
        assertThat(event.getLoggerName()).isEqualTo(DefaultRetryExecutor.class.getName());
    }
}
