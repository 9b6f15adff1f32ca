package com.phillippitts.dictation.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Checks that a control API call carries requestId and userId from {@code MdcFilter} into the
 * Log4j2 context of the handler's log lines, and that the request id is echoed back.
 */
@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LoggingFormatIntegrationTest {

    private static final String PING_LOGGER = "com.phillippitts.dictation.presentation.controller.PingController";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(PING_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldIncludeRequestIdAndUserIdInStructuredLogs() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "abc123");
        headers.add("X-User-ID", "demo");

        ResponseEntity<String> response = restTemplate.exchange(
                "http://localhost:" + port + "/ping",
                HttpMethod.GET,
                new HttpEntity<>(headers),
                String.class
        );

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(response.getHeaders().getFirst("X-Request-ID")).isEqualTo("abc123");

        await().atMost(3, SECONDS).until(() -> findPingEvent() != null);

        LogEvent event = findPingEvent();
        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData).isNotNull();
        assertThat((String) contextData.getValue("requestId")).isEqualTo("abc123");
        assertThat((String) contextData.getValue("userId")).isEqualTo("demo");
        assertThat((String) contextData.getValue("endpoint")).isEqualTo("GET /ping");
        assertThat(event.getLoggerName()).isEqualTo(PING_LOGGER);
    }

    private LogEvent findPingEvent() {
        return appender.getEvents().stream()
                .filter(e -> e.getMessage() != null
                        && String.valueOf(e.getMessage().getFormattedMessage()).contains("Ping received"))
                .findFirst()
                .orElse(null);
    }

    /**
     * Captures LogEvents for assertions.
     */
    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return Collections.unmodifiableList(events);
        }
    }
}
