package me.golemcore.monitor.adapter.outbound.notification;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import me.golemcore.monitor.domain.model.MatchRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingNotificationAdapterTest {

    private final LoggingNotificationAdapter adapter = new LoggingNotificationAdapter();
    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LoggingNotificationAdapter.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void shouldLogMatchWithSenderNameAndFilenames() {
        adapter.notify(MatchRecord.builder()
                .messageId("m1")
                .sender("\"Varun K\" <varun@example.com>")
                .subject("Offer")
                .receivedAt(Instant.parse("2026-10-19T12:00:00Z"))
                .matchedFilenames(List.of("offer.txt", "terms.pdf"))
                .build());

        assertEquals(1, appender.list.size());
        assertEquals("[Notify] New match from Varun K: 'Offer' (offer.txt, terms.pdf)",
                appender.list.get(0).getFormattedMessage());
    }

    @Test
    void shouldLogCycleSummaryWithPlural() {
        adapter.notifyCycleSummary(1, "varun");
        adapter.notifyCycleSummary(3, "varun");

        assertEquals("[Notify] 1 new email found with 'varun'", appender.list.get(0).getFormattedMessage());
        assertEquals("[Notify] 3 new emails found with 'varun'", appender.list.get(1).getFormattedMessage());
    }
}
