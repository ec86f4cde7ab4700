// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.txtracker.debug");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        TrackerDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logIngest("nor this");
        assertTrue(appender.list.isEmpty());
    }

    @Test
    void formatsWhenEnabled() {
        TrackerDebug.setEnabled(true);
        DebugLogger.log("height=%d", 4);
        assertEquals(1, appender.list.size());
        assertEquals("height=4", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void switchesAreIndependent() {
        TrackerDebug.setQueryLogging(true);
        DebugLogger.logIngest("ingest");
        DebugLogger.logQuery("query");
        assertEquals(1, appender.list.size());
        assertEquals("query", appender.list.get(0).getFormattedMessage());
        assertTrue(TrackerDebug.isEnabled());
    }
}
