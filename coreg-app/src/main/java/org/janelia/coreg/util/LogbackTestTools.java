package org.janelia.coreg.util;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.read.ListAppender;

/**
 * Captures logback events so tests can assert on logged verdicts.
 */
public class LogbackTestTools {

    /**
     * Attaches an in-memory appender to the named logger so that callers can inspect emitted events.
     * Remove it with {@link #detachCaptureAppender} when done.
     */
    public static ListAppender<ILoggingEvent> attachCaptureAppender(final Class<?> loggerClass) {
        final Logger logger = getLogger(loggerClass.getName());
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.setName(CAPTURE_APPENDER_NAME);
        appender.setContext(logger.getLoggerContext());
        appender.start();
        logger.addAppender(appender);
        return appender;
    }

    public static void detachCaptureAppender(final Class<?> loggerClass) {
        final Logger logger = getLogger(loggerClass.getName());
        final Appender<ILoggingEvent> appender = logger.getAppender(CAPTURE_APPENDER_NAME);
        if (appender != null) {
            appender.stop();
            logger.detachAppender(appender);
        }
    }

    public static List<String> getFormattedMessages(final ListAppender<ILoggingEvent> appender) {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    private static Logger getLogger(final String loggerName) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(loggerName);
        if (logger == null) {
            throw new IllegalArgumentException("logger with name '" + loggerName + "' not found");
        }
        return logger;
    }

    public static final String CAPTURE_APPENDER_NAME = "testCaptureAppender";
}
