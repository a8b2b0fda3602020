package com.indigententerprises.applications.toolkit.serviceimplementations;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * a uniquely named logger whose events are kept in memory, to be handed to a component's config.
 */
final class LogCapture {

    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender;

    private LogCapture(final Logger logger, final ListAppender<ILoggingEvent> appender) {
        this.logger = logger;
        this.appender = appender;
    }

    static LogCapture create() {
        final Logger logger = (Logger) LoggerFactory.getLogger("capture." + UUID.randomUUID());
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        return new LogCapture(logger, appender);
    }

    org.slf4j.Logger logger() {
        return logger;
    }

    List<String> messages(final Level level) {
        final List<String> messages = new ArrayList<>();

        for (final ILoggingEvent event : snapshot()) {
            if (event.getLevel() == level) {
                messages.add(event.getFormattedMessage());
            }
        }

        return messages;
    }

    int count(final Level level) {
        return messages(level).size();
    }

    private List<ILoggingEvent> snapshot() {
        // appends are synchronized on the appender
        synchronized (appender) {
            return new ArrayList<>(appender.list);
        }
    }
}
