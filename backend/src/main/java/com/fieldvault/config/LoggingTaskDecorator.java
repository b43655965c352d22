package com.fieldvault.config;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskDecorator;

/**
 * Logs how long each codec task waited in the queue and how long it ran, at debug level.
 */
public class LoggingTaskDecorator implements TaskDecorator {

    private static final Logger log = LoggerFactory.getLogger(LoggingTaskDecorator.class);

    @Override
    public Runnable decorate(Runnable runnable) {
        if (!log.isDebugEnabled()) {
            return runnable;
        }
        String submissionThreadName = Thread.currentThread().getName();
        Instant submissionTime = Instant.now();

        return () -> {
            Instant startTime = Instant.now();
            try {
                runnable.run();
            } finally {
                log.debug("Codec task | Submitted by: {} | Queued: {} ms | Ran: {} ms",
                        submissionThreadName,
                        Duration.between(submissionTime, startTime).toMillis(),
                        Duration.between(startTime, Instant.now()).toMillis());
            }
        };
    }
}
