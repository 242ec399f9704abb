package com.adobe.aep.waflookout.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Local stand-in for the EventBridge schedule, used when the publisher runs as a plain process.
 */
public class ScheduledExecutorTrigger implements PeriodicTrigger {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledExecutorTrigger.class);

    private final ScheduledExecutorService executor;

    public ScheduledExecutorTrigger() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "zero-value-trigger");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ScheduledExecutorTrigger(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public void start(Duration cadence, Runnable callback) {
        logger.info("Firing every {}", cadence);
        executor.scheduleAtFixedRate(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                // an escaping exception would cancel every future run
                logger.error("Scheduled callback failed", e);
            }
        }, 0, cadence.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
