package com.adobe.aep.waflookout.publisher;

import com.adobe.aep.waflookout.MetricRejectedException;
import com.adobe.aep.waflookout.TransientPublishException;
import com.adobe.aep.waflookout.records.MetricDataPoint;
import com.adobe.aep.waflookout.records.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps a metric series dense by writing an explicit zero once per interval.
 * <p>
 * The detector aggregates the series with SUM, so a zero written next to an organic point leaves the
 * interval total unchanged and a zero written twice is still zero. The write is therefore unconditional
 * and a retried {@link #tick()} is always safe. Nothing is retried here; the caller owns the schedule.
 */
public class ZeroValuePublisher {

    private static final Logger logger = LoggerFactory.getLogger(ZeroValuePublisher.class);

    private final MetricStore metricStore;
    private final MetricSeries series;
    private final Duration interval;
    private final Clock clock;

    public ZeroValuePublisher(MetricStore metricStore, MetricSeries series, Duration interval, Clock clock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        this.metricStore = metricStore;
        this.series = series;
        this.interval = interval;
        this.clock = clock;
    }

    /**
     * Writes the zero point for the interval containing the current instant.
     *
     * @return the interval start the point was stamped with
     * @throws TransientPublishException if the metric store could not be reached; nothing was written
     * @throws MetricRejectedException if the metric store refused the point; retrying will not help
     */
    public Instant tick() throws TransientPublishException, MetricRejectedException {
        Instant intervalStart = intervalStart(clock.instant());
        metricStore.put(MetricDataPoint.zero(series, intervalStart));
        logger.info("Published zero value for {}/{} {} at {}",
                series.namespace(), series.metricName(), series.dimensions(), intervalStart);
        return intervalStart;
    }

    /**
     * Floors {@code now} to the interval boundary, counted from the epoch.
     */
    public Instant intervalStart(Instant now) {
        long intervalMillis = interval.toMillis();
        long millis = now.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, intervalMillis) * intervalMillis);
    }

    /**
     * Hands {@link #tick()} to a trigger. Failures are logged and left for the next firing.
     */
    public void scheduleWith(PeriodicTrigger trigger) {
        trigger.start(interval, () -> {
            try {
                tick();
            } catch (TransientPublishException e) {
                logger.warn("Zero value not published, next tick will retry: {}", e.getMessage());
            } catch (MetricRejectedException e) {
                logger.error("Zero value rejected by the metric store, check the series configuration", e);
            }
        });
    }
}
