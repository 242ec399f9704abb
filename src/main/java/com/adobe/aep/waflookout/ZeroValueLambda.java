package com.adobe.aep.waflookout;

import com.adobe.aep.waflookout.publisher.CloudWatchMetricStore;
import com.adobe.aep.waflookout.publisher.ScheduledExecutorTrigger;
import com.adobe.aep.waflookout.publisher.ZeroValuePublisher;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.ScheduledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Target of the EventBridge schedule that keeps the blocked-requests series dense.
 */
public class ZeroValueLambda implements RequestHandler<ScheduledEvent, String> {

    static {
        LookoutConfig.applyLogLevel(System.getenv("LOG_LEVEL"));
    }

    private static final Logger logger = LoggerFactory.getLogger(ZeroValueLambda.class);

    private final ZeroValuePublisher publisher;

    public ZeroValueLambda() {
        // the publisher never needs the account id, so no STS call
        this(createPublisher(LookoutConfig.fromEnvironment(() -> "")));
    }

    public ZeroValueLambda(ZeroValuePublisher publisher) {
        this.publisher = publisher;
    }

    static ZeroValuePublisher createPublisher(LookoutConfig config) {
        return new ZeroValuePublisher(
                new CloudWatchMetricStore(AwsClients.cloudWatch(config.region())),
                config.series(),
                config.publishInterval(),
                Clock.systemUTC());
    }

    /**
     * @return the start of the interval the zero was written for
     */
    @Override
    public String handleRequest(ScheduledEvent event, Context context) {
        context.getLogger().log(String.format("Scheduled trigger %s, request %s",
                event == null ? "-" : event.getId(), context.getAwsRequestId()));
        try {
            return publisher.tick().toString();
        } catch (TransientPublishException e) {
            logger.warn("Zero value not published: {}", e.getMessage());
            throw new InvocationFailedException("Metric store unreachable", e);
        } catch (MetricRejectedException e) {
            logger.error("Zero value rejected by the metric store, check the series configuration", e);
            throw new InvocationFailedException("Metric rejected", e);
        }
    }

    /**
     * Runs the publisher as a long-lived process with a local schedule instead of EventBridge.
     */
    public static void main(String[] args) throws InterruptedException {
        ZeroValuePublisher publisher = createPublisher(LookoutConfig.fromEnvironment(() -> ""));
        ScheduledExecutorTrigger trigger = new ScheduledExecutorTrigger();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            trigger.close();
            stopped.countDown();
        }));
        publisher.scheduleWith(trigger);
        stopped.await();
    }
}
