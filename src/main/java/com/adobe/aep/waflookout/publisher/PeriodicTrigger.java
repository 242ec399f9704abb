package com.adobe.aep.waflookout.publisher;

import java.time.Duration;

/**
 * Something that calls back on a fixed cadence. EventBridge plays this role when deployed as a Lambda.
 */
public interface PeriodicTrigger extends AutoCloseable {

    void start(Duration cadence, Runnable callback);

    @Override
    void close();
}
