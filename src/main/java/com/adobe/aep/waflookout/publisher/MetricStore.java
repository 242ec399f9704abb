package com.adobe.aep.waflookout.publisher;

import com.adobe.aep.waflookout.MetricRejectedException;
import com.adobe.aep.waflookout.TransientPublishException;
import com.adobe.aep.waflookout.records.MetricDataPoint;

/**
 * Destination of metric data points. A single call is a single atomic write.
 */
public interface MetricStore {

    void put(MetricDataPoint point) throws TransientPublishException, MetricRejectedException;
}
