package com.adobe.aep.waflookout.publisher;

import com.adobe.aep.waflookout.MetricRejectedException;
import com.adobe.aep.waflookout.TransientPublishException;
import com.adobe.aep.waflookout.records.MetricDataPoint;
import com.adobe.aep.waflookout.records.MetricDimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.util.List;
import java.util.stream.Collectors;

public class CloudWatchMetricStore implements MetricStore {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricStore.class);

    private final CloudWatchClient cloudWatch;

    public CloudWatchMetricStore(CloudWatchClient cloudWatch) {
        this.cloudWatch = cloudWatch;
    }

    @Override
    public void put(MetricDataPoint point) throws TransientPublishException, MetricRejectedException {
        PutMetricDataRequest request = toRequest(point);
        logger.debug("PutMetricData {}/{} dimensions={} value={} at {}",
                point.series().namespace(), point.series().metricName(),
                point.series().dimensions(), point.value(), point.timestamp());
        try {
            cloudWatch.putMetricData(request);
        } catch (AwsServiceException e) {
            String message = String.format("CloudWatch refused %s/%s with status %d: %s",
                    point.series().namespace(), point.series().metricName(), e.statusCode(), e.getMessage());
            if (e.isThrottlingException() || e.statusCode() >= 500 || e.retryable()) {
                throw new TransientPublishException(message, e);
            }
            throw new MetricRejectedException(message, e);
        } catch (SdkClientException e) {
            throw new TransientPublishException(String.format("Failed to put %s/%s to CloudWatch: %s",
                    point.series().namespace(), point.series().metricName(), e.getMessage()), e);
        } catch (SdkException e) {
            String message = String.format("Failed to put %s/%s to CloudWatch: %s",
                    point.series().namespace(), point.series().metricName(), e.getMessage());
            if (e.retryable()) {
                throw new TransientPublishException(message, e);
            }
            throw new MetricRejectedException(message, e);
        }
    }

    static PutMetricDataRequest toRequest(MetricDataPoint point) {
        List<Dimension> dimensions = point.series().dimensions().stream()
                .map(CloudWatchMetricStore::toDimension)
                .collect(Collectors.toList());
        MetricDatum datum = MetricDatum.builder()
                .metricName(point.series().metricName())
                .dimensions(dimensions)
                .value(point.value())
                .timestamp(point.timestamp())
                .unit(point.unit() == null ? StandardUnit.NONE : StandardUnit.fromValue(point.unit()))
                .build();
        return PutMetricDataRequest.builder()
                .namespace(point.series().namespace())
                .metricData(datum)
                .build();
    }

    private static Dimension toDimension(MetricDimension dimension) {
        return Dimension.builder()
                .name(dimension.name())
                .value(dimension.value())
                .build();
    }
}
