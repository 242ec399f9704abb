package com.adobe.aep.waflookout.publisher;

import com.adobe.aep.waflookout.MetricRejectedException;
import com.adobe.aep.waflookout.TransientPublishException;
import com.adobe.aep.waflookout.records.MetricDataPoint;
import com.adobe.aep.waflookout.testutil.TestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.InvalidParameterValueException;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataResponse;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class CloudWatchMetricStoreTest {

    private static final Instant TIMESTAMP = Instant.parse("2024-01-01T12:05:00Z");

    @Mock
    private CloudWatchClient cloudWatch;

    private CloudWatchMetricStore store;

    @BeforeEach
    public void setUp() {
        store = new CloudWatchMetricStore(cloudWatch);
    }

    @Test
    public void testPutSendsSingleDatumWithDimensionsInOrder() throws Exception {
        when(cloudWatch.putMetricData(any(PutMetricDataRequest.class)))
                .thenReturn(PutMetricDataResponse.builder().build());

        store.put(MetricDataPoint.zero(TestFactory.series(), TIMESTAMP));

        ArgumentCaptor<PutMetricDataRequest> captor = ArgumentCaptor.forClass(PutMetricDataRequest.class);
        verify(cloudWatch).putMetricData(captor.capture());
        PutMetricDataRequest request = captor.getValue();
        assertThat(request.namespace()).isEqualTo("AWS/WAFV2");
        assertThat(request.metricData()).hasSize(1);
        MetricDatum datum = request.metricData().get(0);
        assertThat(datum.metricName()).isEqualTo("BlockedRequests");
        assertThat(datum.value()).isEqualTo(0d);
        assertThat(datum.timestamp()).isEqualTo(TIMESTAMP);
        assertThat(datum.unit()).isEqualTo(StandardUnit.COUNT);
        assertThat(datum.dimensions()).extracting(d -> d.name() + "=" + d.value())
                .containsExactly("Region=us-east-1", "Rule=AWS-AWSManagedRulesCommonRuleSet",
                        "WebACL=WebACLForWAFDemo");
    }

    @Test
    public void testUnreachableEndpointIsTransient() {
        when(cloudWatch.putMetricData(any(PutMetricDataRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertThatThrownBy(() -> store.put(MetricDataPoint.zero(TestFactory.series(), TIMESTAMP)))
                .isInstanceOf(TransientPublishException.class)
                .hasMessageContaining("AWS/WAFV2/BlockedRequests")
                .hasCauseInstanceOf(SdkClientException.class);
    }

    @Test
    public void testServiceErrorIsTransient() {
        when(cloudWatch.putMetricData(any(PutMetricDataRequest.class)))
                .thenThrow(CloudWatchException.builder().statusCode(503).message("Service Unavailable").build());

        assertThatThrownBy(() -> store.put(MetricDataPoint.zero(TestFactory.series(), TIMESTAMP)))
                .isInstanceOf(TransientPublishException.class);
    }

    @Test
    public void testThrottlingIsTransient() {
        when(cloudWatch.putMetricData(any(PutMetricDataRequest.class)))
                .thenThrow(CloudWatchException.builder().statusCode(429).message("Rate exceeded").build());

        assertThatThrownBy(() -> store.put(MetricDataPoint.zero(TestFactory.series(), TIMESTAMP)))
                .isInstanceOf(TransientPublishException.class);
    }

    @Test
    public void testInvalidParameterIsRejectedNotTransient() {
        when(cloudWatch.putMetricData(any(PutMetricDataRequest.class)))
                .thenThrow(InvalidParameterValueException.builder().statusCode(400)
                        .message("The value AWS/ for parameter Namespace is invalid.").build());

        assertThatThrownBy(() -> store.put(MetricDataPoint.zero(TestFactory.series(), TIMESTAMP)))
                .isInstanceOf(MetricRejectedException.class)
                .hasMessageContaining("400")
                .satisfies(e -> assertThat(((MetricRejectedException) e).isRetryable()).isFalse());
    }

    @Test
    public void testAccessDeniedIsRejected() {
        when(cloudWatch.putMetricData(any(PutMetricDataRequest.class)))
                .thenThrow(CloudWatchException.builder().statusCode(403).message("AccessDenied").build());

        assertThatThrownBy(() -> store.put(MetricDataPoint.zero(TestFactory.series(), TIMESTAMP)))
                .isInstanceOf(MetricRejectedException.class);
    }
}
