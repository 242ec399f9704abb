package com.adobe.aep.waflookout.records;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Alert payload sent by Lookout for Metrics to its Lambda alert target. Every field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnomalyNotification(
        @JsonProperty("alertName")
        String alertName,
        @JsonProperty("alertDescription")
        String alertDescription,
        @JsonProperty("anomalyScore")
        Double anomalyScore,
        @JsonProperty("anomalyDetectorArn")
        String anomalyDetectorArn,
        @JsonProperty("alertEventId")
        String alertEventId
) {
}
