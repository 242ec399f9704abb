package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.LookoutConfig;
import com.adobe.aep.waflookout.MalformedNotificationException;
import com.adobe.aep.waflookout.records.AnomalyNotification;
import com.adobe.aep.waflookout.records.RecordState;
import com.adobe.aep.waflookout.records.Remediation;
import com.adobe.aep.waflookout.records.ResourceRef;
import com.adobe.aep.waflookout.records.SecurityFinding;
import com.adobe.aep.waflookout.records.Severity;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import static com.adobe.aep.waflookout.finding.NotificationSanitizer.*;

/**
 * Turns one Lookout for Metrics alert into one Security Hub finding. Holds no state between calls.
 */
public class FindingBuilder {

    public static final String SCHEMA_VERSION = "2018-10-08";
    public static final String GENERATOR_ID = "LookoutForMetrics";
    public static final String FINDING_TYPE = "AWS WAF Anomaly";
    public static final String PRODUCT_NAME = "AWS WAF/Lookout For Metrics";
    public static final String REMEDIATION_TEXT =
            "Navigate in Lookout for Metrics to see more information on this anomaly";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSxxx");

    private final LookoutConfig config;
    private final Clock clock;

    public FindingBuilder(LookoutConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws MalformedNotificationException if a required field is missing or unusable
     */
    public SecurityFinding build(AnomalyNotification notification) throws MalformedNotificationException {
        if (notification == null) {
            throw new MalformedNotificationException("Empty notification");
        }
        String alertName = requireCleanText("alertName", notification.alertName(), MAX_TITLE_LENGTH);
        String alertDescription = requireCleanText("alertDescription", notification.alertDescription(),
                MAX_DESCRIPTION_LENGTH);
        double anomalyScore = requireScore(notification.anomalyScore());
        String detectorArn = requireIdentifier("anomalyDetectorArn", notification.anomalyDetectorArn());
        String alertEventId = requireIdentifier("alertEventId", notification.alertEventId());
        String anomalyId = anomalyId(alertEventId);

        String findingId = config.findingIdGenerator().generate(notification);
        String now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).format(TIMESTAMP_FORMAT);
        Severity severity = config.severityPolicy().severityFor(anomalyScore);

        String description = truncate(String.format("Anomaly detected [%s] with a score of %s",
                alertDescription, anomalyScore), MAX_DESCRIPTION_LENGTH);

        return new SecurityFinding(
                findingId,
                SCHEMA_VERSION,
                config.productArn(),
                config.accountId(),
                GENERATOR_ID,
                List.of(FINDING_TYPE),
                now,
                now,
                severity,
                alertName,
                description,
                Map.of("Product Name", PRODUCT_NAME),
                List.of(new ResourceRef("Account", config.accountId(), config.partition(), config.region())),
                new Remediation(REMEDIATION_TEXT, remediationUrl(detectorArn, anomalyId)),
                RecordState.ACTIVE
        );
    }

    String remediationUrl(String detectorArn, String anomalyId) {
        return String.format("%s/lookoutmetrics/home#%s/anomalies/anomaly/%s",
                config.consoleBaseUrl(), detectorArn, anomalyId);
    }
}
