package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.records.AnomalyNotification;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Chooses the finding id for a notification.
 */
@FunctionalInterface
public interface FindingIdGenerator {

    String generate(AnomalyNotification notification);

    /**
     * Name-based UUID of detector ARN and alert event id. A redelivered notification maps to the same id,
     * so Security Hub updates the existing finding instead of creating a duplicate.
     */
    static FindingIdGenerator deterministic() {
        return notification -> UUID.nameUUIDFromBytes(
                (notification.anomalyDetectorArn() + "|" + notification.alertEventId())
                        .getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * A fresh id per call. Redelivery produces duplicate findings.
     */
    static FindingIdGenerator random() {
        return notification -> UUID.randomUUID().toString();
    }

    static FindingIdGenerator named(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "deterministic":
                return deterministic();
            case "random":
                return random();
            default:
                throw new IllegalStateException("Unknown finding id mode: " + name);
        }
    }
}
