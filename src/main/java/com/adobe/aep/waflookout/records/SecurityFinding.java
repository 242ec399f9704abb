package com.adobe.aep.waflookout.records;

import java.util.List;
import java.util.Map;

/**
 * A finding in AWS Security Finding Format, built once per anomaly and never mutated.
 * Timestamps are ISO-8601 strings with an explicit UTC offset.
 */
public record SecurityFinding(
        String id,
        String schemaVersion,
        String productArn,
        String awsAccountId,
        String generatorId,
        List<String> types,
        String createdAt,
        String updatedAt,
        Severity severity,
        String title,
        String description,
        Map<String, String> productFields,
        List<ResourceRef> resources,
        Remediation remediation,
        RecordState recordState
) {

    public SecurityFinding {
        types = List.copyOf(types);
        productFields = Map.copyOf(productFields);
        resources = List.copyOf(resources);
    }
}
