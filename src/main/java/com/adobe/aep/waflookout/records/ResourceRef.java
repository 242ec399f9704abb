package com.adobe.aep.waflookout.records;

public record ResourceRef(String type, String id, String partition, String region) {
}
