package com.adobe.aep.waflookout.records;

public record Remediation(String text, String url) {
}
