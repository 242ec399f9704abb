package com.adobe.aep.waflookout.records;

public enum RecordState {
    ACTIVE,
    ARCHIVED
}
