package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.SubmissionException;
import com.adobe.aep.waflookout.records.SecurityFinding;

/**
 * Central store that ingests findings, one record per call.
 */
public interface FindingsRepository {

    void submit(SecurityFinding finding) throws SubmissionException;
}
