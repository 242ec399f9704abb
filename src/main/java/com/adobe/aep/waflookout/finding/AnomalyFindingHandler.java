package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.MalformedNotificationException;
import com.adobe.aep.waflookout.SubmissionException;
import com.adobe.aep.waflookout.records.AnomalyNotification;
import com.adobe.aep.waflookout.records.SecurityFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the finding for a notification and submits it. Safe to call concurrently.
 */
public class AnomalyFindingHandler {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyFindingHandler.class);

    private final FindingBuilder findingBuilder;
    private final FindingsRepository repository;

    public AnomalyFindingHandler(FindingBuilder findingBuilder, FindingsRepository repository) {
        this.findingBuilder = findingBuilder;
        this.repository = repository;
    }

    /**
     * @return the id of the submitted finding
     * @throws MalformedNotificationException if the notification is unusable; nothing was submitted
     * @throws SubmissionException if the repository call failed, see {@link SubmissionException#isRetryable()}
     */
    public String handle(AnomalyNotification notification)
            throws MalformedNotificationException, SubmissionException {
        SecurityFinding finding = findingBuilder.build(notification);
        logger.debug("Built finding {} for alert event {}", finding.id(), notification.alertEventId());
        repository.submit(finding);
        logger.info("Submitted finding {} '{}' severity {}", finding.id(), finding.title(),
                finding.severity().normalized());
        return finding.id();
    }
}
