package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.NonRetryableSubmissionException;
import com.adobe.aep.waflookout.SubmissionException;
import com.adobe.aep.waflookout.records.ResourceRef;
import com.adobe.aep.waflookout.records.SecurityFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.securityhub.SecurityHubClient;
import software.amazon.awssdk.services.securityhub.model.AwsSecurityFinding;
import software.amazon.awssdk.services.securityhub.model.BatchImportFindingsRequest;
import software.amazon.awssdk.services.securityhub.model.BatchImportFindingsResponse;
import software.amazon.awssdk.services.securityhub.model.ImportFindingsError;
import software.amazon.awssdk.services.securityhub.model.Recommendation;
import software.amazon.awssdk.services.securityhub.model.Remediation;
import software.amazon.awssdk.services.securityhub.model.Resource;
import software.amazon.awssdk.services.securityhub.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Submits findings through Security Hub's BatchImportFindings, one finding per request.
 */
public class SecurityHubFindingsRepository implements FindingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(SecurityHubFindingsRepository.class);

    private final SecurityHubClient securityHub;

    public SecurityHubFindingsRepository(SecurityHubClient securityHub) {
        this.securityHub = securityHub;
    }

    @Override
    public void submit(SecurityFinding finding) throws SubmissionException {
        BatchImportFindingsRequest request = BatchImportFindingsRequest.builder()
                .findings(toAwsSecurityFinding(finding))
                .build();

        BatchImportFindingsResponse response;
        try {
            response = securityHub.batchImportFindings(request);
        } catch (AwsServiceException e) {
            boolean retryable = e.isThrottlingException() || e.statusCode() >= 500 || e.retryable();
            String message = String.format("Security Hub rejected finding %s with status %d: %s",
                    finding.id(), e.statusCode(), e.getMessage());
            if (retryable) {
                throw new SubmissionException(message, true, e);
            }
            throw new NonRetryableSubmissionException(message, e);
        } catch (SdkClientException e) {
            throw new SubmissionException("Could not reach Security Hub: " + e.getMessage(), true, e);
        } catch (SdkException e) {
            throw new SubmissionException("Finding submission failed: " + e.getMessage(), e.retryable(), e);
        }

        Integer failedCount = response.failedCount();
        if (failedCount != null && failedCount > 0) {
            List<ImportFindingsError> errors = response.failedFindings();
            String detail = errors.stream()
                    .map(error -> String.format("%s: %s %s", error.id(), error.errorCode(), error.errorMessage()))
                    .collect(Collectors.joining("; "));
            if (errors.stream().allMatch(SecurityHubFindingsRepository::isTransient) && !errors.isEmpty()) {
                throw new SubmissionException("Security Hub could not import finding: " + detail, true);
            }
            throw new NonRetryableSubmissionException("Security Hub refused finding: " + detail);
        }
        logger.debug("Security Hub imported {} finding(s)", response.successCount());
    }

    private static boolean isTransient(ImportFindingsError error) {
        String code = error.errorCode() == null ? "" : error.errorCode().toLowerCase(Locale.ROOT);
        return code.contains("throttl") || code.contains("internal") || code.contains("limitexceeded");
    }

    static AwsSecurityFinding toAwsSecurityFinding(SecurityFinding finding) {
        return AwsSecurityFinding.builder()
                .schemaVersion(finding.schemaVersion())
                .id(finding.id())
                .productArn(finding.productArn())
                .awsAccountId(finding.awsAccountId())
                .generatorId(finding.generatorId())
                .types(finding.types())
                .createdAt(finding.createdAt())
                .updatedAt(finding.updatedAt())
                .severity(Severity.builder()
                        .product(finding.severity().product())
                        .normalized(finding.severity().normalized())
                        .label(finding.severity().label())
                        .build())
                .title(finding.title())
                .description(finding.description())
                .productFields(finding.productFields())
                .resources(finding.resources().stream()
                        .map(SecurityHubFindingsRepository::toResource)
                        .collect(Collectors.toList()))
                .remediation(Remediation.builder()
                        .recommendation(Recommendation.builder()
                                .text(finding.remediation().text())
                                .url(finding.remediation().url())
                                .build())
                        .build())
                .recordState(finding.recordState().name())
                .build();
    }

    private static Resource toResource(ResourceRef resource) {
        return Resource.builder()
                .type(resource.type())
                .id(resource.id())
                .partition(resource.partition())
                .region(resource.region())
                .build();
    }
}
