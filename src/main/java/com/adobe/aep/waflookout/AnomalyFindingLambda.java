package com.adobe.aep.waflookout;

import com.adobe.aep.waflookout.finding.AnomalyFindingHandler;
import com.adobe.aep.waflookout.finding.FindingBuilder;
import com.adobe.aep.waflookout.finding.SecurityHubFindingsRepository;
import com.adobe.aep.waflookout.records.AnomalyNotification;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;

/**
 * Lambda alert target of the Lookout for Metrics detector. Each invocation carries one anomaly alert
 * and results in at most one Security Hub finding.
 * <p>
 * Malformed alerts are dropped, non-retryable rejections are reported as failed, and retryable
 * failures fail the invocation so the asynchronous invoke is retried.
 */
public class AnomalyFindingLambda implements RequestStreamHandler {

    static {
        LookoutConfig.applyLogLevel(System.getenv("LOG_LEVEL"));
    }

    private static final Logger logger = LoggerFactory.getLogger(AnomalyFindingLambda.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final AnomalyFindingHandler handler;

    public AnomalyFindingLambda() {
        LookoutConfig config = LookoutConfig.fromEnvironment(AwsClients::callerAccountId);
        this.handler = new AnomalyFindingHandler(
                new FindingBuilder(config, Clock.systemUTC()),
                new SecurityHubFindingsRepository(AwsClients.securityHub(config.region())));
        logger.info("Finding handler ready for account {} in {}", config.accountId(), config.region());
    }

    public AnomalyFindingLambda(AnomalyFindingHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        context.getLogger().log(String.format("Received anomaly alert, request %s", context.getAwsRequestId()));
        FindingProcessingResult result = process(input);
        objectMapper.writeValue(output, result);
    }

    FindingProcessingResult process(InputStream input) throws IOException {
        AnomalyNotification notification;
        try {
            notification = objectMapper.readValue(input, AnomalyNotification.class);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unparsable notification: {}", e.getOriginalMessage());
            return FindingProcessingResult.createDroppedResult("Unparsable notification: " + e.getOriginalMessage());
        }
        logger.debug("Notification: {}", notification);

        try {
            String findingId = handler.handle(notification);
            return FindingProcessingResult.createSuccessResult(findingId);
        } catch (MalformedNotificationException e) {
            logger.warn("Dropping malformed notification: {}", e.getMessage());
            return FindingProcessingResult.createDroppedResult(e.getMessage());
        } catch (SubmissionException e) {
            if (e.isRetryable()) {
                logger.warn("Finding submission failed, invocation will be retried: {}", e.getMessage());
                throw new InvocationFailedException("Retryable finding submission failure", e);
            }
            logger.error("Finding rejected by Security Hub, needs investigation", e);
            return FindingProcessingResult.createFailureResult(e.getMessage());
        }
    }
}
