package com.adobe.aep.waflookout;

/**
 * What the finding Lambda answers for one notification.
 */
public class FindingProcessingResult {

    public enum Result {
        Ok,
        Dropped,
        ProcessingFailed
    }

    private final Result result;
    private final String findingId;
    private final String message;

    FindingProcessingResult(Result result, String findingId, String message) {
        this.result = result;
        this.findingId = findingId;
        this.message = message;
    }

    public Result getResult() {
        return result;
    }

    public String getFindingId() {
        return findingId;
    }

    public String getMessage() {
        return message;
    }

    public static FindingProcessingResult createSuccessResult(String findingId) {
        return new FindingProcessingResult(Result.Ok, findingId, null);
    }

    public static FindingProcessingResult createDroppedResult(String reason) {
        return new FindingProcessingResult(Result.Dropped, null, reason);
    }

    public static FindingProcessingResult createFailureResult(String errorMessage) {
        return new FindingProcessingResult(Result.ProcessingFailed, null, errorMessage);
    }
}
