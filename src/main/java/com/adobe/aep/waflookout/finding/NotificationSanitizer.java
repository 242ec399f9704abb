package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.MalformedNotificationException;

import java.util.regex.Pattern;

/**
 * Checks and cleans untrusted notification fields before they end up in a finding or a URL.
 */
final class NotificationSanitizer {

    static final int MAX_TITLE_LENGTH = 256;
    static final int MAX_DESCRIPTION_LENGTH = 1024;
    static final int MAX_IDENTIFIER_LENGTH = 2048;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}\\p{Cf}]");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9:/_.=+@-]+");

    private NotificationSanitizer() {
    }

    static String requireText(String field, String value) throws MalformedNotificationException {
        if (value == null || value.isBlank()) {
            throw new MalformedNotificationException("Missing required field: " + field);
        }
        return value;
    }

    /**
     * Cleans the text first so a value made only of control characters counts as missing.
     */
    static String requireCleanText(String field, String value, int maxLength) throws MalformedNotificationException {
        return requireText(field, cleanText(requireText(field, value), maxLength));
    }

    static double requireScore(Double score) throws MalformedNotificationException {
        if (score == null) {
            throw new MalformedNotificationException("Missing required field: anomalyScore");
        }
        if (!Double.isFinite(score)) {
            throw new MalformedNotificationException("anomalyScore is not a finite number: " + score);
        }
        return score;
    }

    /**
     * Identifiers are embedded in the console URL as is, so only ARN characters are accepted.
     */
    static String requireIdentifier(String field, String value) throws MalformedNotificationException {
        requireText(field, value);
        if (value.length() > MAX_IDENTIFIER_LENGTH) {
            throw new MalformedNotificationException(field + " exceeds " + MAX_IDENTIFIER_LENGTH + " characters");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new MalformedNotificationException(field + " contains characters not allowed in an identifier");
        }
        return value;
    }

    static String cleanText(String value, int maxLength) {
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll(" ").trim();
        return truncate(cleaned, maxLength);
    }

    static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int cut = maxLength - 3;
        if (Character.isHighSurrogate(value.charAt(cut - 1))) {
            cut--;
        }
        return value.substring(0, cut) + "...";
    }

    /**
     * The part of {@code alertEventId} after its last {@code /}.
     */
    static String anomalyId(String alertEventId) throws MalformedNotificationException {
        int slash = alertEventId.lastIndexOf('/');
        if (slash < 0) {
            throw new MalformedNotificationException("alertEventId has no path separator: " + alertEventId);
        }
        String anomalyId = alertEventId.substring(slash + 1);
        if (anomalyId.isEmpty()) {
            throw new MalformedNotificationException("alertEventId ends with a path separator: " + alertEventId);
        }
        return anomalyId;
    }
}
