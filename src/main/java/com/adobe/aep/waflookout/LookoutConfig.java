package com.adobe.aep.waflookout;

import com.adobe.aep.waflookout.finding.FindingIdGenerator;
import com.adobe.aep.waflookout.finding.SeverityPolicy;
import com.adobe.aep.waflookout.records.MetricDimension;
import com.adobe.aep.waflookout.records.MetricSeries;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Process-wide settings, read once from the environment when a handler is created.
 */
public final class LookoutConfig {

    public static final String DEFAULT_NAMESPACE = "AWS/WAFV2";
    public static final String DEFAULT_METRIC_NAME = "BlockedRequests";
    public static final String DEFAULT_RULE = "AWS-AWSManagedRulesCommonRuleSet";
    public static final String DEFAULT_WEB_ACL = "WebACLForWAFDemo";
    public static final long DEFAULT_INTERVAL_MINUTES = 5;

    private final String region;
    private final String partition;
    private final String accountId;
    private final String consoleBaseUrl;
    private final MetricSeries series;
    private final Duration publishInterval;
    private final SeverityPolicy severityPolicy;
    private final FindingIdGenerator findingIdGenerator;

    public LookoutConfig(String region, String accountId, String consoleBaseUrl, MetricSeries series,
                         Duration publishInterval, SeverityPolicy severityPolicy,
                         FindingIdGenerator findingIdGenerator) {
        if (publishInterval.isZero() || publishInterval.isNegative()) {
            throw new IllegalStateException("Publish interval must be positive: " + publishInterval);
        }
        this.region = region;
        this.partition = partitionOf(region);
        this.accountId = accountId;
        this.consoleBaseUrl = stripTrailingSlash(consoleBaseUrl);
        this.series = series;
        this.publishInterval = publishInterval;
        this.severityPolicy = severityPolicy;
        this.findingIdGenerator = findingIdGenerator;
    }

    public static LookoutConfig fromEnvironment(Supplier<String> accountIdResolver) {
        return fromEnvironment(System::getenv, accountIdResolver);
    }

    /**
     * @param env               variable lookup, {@code System::getenv} outside tests
     * @param accountIdResolver called only when {@code ACCOUNT_ID} is not set
     */
    public static LookoutConfig fromEnvironment(Function<String, String> env, Supplier<String> accountIdResolver) {
        String region = getEnvVar(env, "AWS_REGION", getEnvVar(env, "REGION", ""));
        if (region.isEmpty()) {
            throw new IllegalStateException("Required environment variable missing: AWS_REGION");
        }
        String accountId = getEnvVar(env, "ACCOUNT_ID", "");
        if (accountId.isEmpty()) {
            accountId = accountIdResolver.get();
        }
        String consoleBaseUrl = getEnvVar(env, "CONSOLE_BASE_URL", defaultConsoleBaseUrl(region));

        String namespace = getEnvVar(env, "METRIC_NAMESPACE", DEFAULT_NAMESPACE);
        String metricName = getEnvVar(env, "METRIC_NAME", DEFAULT_METRIC_NAME);
        String dimensions = getEnvVar(env, "METRIC_DIMENSIONS",
                String.format("Region=%s,Rule=%s,WebACL=%s", region, DEFAULT_RULE, DEFAULT_WEB_ACL));
        MetricSeries series = new MetricSeries(namespace, metricName, parseDimensions(dimensions));

        long minutes = parseLong("PUBLISH_INTERVAL_MINUTES",
                getEnvVar(env, "PUBLISH_INTERVAL_MINUTES", String.valueOf(DEFAULT_INTERVAL_MINUTES)));

        SeverityPolicy severityPolicy = SeverityPolicy.named(getEnvVar(env, "SEVERITY_POLICY", "fixed"));
        FindingIdGenerator idGenerator = FindingIdGenerator.named(getEnvVar(env, "FINDING_ID_MODE", "deterministic"));

        return new LookoutConfig(region, accountId, consoleBaseUrl, series, Duration.ofMinutes(minutes),
                severityPolicy, idGenerator);
    }

    /**
     * Must run before the first logger is created for the level to take effect.
     */
    public static void applyLogLevel(String logLevel) {
        if (logLevel != null && !logLevel.isEmpty()) {
            // Valid values are: trace, debug, info, warn, error, off
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", logLevel.toLowerCase(Locale.ROOT));
        }
    }

    static List<MetricDimension> parseDimensions(String spec) {
        List<MetricDimension> dimensions = new ArrayList<>();
        for (String pair : spec.split(",")) {
            if (pair.isBlank()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalStateException("Invalid METRIC_DIMENSIONS entry, expected Name=Value: " + pair);
            }
            dimensions.add(new MetricDimension(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim()));
        }
        return dimensions;
    }

    static String partitionOf(String region) {
        if (region.startsWith("cn-")) {
            return "aws-cn";
        } else if (region.startsWith("us-gov-")) {
            return "aws-us-gov";
        }
        return "aws";
    }

    private static String defaultConsoleBaseUrl(String region) {
        if (region.startsWith("cn-")) {
            return String.format("https://%s.console.amazonaws.cn", region);
        }
        return String.format("https://%s.console.aws.amazon.com", region);
    }

    private static String getEnvVar(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static long parseLong(String name, String value) {
        try {
            long parsed = Long.parseLong(value);
            if (parsed <= 0) {
                throw new IllegalStateException(name + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + name + ": " + value, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String region() {
        return region;
    }

    public String partition() {
        return partition;
    }

    public String accountId() {
        return accountId;
    }

    public String consoleBaseUrl() {
        return consoleBaseUrl;
    }

    public MetricSeries series() {
        return series;
    }

    public Duration publishInterval() {
        return publishInterval;
    }

    public SeverityPolicy severityPolicy() {
        return severityPolicy;
    }

    public FindingIdGenerator findingIdGenerator() {
        return findingIdGenerator;
    }

    public String productArn() {
        return String.format("arn:%s:securityhub:%s:%s:product/%s/default", partition, region, accountId, accountId);
    }
}
