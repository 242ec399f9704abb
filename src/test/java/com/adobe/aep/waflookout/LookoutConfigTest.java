package com.adobe.aep.waflookout;

import com.adobe.aep.waflookout.records.AnomalyNotification;
import com.adobe.aep.waflookout.records.MetricDimension;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LookoutConfigTest {

    private final Map<String, String> env = new HashMap<>();
    private final AtomicInteger resolverCalls = new AtomicInteger();

    private LookoutConfig load() {
        return LookoutConfig.fromEnvironment(env::get, () -> {
            resolverCalls.incrementAndGet();
            return "210987654321";
        });
    }

    @Test
    public void testDefaults() {
        env.put("AWS_REGION", "eu-west-1");

        LookoutConfig config = load();

        assertThat(config.region()).isEqualTo("eu-west-1");
        assertThat(config.partition()).isEqualTo("aws");
        assertThat(config.accountId()).isEqualTo("210987654321");
        assertThat(config.consoleBaseUrl()).isEqualTo("https://eu-west-1.console.aws.amazon.com");
        assertThat(config.publishInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.series().namespace()).isEqualTo("AWS/WAFV2");
        assertThat(config.series().metricName()).isEqualTo("BlockedRequests");
        assertThat(config.series().dimensions()).containsExactly(
                new MetricDimension("Region", "eu-west-1"),
                new MetricDimension("Rule", "AWS-AWSManagedRulesCommonRuleSet"),
                new MetricDimension("WebACL", "WebACLForWAFDemo"));
        assertThat(config.productArn())
                .isEqualTo("arn:aws:securityhub:eu-west-1:210987654321:product/210987654321/default");
        assertThat(config.severityPolicy().severityFor(99).normalized()).isEqualTo(10);
    }

    @Test
    public void testExplicitAccountSkipsResolver() {
        env.put("AWS_REGION", "us-east-1");
        env.put("ACCOUNT_ID", "123456789012");

        assertThat(load().accountId()).isEqualTo("123456789012");
        assertThat(resolverCalls.get()).isZero();
    }

    @Test
    public void testOverrides() {
        env.put("REGION", "us-west-2");
        env.put("ACCOUNT_ID", "123456789012");
        env.put("CONSOLE_BASE_URL", "https://console.example.com/");
        env.put("METRIC_NAMESPACE", "Custom/WAF");
        env.put("METRIC_NAME", "Blocked");
        env.put("METRIC_DIMENSIONS", "WebACL=acl, Rule=rule");
        env.put("PUBLISH_INTERVAL_MINUTES", "1");
        env.put("SEVERITY_POLICY", "proportional");
        env.put("FINDING_ID_MODE", "random");

        LookoutConfig config = load();

        assertThat(config.region()).isEqualTo("us-west-2");
        assertThat(config.consoleBaseUrl()).isEqualTo("https://console.example.com");
        assertThat(config.series().namespace()).isEqualTo("Custom/WAF");
        assertThat(config.series().dimensions()).extracting(MetricDimension::name).containsExactly("WebACL", "Rule");
        assertThat(config.publishInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.severityPolicy().severityFor(55).normalized()).isEqualTo(55);

        AnomalyNotification redelivered = new AnomalyNotification("n", "d", 1.0, "arn:x:1", "a/1");
        assertThat(config.findingIdGenerator().generate(redelivered))
                .isNotEqualTo(config.findingIdGenerator().generate(redelivered));
    }

    @Test
    public void testDefaultIdModeIsStableForRedelivery() {
        env.put("AWS_REGION", "us-east-1");
        env.put("ACCOUNT_ID", "123456789012");

        LookoutConfig config = load();

        AnomalyNotification redelivered = new AnomalyNotification("n", "d", 1.0, "arn:x:1", "a/1");
        assertThat(config.findingIdGenerator().generate(redelivered))
                .isEqualTo(config.findingIdGenerator().generate(redelivered));
    }

    @Test
    public void testPartitionFollowsRegion() {
        assertThat(LookoutConfig.partitionOf("cn-north-1")).isEqualTo("aws-cn");
        assertThat(LookoutConfig.partitionOf("us-gov-west-1")).isEqualTo("aws-us-gov");
        assertThat(LookoutConfig.partitionOf("ap-south-1")).isEqualTo("aws");
    }

    @Test
    public void testMissingRegionFails() {
        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("AWS_REGION");
    }

    @Test
    public void testInvalidValuesFail() {
        env.put("AWS_REGION", "us-east-1");
        env.put("ACCOUNT_ID", "123456789012");

        env.put("PUBLISH_INTERVAL_MINUTES", "five");
        assertThatThrownBy(this::load).isInstanceOf(IllegalStateException.class);

        env.put("PUBLISH_INTERVAL_MINUTES", "0");
        assertThatThrownBy(this::load).isInstanceOf(IllegalStateException.class);

        env.remove("PUBLISH_INTERVAL_MINUTES");
        env.put("METRIC_DIMENSIONS", "Rule");
        assertThatThrownBy(this::load).isInstanceOf(IllegalStateException.class);

        env.put("METRIC_DIMENSIONS", "Rule=a,Rule=b");
        assertThatThrownBy(this::load).isInstanceOf(IllegalArgumentException.class);
    }
}
