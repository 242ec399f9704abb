package com.adobe.aep.waflookout;

import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.securityhub.SecurityHubClient;
import software.amazon.awssdk.services.sts.StsClient;

import java.time.Duration;

/**
 * Builds the SDK clients a handler keeps for the lifetime of its container.
 */
public final class AwsClients {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private AwsClients() {
    }

    static SdkHttpClient httpClient() {
        return ApacheHttpClient.builder()
                .socketTimeout(TIMEOUT)
                .connectionTimeout(TIMEOUT)
                .build();
    }

    public static CloudWatchClient cloudWatch(String region) {
        return CloudWatchClient.builder()
                .region(Region.of(region))
                .httpClient(httpClient())
                .build();
    }

    public static SecurityHubClient securityHub(String region) {
        return SecurityHubClient.builder()
                .region(Region.of(region))
                .httpClient(httpClient())
                .build();
    }

    /**
     * Account of the credentials the process runs with. Only used when ACCOUNT_ID is not configured.
     */
    public static String callerAccountId() {
        try (StsClient sts = StsClient.builder().httpClient(httpClient()).build()) {
            return sts.getCallerIdentity().account();
        }
    }
}
