package com.mtlockyer;

import java.util.regex.Pattern;
import org.immutables.value.Value;

/**
 * Resolved configuration for one deployment. Built once by {@link MtLockyerApplication} and the source
 * of every name, ARN and payload value in the stack.
 */
@Value.Immutable
public interface DeploymentConfig {

    Pattern ACCOUNT_ID = Pattern.compile("\\d{12}");

    String name();

    String accountId();

    String region();

    String applicationTag();

    /**
     * Recipients separated by ',' or ';'. May be empty.
     */
    @Value.Default
    default String emailNotification() {
        return "";
    }

    /**
     * Site credential reference handed to the function as "site-un".
     */
    String siteUn();

    String s3Bucket();

    String s3ObjectKey();

    String secretsMgrArn();

    @Value.Default
    default int scheduleRateMinutes() {
        return 3;
    }

    /**
     * Directory holding the Dockerfile of the function image.
     */
    @Value.Default
    default String functionImageDirectory() {
        return "function";
    }

    @Value.Check
    default void check() {
        requireNonBlank("name", name());
        requireNonBlank("accountId", accountId());
        requireNonBlank("region", region());
        requireNonBlank("applicationTag", applicationTag());
        requireNonBlank("secretsMgrArn", secretsMgrArn());
        if (!ACCOUNT_ID.matcher(accountId()).matches()) {
            throw new IllegalArgumentException("accountId must be a 12 digit AWS account id, was " + accountId());
        }
        if (scheduleRateMinutes() < 1) {
            throw new IllegalArgumentException("scheduleRateMinutes must be at least 1, was " + scheduleRateMinutes());
        }
    }

    private static void requireNonBlank(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must be non-empty");
        }
    }

    static ImmutableDeploymentConfig.Builder builder() {
        return ImmutableDeploymentConfig.builder();
    }
}
