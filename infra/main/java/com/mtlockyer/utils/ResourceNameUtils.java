package com.mtlockyer.utils;

import java.util.Arrays;
import java.util.Locale;

public class ResourceNameUtils {

    private ResourceNameUtils() {}

    /**
     * Build the dashed full name shared by every resource of a deployment.
     *
     * @param applicationTag tag owning the deployment (e.g. "app-tag-test")
     * @param name application name (e.g. "test")
     * @return "&lt;applicationTag&gt;-&lt;name&gt;"
     */
    public static String buildFullName(String applicationTag, String name) {
        if (applicationTag == null || applicationTag.isBlank()) {
            throw new IllegalArgumentException("applicationTag must be non-empty");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty");
        }
        return "%s-%s".formatted(applicationTag, name);
    }

    /**
     * Convert a hyphen-delimited name to a single camel-cased token.
     * The first segment is lower-cased; every later segment has its first character upper-cased
     * and the remainder lower-cased. Empty segments (leading, trailing or adjacent hyphens) are
     * skipped.
     *
     * Examples:
     *   app-tag-test -> appTagTest
     *   a-B-c        -> aBC
     *   a--b         -> aB
     *
     * @param dashSeparated hyphen-delimited input, may be empty
     * @return camel-cased token, empty when the input has no non-empty segment
     */
    public static String convertDashSeparatedToCamelCase(String dashSeparated) {
        if (dashSeparated == null || dashSeparated.isEmpty()) {
            return "";
        }
        var segments = Arrays.stream(dashSeparated.split("-"))
                .filter(s -> !s.isEmpty())
                .toList();
        var sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (i == 0) {
                sb.append(segment.toLowerCase(Locale.ROOT));
            } else {
                sb.append(segment.substring(0, 1).toUpperCase(Locale.ROOT))
                        .append(segment.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return sb.toString();
    }

    /**
     * Generate AWS IAM-compatible resource names by replacing invalid characters.
     * AWS IAM role and policy names can only contain: alphanumeric characters, plus (+), equals (=),
     * comma (,), period (.), at (@), and hyphen (-).
     * Length must be between 1 and 64 characters.
     *
     * @param resourceNamePrefix base resource name prefix
     * @param suffix additional suffix for the resource name
     * @return IAM-compatible resource name, truncated to 64 characters if needed
     */
    public static String generateIamCompatibleName(String resourceNamePrefix, String suffix) {
        if (resourceNamePrefix == null || resourceNamePrefix.isBlank()) {
            throw new IllegalArgumentException("resourceNamePrefix must be non-empty");
        }
        if (suffix == null || suffix.isBlank()) {
            throw new IllegalArgumentException("suffix must be non-empty");
        }

        String cleanPrefix = resourceNamePrefix
                .replaceAll("[^a-zA-Z0-9+=,.@-]", "-")
                .replaceAll("-+", "-") // Collapse multiple dashes
                .replaceAll("^-+|-+$", ""); // Remove leading/trailing dashes

        String cleanSuffix = suffix.replaceAll("[^a-zA-Z0-9+=,.@-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-+|-+$", "");

        String fullName = cleanPrefix + "-" + cleanSuffix;

        if (fullName.length() > 64) {
            fullName = fullName.substring(0, 64);
            // Ensure we don't end with a dash after truncation
            fullName = fullName.replaceAll("-+$", "");
        }

        return fullName;
    }

    public static String buildFunctionName(String fullName) {
        return "%s-function".formatted(fullName);
    }

    public static String buildFunctionLogGroupName(String functionName) {
        return "/aws/lambda/%s".formatted(functionName);
    }

    public static String buildSchedulerName(String canonicalName) {
        return "%sEBScheduler".formatted(canonicalName);
    }

    /**
     * EventBridge Scheduler rate expression, e.g. rate(1 minute) or rate(3 minutes).
     */
    public static String buildRateExpression(int minutes) {
        if (minutes < 1) {
            throw new IllegalArgumentException("Schedule rate must be at least 1 minute, was " + minutes);
        }
        return minutes == 1 ? "rate(1 minute)" : "rate(%d minutes)".formatted(minutes);
    }
}
