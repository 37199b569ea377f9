package com.mtlockyer.constructs;

/**
 * Anything whose ARN can be referenced by another resource: a policy statement resource, a schedule
 * target, a payload field. The ARN may be an unresolved CDK token until synthesis.
 */
@FunctionalInterface
public interface ArnAddressable {

    ArnAddressable ANY_RESOURCE = () -> "*";

    String arn();

    static ArnAddressable of(String arn) {
        if (arn == null || arn.isBlank()) {
            throw new IllegalArgumentException("arn must be non-empty");
        }
        return () -> arn;
    }
}
