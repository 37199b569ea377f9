package com.mtlockyer.constructs;

import org.immutables.value.Value;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.services.logs.RetentionDays;

@Value.Immutable
public interface ComputeFunctionProps {

    String idPrefix();

    String functionName();

    String roleName();

    String logGroupName();

    /**
     * Directory containing the Dockerfile the function image is built from.
     */
    String imageDirectory();

    @Value.Default
    default Duration timeout() {
        return Duration.seconds(90);
    }

    @Value.Default
    default int memorySize() {
        return 512;
    }

    @Value.Default
    default RetentionDays logGroupRetention() {
        return RetentionDays.ONE_WEEK;
    }

    @Value.Default
    default RemovalPolicy logGroupRemovalPolicy() {
        return RemovalPolicy.DESTROY;
    }

    static ImmutableComputeFunctionProps.Builder builder() {
        return ImmutableComputeFunctionProps.builder();
    }
}
