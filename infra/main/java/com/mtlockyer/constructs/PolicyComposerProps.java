package com.mtlockyer.constructs;

import org.immutables.value.Value;
import software.amazon.awscdk.services.iam.IRole;

@Value.Immutable
public interface PolicyComposerProps {

    String idPrefix();

    IRole schedulerRole();

    String schedulerPolicyName();

    IRole functionRole();

    String functionPolicyName();

    ArnAddressable function();

    ArnAddressable notificationTopic();

    ArnAddressable secret();

    @Value.Default
    default ArnAddressable objectStorage() {
        return ArnAddressable.ANY_RESOURCE;
    }

    static ImmutablePolicyComposerProps.Builder builder() {
        return ImmutablePolicyComposerProps.builder();
    }
}
