package com.mtlockyer.constructs;

import org.immutables.value.Value;

@Value.Immutable
public interface ScheduleBindingProps {

    String idPrefix();

    String scheduleName();

    String roleName();

    /**
     * Fixed interval between invocations. There is no overlap protection: a run longer than this
     * interval will be running when the next one starts.
     */
    @Value.Default
    default int rateMinutes() {
        return 3;
    }

    ArnAddressable target();

    ArnAddressable notificationTopic();

    String siteUn();

    String s3Bucket();

    String s3ObjectKey();

    static ImmutableScheduleBindingProps.Builder builder() {
        return ImmutableScheduleBindingProps.builder();
    }
}
