package com.mtlockyer.constructs;

import org.immutables.value.Value;

@Value.Immutable
public interface NotificationFanoutProps {

    String idPrefix();

    String displayName();

    /**
     * Recipients separated by ',' or ';' in any combination. Empty means no subscriptions.
     */
    @Value.Default
    default String emailNotification() {
        return "";
    }

    static ImmutableNotificationFanoutProps.Builder builder() {
        return ImmutableNotificationFanoutProps.builder();
    }
}
