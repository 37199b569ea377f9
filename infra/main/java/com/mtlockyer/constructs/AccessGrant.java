package com.mtlockyer.constructs;

import java.util.List;
import software.amazon.awscdk.services.iam.Effect;
import software.amazon.awscdk.services.iam.PolicyStatement;

/**
 * One access need: a set of actions on exactly one resource. Becomes exactly one allow statement.
 */
public record AccessGrant(String sid, List<String> actions, ArnAddressable resource) {

    public AccessGrant {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("An access grant needs at least one action");
        }
        actions = List.copyOf(actions);
    }

    public PolicyStatement toStatement() {
        return PolicyStatement.Builder.create()
                .sid(sid)
                .effect(Effect.ALLOW)
                .actions(actions)
                .resources(List.of(resource.arn()))
                .build();
    }
}
