package com.mtlockyer.utils;

import static com.mtlockyer.utils.Kind.infof;
import static com.mtlockyer.utils.Kind.redact;
import static com.mtlockyer.utils.Kind.warnf;

import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Environment;
import software.amazon.awssdk.utils.StringUtils;
import software.constructs.Construct;

public class KindCdk {

    private KindCdk() {}

    public static CfnOutput cfnOutput(Construct scope, String id, String value) {
        if (StringUtils.isBlank(value)) {
            warnf("CfnOutput value for %s is blank", id);
        }
        return CfnOutput.Builder.create(scope, id).value(value).build();
    }

    public static String getContextValueString(Construct scope, String contextKey, String defaultValue) {
        var contextValue = scope.getNode().tryGetContext(contextKey);
        String defaultedValue;
        if (contextValue != null && StringUtils.isNotBlank(contextValue.toString())) {
            defaultedValue = contextValue.toString();
            infof("%s=%s (source: CDK context)", contextKey, redact(contextKey, defaultedValue));
        } else {
            defaultedValue = defaultValue;
            infof("%s=%s (resolved from default)", contextKey, redact(contextKey, defaultedValue));
        }

        return defaultedValue;
    }

    /**
     * Build the stack environment from an explicitly configured account and region.
     *
     * @param account 12-digit AWS account id
     * @param region AWS region name, e.g. eu-west-2
     * @return a CDK Environment pinned to the account and region
     */
    public static @NotNull Environment buildEnvironment(String account, String region) {
        if (StringUtils.isBlank(account) || StringUtils.isBlank(region)) {
            throw new IllegalArgumentException("account and region must both be set to build an environment");
        }
        infof("Using environment account %s region %s", account, region);
        return Environment.builder().account(account).region(region).build();
    }
}
