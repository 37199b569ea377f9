package com.mtlockyer;

import static com.mtlockyer.utils.Kind.envOr;
import static com.mtlockyer.utils.Kind.errorf;
import static com.mtlockyer.utils.Kind.infof;
import static com.mtlockyer.utils.Kind.warnf;

import com.mtlockyer.stacks.MtLockyerStack;
import com.mtlockyer.utils.KindCdk;
import java.lang.reflect.Field;
import software.amazon.awscdk.App;
import software.constructs.Construct;

public class MtLockyerApplication {

    public final DeploymentConfig config;
    public final MtLockyerSharedNames sharedNames;
    public final MtLockyerStack stack;

    public static void main(final String[] args) {
        App app = new App();
        MtLockyerApplicationProps appProps = loadAppProps(app);
        MtLockyerApplication application;
        try {
            application = new MtLockyerApplication(app, appProps);
        } catch (IllegalArgumentException e) {
            errorf("Invalid deployment configuration: %s", e.getMessage());
            throw e;
        }
        app.synth();
        infof("CDK synth complete");
        infof("Created stack: %s", application.stack.getStackName());
    }

    public MtLockyerApplication(App app, MtLockyerApplicationProps appProps) {
        // Validation happens here, before any construct is added to the app
        this.config = resolveConfig(appProps);
        this.sharedNames = MtLockyerSharedNames.from(this.config);

        infof(
                "Synthesizing stack %s for %s in account %s region %s",
                sharedNames.stackId, sharedNames.fullName, config.accountId(), config.region());
        this.stack = new MtLockyerStack(
                app,
                sharedNames.stackId,
                MtLockyerStack.MtLockyerStackProps.builder()
                        .env(KindCdk.buildEnvironment(config.accountId(), config.region()))
                        .config(config)
                        .sharedNames(sharedNames)
                        .build());
    }

    // Environment variables (as set by the CI pipeline) win over cdk.json context
    public static DeploymentConfig resolveConfig(MtLockyerApplicationProps appProps) {
        var name = envOr("APPLICATION_NAME", appProps.name, "(from name in cdk.json)");
        var accountId = envOr(
                "AWS_ACCOUNT_ID",
                firstNonBlank(appProps.accountId, envOr("CDK_DEFAULT_ACCOUNT", null)),
                "(from accountId in cdk.json or CDK_DEFAULT_ACCOUNT)");
        var region = envOr(
                "AWS_REGION",
                firstNonBlank(appProps.region, envOr("CDK_DEFAULT_REGION", null)),
                "(from region in cdk.json or CDK_DEFAULT_REGION)");
        var applicationTag = envOr("APPLICATION_TAG", appProps.applicationTag, "(from applicationTag in cdk.json)");
        var emailNotification =
                envOr("EMAIL_NOTIFICATION", appProps.emailNotification, "(from emailNotification in cdk.json)");
        var siteUn = envOr("SITE_UN", appProps.siteUn, "(from siteUn in cdk.json)");
        var s3Bucket = envOr("S3_BUCKET", appProps.s3Bucket, "(from s3Bucket in cdk.json)");
        var s3ObjectKey = envOr("S3_OBJECT", appProps.s3ObjectKey, "(from s3ObjectKey in cdk.json)");
        var secretsMgrArn = envOr("SECRETS_MGR_ARN", appProps.secretsMgrArn, "(from secretsMgrArn in cdk.json)");
        var scheduleRateMinutes = envOr(
                "SCHEDULE_RATE_MINUTES", appProps.scheduleRateMinutes, "(from scheduleRateMinutes in cdk.json)");
        var functionImageDirectory = envOr(
                "FUNCTION_IMAGE_DIRECTORY",
                appProps.functionImageDirectory,
                "(from functionImageDirectory in cdk.json)");

        var builder = DeploymentConfig.builder()
                .name(nullToEmpty(name))
                .accountId(nullToEmpty(accountId))
                .region(nullToEmpty(region))
                .applicationTag(nullToEmpty(applicationTag))
                .emailNotification(nullToEmpty(emailNotification))
                .siteUn(nullToEmpty(siteUn))
                .s3Bucket(nullToEmpty(s3Bucket))
                .s3ObjectKey(nullToEmpty(s3ObjectKey))
                .secretsMgrArn(nullToEmpty(secretsMgrArn));
        if (scheduleRateMinutes != null && !scheduleRateMinutes.isBlank()) {
            builder.scheduleRateMinutes(parseRateMinutes(scheduleRateMinutes));
        }
        if (functionImageDirectory != null && !functionImageDirectory.isBlank()) {
            builder.functionImageDirectory(functionImageDirectory);
        }
        return builder.build();
    }

    // populate from cdk.json context using exact camelCase keys
    public static MtLockyerApplicationProps loadAppProps(Construct scope) {
        MtLockyerApplicationProps props = MtLockyerApplicationProps.Builder.create().build();
        for (Field f : MtLockyerApplicationProps.class.getDeclaredFields()) {
            if (f.getType() != String.class) continue;
            try {
                String current = (String) f.get(props);
                String ctx = KindCdk.getContextValueString(scope, f.getName(), current);
                if (ctx != null) f.set(props, ctx);
            } catch (IllegalAccessException e) {
                warnf("Failed to read context for %s: %s", f.getName(), e.getMessage());
            }
        }
        return props;
    }

    private static int parseRateMinutes(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("scheduleRateMinutes must be a whole number of minutes, was " + value, e);
        }
    }

    private static String firstNonBlank(String first, String second) {
        return (first != null && !first.isBlank()) ? first : second;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
