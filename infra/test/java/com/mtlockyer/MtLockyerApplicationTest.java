package com.mtlockyer;

import static com.mtlockyer.MtLockyerTestFixtures.FUNCTION_IMAGE_DIRECTORY;
import static com.mtlockyer.MtLockyerTestFixtures.TEST_ACCOUNT;
import static com.mtlockyer.MtLockyerTestFixtures.TEST_REGION;
import static com.mtlockyer.MtLockyerTestFixtures.TEST_SECRET_ARN;
import static com.mtlockyer.utils.Kind.infof;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import software.amazon.awscdk.App;
import software.amazon.awscdk.AppProps;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.assertions.Template;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStub;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

@ExtendWith(SystemStubsExtension.class)
class MtLockyerApplicationTest {

    private static final String[] OVERRIDE_KEYS = {
        "APPLICATION_NAME",
        "AWS_ACCOUNT_ID",
        "AWS_REGION",
        "APPLICATION_TAG",
        "EMAIL_NOTIFICATION",
        "SITE_UN",
        "S3_BUCKET",
        "S3_OBJECT",
        "SECRETS_MGR_ARN",
        "SCHEDULE_RATE_MINUTES",
        "FUNCTION_IMAGE_DIRECTORY",
    };

    @SystemStub
    private EnvironmentVariables environmentVariables = new EnvironmentVariables();

    @BeforeEach
    void clearOverrides() {
        for (String key : OVERRIDE_KEYS) {
            environmentVariables.remove(key);
        }
        environmentVariables.set("CDK_DEFAULT_ACCOUNT", TEST_ACCOUNT);
        environmentVariables.set("CDK_DEFAULT_REGION", TEST_REGION);
    }

    @Test
    void shouldCreateMtLockyerApplicationFromContext() throws IOException {
        App app = new App(AppProps.builder().context(testContext()).build());

        MtLockyerApplicationProps appProps = MtLockyerApplication.loadAppProps(app);
        var application = new MtLockyerApplication(app, appProps);
        app.synth();
        infof("CDK synth complete");

        infof("Created stack: %s", application.stack.getStackName());
        assertEquals("appTagTestTest", application.stack.getStackName());
        assertEquals(TEST_ACCOUNT, application.config.accountId());
        assertEquals(3, application.config.scheduleRateMinutes());

        Template template = Template.fromStack(application.stack);
        template.resourceCountIs("AWS::Lambda::Function", 1);
        template.resourceCountIs("AWS::SNS::Subscription", 3);
        template.resourceCountIs("AWS::Scheduler::Schedule", 1);
    }

    @Test
    void environmentVariablesWinOverContext() throws IOException {
        environmentVariables.set("APPLICATION_TAG", "env-tag");
        environmentVariables.set("SCHEDULE_RATE_MINUTES", "5");
        App app = new App(AppProps.builder().context(testContext()).build());

        var application = new MtLockyerApplication(app, MtLockyerApplication.loadAppProps(app));

        assertEquals("env-tag", application.config.applicationTag());
        assertEquals("envTagTest", application.stack.getStackName());
        assertEquals(5, application.config.scheduleRateMinutes());
        assertEquals("rate(5 minutes)", application.stack.scheduleBinding.scheduleExpression);
    }

    @Test
    void blankContextAccountFallsBackToCdkDefault() throws IOException {
        Map<String, Object> ctx = testContext();
        ctx.put("accountId", "");
        ctx.put("region", "");

        var config = MtLockyerApplication.resolveConfig(
                MtLockyerApplication.loadAppProps(new App(AppProps.builder().context(ctx).build())));

        assertEquals(TEST_ACCOUNT, config.accountId());
        assertEquals(TEST_REGION, config.region());
    }

    @Test
    void missingApplicationTagFailsWithoutCreatingAStack() throws IOException {
        Map<String, Object> ctx = testContext();
        ctx.put("applicationTag", "");
        App app = new App(AppProps.builder().context(ctx).build());
        MtLockyerApplicationProps appProps = MtLockyerApplication.loadAppProps(app);

        var e = assertThrows(IllegalArgumentException.class, () -> new MtLockyerApplication(app, appProps));

        assertTrue(e.getMessage().contains("applicationTag"), e.getMessage());
        assertFalse(app.getNode().getChildren().stream().anyMatch(Stack::isStack));
    }

    @Test
    void missingSecretReferenceIsRejected() throws IOException {
        Map<String, Object> ctx = testContext();
        ctx.remove("secretsMgrArn");
        App app = new App(AppProps.builder().context(ctx).build());

        var e = assertThrows(
                IllegalArgumentException.class,
                () -> MtLockyerApplication.resolveConfig(MtLockyerApplication.loadAppProps(app)));

        assertTrue(e.getMessage().contains("secretsMgrArn"), e.getMessage());
    }

    @Test
    void nonNumericRateIsRejected() throws IOException {
        Map<String, Object> ctx = testContext();
        ctx.put("scheduleRateMinutes", "hourly");
        App app = new App(AppProps.builder().context(ctx).build());

        var e = assertThrows(
                IllegalArgumentException.class,
                () -> MtLockyerApplication.resolveConfig(MtLockyerApplication.loadAppProps(app)));

        assertTrue(e.getMessage().contains("scheduleRateMinutes"), e.getMessage());
    }

    @Test
    void unknownPropertyIsRejected() {
        var builder = MtLockyerApplicationProps.Builder.create().set("applicationTag", "app-tag-test");

        assertEquals("app-tag-test", builder.build().applicationTag);
        assertThrows(IllegalArgumentException.class, () -> builder.set("noSuchKey", "value"));
    }

    // cdk.json at the project root with the deployment specific keys filled in
    private static Map<String, Object> testContext() throws IOException {
        Map<String, Object> ctx = buildContextPropertyMapFromCdkJsonPath(Path.of("cdk.json").toAbsolutePath());
        ctx.put("name", "test");
        ctx.put("applicationTag", "app-tag-test");
        ctx.put("emailNotification", "a@x.com,b@y.com;c@z.com");
        ctx.put("siteUn", "site-user");
        ctx.put("s3Bucket", "waitlist-bucket");
        ctx.put("s3ObjectKey", "waitlist/position.json");
        ctx.put("secretsMgrArn", TEST_SECRET_ARN);
        ctx.put("functionImageDirectory", FUNCTION_IMAGE_DIRECTORY);
        return ctx;
    }

    private static @NotNull Map<String, Object> buildContextPropertyMapFromCdkJsonPath(Path cdkJsonPath)
            throws IOException {
        String json = Files.readString(cdkJsonPath);

        ObjectMapper om = new ObjectMapper();
        JsonNode root = om.readTree(json);
        JsonNode ctxNode = root.path("context");

        Map<String, Object> ctx = new HashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = ctxNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            ctx.put(e.getKey(), e.getValue().isValueNode() ? e.getValue().asText() : e.getValue().toString());
        }
        return ctx;
    }
}
