package com.mtlockyer.constructs;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awscdk.services.iam.IRole;
import software.amazon.awscdk.services.iam.Policy;
import software.amazon.awscdk.services.iam.PolicyDocument;
import software.constructs.Construct;

/**
 * Least-privilege inline policies for the two execution roles.
 *
 * <ul>
 *   <li>scheduler role: lambda:InvokeFunction on the function only
 *   <li>function role: sns:Publish on the topic, secretsmanager:GetSecretValue on the secret and
 *       s3:PutObject/GetObject/ListBucket on the object storage resource
 * </ul>
 *
 * Each role gets a single policy document created already attached to it, so there is no state in
 * which only some of a role's statements apply.
 */
public class PolicyComposer {

    private static final Logger logger = LogManager.getLogger(PolicyComposer.class);

    public static final String INVOKE_FUNCTION = "lambda:InvokeFunction";

    public final List<AccessGrant> schedulerGrants;
    public final List<AccessGrant> functionGrants;
    public final Policy schedulerPolicy;
    public final Policy functionPolicy;

    public PolicyComposer(final Construct scope, PolicyComposerProps props) {
        this.schedulerGrants = List.of(new AccessGrant("InvokeFunction", List.of(INVOKE_FUNCTION), props.function()));

        // TODO scope object storage to arn:aws:s3:::<bucket> and arn:aws:s3:::<bucket>/<key> instead of "*"
        if ("*".equals(props.objectStorage().arn())) {
            logger.warn("Function role {} is granted S3 object access on all resources (*)",
                    props.functionPolicyName());
        }
        this.functionGrants = List.of(
                new AccessGrant("PublishNotification", List.of("sns:Publish"), props.notificationTopic()),
                new AccessGrant("ReadSecret", List.of("secretsmanager:GetSecretValue"), props.secret()),
                new AccessGrant(
                        "ObjectStorage",
                        List.of("s3:PutObject", "s3:GetObject", "s3:ListBucket"),
                        props.objectStorage()));

        if (this.functionGrants.stream().anyMatch(g -> g.actions().contains(INVOKE_FUNCTION))) {
            throw new IllegalStateException("The function role must not be able to invoke the function");
        }

        this.schedulerPolicy = attach(
                scope, props.idPrefix() + "-SchedulerPolicy", props.schedulerPolicyName(), props.schedulerRole(),
                this.schedulerGrants);
        this.functionPolicy = attach(
                scope, props.idPrefix() + "-FunctionPolicy", props.functionPolicyName(), props.functionRole(),
                this.functionGrants);
    }

    private static Policy attach(
            Construct scope, String id, String policyName, IRole role, List<AccessGrant> grants) {
        var document = PolicyDocument.Builder.create()
                .statements(grants.stream().map(AccessGrant::toStatement).toList())
                .build();
        var policy = Policy.Builder.create(scope, id)
                .policyName(policyName)
                .document(document)
                .roles(List.of(role))
                .build();
        logger.info("Attached policy {} with {} statement(s)", policyName, grants.size());
        return policy;
    }
}
