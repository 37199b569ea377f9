package com.mtlockyer.stacks;

import static com.mtlockyer.utils.Kind.infof;
import static com.mtlockyer.utils.KindCdk.cfnOutput;

import com.mtlockyer.DeploymentConfig;
import com.mtlockyer.MtLockyerSharedNames;
import com.mtlockyer.constructs.ArnAddressable;
import com.mtlockyer.constructs.ComputeFunction;
import com.mtlockyer.constructs.ComputeFunctionProps;
import com.mtlockyer.constructs.NotificationFanout;
import com.mtlockyer.constructs.NotificationFanoutProps;
import com.mtlockyer.constructs.PolicyComposer;
import com.mtlockyer.constructs.PolicyComposerProps;
import com.mtlockyer.constructs.ScheduleBinding;
import com.mtlockyer.constructs.ScheduleBindingProps;
import org.immutables.value.Value;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.Tags;
import software.constructs.Construct;

/**
 * The whole deployment: function, notification topic, schedule and the policies binding them.
 *
 * <p>Resources are created in dependency order because later resources embed the ARNs of earlier
 * ones: function, then topic, then schedule (payload carries the topic ARN, target is the function),
 * then policies (scoped to all of the above).
 */
public class MtLockyerStack extends Stack {

    public static final String OWNER_TAG = "Customer";

    public final ComputeFunction computeFunction;
    public final NotificationFanout notificationFanout;
    public final ScheduleBinding scheduleBinding;
    public final PolicyComposer policyComposer;

    @Value.Immutable
    public interface MtLockyerStackProps extends StackProps {

        @Override
        Environment getEnv();

        @Override
        @Value.Default
        default Boolean getCrossRegionReferences() {
            return false;
        }

        DeploymentConfig config();

        MtLockyerSharedNames sharedNames();

        static ImmutableMtLockyerStackProps.Builder builder() {
            return ImmutableMtLockyerStackProps.builder();
        }
    }

    public MtLockyerStack(final Construct scope, final String id, final MtLockyerStackProps props) {
        super(scope, id, props);
        var config = props.config();
        var names = props.sharedNames();

        this.computeFunction = new ComputeFunction(
                this,
                ComputeFunctionProps.builder()
                        .idPrefix(names.functionIdPrefix)
                        .functionName(names.functionName)
                        .roleName(names.functionRoleName)
                        .logGroupName(names.functionLogGroupName)
                        .imageDirectory(config.functionImageDirectory())
                        .build());

        this.notificationFanout = new NotificationFanout(
                this,
                NotificationFanoutProps.builder()
                        .idPrefix(names.topicId)
                        .displayName(names.topicDisplayName)
                        .emailNotification(config.emailNotification())
                        .build());

        this.scheduleBinding = new ScheduleBinding(
                this,
                ScheduleBindingProps.builder()
                        .idPrefix(names.schedulerId)
                        .scheduleName(names.schedulerName)
                        .roleName(names.schedulerRoleName)
                        .rateMinutes(config.scheduleRateMinutes())
                        .target(this.computeFunction)
                        .notificationTopic(this.notificationFanout)
                        .siteUn(config.siteUn())
                        .s3Bucket(config.s3Bucket())
                        .s3ObjectKey(config.s3ObjectKey())
                        .build());

        this.policyComposer = new PolicyComposer(
                this,
                PolicyComposerProps.builder()
                        .idPrefix(names.canonicalName)
                        .schedulerRole(this.scheduleBinding.schedulerRole)
                        .schedulerPolicyName(names.invokeFunctionPolicyName)
                        .functionRole(this.computeFunction.executionRole)
                        .functionPolicyName(names.executeFunctionPolicyName)
                        .function(this.computeFunction)
                        .notificationTopic(this.notificationFanout)
                        .secret(ArnAddressable.of(config.secretsMgrArn()))
                        .build());

        Tags.of(this.computeFunction.lambda).add(OWNER_TAG, config.applicationTag());
        Tags.of(this).add(OWNER_TAG, config.applicationTag());

        cfnOutput(this, "FunctionArn", this.computeFunction.arn());
        cfnOutput(this, "NotificationTopicArn", this.notificationFanout.arn());
        cfnOutput(this, "ScheduleArn", this.scheduleBinding.arn());

        infof("MtLockyerStack %s created successfully for %s", this.getNode().getId(), names.fullName);
    }
}
