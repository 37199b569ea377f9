package com.mtlockyer.constructs;

import static com.mtlockyer.utils.Kind.infof;
import static com.mtlockyer.utils.ResourceNameUtils.buildRateExpression;

import software.amazon.awscdk.services.iam.Role;
import software.amazon.awscdk.services.iam.ServicePrincipal;
import software.amazon.awscdk.services.scheduler.CfnSchedule;
import software.constructs.Construct;

/**
 * EventBridge Scheduler schedule invoking the target at a fixed rate with a constant JSON payload.
 *
 * <p>The schedule assumes its own role. That role is created bare here and only ever receives the
 * invoke permission from {@link PolicyComposer}, so it never shares the function's identity.
 */
public class ScheduleBinding implements ArnAddressable {

    public final Role schedulerRole;
    public final InvocationPayload payload;
    public final String scheduleExpression;
    public final CfnSchedule schedule;

    public ScheduleBinding(final Construct scope, ScheduleBindingProps props) {
        this.schedulerRole = Role.Builder.create(scope, props.idPrefix() + "-Role")
                .roleName(props.roleName())
                .assumedBy(new ServicePrincipal("scheduler.amazonaws.com"))
                .build();

        this.payload = new InvocationPayload(
                props.siteUn(), props.s3Bucket(), props.s3ObjectKey(), props.notificationTopic().arn());

        this.scheduleExpression = buildRateExpression(props.rateMinutes());

        // TODO the schedule was intended to run hourly or every few hours; confirm the rate before relying on it
        this.schedule = CfnSchedule.Builder.create(scope, props.idPrefix())
                .name(props.scheduleName())
                .description("Runs mtlockyer at " + this.scheduleExpression)
                .flexibleTimeWindow(CfnSchedule.FlexibleTimeWindowProperty.builder()
                        .mode("OFF")
                        .build())
                .scheduleExpression(this.scheduleExpression)
                .target(CfnSchedule.TargetProperty.builder()
                        .arn(props.target().arn())
                        .input(this.payload.toJson())
                        .roleArn(this.schedulerRole.getRoleArn())
                        .build())
                .build();

        infof("Created schedule %s with expression %s", props.scheduleName(), this.scheduleExpression);
    }

    @Override
    public String arn() {
        return this.schedule.getAttrArn();
    }
}
