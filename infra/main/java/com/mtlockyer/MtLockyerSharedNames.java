package com.mtlockyer;

import static com.mtlockyer.utils.ResourceNameUtils.buildFullName;
import static com.mtlockyer.utils.ResourceNameUtils.buildFunctionLogGroupName;
import static com.mtlockyer.utils.ResourceNameUtils.buildFunctionName;
import static com.mtlockyer.utils.ResourceNameUtils.buildSchedulerName;
import static com.mtlockyer.utils.ResourceNameUtils.convertDashSeparatedToCamelCase;
import static com.mtlockyer.utils.ResourceNameUtils.generateIamCompatibleName;

/**
 * Names derived from the application tag and name. Every logical id and physical name in the stack
 * is taken from here so two deployments with different (tag, name) pairs never collide.
 */
public class MtLockyerSharedNames {

    public final String fullName;
    public final String canonicalName;

    public final String stackId;
    public final String functionIdPrefix;
    public final String functionName;
    public final String functionLogGroupName;
    public final String functionRoleName;
    public final String topicId;
    public final String topicDisplayName;
    public final String schedulerId;
    public final String schedulerName;
    public final String schedulerRoleName;
    public final String invokeFunctionPolicyName;
    public final String executeFunctionPolicyName;

    public MtLockyerSharedNames(String applicationTag, String name) {
        this.fullName = buildFullName(applicationTag, name);
        this.canonicalName = convertDashSeparatedToCamelCase(this.fullName);

        this.stackId = this.canonicalName;
        this.functionIdPrefix = this.canonicalName + "DIF";
        this.functionName = buildFunctionName(this.fullName);
        this.functionLogGroupName = buildFunctionLogGroupName(this.functionName);
        this.functionRoleName = generateIamCompatibleName(this.fullName, "function-role");
        this.topicId = this.canonicalName + "SnsTopic";
        this.topicDisplayName = "Mtlockyer SNS topic";
        this.schedulerId = this.canonicalName + "Scheduler";
        this.schedulerName = buildSchedulerName(this.canonicalName);
        this.schedulerRoleName = generateIamCompatibleName(this.fullName, "scheduler-role");
        this.invokeFunctionPolicyName = generateIamCompatibleName(this.fullName, "invoke-function");
        this.executeFunctionPolicyName = generateIamCompatibleName(this.fullName, "execute-function");
    }

    public static MtLockyerSharedNames from(DeploymentConfig config) {
        return new MtLockyerSharedNames(config.applicationTag(), config.name());
    }
}
