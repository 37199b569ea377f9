package com.mtlockyer.constructs;

import static com.mtlockyer.utils.Kind.infof;

import java.nio.file.Paths;
import java.util.List;
import software.amazon.awscdk.services.iam.ManagedPolicy;
import software.amazon.awscdk.services.iam.Role;
import software.amazon.awscdk.services.iam.ServicePrincipal;
import software.amazon.awscdk.services.lambda.DockerImageCode;
import software.amazon.awscdk.services.lambda.DockerImageFunction;
import software.amazon.awscdk.services.lambda.Function;
import software.amazon.awscdk.services.logs.ILogGroup;
import software.amazon.awscdk.services.logs.LogGroup;
import software.amazon.awscdk.services.logs.LogGroupProps;
import software.constructs.Construct;

/**
 * The container-image Lambda that does the actual work, with its own log group and execution role.
 * The role starts with log delivery only; {@link PolicyComposer} adds the rest.
 */
public class ComputeFunction implements ArnAddressable {

    public final DockerImageCode dockerImage;
    public final Role executionRole;
    public final ILogGroup logGroup;
    public final Function lambda;
    public final ComputeFunctionProps props;

    public ComputeFunction(final Construct scope, ComputeFunctionProps props) {
        this.props = props;

        var imageDirectory = Paths.get(props.imageDirectory()).toAbsolutePath().normalize();
        if (!imageDirectory.resolve("Dockerfile").toFile().exists()) {
            throw new IllegalArgumentException("No Dockerfile found in function image directory " + imageDirectory
                    + "; set functionImageDirectory in cdk.json or FUNCTION_IMAGE_DIRECTORY to the function's image source");
        }
        this.dockerImage = DockerImageCode.fromImageAsset(imageDirectory.toString());

        this.executionRole = Role.Builder.create(scope, props.idPrefix() + "-Role")
                .roleName(props.roleName())
                .assumedBy(new ServicePrincipal("lambda.amazonaws.com"))
                .managedPolicies(
                        List.of(ManagedPolicy.fromAwsManagedPolicyName("service-role/AWSLambdaBasicExecutionRole")))
                .build();

        this.logGroup = new LogGroup(
                scope,
                props.idPrefix() + "-LogGroup",
                LogGroupProps.builder()
                        .logGroupName(props.logGroupName())
                        .retention(props.logGroupRetention())
                        .removalPolicy(props.logGroupRemovalPolicy())
                        .build());
        infof(
                "Created log group %s with retention %s for Lambda %s",
                this.logGroup.getNode().getId(), props.logGroupRetention(), props.functionName());

        this.lambda = DockerImageFunction.Builder.create(scope, props.idPrefix())
                .code(this.dockerImage)
                .functionName(props.functionName())
                .timeout(props.timeout())
                .memorySize(props.memorySize())
                .logGroup(this.logGroup)
                .role(this.executionRole)
                .build();
        infof("Created Lambda %s with function name %s", this.lambda.getNode().getId(), props.functionName());
    }

    @Override
    public String arn() {
        return this.lambda.getFunctionArn();
    }
}
