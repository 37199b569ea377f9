package com.mtlockyer.constructs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Event the schedule sends to the function on every invocation. Only the function interprets it.
 * The topic ARN is usually a CDK token which CloudFormation resolves inside the serialized string.
 */
@JsonPropertyOrder({"site-un", "s3-bucket", "s3-object-key", "sns-topic-arn"})
public record InvocationPayload(
        @JsonProperty("site-un") String siteUn,
        @JsonProperty("s3-bucket") String s3Bucket,
        @JsonProperty("s3-object-key") String s3ObjectKey,
        @JsonProperty("sns-topic-arn") String snsTopicArn) {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize invocation payload", e);
        }
    }
}
