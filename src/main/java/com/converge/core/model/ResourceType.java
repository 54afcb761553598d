package com.converge.core.model;

import java.util.Arrays;

/**
 * Discriminator persisted in the deployed-resources record.
 * Only managed types are recorded and swept; the others exist in the graph
 * to feed attributes into managed resources.
 */
public enum ResourceType {

    LAMBDA_FUNCTION("lambda_function", true),
    IAM_ROLE("iam_role", true),
    REST_API("rest_api", true),
    SCHEDULED_EVENT("scheduled_event", true),
    CLOUDWATCH_EVENT("cloudwatch_event", true),
    S3_EVENT("s3_event", true),
    SNS_EVENT("sns_event", true),
    SQS_EVENT("sqs_event", true),
    PRE_CREATED_IAM_ROLE("pre_created_iam_role", false),
    IAM_POLICY("iam_policy", false),
    DEPLOYMENT_PACKAGE("deployment_package", false);

    private final String wireName;
    private final boolean managed;

    ResourceType(String wireName, boolean managed) {
        this.wireName = wireName;
        this.managed = managed;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isManaged() {
        return managed;
    }

    /**
     * Looks up a type by the name stored on disk.
     *
     * @throws IllegalArgumentException for names this version does not know
     */
    public static ResourceType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
