package com.converge.core.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Policy documents and statements attached to generated roles.
 */
public final class IamPolicies {

    public static final String POLICY_VERSION = "2012-10-17";

    private IamPolicies() {}

    public static Map<String, Object> lambdaTrustPolicy() {
        return Map.of(
                "Version", POLICY_VERSION,
                "Statement", List.of(Map.of(
                        "Sid", "",
                        "Effect", "Allow",
                        "Principal", Map.of("Service", "lambda.amazonaws.com"),
                        "Action", "sts:AssumeRole")));
    }

    public static Map<String, Object> cloudWatchLogsStatement() {
        return Map.of(
                "Effect", "Allow",
                "Action", List.of("logs:CreateLogGroup", "logs:CreateLogStream", "logs:PutLogEvents"),
                "Resource", "arn:*:logs:*:*:*");
    }

    public static Map<String, Object> vpcAttachStatement() {
        return Map.of(
                "Effect", "Allow",
                "Action", List.of(
                        "ec2:CreateNetworkInterface",
                        "ec2:DescribeNetworkInterfaces",
                        "ec2:DetachNetworkInterface",
                        "ec2:DeleteNetworkInterface"),
                "Resource", "*");
    }

    public static Map<String, Object> xrayStatement() {
        return Map.of(
                "Effect", "Allow",
                "Action", List.of("xray:PutTraceSegments", "xray:PutTelemetryRecords"),
                "Resource", "*");
    }

    public static Map<String, Object> document(List<Map<String, Object>> statements) {
        return Map.of("Version", POLICY_VERSION, "Statement", new ArrayList<>(statements));
    }
}
