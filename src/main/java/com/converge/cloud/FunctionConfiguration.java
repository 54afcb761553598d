package com.converge.cloud;

import java.util.List;
import java.util.Map;

/**
 * Live configuration of a deployed function.
 *
 * @param codeSha256          base64 SHA-256 of the deployed package
 * @param reservedConcurrency reserved executions, or {@code null} when unset
 */
public record FunctionConfiguration(
        String functionArn,
        String roleArn,
        String runtime,
        String handler,
        int timeout,
        int memorySize,
        Map<String, String> environmentVariables,
        Map<String, String> tags,
        List<String> securityGroupIds,
        List<String> subnetIds,
        List<String> layers,
        boolean xray,
        String codeSha256,
        Integer reservedConcurrency
) {
}
