package com.converge.cloud;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to create a function.
 *
 * @param zipFile path of the deployment package on the local disk
 */
public record FunctionDefinition(
        String functionName,
        String roleArn,
        String zipFile,
        String runtime,
        String handler,
        Map<String, String> environmentVariables,
        Map<String, String> tags,
        int timeout,
        int memorySize,
        List<String> securityGroupIds,
        List<String> subnetIds,
        List<String> layers,
        boolean xray
) {
}
