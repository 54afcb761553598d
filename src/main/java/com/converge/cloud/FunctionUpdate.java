package com.converge.cloud;

import java.util.List;
import java.util.Map;

/**
 * Changes to apply to an existing function. {@code null} fields are left as they are.
 */
public record FunctionUpdate(
        String functionName,
        String zipFile,
        String roleArn,
        String runtime,
        String handler,
        Map<String, String> environmentVariables,
        Map<String, String> tags,
        Integer timeout,
        Integer memorySize,
        List<String> securityGroupIds,
        List<String> subnetIds,
        List<String> layers,
        Boolean xray
) {

    public boolean changesConfiguration() {
        return roleArn != null || runtime != null || handler != null || environmentVariables != null
                || timeout != null || memorySize != null || securityGroupIds != null || subnetIds != null
                || layers != null || xray != null;
    }
}
