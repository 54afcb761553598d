package com.converge.core.engine;

import java.util.List;
import java.util.Map;

/**
 * Formats the summary printed after a deployment: function ARNs, then the API URL.
 */
public class DeploymentReporter {

    public String generateReport(List<Map<String, Object>> resources) {
        StringBuilder report = new StringBuilder("Resources deployed:\n");
        String restApiUrl = null;
        for (Map<String, Object> resource : resources) {
            Object type = resource.get("resource_type");
            if ("lambda_function".equals(type)) {
                report.append("  - Lambda ARN: ").append(resource.get("lambda_arn")).append('\n');
            } else if ("rest_api".equals(type)) {
                restApiUrl = String.valueOf(resource.get("rest_api_url"));
            }
        }
        if (restApiUrl != null) {
            report.append("  - Rest API URL: ").append(restApiUrl).append('\n');
        }
        return report.toString();
    }
}
