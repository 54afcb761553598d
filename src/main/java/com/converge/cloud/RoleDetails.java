package com.converge.cloud;

import java.util.Map;

/**
 * A live IAM role and its assume-role policy.
 */
public record RoleDetails(String roleName, String roleArn, Map<String, Object> trustPolicy) {
}
