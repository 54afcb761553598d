package com.converge.core.model;

/**
 * Capabilities a function needs from its auto-generated role policy.
 */
public enum RoleTraits {
    VPC_NEEDED,
    XRAY_NEEDED
}
