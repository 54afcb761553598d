package com.converge.core.model;

import java.util.Map;

/**
 * Inline policy document attached to a managed role.
 */
public interface IamPolicy extends Resource {

    Deferred<Map<String, Object>> document();

    @Override
    default ResourceType resourceType() {
        return ResourceType.IAM_POLICY;
    }
}
