package com.converge.core.plan;

import com.converge.core.model.ResourceType;

/**
 * Instructions that add a field to the deployed-resources record.
 */
public interface RecordResource extends Instruction {

    ResourceType resourceType();

    String resourceName();

    String field();
}
