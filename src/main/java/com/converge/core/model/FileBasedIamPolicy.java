package com.converge.core.model;

import java.util.List;
import java.util.Map;

/**
 * Policy whose document is read from a JSON file in the project.
 *
 * @param filename path relative to the project directory
 */
public record FileBasedIamPolicy(
        String resourceName,
        String filename,
        Deferred<Map<String, Object>> document
) implements IamPolicy {

    public FileBasedIamPolicy withDocument(Map<String, Object> document) {
        return new FileBasedIamPolicy(resourceName, filename, Deferred.of(document));
    }

    @Override
    public List<String> pendingFields() {
        return document.isPending() ? List.of("document") : List.of();
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitFileBasedIamPolicy(this);
    }
}
