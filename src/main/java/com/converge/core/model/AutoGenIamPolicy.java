package com.converge.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Policy generated from the permissions the application's functions need.
 */
public record AutoGenIamPolicy(
        String resourceName,
        Deferred<Map<String, Object>> document,
        Set<RoleTraits> traits
) implements IamPolicy {

    public AutoGenIamPolicy {
        traits = Set.copyOf(traits);
    }

    public AutoGenIamPolicy withDocument(Map<String, Object> document) {
        return new AutoGenIamPolicy(resourceName, Deferred.of(document), traits);
    }

    public AutoGenIamPolicy withTrait(RoleTraits trait) {
        var merged = new HashSet<>(traits);
        merged.add(trait);
        return new AutoGenIamPolicy(resourceName, document, merged);
    }

    @Override
    public List<String> pendingFields() {
        return document.isPending() ? List.of("document") : List.of();
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitAutoGenIamPolicy(this);
    }
}
