package com.converge.core.executor;

import com.converge.core.model.Deferred;
import com.converge.core.plan.StringFormat;
import com.converge.core.plan.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces {@link Variable}s and {@link StringFormat}s in a value with their
 * pool values, walking maps and lists recursively. Literals pass through.
 */
public class VariableResolver {

    /**
     * @param value parameter value to resolve
     * @param key   parameter name, reported if an unresolved value is found
     * @param pool  current variable pool
     * @throws UnresolvedValueException if a pending {@link Deferred} is found
     * @throws IllegalStateException    if a referenced variable is not in the pool
     */
    public Object resolve(String key, Object value, Map<String, Object> pool) {
        if (value instanceof Variable variable) {
            return lookup(variable.name(), pool);
        }
        if (value instanceof StringFormat format) {
            Map<String, Object> values = new HashMap<>();
            for (String name : format.variables()) {
                values.put(name, lookup(name, pool));
            }
            return format.render(values);
        }
        if (value instanceof Deferred<?> deferred) {
            if (deferred.isPending()) {
                throw new UnresolvedValueException(key, deferred);
            }
            return resolve(key, deferred.get(), pool);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(entry.getKey(), resolve(String.valueOf(entry.getKey()), entry.getValue(), pool));
            }
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolve(key, item, pool));
            }
            return resolved;
        }
        return value;
    }

    /** Resolves every parameter of an API call. */
    public Map<String, Object> resolveParams(Map<String, Object> params, Map<String, Object> pool) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getKey(), entry.getValue(), pool));
        }
        return resolved;
    }

    private static Object lookup(String name, Map<String, Object> pool) {
        if (!pool.containsKey(name)) {
            throw new IllegalStateException("Variable '" + name + "' has not been set by an earlier instruction");
        }
        return pool.get(name);
    }
}
