package com.converge.core.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the resolved keyword parameters of an API call.
 */
final class Params {

    private final String methodName;
    private final Map<String, Object> values;

    Params(String methodName, Map<String, Object> values) {
        this.methodName = methodName;
        this.values = values;
    }

    String string(String key) {
        return required(key).toString();
    }

    String optionalString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    int integer(String key) {
        return toInteger(key, required(key));
    }

    Integer optionalInteger(String key) {
        Object value = values.get(key);
        return value == null ? null : toInteger(key, value);
    }

    boolean bool(String key) {
        Boolean value = optionalBoolean(key);
        return value != null && value;
    }

    Boolean optionalBoolean(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString());
    }

    Map<String, Object> map(String key) {
        Object value = required(key);
        if (!(value instanceof Map<?, ?> map)) {
            throw wrongType(key, "an object", value);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    Map<String, String> stringMap(String key) {
        Map<String, String> result = optionalStringMap(key);
        return result == null ? Map.of() : result;
    }

    Map<String, String> optionalStringMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw wrongType(key, "an object", value);
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v == null ? null : v.toString()));
        return result;
    }

    List<String> stringList(String key) {
        List<String> result = optionalStringList(key);
        return result == null ? List.of() : result;
    }

    List<String> optionalStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw wrongType(key, "a list", value);
        }
        List<String> result = new ArrayList<>(list.size());
        list.forEach(item -> result.add(String.valueOf(item)));
        return result;
    }

    List<Map<String, String>> stringMapList(String key) {
        Object value = required(key);
        if (!(value instanceof List<?> list)) {
            throw wrongType(key, "a list", value);
        }
        List<Map<String, String>> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw wrongType(key, "a list of objects", value);
            }
            Map<String, String> entry = new LinkedHashMap<>();
            map.forEach((k, v) -> entry.put(String.valueOf(k), v == null ? null : v.toString()));
            result.add(entry);
        }
        return result;
    }

    private Object required(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing parameter '" + key + "' for " + methodName);
        }
        return value;
    }

    private int toInteger(String key, Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw wrongType(key, "a number", value);
        }
    }

    private IllegalArgumentException wrongType(String key, String expected, Object value) {
        return new IllegalArgumentException("Parameter '" + key + "' of " + methodName + " must be "
                + expected + ", got: " + value);
    }
}
