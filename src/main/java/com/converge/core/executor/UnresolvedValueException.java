package com.converge.core.executor;

/**
 * A value the build stage should have filled in reached an API call unresolved.
 * Always a defect in the build stage; never retried.
 */
public class UnresolvedValueException extends RuntimeException {

    private final String key;
    private final Object value;
    private final String methodName;

    public UnresolvedValueException(String key, Object value) {
        this(key, value, null);
    }

    public UnresolvedValueException(String key, Object value, String methodName) {
        super(String.format("The API parameter '%s' has an unresolved value of %s in the method call: %s",
                key, value, methodName));
        this.key = key;
        this.value = value;
        this.methodName = methodName;
    }

    /** Copy of this exception naming the API method the parameter belonged to. */
    public UnresolvedValueException withMethodName(String methodName) {
        UnresolvedValueException copy = new UnresolvedValueException(key, value, methodName);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    public String getMethodName() {
        return methodName;
    }
}
