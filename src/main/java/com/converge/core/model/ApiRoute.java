package com.converge.core.model;

import java.util.List;

/**
 * A path of a REST API and the HTTP methods it accepts.
 *
 * @param authorizer resource name of the authorizer function guarding the route, or {@code null}
 */
public record ApiRoute(String path, List<String> methods, String authorizer) {

    public ApiRoute {
        methods = List.copyOf(methods);
    }

    public ApiRoute(String path, List<String> methods) {
        this(path, methods, null);
    }
}
