package com.converge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A REST API whose routes all proxy to one handler function.
 *
 * @param swaggerDoc         API definition, pending until generated
 * @param minimumCompression minimum payload size to compress, empty for none
 * @param apiGatewayStage    stage the API is deployed to
 * @param endpointType       EDGE, REGIONAL or PRIVATE
 * @param lambdaFunction     id of the handler function
 * @param authorizers        ids of authorizer functions
 */
public record RestApi(
        String resourceName,
        Deferred<Map<String, Object>> swaggerDoc,
        String minimumCompression,
        String apiGatewayStage,
        String endpointType,
        ResourceId lambdaFunction,
        List<ResourceId> authorizers,
        List<ApiRoute> routes
) implements Resource {

    public RestApi {
        authorizers = List.copyOf(authorizers);
        routes = List.copyOf(routes);
    }

    public RestApi withSwaggerDoc(Map<String, Object> doc) {
        return new RestApi(resourceName, Deferred.of(doc), minimumCompression, apiGatewayStage,
                endpointType, lambdaFunction, authorizers, routes);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.REST_API;
    }

    @Override
    public List<ResourceId> dependencies() {
        List<ResourceId> deps = new ArrayList<>();
        deps.add(lambdaFunction);
        deps.addAll(authorizers);
        return deps;
    }

    @Override
    public List<String> pendingFields() {
        return swaggerDoc.isPending() ? List.of("swagger_doc") : List.of();
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitRestApi(this);
    }
}
