package com.converge.core.build;

import com.converge.core.model.ApiRoute;
import com.converge.core.model.LambdaFunction;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;
import com.converge.core.model.RestApi;
import com.converge.core.plan.StringFormat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates the Swagger 2.0 definition of a REST API.
 * <p>
 * Every route proxies to the API's handler function. Integration URIs are
 * {@link StringFormat}s over {@code partition}, {@code region_name} and the
 * function ARN variables, since the handler may not exist until the plan runs.
 */
public class ApiDefinitionBuilder implements BuildStep {

    public static final String HANDLER_ARN_VARIABLE = "api_handler_lambda_arn";

    private static final String INVOCATION_URI =
            "arn:{partition}:apigateway:{region_name}:lambda:path/2015-03-31/functions/{%s}/invocations";

    @Override
    public void handle(ResourceGraph graph, ResourceId id) {
        if (graph.get(id) instanceof RestApi restApi && restApi.swaggerDoc().isPending()) {
            graph.replace(id, restApi.withSwaggerDoc(generate(graph, restApi)));
        }
    }

    Map<String, Object> generate(ResourceGraph graph, RestApi restApi) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("swagger", "2.0");
        doc.put("info", Map.of("version", "1.0", "title", restApi.resourceName()));
        doc.put("schemes", List.of("https"));
        doc.put("definitions", Map.of("Empty", Map.of("type", "object", "title", "Empty Schema")));

        Map<String, Map<String, Object>> paths = new LinkedHashMap<>();
        for (ApiRoute route : restApi.routes()) {
            Map<String, Object> methods = paths.computeIfAbsent(route.path(), k -> new LinkedHashMap<>());
            for (String method : route.methods()) {
                methods.put(method.toLowerCase(Locale.ROOT), methodEntry(route));
            }
        }
        doc.put("paths", paths);

        Map<String, Object> securityDefinitions = new LinkedHashMap<>();
        for (ResourceId authorizerId : restApi.authorizers()) {
            LambdaFunction authorizer = graph.get(authorizerId, LambdaFunction.class);
            securityDefinitions.put(authorizer.resourceName(), authorizerEntry(authorizer.resourceName()));
        }
        if (!securityDefinitions.isEmpty()) {
            doc.put("securityDefinitions", securityDefinitions);
        }
        return doc;
    }

    private Map<String, Object> methodEntry(ApiRoute route) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("consumes", List.of("application/json"));
        entry.put("produces", List.of("application/json"));
        entry.put("responses", Map.of("200", Map.of(
                "description", "200 response",
                "schema", Map.of("$ref", "#/definitions/Empty"))));
        Map<String, Object> integration = new LinkedHashMap<>();
        integration.put("responses", Map.of("default", Map.of("statusCode", "200")));
        integration.put("uri", invocationUri(HANDLER_ARN_VARIABLE));
        integration.put("passthroughBehavior", "when_no_match");
        integration.put("httpMethod", "POST");
        integration.put("contentHandling", "CONVERT_TO_TEXT");
        integration.put("type", "aws_proxy");
        entry.put("x-amazon-apigateway-integration", integration);
        if (route.authorizer() != null) {
            entry.put("security", List.of(Map.of(route.authorizer(), List.of())));
        }
        return entry;
    }

    private Map<String, Object> authorizerEntry(String authorizerName) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("in", "header");
        entry.put("type", "apiKey");
        entry.put("name", "Authorization");
        entry.put("x-amazon-apigateway-authtype", "custom");
        entry.put("x-amazon-apigateway-authorizer", Map.of(
                "type", "token",
                "authorizerUri", invocationUri(authorizerArnVariable(authorizerName)),
                "authorizerResultTtlInSeconds", 300));
        return entry;
    }

    public static String authorizerArnVariable(String authorizerName) {
        return authorizerName + "_lambda_arn";
    }

    private static StringFormat invocationUri(String arnVariable) {
        return new StringFormat(INVOCATION_URI.formatted(arnVariable),
                List.of("partition", "region_name", arnVariable));
    }
}
