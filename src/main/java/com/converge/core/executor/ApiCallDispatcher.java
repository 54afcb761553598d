package com.converge.core.executor;

import com.converge.cloud.CloudClient;
import com.converge.cloud.FunctionDefinition;
import com.converge.cloud.FunctionUpdate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps the method names used in plans onto {@link CloudClient} calls.
 * <p>
 * The registry is fixed; a plan naming any other method is a programming
 * error. Methods returning nothing yield {@code null}.
 */
public class ApiCallDispatcher {

    private final Map<String, Function<Params, Object>> methods;

    public ApiCallDispatcher(CloudClient client) {
        Map<String, Function<Params, Object>> m = new HashMap<>();

        // Functions
        m.put("lambda_function_exists", p -> client.lambdaFunctionExists(p.string("name")));
        m.put("create_function", p -> client.createFunction(new FunctionDefinition(
                p.string("function_name"),
                p.string("role_arn"),
                p.string("zip_file"),
                p.string("runtime"),
                p.string("handler"),
                p.stringMap("environment_variables"),
                p.stringMap("tags"),
                p.integer("timeout"),
                p.integer("memory_size"),
                p.stringList("security_group_ids"),
                p.stringList("subnet_ids"),
                p.stringList("layers"),
                p.bool("xray"))));
        m.put("update_function", p -> client.updateFunction(new FunctionUpdate(
                p.string("function_name"),
                p.optionalString("zip_file"),
                p.optionalString("role_arn"),
                p.optionalString("runtime"),
                p.optionalString("handler"),
                p.optionalStringMap("environment_variables"),
                p.optionalStringMap("tags"),
                p.optionalInteger("timeout"),
                p.optionalInteger("memory_size"),
                p.optionalStringList("security_group_ids"),
                p.optionalStringList("subnet_ids"),
                p.optionalStringList("layers"),
                p.optionalBoolean("xray"))));
        m.put("put_function_concurrency", p -> {
            client.putFunctionConcurrency(p.string("function_name"), p.integer("reserved_concurrent_executions"));
            return null;
        });
        m.put("delete_function_concurrency", p -> {
            client.deleteFunctionConcurrency(p.string("function_name"));
            return null;
        });
        m.put("delete_function", p -> {
            client.deleteFunction(p.string("function_name"));
            return null;
        });

        // Roles
        m.put("create_role", p -> client.createRole(p.string("name"), p.map("trust_policy"), p.map("policy")));
        m.put("put_role_policy", p -> {
            client.putRolePolicy(p.string("role_name"), p.string("policy_name"), p.map("policy_document"));
            return null;
        });
        m.put("update_assume_role_policy", p -> {
            client.updateAssumeRolePolicy(p.string("role_name"), p.map("trust_policy"));
            return null;
        });
        m.put("delete_role", p -> {
            client.deleteRole(p.string("name"));
            return null;
        });

        // REST APIs
        m.put("import_rest_api", p -> client.importRestApi(p.map("swagger_document"), p.string("endpoint_type")));
        m.put("update_api_from_swagger", p -> {
            client.updateApiFromSwagger(p.string("rest_api_id"), p.map("swagger_document"));
            return null;
        });
        m.put("update_rest_api", p -> {
            client.updateRestApi(p.string("rest_api_id"), p.stringMapList("patch_operations"));
            return null;
        });
        m.put("add_permission_for_apigateway", p -> {
            client.addPermissionForApigateway(p.string("function_name"), p.string("region_name"),
                    p.string("account_id"), p.string("rest_api_id"));
            return null;
        });
        m.put("deploy_rest_api", p -> {
            client.deployRestApi(p.string("rest_api_id"), p.string("api_gateway_stage"));
            return null;
        });
        m.put("delete_rest_api", p -> {
            client.deleteRestApi(p.string("rest_api_id"));
            return null;
        });

        // Event rules
        m.put("get_or_create_rule_arn", p -> client.getOrCreateRuleArn(p.string("rule_name"),
                p.optionalString("schedule_expression"), p.optionalString("event_pattern"),
                p.optionalString("rule_description")));
        m.put("connect_rule_to_lambda", p -> {
            client.connectRuleToLambda(p.string("rule_name"), p.string("function_arn"));
            return null;
        });
        m.put("add_permission_for_cloudwatch_event", p -> {
            client.addPermissionForCloudwatchEvent(p.string("rule_arn"), p.string("function_arn"));
            return null;
        });
        m.put("delete_rule", p -> {
            client.deleteRule(p.string("rule_name"));
            return null;
        });

        // S3
        m.put("add_permission_for_s3_event", p -> {
            client.addPermissionForS3Event(p.string("bucket"), p.string("function_arn"));
            return null;
        });
        m.put("connect_s3_bucket_to_lambda", p -> {
            client.connectS3BucketToLambda(p.string("bucket"), p.string("function_arn"),
                    p.stringList("events"), p.optionalString("prefix"), p.optionalString("suffix"));
            return null;
        });
        m.put("disconnect_s3_bucket_from_lambda", p -> {
            client.disconnectS3BucketFromLambda(p.string("bucket"), p.string("function_arn"));
            return null;
        });
        m.put("remove_permission_for_s3_event", p -> {
            client.removePermissionForS3Event(p.string("bucket"), p.string("function_arn"));
            return null;
        });

        // SNS
        m.put("add_permission_for_sns_topic", p -> {
            client.addPermissionForSnsTopic(p.string("topic_arn"), p.string("function_arn"));
            return null;
        });
        m.put("subscribe_function_to_topic", p ->
                client.subscribeFunctionToTopic(p.string("topic_arn"), p.string("function_arn")));
        m.put("unsubscribe_from_topic", p -> {
            client.unsubscribeFromTopic(p.string("subscription_arn"));
            return null;
        });
        m.put("remove_permission_for_sns_topic", p -> {
            client.removePermissionForSnsTopic(p.string("topic_arn"), p.string("function_arn"));
            return null;
        });

        // SQS
        m.put("create_sqs_event_source", p -> client.createSqsEventSource(p.string("queue_arn"),
                p.string("function_name"), p.integer("batch_size"), p.integer("maximum_batching_window_in_seconds")));
        m.put("update_sqs_event_source", p -> {
            client.updateSqsEventSource(p.string("event_uuid"), p.integer("batch_size"),
                    p.integer("maximum_batching_window_in_seconds"));
            return null;
        });
        m.put("remove_sqs_event_source", p -> {
            client.removeSqsEventSource(p.string("event_uuid"));
            return null;
        });

        this.methods = Collections.unmodifiableMap(m);
    }

    /**
     * @param params parameters with every variable already resolved
     * @throws IllegalStateException if the method is not in the registry
     */
    public Object invoke(String methodName, Map<String, Object> params) {
        Function<Params, Object> method = methods.get(methodName);
        if (method == null) {
            throw new IllegalStateException("Unknown API method: " + methodName);
        }
        return method.apply(new Params(methodName, params));
    }

    public Set<String> methodNames() {
        return methods.keySet();
    }
}
