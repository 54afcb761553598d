package com.converge.core.planner;

import com.converge.core.build.ApiDefinitionBuilder;
import com.converge.core.build.BuiltResources;
import com.converge.core.build.PackageDigest;
import com.converge.core.logging.MdcContext;
import com.converge.core.model.AutoGenIamPolicy;
import com.converge.core.model.CloudWatchEvent;
import com.converge.core.model.DeploymentPackage;
import com.converge.core.model.FileBasedIamPolicy;
import com.converge.core.model.IamPolicy;
import com.converge.core.model.LambdaFunction;
import com.converge.core.model.ManagedIamRole;
import com.converge.core.model.PreCreatedIamRole;
import com.converge.core.model.Resource;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;
import com.converge.core.model.ResourceType;
import com.converge.core.model.ResourceVisitor;
import com.converge.core.model.RestApi;
import com.converge.core.model.S3BucketNotification;
import com.converge.core.model.ScheduledEvent;
import com.converge.core.model.SnsSubscription;
import com.converge.core.model.SqsEventSource;
import com.converge.core.plan.ApiCall;
import com.converge.core.plan.BuiltinFunction;
import com.converge.core.plan.Instruction;
import com.converge.core.plan.JpSearch;
import com.converge.core.plan.Plan;
import com.converge.core.plan.RecordResourceValue;
import com.converge.core.plan.RecordResourceVariable;
import com.converge.core.plan.StoreValue;
import com.converge.core.plan.StringFormat;
import com.converge.core.plan.Variable;
import com.converge.core.remote.RemoteState;
import com.converge.core.remote.ResourceSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diffs built resources against remote state and emits the instructions that
 * converge them.
 * <p>
 * Updates are field level: an existing resource only gets the calls needed
 * for the attributes that differ. A resource that already matches gets no API
 * calls, only the {@code RecordResource*} instructions that carry its
 * identifiers into the next deployed record.
 * <p>
 * A dependency created earlier in the same plan is referenced through a
 * {@link Variable}; one that already exists is referenced by its literal ARN.
 * Only read-only queries are issued, so planning twice against the same
 * remote state yields equal plans.
 */
public class PlanStage implements Planner {

    private static final Logger log = LoggerFactory.getLogger(PlanStage.class);

    private final RemoteState remoteState;
    private final ObjectMapper canonicalMapper;

    public PlanStage(RemoteState remoteState, ObjectMapper objectMapper) {
        this.remoteState = remoteState;
        this.canonicalMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public Plan plan(BuiltResources resources) {
        PlanningSession session = new PlanningSession(resources.graph());
        try {
            for (ResourceId id : resources.order()) {
                Resource resource = resources.graph().get(id);
                MdcContext.setResource(resources.stage(), resource.resourceType().wireName(), resource.resourceName());
                session.plan(id);
            }
        } finally {
            MdcContext.clearResource();
        }
        Plan plan = session.builder.build();
        log.info("Planned {} instructions for {} resources", plan.size(), resources.order().size());
        return plan;
    }

    /** SHA-256 of the API document serialized with sorted keys. */
    String apiDefinitionHash(Map<String, Object> swaggerDoc) {
        try {
            return PackageDigest.sha256Hex(canonicalMapper.writeValueAsString(swaggerDoc).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("API definition is not serializable", e);
        }
    }

    /**
     * State of one {@link #plan} call: the plan under construction and the
     * ARN reference (literal or variable) of every function and role planned so far.
     */
    private final class PlanningSession implements ResourceVisitor<Void> {

        private final ResourceGraph graph;
        private final Plan.Builder builder = Plan.builder();
        private final Map<ResourceId, Object> functionArns = new HashMap<>();
        private final Map<ResourceId, Object> roleArns = new HashMap<>();
        private ResourceId current;

        PlanningSession(ResourceGraph graph) {
            this.graph = graph;
        }

        void plan(ResourceId id) {
            current = id;
            graph.get(id).accept(this);
        }

        private void emit(List<Instruction> instructions, String message) {
            for (int i = 0; i < instructions.size(); i++) {
                builder.add(instructions.get(i), i == 0 ? message : null);
            }
        }

        // -- Functions --

        @Override
        public Void visitLambdaFunction(LambdaFunction function) {
            Object roleArn = roleArnFor(function.role());
            String zipFile = graph.get(function.deploymentPackage(), DeploymentPackage.class).filename().get();
            String arnVariable = function.resourceName() + "_lambda_arn";
            List<Instruction> instructions = new ArrayList<>();

            if (!remoteState.exists(function)) {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("function_name", function.functionName());
                params.put("role_arn", roleArn);
                params.put("zip_file", zipFile);
                params.put("runtime", function.runtime());
                params.put("handler", function.handler());
                params.put("environment_variables", function.environmentVariables());
                params.put("tags", function.tags());
                params.put("timeout", function.timeout().get());
                params.put("memory_size", function.memorySize().get());
                params.put("security_group_ids", function.securityGroupIds());
                params.put("subnet_ids", function.subnetIds());
                params.put("layers", function.layers());
                params.put("xray", function.xray());
                instructions.add(new ApiCall("create_function", params, arnVariable));
                if (function.reservedConcurrency() != null) {
                    instructions.add(new ApiCall("put_function_concurrency", Map.of(
                            "function_name", function.functionName(),
                            "reserved_concurrent_executions", function.reservedConcurrency())));
                }
                instructions.add(new RecordResourceVariable(
                        ResourceType.LAMBDA_FUNCTION, function.resourceName(), "lambda_arn", arnVariable));
                functionArns.put(current, new Variable(arnVariable));
                emit(instructions, "Creating lambda function: " + function.functionName());
                return null;
            }

            ResourceSnapshot snapshot = remoteState.fetch(function);
            String liveArn = snapshot.getString("lambda_arn");
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("function_name", function.functionName());
            if (roleArn instanceof Variable || !snapshot.matches("role_arn", roleArn)) {
                params.put("role_arn", roleArn);
            }
            putIfChanged(params, snapshot, "runtime", function.runtime());
            putIfChanged(params, snapshot, "handler", function.handler());
            putIfChanged(params, snapshot, "timeout", function.timeout().get());
            putIfChanged(params, snapshot, "memory_size", function.memorySize().get());
            putIfChanged(params, snapshot, "environment_variables", function.environmentVariables());
            putIfChanged(params, snapshot, "tags", function.tags());
            if (!snapshot.matches("security_group_ids", function.securityGroupIds())
                    || !snapshot.matches("subnet_ids", function.subnetIds())) {
                // VPC settings are replaced as a unit
                params.put("security_group_ids", function.securityGroupIds());
                params.put("subnet_ids", function.subnetIds());
            }
            putIfChanged(params, snapshot, "layers", function.layers());
            putIfChanged(params, snapshot, "xray", function.xray());
            if (!PackageDigest.sha256Base64(Path.of(zipFile)).equals(snapshot.getString("code_sha256"))) {
                params.put("zip_file", zipFile);
            }
            if (params.size() > 1) {
                instructions.add(new ApiCall("update_function", params));
            }

            Integer liveConcurrency = snapshot.getInteger("reserved_concurrency");
            if (!Objects.equals(function.reservedConcurrency(), liveConcurrency)) {
                if (function.reservedConcurrency() == null) {
                    instructions.add(new ApiCall("delete_function_concurrency",
                            Map.of("function_name", function.functionName())));
                } else {
                    instructions.add(new ApiCall("put_function_concurrency", Map.of(
                            "function_name", function.functionName(),
                            "reserved_concurrent_executions", function.reservedConcurrency())));
                }
            }
            instructions.add(new RecordResourceValue(
                    ResourceType.LAMBDA_FUNCTION, function.resourceName(), "lambda_arn", liveArn));
            functionArns.put(current, liveArn);
            emit(instructions, instructions.size() > 1 ? "Updating lambda function: " + function.functionName() : null);
            return null;
        }

        private void putIfChanged(Map<String, Object> params, ResourceSnapshot snapshot, String field, Object desired) {
            if (!snapshot.matches(field, desired)) {
                params.put(field, desired);
            }
        }

        // -- Roles and policies --

        @Override
        public Void visitManagedIamRole(ManagedIamRole role) {
            Map<String, Object> policy = graph.get(role.policy(), IamPolicy.class).document().get();
            String arnVariable = role.roleName() + "_role_arn";
            List<Instruction> instructions = new ArrayList<>();

            if (!remoteState.exists(role)) {
                instructions.add(new ApiCall("create_role", params(
                        "name", role.roleName(),
                        "trust_policy", role.trustPolicy(),
                        "policy", policy), arnVariable));
                instructions.add(new RecordResourceVariable(ResourceType.IAM_ROLE, role.resourceName(), "role_arn", arnVariable));
                instructions.add(new RecordResourceValue(ResourceType.IAM_ROLE, role.resourceName(), "role_name", role.roleName()));
                roleArns.put(current, new Variable(arnVariable));
                emit(instructions, "Creating IAM role: " + role.roleName());
                return null;
            }

            ResourceSnapshot snapshot = remoteState.fetch(role);
            String liveArn = snapshot.getString("role_arn");
            String message = null;
            if (!snapshot.matches("policy_document", policy)) {
                instructions.add(new ApiCall("put_role_policy", params(
                        "role_name", role.roleName(),
                        "policy_name", role.roleName(),
                        "policy_document", policy)));
                message = "Updating policy for IAM role: " + role.roleName();
            }
            if (!snapshot.matches("trust_policy", role.trustPolicy())) {
                instructions.add(new ApiCall("update_assume_role_policy", params(
                        "role_name", role.roleName(),
                        "trust_policy", role.trustPolicy())));
                if (message == null) {
                    message = "Updating trust policy for IAM role: " + role.roleName();
                }
            }
            instructions.add(new RecordResourceValue(ResourceType.IAM_ROLE, role.resourceName(), "role_arn", liveArn));
            instructions.add(new RecordResourceValue(ResourceType.IAM_ROLE, role.resourceName(), "role_name", role.roleName()));
            roleArns.put(current, liveArn);
            emit(instructions, message);
            return null;
        }

        @Override
        public Void visitPreCreatedIamRole(PreCreatedIamRole role) {
            roleArns.put(current, role.roleArn());
            return null;
        }

        @Override
        public Void visitAutoGenIamPolicy(AutoGenIamPolicy policy) {
            return null;
        }

        @Override
        public Void visitFileBasedIamPolicy(FileBasedIamPolicy policy) {
            return null;
        }

        @Override
        public Void visitDeploymentPackage(DeploymentPackage deploymentPackage) {
            return null;
        }

        // -- REST API --

        @Override
        public Void visitRestApi(RestApi restApi) {
            String name = restApi.resourceName();
            Object handlerArn = functionArnFor(restApi.lambdaFunction());
            Map<String, Object> swaggerDoc = restApi.swaggerDoc().get();
            String definitionHash = apiDefinitionHash(swaggerDoc);
            boolean exists = remoteState.exists(restApi);
            ResourceSnapshot snapshot = remoteState.fetch(restApi);

            if (exists
                    && snapshot.matches("api_definition_hash", definitionHash)
                    && snapshot.matches("api_gateway_stage", restApi.apiGatewayStage())
                    && snapshot.matches("minimum_compression", restApi.minimumCompression())
                    && snapshot.matches("endpoint_type", restApi.endpointType())
                    && snapshot.matches("lambda_arn", handlerArn)) {
                emit(List.of(
                        recordValue(ResourceType.REST_API, name, "rest_api_id", snapshot.get("rest_api_id")),
                        recordValue(ResourceType.REST_API, name, "rest_api_url", snapshot.get("rest_api_url")),
                        recordValue(ResourceType.REST_API, name, "api_definition_hash", definitionHash),
                        recordValue(ResourceType.REST_API, name, "api_gateway_stage", restApi.apiGatewayStage()),
                        recordValue(ResourceType.REST_API, name, "minimum_compression", restApi.minimumCompression()),
                        recordValue(ResourceType.REST_API, name, "endpoint_type", restApi.endpointType()),
                        recordValue(ResourceType.REST_API, name, "lambda_arn", handlerArn)), null);
                return null;
            }

            List<Instruction> instructions = new ArrayList<>();
            instructions.add(new StoreValue(ApiDefinitionBuilder.HANDLER_ARN_VARIABLE, handlerArn));
            for (ResourceId authorizerId : restApi.authorizers()) {
                Object authorizerArn = functionArnFor(authorizerId);
                String variable = ApiDefinitionBuilder.authorizerArnVariable(graph.get(authorizerId).resourceName());
                if (!(authorizerArn instanceof Variable v && v.name().equals(variable))) {
                    instructions.add(new StoreValue(variable, authorizerArn));
                }
            }
            instructions.addAll(parseArnInstructions(new Variable(ApiDefinitionBuilder.HANDLER_ARN_VARIABLE)));

            String message;
            if (!exists) {
                instructions.add(new ApiCall("import_rest_api", params(
                        "swagger_document", swaggerDoc,
                        "endpoint_type", restApi.endpointType()), "rest_api_id"));
                message = "Creating Rest API";
            } else {
                instructions.add(new StoreValue("rest_api_id", snapshot.get("rest_api_id")));
                instructions.add(new ApiCall("update_api_from_swagger", params(
                        "rest_api_id", new Variable("rest_api_id"),
                        "swagger_document", swaggerDoc)));
                message = "Updating rest API";
            }
            instructions.add(new RecordResourceVariable(ResourceType.REST_API, name, "rest_api_id", "rest_api_id"));

            List<Map<String, String>> patchOperations = new ArrayList<>();
            patchOperations.add(Map.of(
                    "op", "replace",
                    "path", "/minimumCompressionSize",
                    "value", restApi.minimumCompression()));
            String liveEndpointType = snapshot.getString("endpoint_type");
            if (exists && liveEndpointType != null && !liveEndpointType.equals(restApi.endpointType())) {
                patchOperations.add(Map.of(
                        "op", "replace",
                        "path", "/endpointConfiguration/types/" + liveEndpointType,
                        "value", restApi.endpointType()));
            }
            instructions.add(new ApiCall("update_rest_api", params(
                    "rest_api_id", new Variable("rest_api_id"),
                    "patch_operations", patchOperations)));

            instructions.add(apigatewayPermission(new Variable(ApiDefinitionBuilder.HANDLER_ARN_VARIABLE)));
            for (ResourceId authorizerId : restApi.authorizers()) {
                String variable = ApiDefinitionBuilder.authorizerArnVariable(graph.get(authorizerId).resourceName());
                instructions.add(apigatewayPermission(new Variable(variable)));
            }
            instructions.add(new ApiCall("deploy_rest_api", params(
                    "rest_api_id", new Variable("rest_api_id"),
                    "api_gateway_stage", restApi.apiGatewayStage())));
            instructions.add(new StoreValue("rest_api_url", new StringFormat(
                    "https://{rest_api_id}.execute-api.{region_name}.amazonaws.com/" + restApi.apiGatewayStage() + "/",
                    List.of("rest_api_id", "region_name"))));
            instructions.add(new RecordResourceVariable(ResourceType.REST_API, name, "rest_api_url", "rest_api_url"));
            instructions.add(recordValue(ResourceType.REST_API, name, "api_definition_hash", definitionHash));
            instructions.add(recordValue(ResourceType.REST_API, name, "api_gateway_stage", restApi.apiGatewayStage()));
            instructions.add(recordValue(ResourceType.REST_API, name, "minimum_compression", restApi.minimumCompression()));
            instructions.add(recordValue(ResourceType.REST_API, name, "endpoint_type", restApi.endpointType()));
            instructions.add(new RecordResourceVariable(ResourceType.REST_API, name, "lambda_arn",
                    ApiDefinitionBuilder.HANDLER_ARN_VARIABLE));
            emit(instructions, message);
            return null;
        }

        private ApiCall apigatewayPermission(Variable functionArn) {
            return new ApiCall("add_permission_for_apigateway", params(
                    "function_name", functionArn,
                    "region_name", new Variable("region_name"),
                    "account_id", new Variable("account_id"),
                    "rest_api_id", new Variable("rest_api_id")));
        }

        // -- Event rules --

        @Override
        public Void visitScheduledEvent(ScheduledEvent event) {
            planRule(event, event.ruleName(), "schedule_expression", event.scheduleExpression(),
                    event.ruleDescription(), event.lambdaFunction());
            return null;
        }

        @Override
        public Void visitCloudWatchEvent(CloudWatchEvent event) {
            planRule(event, event.ruleName(), "event_pattern", event.eventPattern(),
                    event.ruleDescription(), event.lambdaFunction());
            return null;
        }

        private void planRule(Resource event, String ruleName, String expressionField, String expression,
                              String description, ResourceId lambdaFunction) {
            ResourceType type = event.resourceType();
            String name = event.resourceName();
            Object functionArn = functionArnFor(lambdaFunction);
            boolean exists = remoteState.exists(event);
            ResourceSnapshot snapshot = remoteState.fetch(event);
            boolean unchanged = exists
                    && snapshot.matches("rule_name", ruleName)
                    && snapshot.matches(expressionField, expression)
                    && snapshot.matches("rule_description", description)
                    && snapshot.matches("lambda_arn", functionArn);

            List<Instruction> instructions = new ArrayList<>();
            String message = null;
            if (!unchanged) {
                String ruleArnVariable = name + "_rule_arn";
                instructions.add(new ApiCall("get_or_create_rule_arn", params(
                        "rule_name", ruleName,
                        expressionField, expression,
                        "rule_description", description), ruleArnVariable));
                instructions.add(new ApiCall("connect_rule_to_lambda", params(
                        "rule_name", ruleName,
                        "function_arn", functionArn)));
                instructions.add(new ApiCall("add_permission_for_cloudwatch_event", params(
                        "rule_arn", new Variable(ruleArnVariable),
                        "function_arn", functionArn)));
                message = (exists ? "Updating" : "Creating") + " event rule " + ruleName + " for function: " + name;
            }
            instructions.add(recordValue(type, name, "rule_name", ruleName));
            instructions.add(recordValue(type, name, expressionField, expression));
            instructions.add(recordValue(type, name, "rule_description", description));
            instructions.add(recordValue(type, name, "lambda_arn", functionArn));
            emit(instructions, message);
        }

        // -- Subscriptions --

        @Override
        public Void visitS3BucketNotification(S3BucketNotification notification) {
            String name = notification.resourceName();
            Object functionArn = functionArnFor(notification.lambdaFunction());
            boolean exists = remoteState.exists(notification);
            ResourceSnapshot snapshot = remoteState.fetch(notification);
            boolean unchanged = exists
                    && snapshot.matches("bucket", notification.bucket())
                    && snapshot.matches("events", notification.events())
                    && snapshot.matches("prefix", notification.prefix())
                    && snapshot.matches("suffix", notification.suffix())
                    && snapshot.matches("lambda_arn", functionArn);

            List<Instruction> instructions = new ArrayList<>();
            String message = null;
            if (!unchanged) {
                Object previousArn = snapshot.get("lambda_arn");
                if (exists && snapshot.matches("bucket", notification.bucket()) && previousArn != null
                        && !snapshot.matches("lambda_arn", functionArn)) {
                    // same bucket, other function
                    instructions.add(new ApiCall("disconnect_s3_bucket_from_lambda", params(
                            "bucket", notification.bucket(),
                            "function_arn", previousArn)));
                    instructions.add(new ApiCall("remove_permission_for_s3_event", params(
                            "bucket", notification.bucket(),
                            "function_arn", previousArn)));
                }
                instructions.add(new ApiCall("add_permission_for_s3_event", params(
                        "bucket", notification.bucket(),
                        "function_arn", functionArn)));
                instructions.add(new ApiCall("connect_s3_bucket_to_lambda", params(
                        "bucket", notification.bucket(),
                        "function_arn", functionArn,
                        "events", notification.events(),
                        "prefix", notification.prefix(),
                        "suffix", notification.suffix())));
                message = "Configuring S3 events in bucket " + notification.bucket() + " to function: " + name;
            }
            instructions.add(recordValue(ResourceType.S3_EVENT, name, "bucket", notification.bucket()));
            instructions.add(recordValue(ResourceType.S3_EVENT, name, "events", notification.events()));
            instructions.add(recordValue(ResourceType.S3_EVENT, name, "prefix", notification.prefix()));
            instructions.add(recordValue(ResourceType.S3_EVENT, name, "suffix", notification.suffix()));
            instructions.add(recordValue(ResourceType.S3_EVENT, name, "lambda_arn", functionArn));
            emit(instructions, message);
            return null;
        }

        @Override
        public Void visitSnsSubscription(SnsSubscription subscription) {
            String name = subscription.resourceName();
            Object functionArn = functionArnFor(subscription.lambdaFunction());
            List<Instruction> instructions = new ArrayList<>();

            ResourceSnapshot snapshot = remoteState.fetch(subscription);
            if (snapshot.isPresent() && snapshot.matches("lambda_arn", functionArn)) {
                instructions.add(recordValue(ResourceType.SNS_EVENT, name, "topic", subscription.topic()));
                instructions.add(recordValue(ResourceType.SNS_EVENT, name, "topic_arn", snapshot.get("topic_arn")));
                instructions.add(recordValue(ResourceType.SNS_EVENT, name, "subscription_arn", snapshot.get("subscription_arn")));
                instructions.add(recordValue(ResourceType.SNS_EVENT, name, "lambda_arn", functionArn));
                emit(instructions, null);
                return null;
            }

            if (snapshot.isPresent()) {
                // subscribed to the same topic for another function
                instructions.add(new ApiCall("unsubscribe_from_topic", params(
                        "subscription_arn", snapshot.get("subscription_arn"))));
                instructions.add(new ApiCall("remove_permission_for_sns_topic", params(
                        "topic_arn", snapshot.get("topic_arn"),
                        "function_arn", snapshot.get("lambda_arn"))));
            }
            String topicArnVariable = name + "_topic_arn";
            instructions.addAll(resolveArn(subscription.topic(), "sns", topicArnVariable, functionArn));
            String subscriptionVariable = name + "_subscription_arn";
            instructions.add(new ApiCall("add_permission_for_sns_topic", params(
                    "topic_arn", new Variable(topicArnVariable),
                    "function_arn", functionArn)));
            instructions.add(new ApiCall("subscribe_function_to_topic", params(
                    "topic_arn", new Variable(topicArnVariable),
                    "function_arn", functionArn), subscriptionVariable));
            instructions.add(recordValue(ResourceType.SNS_EVENT, name, "topic", subscription.topic()));
            instructions.add(new RecordResourceVariable(ResourceType.SNS_EVENT, name, "topic_arn", topicArnVariable));
            instructions.add(new RecordResourceVariable(ResourceType.SNS_EVENT, name, "subscription_arn", subscriptionVariable));
            instructions.add(recordValue(ResourceType.SNS_EVENT, name, "lambda_arn", functionArn));
            emit(instructions, "Subscribing " + name + " to SNS topic " + subscription.topic());
            return null;
        }

        @Override
        public Void visitSqsEventSource(SqsEventSource eventSource) {
            String name = eventSource.resourceName();
            Object functionArn = functionArnFor(eventSource.lambdaFunction());
            List<Instruction> instructions = new ArrayList<>();

            ResourceSnapshot snapshot = remoteState.fetch(eventSource);
            if (snapshot.isPresent() && snapshot.matches("lambda_arn", functionArn)) {
                String message = null;
                if (!snapshot.matches("batch_size", eventSource.batchSize())
                        || !snapshot.matches("maximum_batching_window_in_seconds", eventSource.maximumBatchingWindowInSeconds())) {
                    instructions.add(new ApiCall("update_sqs_event_source", params(
                            "event_uuid", snapshot.get("event_uuid"),
                            "batch_size", eventSource.batchSize(),
                            "maximum_batching_window_in_seconds", eventSource.maximumBatchingWindowInSeconds())));
                    message = "Updating SQS event source: " + name;
                }
                instructions.add(recordValue(ResourceType.SQS_EVENT, name, "queue", eventSource.queue()));
                instructions.add(recordValue(ResourceType.SQS_EVENT, name, "queue_arn", snapshot.get("queue_arn")));
                instructions.add(recordValue(ResourceType.SQS_EVENT, name, "event_uuid", snapshot.get("event_uuid")));
                addSqsSettings(instructions, eventSource, functionArn);
                emit(instructions, message);
                return null;
            }

            if (snapshot.isPresent()) {
                // mapped from the same queue to another function
                instructions.add(new ApiCall("remove_sqs_event_source", params(
                        "event_uuid", snapshot.get("event_uuid"))));
            }
            String queueArnVariable = name + "_queue_arn";
            String uuidVariable = name + "_event_uuid";
            instructions.addAll(resolveArn(eventSource.queue(), "sqs", queueArnVariable, functionArn));
            instructions.add(new ApiCall("create_sqs_event_source", params(
                    "queue_arn", new Variable(queueArnVariable),
                    "function_name", functionArn,
                    "batch_size", eventSource.batchSize(),
                    "maximum_batching_window_in_seconds", eventSource.maximumBatchingWindowInSeconds()), uuidVariable));
            instructions.add(recordValue(ResourceType.SQS_EVENT, name, "queue", eventSource.queue()));
            instructions.add(new RecordResourceVariable(ResourceType.SQS_EVENT, name, "queue_arn", queueArnVariable));
            instructions.add(new RecordResourceVariable(ResourceType.SQS_EVENT, name, "event_uuid", uuidVariable));
            addSqsSettings(instructions, eventSource, functionArn);
            emit(instructions, "Subscribing " + name + " to SQS queue " + eventSource.queue());
            return null;
        }

        private void addSqsSettings(List<Instruction> instructions, SqsEventSource eventSource, Object functionArn) {
            String name = eventSource.resourceName();
            instructions.add(recordValue(ResourceType.SQS_EVENT, name, "batch_size", eventSource.batchSize()));
            instructions.add(recordValue(ResourceType.SQS_EVENT, name, "maximum_batching_window_in_seconds",
                    eventSource.maximumBatchingWindowInSeconds()));
            instructions.add(recordValue(ResourceType.SQS_EVENT, name, "lambda_arn", functionArn));
        }

        /**
         * Stores the ARN of a topic or queue under {@code variable}. Names are
         * turned into ARNs in the function's partition, region and account.
         */
        private List<Instruction> resolveArn(String nameOrArn, String service, String variable, Object functionArn) {
            if (nameOrArn.startsWith("arn:")) {
                return List.of(new StoreValue(variable, nameOrArn));
            }
            List<Instruction> instructions = new ArrayList<>(parseArnInstructions(functionArn));
            instructions.add(new StoreValue(variable, new StringFormat(
                    "arn:{partition}:" + service + ":{region_name}:{account_id}:" + nameOrArn,
                    List.of("partition", "region_name", "account_id"))));
            return instructions;
        }

        // -- Helpers --

        private List<Instruction> parseArnInstructions(Object arn) {
            return List.of(
                    new BuiltinFunction("parse_arn", List.of(arn), "parsed_lambda_arn"),
                    new JpSearch("account_id", "parsed_lambda_arn", "account_id"),
                    new JpSearch("region", "parsed_lambda_arn", "region_name"),
                    new JpSearch("partition", "parsed_lambda_arn", "partition"));
        }

        private Object functionArnFor(ResourceId id) {
            Object arn = functionArns.get(id);
            if (arn == null) {
                throw new IllegalStateException("Function " + graph.get(id).resourceName()
                        + " must be planned before the resources that reference it");
            }
            return arn;
        }

        private Object roleArnFor(ResourceId id) {
            Object arn = roleArns.get(id);
            if (arn == null) {
                throw new IllegalStateException("Role " + graph.get(id).resourceName()
                        + " must be planned before the functions that use it");
            }
            return arn;
        }

        private Instruction recordValue(ResourceType type, String name, String field, Object value) {
            if (value instanceof Variable variable) {
                return new RecordResourceVariable(type, name, field, variable.name());
            }
            return new RecordResourceValue(type, name, field, value);
        }

        private Map<String, Object> params(Object... keysAndValues) {
            Map<String, Object> params = new LinkedHashMap<>();
            for (int i = 0; i < keysAndValues.length; i += 2) {
                params.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
            return params;
        }
    }
}
