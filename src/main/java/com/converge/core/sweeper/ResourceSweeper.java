package com.converge.core.sweeper;

import com.converge.core.model.ResourceType;
import com.converge.core.plan.ApiCall;
import com.converge.core.plan.Instruction;
import com.converge.core.plan.Plan;
import com.converge.core.plan.RecordResource;
import com.converge.core.plan.RecordResourceValue;
import com.converge.core.state.DeployedResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Appends deletions for previously deployed resources the new plan no longer records.
 * <p>
 * The previous record lists resources in creation order; walking it backwards
 * deletes dependents before what they depend on. Event subscriptions still in
 * the plan but pointed at a different bucket, topic or queue are disconnected
 * from the old one, since the plan already connects the new one.
 */
public class ResourceSweeper {

    private static final Logger log = LoggerFactory.getLogger(ResourceSweeper.class);

    private static final Map<ResourceType, String> RETARGETABLE_FIELDS = Map.of(
            ResourceType.S3_EVENT, "bucket",
            ResourceType.SNS_EVENT, "topic",
            ResourceType.SQS_EVENT, "queue");

    public Plan sweep(Plan plan, DeployedResources deployed) {
        Set<String> marked = new HashSet<>();
        Map<String, Map<String, Object>> recordedValues = new HashMap<>();
        for (Instruction instruction : plan.instructions()) {
            if (instruction instanceof RecordResource record) {
                marked.add(key(record.resourceType().wireName(), record.resourceName()));
            }
            if (instruction instanceof RecordResourceValue value) {
                recordedValues.computeIfAbsent(value.resourceName(), k -> new HashMap<>())
                        .put(value.field(), value.value());
            }
        }

        Plan.Builder builder = plan.toBuilder();
        List<String> names = new ArrayList<>(deployed.resourceNames());
        int deletions = 0;
        for (int i = names.size() - 1; i >= 0; i--) {
            String name = names.get(i);
            Map<String, Object> values = deployed.resourceValues(name).orElseThrow();
            String wireType = String.valueOf(values.get("resource_type"));
            ResourceType type = typeOf(wireType, name);
            if (!marked.contains(key(wireType, name))) {
                log.info("Resource {} ({}) is no longer declared, scheduling deletion", name, wireType);
                addAll(builder, deleteInstructions(type, name, values));
                deletions++;
            } else if (retargeted(type, values, recordedValues.getOrDefault(name, Map.of()))) {
                log.info("Resource {} ({}) now targets another source, disconnecting the old one", name, wireType);
                addAll(builder, deleteInstructions(type, name, values));
                deletions++;
            }
        }
        log.debug("Sweeper scheduled {} deletions", deletions);
        return builder.build();
    }

    private static boolean retargeted(ResourceType type, Map<String, Object> previous, Map<String, Object> current) {
        String field = RETARGETABLE_FIELDS.get(type);
        if (field == null || !current.containsKey(field)) {
            return false;
        }
        return !Objects.equals(previous.get(field), current.get(field));
    }

    private static ResourceType typeOf(String wireType, String name) {
        try {
            return ResourceType.fromWireName(wireType);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown resource type '" + wireType + "' recorded for " + name, e);
        }
    }

    private static void addAll(Plan.Builder builder, DeletionInstructions deletion) {
        for (int i = 0; i < deletion.instructions().size(); i++) {
            builder.add(deletion.instructions().get(i), i == 0 ? deletion.message() : null);
        }
    }

    private DeletionInstructions deleteInstructions(ResourceType type, String name, Map<String, Object> values) {
        return switch (type) {
            case LAMBDA_FUNCTION -> new DeletionInstructions(
                    "Deleting function: " + field(values, name, "lambda_arn"),
                    List.of(new ApiCall("delete_function", Map.of("function_name", field(values, name, "lambda_arn")))));
            case IAM_ROLE -> new DeletionInstructions(
                    "Deleting IAM role: " + field(values, name, "role_name"),
                    List.of(new ApiCall("delete_role", Map.of("name", field(values, name, "role_name")))));
            case REST_API -> new DeletionInstructions(
                    "Deleting Rest API: " + field(values, name, "rest_api_id"),
                    List.of(new ApiCall("delete_rest_api", Map.of("rest_api_id", field(values, name, "rest_api_id")))));
            case SCHEDULED_EVENT, CLOUDWATCH_EVENT -> new DeletionInstructions(
                    "Deleting event rule: " + field(values, name, "rule_name"),
                    List.of(new ApiCall("delete_rule", Map.of("rule_name", field(values, name, "rule_name")))));
            case S3_EVENT -> new DeletionInstructions(
                    "Disconnecting S3 bucket " + field(values, name, "bucket") + " from function " + field(values, name, "lambda_arn"),
                    List.of(
                            new ApiCall("disconnect_s3_bucket_from_lambda", Map.of(
                                    "bucket", field(values, name, "bucket"),
                                    "function_arn", field(values, name, "lambda_arn"))),
                            new ApiCall("remove_permission_for_s3_event", Map.of(
                                    "bucket", field(values, name, "bucket"),
                                    "function_arn", field(values, name, "lambda_arn")))));
            case SNS_EVENT -> new DeletionInstructions(
                    "Unsubscribing from SNS topic " + field(values, name, "topic"),
                    List.of(
                            new ApiCall("unsubscribe_from_topic", Map.of(
                                    "subscription_arn", field(values, name, "subscription_arn"))),
                            new ApiCall("remove_permission_for_sns_topic", Map.of(
                                    "topic_arn", field(values, name, "topic_arn"),
                                    "function_arn", field(values, name, "lambda_arn")))));
            case SQS_EVENT -> new DeletionInstructions(
                    "Removing SQS event source " + name + " for queue " + field(values, name, "queue"),
                    List.of(new ApiCall("remove_sqs_event_source", Map.of("event_uuid", field(values, name, "event_uuid")))));
            case PRE_CREATED_IAM_ROLE, IAM_POLICY, DEPLOYMENT_PACKAGE -> throw new IllegalStateException(
                    "Resource type " + type + " is never deployed and cannot be deleted: " + name);
        };
    }

    private static Object field(Map<String, Object> values, String name, String field) {
        Object value = values.get(field);
        if (value == null) {
            throw new IllegalStateException("Deployed record of " + name + " has no '" + field + "' field");
        }
        return value;
    }

    private static String key(String wireType, String name) {
        return wireType + ":" + name;
    }

    private record DeletionInstructions(String message, List<Instruction> instructions) {
    }
}
