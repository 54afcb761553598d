package com.converge.core.sweeper;

import com.converge.core.model.ResourceType;
import com.converge.core.plan.ApiCall;
import com.converge.core.plan.Plan;
import com.converge.core.plan.RecordResourceValue;
import com.converge.core.state.DeployedResources;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceSweeperTest {

    private final ResourceSweeper sweeper = new ResourceSweeper();

    private static Map<String, Object> function(String name) {
        return Map.of("name", name, "resource_type", "lambda_function",
                "lambda_arn", "arn:aws:lambda:us-west-2:123456789012:function:" + name);
    }

    private static Plan recording(String... functionNames) {
        Plan.Builder builder = Plan.builder();
        for (String name : functionNames) {
            builder.add(new RecordResourceValue(ResourceType.LAMBDA_FUNCTION, name, "lambda_arn", "arn:" + name));
        }
        return builder.build();
    }

    @Test
    @DisplayName("resources no longer recorded are deleted newest first")
    void deletesOrphansInReverse() {
        DeployedResources deployed = new DeployedResources(List.of(function("a"), function("b"), function("c")));

        Plan swept = sweeper.sweep(recording("a"), deployed);

        List<ApiCall> calls = swept.instructionsOf(ApiCall.class);
        assertEquals(List.of(
                new ApiCall("delete_function", Map.of("function_name", "arn:aws:lambda:us-west-2:123456789012:function:c")),
                new ApiCall("delete_function", Map.of("function_name", "arn:aws:lambda:us-west-2:123456789012:function:b"))),
                calls);
        assertEquals("Deleting function: arn:aws:lambda:us-west-2:123456789012:function:c",
                swept.messageFor(calls.get(0)).orElseThrow());
    }

    @Test
    @DisplayName("the original plan is kept in front of the deletions")
    void keepsPlan() {
        Plan plan = recording("a");
        Plan swept = sweeper.sweep(plan, new DeployedResources(List.of(function("a"), function("b"))));

        assertEquals(plan.instructions().get(0), swept.instructions().get(0));
        assertEquals(2, swept.size());
    }

    @Test
    @DisplayName("nothing is deleted when everything is still recorded")
    void nothingToSweep() {
        Plan plan = recording("a", "b");
        assertEquals(plan, sweeper.sweep(plan, new DeployedResources(List.of(function("a"), function("b")))));
    }

    @Test
    @DisplayName("a bucket notification moved to another bucket is disconnected from the old one")
    void retargetedBucket() {
        DeployedResources deployed = new DeployedResources(List.of(Map.of(
                "name", "uploads", "resource_type", "s3_event",
                "bucket", "old-bucket", "lambda_arn", "arn:fn")));
        Plan plan = Plan.builder()
                .add(new RecordResourceValue(ResourceType.S3_EVENT, "uploads", "bucket", "new-bucket"))
                .build();

        Plan swept = sweeper.sweep(plan, deployed);

        assertEquals(List.of(
                new ApiCall("disconnect_s3_bucket_from_lambda", Map.of("bucket", "old-bucket", "function_arn", "arn:fn")),
                new ApiCall("remove_permission_for_s3_event", Map.of("bucket", "old-bucket", "function_arn", "arn:fn"))),
                swept.instructionsOf(ApiCall.class));
    }

    @Test
    @DisplayName("an orphaned REST API is deleted by id")
    void orphanedRestApi() {
        DeployedResources deployed = new DeployedResources(List.of(Map.of(
                "name", "rest_api", "resource_type", "rest_api", "rest_api_id", "abc123")));

        Plan swept = sweeper.sweep(Plan.empty(), deployed);

        List<ApiCall> calls = swept.instructionsOf(ApiCall.class);
        assertEquals(List.of(new ApiCall("delete_rest_api", Map.of("rest_api_id", "abc123"))), calls);
        assertEquals("Deleting Rest API: abc123", swept.messageFor(calls.get(0)).orElseThrow());
    }

    private static Map<String, Object> snsRecord(String topic) {
        return Map.of("name", "alerts", "resource_type", "sns_event", "topic", topic,
                "topic_arn", "arn:aws:sns:us-west-2:123456789012:" + topic,
                "subscription_arn", "arn:aws:sns:us-west-2:123456789012:" + topic + ":sub-1",
                "lambda_arn", "arn:fn");
    }

    private static List<ApiCall> snsTeardown(String topic) {
        return List.of(
                new ApiCall("unsubscribe_from_topic", Map.of(
                        "subscription_arn", "arn:aws:sns:us-west-2:123456789012:" + topic + ":sub-1")),
                new ApiCall("remove_permission_for_sns_topic", Map.of(
                        "topic_arn", "arn:aws:sns:us-west-2:123456789012:" + topic,
                        "function_arn", "arn:fn")));
    }

    @Test
    @DisplayName("an orphaned SNS subscription is unsubscribed before its permission is removed")
    void orphanedSnsSubscription() {
        Plan swept = sweeper.sweep(Plan.empty(), new DeployedResources(List.of(snsRecord("alerts-topic"))));

        assertEquals(snsTeardown("alerts-topic"), swept.instructionsOf(ApiCall.class));
    }

    @Test
    @DisplayName("an SNS subscription moved to another topic is unsubscribed from the old one")
    void retargetedTopic() {
        Plan plan = Plan.builder()
                .add(new RecordResourceValue(ResourceType.SNS_EVENT, "alerts", "topic", "new-topic"))
                .build();

        Plan swept = sweeper.sweep(plan, new DeployedResources(List.of(snsRecord("old-topic"))));

        assertEquals(snsTeardown("old-topic"), swept.instructionsOf(ApiCall.class));
    }

    @Test
    @DisplayName("an SNS subscription on the same topic is left alone")
    void sameTopic() {
        Plan plan = Plan.builder()
                .add(new RecordResourceValue(ResourceType.SNS_EVENT, "alerts", "topic", "alerts-topic"))
                .build();

        assertEquals(plan, sweeper.sweep(plan, new DeployedResources(List.of(snsRecord("alerts-topic")))));
    }

    private static Map<String, Object> sqsRecord(String queue) {
        return Map.of("name", "jobs", "resource_type", "sqs_event", "queue", queue,
                "event_uuid", "uuid-1", "lambda_arn", "arn:fn");
    }

    @Test
    @DisplayName("an orphaned SQS mapping is removed by its uuid")
    void orphanedSqsMapping() {
        Plan swept = sweeper.sweep(Plan.empty(), new DeployedResources(List.of(sqsRecord("jobs"))));

        List<ApiCall> calls = swept.instructionsOf(ApiCall.class);
        assertEquals(List.of(new ApiCall("remove_sqs_event_source", Map.of("event_uuid", "uuid-1"))), calls);
        assertEquals("Removing SQS event source jobs for queue jobs", swept.messageFor(calls.get(0)).orElseThrow());
    }

    @Test
    @DisplayName("an SQS mapping moved to another queue is removed from the old one")
    void retargetedQueue() {
        Plan plan = Plan.builder()
                .add(new RecordResourceValue(ResourceType.SQS_EVENT, "jobs", "queue", "new-jobs"))
                .build();

        Plan swept = sweeper.sweep(plan, new DeployedResources(List.of(sqsRecord("old-jobs"))));

        assertEquals(List.of(new ApiCall("remove_sqs_event_source", Map.of("event_uuid", "uuid-1"))),
                swept.instructionsOf(ApiCall.class));
    }

    @Test
    @DisplayName("rules and roles are deleted by name")
    void rulesAndRoles() {
        DeployedResources deployed = new DeployedResources(List.of(
                Map.of("name", "default-role", "resource_type", "iam_role", "role_name", "myapp-dev", "role_arn", "arn:role"),
                Map.of("name", "nightly", "resource_type", "scheduled_event", "rule_name", "myapp-dev-nightly")));

        Plan swept = sweeper.sweep(Plan.empty(), deployed);

        assertEquals(List.of(
                new ApiCall("delete_rule", Map.of("rule_name", "myapp-dev-nightly")),
                new ApiCall("delete_role", Map.of("name", "myapp-dev"))),
                swept.instructionsOf(ApiCall.class));
    }

    @Test
    @DisplayName("an unknown recorded type is an error")
    void unknownType() {
        DeployedResources deployed = new DeployedResources(List.of(Map.of(
                "name", "table", "resource_type", "dynamodb_table")));
        assertThrows(IllegalStateException.class, () -> sweeper.sweep(Plan.empty(), deployed));
    }

    @Test
    @DisplayName("a record missing the field its deletion needs is an error")
    void missingField() {
        DeployedResources deployed = new DeployedResources(List.of(Map.of(
                "name", "foo", "resource_type", "lambda_function")));
        assertThrows(IllegalStateException.class, () -> sweeper.sweep(Plan.empty(), deployed));
    }
}
