package com.converge.core.executor;

import com.converge.cloud.CloudClient;
import com.converge.cloud.FunctionDefinition;
import com.converge.cloud.FunctionUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ApiCallDispatcherTest {

    private final CloudClient client = mock(CloudClient.class);
    private final ApiCallDispatcher dispatcher = new ApiCallDispatcher(client);

    @Test
    @DisplayName("every method the planner and sweeper emit is registered")
    void registry() {
        assertTrue(dispatcher.methodNames().containsAll(List.of(
                "create_function", "update_function", "put_function_concurrency", "delete_function_concurrency",
                "delete_function", "create_role", "put_role_policy", "update_assume_role_policy", "delete_role",
                "import_rest_api", "update_api_from_swagger", "update_rest_api", "add_permission_for_apigateway",
                "deploy_rest_api", "delete_rest_api", "get_or_create_rule_arn", "connect_rule_to_lambda",
                "add_permission_for_cloudwatch_event", "delete_rule", "add_permission_for_s3_event",
                "connect_s3_bucket_to_lambda", "disconnect_s3_bucket_from_lambda", "remove_permission_for_s3_event",
                "add_permission_for_sns_topic", "subscribe_function_to_topic", "unsubscribe_from_topic",
                "remove_permission_for_sns_topic", "create_sqs_event_source", "update_sqs_event_source",
                "remove_sqs_event_source")));
    }

    @Test
    @DisplayName("create_function maps parameters onto a function definition and returns the ARN")
    void createFunction() {
        when(client.createFunction(any())).thenReturn("arn:fn");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("function_name", "f");
        params.put("role_arn", "arn:role");
        params.put("zip_file", "/tmp/f.zip");
        params.put("runtime", "python3.12");
        params.put("handler", "app.f");
        params.put("environment_variables", Map.of("STAGE", "dev"));
        params.put("timeout", 60);
        params.put("memory_size", 128);
        params.put("security_group_ids", List.of("sg-1"));
        params.put("subnet_ids", List.of("subnet-1"));
        params.put("xray", true);

        assertEquals("arn:fn", dispatcher.invoke("create_function", params));

        ArgumentCaptor<FunctionDefinition> captor = ArgumentCaptor.forClass(FunctionDefinition.class);
        verify(client).createFunction(captor.capture());
        FunctionDefinition definition = captor.getValue();
        assertEquals("f", definition.functionName());
        assertEquals(Map.of("STAGE", "dev"), definition.environmentVariables());
        assertEquals(Map.of(), definition.tags());
        assertEquals(List.of("sg-1"), definition.securityGroupIds());
        assertEquals(List.of(), definition.layers());
        assertTrue(definition.xray());
    }

    @Test
    @DisplayName("update_function leaves absent fields null")
    void updateFunction() {
        dispatcher.invoke("update_function", Map.of("function_name", "f", "memory_size", 256));

        ArgumentCaptor<FunctionUpdate> captor = ArgumentCaptor.forClass(FunctionUpdate.class);
        verify(client).updateFunction(captor.capture());
        FunctionUpdate update = captor.getValue();
        assertEquals(256, update.memorySize());
        assertNull(update.timeout());
        assertNull(update.zipFile());
        assertTrue(update.changesConfiguration());
    }

    @Test
    @DisplayName("object parameters reach the client as string-keyed documents")
    void documentParameters() {
        Map<String, Object> trust = Map.of("Version", "2012-10-17", "Statement", List.of(
                Map.of("Effect", "Allow", "Action", "sts:AssumeRole")));
        Map<String, Object> policy = Map.of("Version", "2012-10-17", "Statement", List.of());
        when(client.createRole(any(), any(), any())).thenReturn("arn:role");

        assertEquals("arn:role", dispatcher.invoke("create_role",
                Map.of("name", "myapp-dev", "trust_policy", trust, "policy", policy)));

        verify(client).createRole("myapp-dev", trust, policy);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> dispatcher.invoke("create_role", Map.of("name", "r", "trust_policy", "x", "policy", policy)));
        assertTrue(e.getMessage().contains("trust_policy"));
    }

    @Test
    @DisplayName("a missing required parameter is reported with the method name")
    void missingParameter() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> dispatcher.invoke("delete_role", Map.of()));
        assertTrue(e.getMessage().contains("delete_role"));
    }
}
