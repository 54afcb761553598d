package com.converge.core.build;

import com.converge.core.model.AutoGenIamPolicy;
import com.converge.core.model.FileBasedIamPolicy;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;
import com.converge.core.model.RoleTraits;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fills in IAM policy documents.
 * <p>
 * File-based policies are read from {@code <configDir>/<filename>}. Auto-generated
 * policies grant CloudWatch Logs access plus whatever the policy's traits require.
 */
public class PolicyGenerator implements BuildStep {

    private static final Logger log = LoggerFactory.getLogger(PolicyGenerator.class);

    private final ObjectMapper objectMapper;
    private final Path configDir;

    public PolicyGenerator(ObjectMapper objectMapper, Path configDir) {
        this.objectMapper = objectMapper;
        this.configDir = configDir;
    }

    @Override
    public void handle(ResourceGraph graph, ResourceId id) {
        var resource = graph.get(id);
        if (resource instanceof FileBasedIamPolicy policy && policy.document().isPending()) {
            graph.replace(id, policy.withDocument(readPolicyFile(policy.filename())));
        } else if (resource instanceof AutoGenIamPolicy policy && policy.document().isPending()) {
            graph.replace(id, policy.withDocument(generate(policy)));
        }
    }

    private Map<String, Object> generate(AutoGenIamPolicy policy) {
        List<Map<String, Object>> statements = new ArrayList<>();
        statements.add(IamPolicies.cloudWatchLogsStatement());
        if (policy.traits().contains(RoleTraits.VPC_NEEDED)) {
            statements.add(IamPolicies.vpcAttachStatement());
        }
        if (policy.traits().contains(RoleTraits.XRAY_NEEDED)) {
            statements.add(IamPolicies.xrayStatement());
        }
        return IamPolicies.document(statements);
    }

    private Map<String, Object> readPolicyFile(String filename) {
        Path path = configDir.resolve(filename);
        log.debug("Loading IAM policy from {}", path);
        try {
            return objectMapper.readValue(Files.readAllBytes(path), new TypeReference<>() {});
        } catch (IOException e) {
            throw new BuildException("Unable to load IAM policy file " + path + ": " + e.getMessage(), e);
        }
    }
}
