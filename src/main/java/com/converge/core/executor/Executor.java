package com.converge.core.executor;

import com.converge.cloud.CloudClient;
import com.converge.core.logging.MdcContext;
import com.converge.core.plan.ApiCall;
import com.converge.core.plan.BuiltinFunction;
import com.converge.core.plan.CopyVariable;
import com.converge.core.plan.CopyVariableFromDict;
import com.converge.core.plan.Instruction;
import com.converge.core.plan.InstructionVisitor;
import com.converge.core.plan.JpSearch;
import com.converge.core.plan.Plan;
import com.converge.core.plan.RecordResourceValue;
import com.converge.core.plan.RecordResourceVariable;
import com.converge.core.plan.StoreMultipleValue;
import com.converge.core.plan.StoreValue;
import com.converge.core.model.ResourceType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.burt.jmespath.JmesPath;
import io.burt.jmespath.jackson.JacksonRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a plan's instructions in order against the cloud client.
 * <p>
 * Holds the variable pool that connects instruction outputs to later inputs,
 * and accumulates the resource values to record once the whole plan succeeds.
 * An instance serves one deploy attempt and is not thread-safe. Cloud failures
 * propagate immediately; nothing is rolled back.
 */
public class Executor implements InstructionVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(Executor.class);

    private static final JmesPath<JsonNode> JMESPATH = new JacksonRuntime();

    private final ApiCallDispatcher dispatcher;
    private final BuiltinFunctions builtins;
    private final Ui ui;
    private final ObjectMapper objectMapper;
    private final VariableResolver resolver = new VariableResolver();

    private final Map<String, Object> variables = new HashMap<>();
    private final List<Map<String, Object>> resourceValues = new ArrayList<>();
    private final Map<String, Map<String, Object>> resourceIndex = new HashMap<>();
    private String lastApiMethod;

    public Executor(CloudClient client, Ui ui) {
        this(new ApiCallDispatcher(client), new BuiltinFunctions(client), ui, new ObjectMapper());
    }

    public Executor(ApiCallDispatcher dispatcher, BuiltinFunctions builtins, Ui ui, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.builtins = builtins;
        this.ui = ui;
        this.objectMapper = objectMapper;
    }

    public void execute(Plan plan) {
        log.debug("Executing plan with {} instructions", plan.size());
        for (Instruction instruction : plan.instructions()) {
            plan.messageFor(instruction).ifPresent(ui::write);
            instruction.accept(this);
        }
    }

    /** Recorded resources, one merged entry per resource name, in first-recorded order. */
    public List<Map<String, Object>> resourceValues() {
        return Collections.unmodifiableList(resourceValues);
    }

    /** Method of the most recent API call, the failing one if execution stopped on an error. */
    public Optional<String> lastApiMethod() {
        return Optional.ofNullable(lastApiMethod);
    }

    public Map<String, Object> variables() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public Void visitApiCall(ApiCall call) {
        lastApiMethod = call.methodName();
        Map<String, Object> params;
        try {
            params = resolver.resolveParams(call.params(), variables);
        } catch (UnresolvedValueException e) {
            throw e.withMethodName(call.methodName());
        }
        MdcContext.setApiMethod(call.methodName());
        try {
            log.debug("Calling {}", call.methodName());
            Object result = dispatcher.invoke(call.methodName(), params);
            if (call.outputVar() != null) {
                variables.put(call.outputVar(), result);
            }
        } finally {
            MdcContext.clearApiMethod();
        }
        return null;
    }

    @Override
    public Void visitStoreValue(StoreValue store) {
        variables.put(store.name(), resolver.resolve(store.name(), store.value(), variables));
        return null;
    }

    @Override
    public Void visitStoreMultipleValue(StoreMultipleValue store) {
        List<Object> resolved = new ArrayList<>();
        for (Object value : store.values()) {
            resolved.add(resolver.resolve(store.name(), value, variables));
        }
        Object existing = variables.get(store.name());
        if (existing instanceof List<?> list) {
            List<Object> merged = new ArrayList<>(list);
            merged.addAll(resolved);
            variables.put(store.name(), merged);
        } else {
            variables.put(store.name(), resolved);
        }
        return null;
    }

    @Override
    public Void visitCopyVariable(CopyVariable copy) {
        variables.put(copy.toVar(), lookup(copy.fromVar()));
        return null;
    }

    @Override
    public Void visitCopyVariableFromDict(CopyVariableFromDict copy) {
        Object source = lookup(copy.fromVar());
        if (!(source instanceof Map<?, ?> map)) {
            throw new IllegalStateException("Variable '" + copy.fromVar() + "' is not a map: " + source);
        }
        variables.put(copy.toVar(), map.get(copy.key()));
        return null;
    }

    @Override
    public Void visitRecordResourceVariable(RecordResourceVariable record) {
        addResourceValue(record.resourceType(), record.resourceName(), record.field(), lookup(record.variableName()));
        return null;
    }

    @Override
    public Void visitRecordResourceValue(RecordResourceValue record) {
        addResourceValue(record.resourceType(), record.resourceName(), record.field(), record.value());
        return null;
    }

    @Override
    public Void visitJpSearch(JpSearch search) {
        JsonNode input = objectMapper.valueToTree(lookup(search.inputVar()));
        JsonNode result = JMESPATH.compile(search.expression()).search(input);
        try {
            variables.put(search.outputVar(), objectMapper.treeToValue(result, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to convert result of '" + search.expression() + "'", e);
        }
        return null;
    }

    @Override
    public Void visitBuiltinFunction(BuiltinFunction function) {
        List<Object> args = new ArrayList<>();
        for (Object arg : function.args()) {
            args.add(resolver.resolve(function.functionName(), arg, variables));
        }
        variables.put(function.outputVar(), builtins.call(function.functionName(), args));
        return null;
    }

    private void addResourceValue(ResourceType type, String name, String field, Object value) {
        Map<String, Object> entry = resourceIndex.get(name);
        if (entry == null) {
            entry = new LinkedHashMap<>();
            entry.put("name", name);
            entry.put("resource_type", type.wireName());
            resourceIndex.put(name, entry);
            resourceValues.add(entry);
        }
        entry.put(field, value);
    }

    private Object lookup(String name) {
        if (!variables.containsKey(name)) {
            throw new IllegalStateException("Variable '" + name + "' has not been set by an earlier instruction");
        }
        return variables.get(name);
    }
}
