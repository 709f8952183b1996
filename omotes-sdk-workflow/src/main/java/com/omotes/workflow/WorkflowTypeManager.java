package com.omotes.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omotes.protocol.workflow.AvailableWorkflows;
import com.omotes.protocol.workflow.WorkflowMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;
import com.omotes.workflow.parameter.MissingFieldException;
import com.omotes.workflow.parameter.ParameterKind;
import com.omotes.workflow.parameter.WorkflowParameter;
import com.omotes.workflow.parameter.WrongFieldTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of the workflow types known to a deployment, keyed by name in configuration order.
 * Immutable after construction and safe to share between threads.
 * <p>
 * Built from the human-edited workflow configuration file ({@link #fromJsonConfigFile(Path)})
 * on the orchestrator side, or from the catalog received over the wire
 * ({@link #fromWireCatalog(AvailableWorkflows)}) on the SDK side.
 */
public final class WorkflowTypeManager {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTypeManager.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, WorkflowType> workflows;

    public WorkflowTypeManager(List<WorkflowType> possibleWorkflows) {
        Map<String, WorkflowType> byName = new LinkedHashMap<>();
        for (WorkflowType workflow : possibleWorkflows) {
            if (byName.put(workflow.getWorkflowTypeName(), workflow) != null) {
                log.warn("Workflow type {} is defined more than once; the last definition is used",
                        workflow.getWorkflowTypeName());
            }
        }
        this.workflows = Collections.unmodifiableMap(byName);
    }

    public Optional<WorkflowType> getWorkflowByName(String name) {
        return Optional.ofNullable(workflows.get(name));
    }

    /** All workflow types in configuration order. */
    public List<WorkflowType> getAllWorkflows() {
        return List.copyOf(workflows.values());
    }

    public boolean workflowExists(WorkflowType workflow) {
        return workflows.containsKey(workflow.getWorkflowTypeName());
    }

    public boolean workflowExists(String name) {
        return workflows.containsKey(name);
    }

    /** Catalog message listing every workflow type with its parameters in order. */
    public AvailableWorkflows toWireCatalog() {
        List<WorkflowMessage> messages = new ArrayList<>();
        for (WorkflowType workflow : workflows.values()) {
            List<WorkflowParameterMessage> parameters = new ArrayList<>();
            for (WorkflowParameter parameter : workflow.getWorkflowParameters()) {
                parameters.add(parameter.toWireMessage());
            }
            messages.add(new WorkflowMessage(workflow.getWorkflowTypeName(),
                    workflow.getWorkflowTypeDescriptionName(), parameters));
        }
        return new AvailableWorkflows(messages);
    }

    /**
     * Rebuilds a registry from a received catalog.
     *
     * @throws com.omotes.protocol.ProtocolException when a parameter message has no parameter type set
     */
    public static WorkflowTypeManager fromWireCatalog(AvailableWorkflows catalog) {
        Objects.requireNonNull(catalog, "catalog");
        List<WorkflowType> workflowTypes = new ArrayList<>();
        for (WorkflowMessage workflow : catalog.getWorkflows()) {
            List<WorkflowParameter> parameters = new ArrayList<>();
            for (WorkflowParameterMessage parameter : workflow.getParameters()) {
                parameters.add(ParameterKind.fromWireMessage(parameter));
            }
            workflowTypes.add(new WorkflowType(workflow.getTypeName(), workflow.getTypeDescription(), parameters));
        }
        return new WorkflowTypeManager(workflowTypes);
    }

    /**
     * Loads the workflow configuration file: a JSON list of workflow definitions.
     *
     * @param configFile path to the JSON file
     * @throws UncheckedIOException     when the file cannot be read or is not valid JSON
     * @throws WrongFieldTypeException  when a field has the wrong type
     * @throws MissingFieldException    when a required field is absent
     */
    public static WorkflowTypeManager fromJsonConfigFile(Path configFile) {
        String json;
        try {
            json = Files.readString(configFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workflow configuration " + configFile, e);
        }
        WorkflowTypeManager manager = fromJsonConfig(json);
        log.info("Loaded {} workflow type(s) from {}", manager.workflows.size(), configFile);
        return manager;
    }

    /**
     * Same as {@link #fromJsonConfigFile(Path)} for configuration already in memory.
     */
    public static WorkflowTypeManager fromJsonConfig(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid workflow configuration JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new WrongFieldTypeException("Workflow configuration must be a list of workflow definitions");
        }
        List<WorkflowType> workflowTypes = new ArrayList<>();
        for (JsonNode workflow : root) {
            workflowTypes.add(workflowFromJson(workflow));
        }
        return new WorkflowTypeManager(workflowTypes);
    }

    private static WorkflowType workflowFromJson(JsonNode workflow) {
        String name = requiredText(workflow, "workflow_type_name");
        String descriptionName = requiredText(workflow, "workflow_type_description_name");
        List<WorkflowParameter> parameters = new ArrayList<>();
        JsonNode parameterConfigs = workflow.get("workflow_parameters");
        if (parameterConfigs != null && !parameterConfigs.isNull()) {
            if (!parameterConfigs.isArray()) {
                throw new WrongFieldTypeException("'workflow_parameters' of workflow " + name + " must be a 'list'");
            }
            for (JsonNode parameterConfig : parameterConfigs) {
                String typeName = requiredText(parameterConfig, "parameter_type");
                Optional<ParameterKind> kind = ParameterKind.fromConfigName(typeName);
                if (kind.isEmpty()) {
                    log.warn("Skipping parameter {} of workflow {}: unknown parameter_type '{}'",
                            parameterConfig.path("key_name").asText(), name, typeName);
                    continue;
                }
                parameters.add(kind.get().fromJsonConfig(parameterConfig));
            }
        }
        return new WorkflowType(name, descriptionName, parameters);
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MissingFieldException(field, "Workflow configuration entry is missing '" + field + "'");
        }
        if (!value.isTextual()) {
            throw new WrongFieldTypeException("'" + field + "' in workflow configuration must be in 'str' format: '" + value.asText() + "'");
        }
        return value.textValue();
    }
}
