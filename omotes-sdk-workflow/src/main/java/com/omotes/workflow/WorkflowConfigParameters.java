package com.omotes.workflow;

import com.omotes.workflow.parameter.MissingFieldException;
import com.omotes.workflow.parameter.ParameterKind;
import com.omotes.workflow.parameter.WorkflowParameter;
import com.omotes.workflow.parameter.WrongFieldTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conversion of workflow parameter values between their runtime types and the wire scalars
 * carried by job submissions.
 */
public final class WorkflowConfigParameters {

    private static final Logger log = LoggerFactory.getLogger(WorkflowConfigParameters.class);

    private WorkflowConfigParameters() {
    }

    /**
     * Reads one parameter from a received workflow configuration.
     * <ul>
     *   <li>present and compatible: the converted value</li>
     *   <li>present but incompatible: {@code defaultValue} with a warning, or the
     *       {@link WrongFieldTypeException} when there is no default</li>
     *   <li>absent: {@code defaultValue} with a warning, or {@link MissingFieldException}
     *       when there is no default</li>
     * </ul>
     *
     * @param workflowConfig wire values keyed by parameter key name
     * @param fieldKey       key to read
     * @param expectedKind   parameter kind; the result has its {@link ParameterKind#getValueType() value type}
     * @param defaultValue   fallback, may be null
     * @param <T>            runtime type of {@code expectedKind}: String, Boolean, Long, Double or LocalDateTime
     * @throws IllegalArgumentException when {@code defaultValue} is not of that type
     */
    @SuppressWarnings("unchecked")
    public static <T> T parse(Map<String, ?> workflowConfig, String fieldKey, ParameterKind expectedKind, T defaultValue) {
        if (defaultValue != null && !expectedKind.getValueType().isInstance(defaultValue)) {
            throw new IllegalArgumentException("Default value " + defaultValue + " for " + fieldKey + " is a "
                    + defaultValue.getClass().getSimpleName() + " but " + expectedKind.getConfigName() + " values are "
                    + expectedKind.getValueType().getSimpleName());
        }
        if (!workflowConfig.containsKey(fieldKey)) {
            if (defaultValue != null) {
                log.warn("{} field was missing in workflow configuration. Using default value {}", fieldKey, defaultValue);
                return defaultValue;
            }
            log.error("{} field was missing in workflow configuration. No default available.", fieldKey);
            throw new MissingFieldException(fieldKey, fieldKey + " field was missing in workflow configuration");
        }
        Object value = workflowConfig.get(fieldKey);
        try {
            return (T) expectedKind.getValueType().cast(expectedKind.fromWireValue(value));
        } catch (WrongFieldTypeException e) {
            String actualType = value == null ? "null" : value.getClass().getSimpleName();
            if (defaultValue != null) {
                log.warn("{} field was passed in workflow configuration but as a {} instead of {}. Using default value {}",
                        fieldKey, actualType, expectedKind.getConfigName(), defaultValue);
                return defaultValue;
            }
            log.error("{} field was passed in workflow configuration but as a {} instead of {}. No default available.",
                    fieldKey, actualType, expectedKind.getConfigName());
            throw e;
        }
    }

    /**
     * Converts the runtime value of every declared parameter of the workflow to its wire scalar.
     * Values for keys the workflow does not declare are not included.
     *
     * @throws MissingFieldException   when a declared parameter has no value
     * @throws WrongFieldTypeException when a value has the wrong runtime type
     */
    public static Map<String, Object> toWireParameters(WorkflowType workflowType, Map<String, ?> params) {
        Objects.requireNonNull(workflowType, "workflowType");
        Map<String, ?> values = params != null ? params : Map.of();
        Map<String, Object> wire = new LinkedHashMap<>();
        for (WorkflowParameter parameter : workflowType.getWorkflowParameters()) {
            Object value = values.get(parameter.getKeyName());
            if (value == null) {
                throw new MissingFieldException(parameter.getKeyName(),
                        "Param with key \"" + parameter.getKeyName() + "\" is missing in params.");
            }
            wire.put(parameter.getKeyName(), parameter.toWireValue(value));
        }
        return Collections.unmodifiableMap(wire);
    }
}
