package com.omotes.workflow;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.ProtocolException;
import com.omotes.protocol.workflow.AvailableWorkflows;
import com.omotes.protocol.workflow.WorkflowMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;
import com.omotes.workflow.parameter.BooleanParameter;
import com.omotes.workflow.parameter.DateTimeParameter;
import com.omotes.workflow.parameter.FloatParameter;
import com.omotes.workflow.parameter.IntegerParameter;
import com.omotes.workflow.parameter.MissingFieldException;
import com.omotes.workflow.parameter.StringEnumOption;
import com.omotes.workflow.parameter.StringParameter;
import com.omotes.workflow.parameter.WorkflowParameter;
import com.omotes.workflow.parameter.WrongFieldTypeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowTypeManagerTest {

    private static Path fixture() throws URISyntaxException {
        return Path.of(WorkflowTypeManagerTest.class.getResource("/workflow_config.json").toURI());
    }

    @Test
    void fromJsonConfigFile_loadsWorkflowsInOrderAndSkipsUnknownParameterTypes() throws Exception {
        WorkflowTypeManager manager = WorkflowTypeManager.fromJsonConfigFile(fixture());

        List<WorkflowType> workflows = manager.getAllWorkflows();
        assertEquals(2, workflows.size());
        assertEquals("grow_optimizer_default", workflows.get(0).getWorkflowTypeName());
        assertEquals("grow_simulator", workflows.get(1).getWorkflowTypeName());
        assertTrue(workflows.get(1).getWorkflowParameters().isEmpty());

        List<WorkflowParameter> parameters = workflows.get(0).getWorkflowParameters();
        assertEquals(5, parameters.size());
        StringParameter solver = assertInstanceOf(StringParameter.class, parameters.get(0));
        assertEquals("Solver", solver.getTitle());
        assertEquals("highs", solver.getDefaultValue());
        assertEquals(List.of(new StringEnumOption("highs", "HiGHS"), new StringEnumOption("gurobi", "Gurobi")),
                solver.getEnumOptions());
        IntegerParameter iterations = assertInstanceOf(IntegerParameter.class, parameters.get(1));
        assertEquals(10L, iterations.getDefaultValue());
        assertEquals(0L, iterations.getMinimum());
        assertNull(iterations.getMaximum());
        FloatParameter gap = assertInstanceOf(FloatParameter.class, parameters.get(2));
        assertEquals(0.0, gap.getMinimum());
        assertEquals(1.0, gap.getMaximum());
        assertEquals(Boolean.TRUE, assertInstanceOf(BooleanParameter.class, parameters.get(3)).getDefaultValue());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0),
                assertInstanceOf(DateTimeParameter.class, parameters.get(4)).getDefaultValue());
    }

    @Test
    void wireCatalog_roundTripKeepsParametersAndOrder() throws Exception {
        WorkflowTypeManager manager = WorkflowTypeManager.fromJsonConfigFile(fixture());

        AvailableWorkflows catalog = manager.toWireCatalog();
        AvailableWorkflows received = ProtocolCodec.decode(ProtocolCodec.encode(catalog), AvailableWorkflows.class);
        WorkflowTypeManager rebuilt = WorkflowTypeManager.fromWireCatalog(received);

        assertEquals(manager.getAllWorkflows(), rebuilt.getAllWorkflows());
        WorkflowType optimizer = rebuilt.getWorkflowByName("grow_optimizer_default").orElseThrow();
        assertEquals("Goal seek optimizer", optimizer.getWorkflowTypeDescriptionName());
        assertEquals(manager.getWorkflowByName("grow_optimizer_default").orElseThrow().getWorkflowParameters(),
                optimizer.getWorkflowParameters());
        IntegerParameter iterations = (IntegerParameter) optimizer.getWorkflowParameters().get(1);
        assertEquals(0L, iterations.getMinimum());
        assertNull(iterations.getMaximum());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0),
                ((DateTimeParameter) optimizer.getWorkflowParameters().get(4)).getDefaultValue());
        assertEquals(catalog, rebuilt.toWireCatalog());
    }

    @Test
    void fromWireCatalog_parameterWithoutType_throwsProtocolException() {
        WorkflowParameterMessage untyped = new WorkflowParameterMessage("orphan", null, null, null, null, null, null, null);
        AvailableWorkflows catalog = new AvailableWorkflows(List.of(new WorkflowMessage("wf", "Workflow", List.of(untyped))));

        assertThrows(ProtocolException.class, () -> WorkflowTypeManager.fromWireCatalog(catalog));
    }

    @Test
    void lookups_byNameAndByInstance() {
        WorkflowTypeManager manager = new WorkflowTypeManager(List.of(
                new WorkflowType("a", "A"), new WorkflowType("b", "B")));

        assertTrue(manager.getWorkflowByName("a").isPresent());
        assertTrue(manager.getWorkflowByName("c").isEmpty());
        assertTrue(manager.workflowExists(new WorkflowType("b", "another label")));
        assertFalse(manager.workflowExists(new WorkflowType("c", "B")));
        assertTrue(manager.workflowExists("a"));
    }

    @Test
    void workflowType_equalityUsesNameOnly() {
        WorkflowType first = new WorkflowType("grow_simulator", "Simulator");
        WorkflowType second = new WorkflowType("grow_simulator", "Renamed",
                List.of(new BooleanParameter("flag", null, null, null)));
        WorkflowType other = new WorkflowType("grow_optimizer", "Simulator");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertFalse(first.equals(other));
    }

    @Test
    void fromJsonConfigFile_missingFile_throwsUncheckedIOException(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class,
                () -> WorkflowTypeManager.fromJsonConfigFile(dir.resolve("absent.json")));
    }

    @Test
    void fromJsonConfigFile_invalidJson_throwsUncheckedIOException(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("workflows.json");
        Files.writeString(file, "[{\"workflow_type_name\": ");

        assertThrows(UncheckedIOException.class, () -> WorkflowTypeManager.fromJsonConfigFile(file));
    }

    @Test
    void fromJsonConfig_missingWorkflowName_throwsMissingFieldException() {
        MissingFieldException e = assertThrows(MissingFieldException.class,
                () -> WorkflowTypeManager.fromJsonConfig("[{\"workflow_type_description_name\": \"x\"}]"));
        assertEquals("workflow_type_name", e.getFieldKey());
    }

    @Test
    void fromJsonConfig_notAList_throwsWrongFieldTypeException() {
        assertThrows(WrongFieldTypeException.class,
                () -> WorkflowTypeManager.fromJsonConfig("{\"workflow_type_name\": \"x\"}"));
    }

    @Test
    void fromJsonConfig_invalidParameter_propagatesValidationError() {
        String json = """
                [{
                  "workflow_type_name": "wf",
                  "workflow_type_description_name": "Workflow",
                  "workflow_parameters": [
                    {"parameter_type": "integer", "key_name": "n", "minimum": 1.5}
                  ]
                }]
                """;

        WrongFieldTypeException e = assertThrows(WrongFieldTypeException.class,
                () -> WorkflowTypeManager.fromJsonConfig(json));
        assertEquals("'minimum' for IntegerParameter must be in 'int' format: '1.5'", e.getMessage());
    }
}
