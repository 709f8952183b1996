package com.omotes.worker;

import com.omotes.broker.InMemoryMessageBus;
import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.job.JobProgressUpdate;
import com.omotes.protocol.job.JobResult;
import com.omotes.protocol.job.WorkerTaskRequest;
import com.omotes.workflow.WorkflowConfigParameters;
import com.omotes.workflow.parameter.ParameterKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerTaskAdapterTest {

    private static final String JOB_ID = "5d0a6b49-0c4c-4a3c-8c9e-2f1b3c4d5e6f";

    private final WorkerConfig config = WorkerConfig.builder()
            .taskProgressQueueName("progress_events")
            .taskResultQueueName("result_events")
            .build();

    private InMemoryMessageBus bus;
    private SimpleMeterRegistry registry;
    private List<JobProgressUpdate> progress;
    private List<JobResult> results;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        bus.start();
        registry = new SimpleMeterRegistry();
        progress = new ArrayList<>();
        results = new ArrayList<>();
        bus.subscribe("progress_events", m -> progress.add(ProtocolCodec.decode(m, JobProgressUpdate.class)));
        bus.subscribe("result_events", m -> results.add(ProtocolCodec.decode(m, JobResult.class)));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private WorkerTaskAdapter adapter(WorkerTaskFunction function) {
        return new WorkerTaskAdapter(config, bus, function, new WorkerMetrics(registry));
    }

    private static WorkerTaskRequest request() {
        return new WorkerTaskRequest(JOB_ID, "grow_optimizer",
                "<esdl in/>".getBytes(StandardCharsets.UTF_8), Map.of("solver", "highs", "mip_gap", 0.05));
    }

    @Test
    void handle_success_publishesProgressThenResult() {
        Map<String, Object> seenParams = new HashMap<>();
        WorkerTaskAdapter adapter = adapter((inputEsdl, workflowConfig, reporter) -> {
            seenParams.put("solver", WorkflowConfigParameters.parse(workflowConfig, "solver", ParameterKind.STRING, null));
            seenParams.put("mip_gap", WorkflowConfigParameters.parse(workflowConfig, "mip_gap", ParameterKind.FLOAT, 0.01));
            seenParams.put("max_iterations",
                    WorkflowConfigParameters.parse(workflowConfig, "max_iterations", ParameterKind.INTEGER, 10L));
            reporter.updateProgress(0.5, "halfway");
            return inputEsdl.replace("in", "out");
        });

        adapter.handle(new TaskContext("task-1", "grow_optimizer"), request());

        assertEquals(Map.of("solver", "highs", "mip_gap", 0.05, "max_iterations", 10L), seenParams);
        assertEquals(3, progress.size());
        assertEquals(0.0, progress.get(0).getProgress());
        assertEquals("Job calculation started", progress.get(0).getMessage());
        assertEquals(0.5, progress.get(1).getProgress());
        assertEquals("halfway", progress.get(1).getMessage());
        assertEquals(1.0, progress.get(2).getProgress());
        assertEquals("Calculation finished.", progress.get(2).getMessage());
        for (JobProgressUpdate update : progress) {
            assertEquals(JOB_ID, update.getJobId());
            assertEquals("task-1", update.getTaskId());
            assertEquals("grow_optimizer", update.getTaskType());
        }

        assertEquals(1, results.size());
        JobResult result = results.get(0);
        assertEquals(JobResult.ResultType.SUCCEEDED, result.getResultType());
        assertEquals(JOB_ID, result.getJobId());
        assertEquals("task-1", result.getTaskId());
        assertArrayEquals("<esdl out/>".getBytes(StandardCharsets.UTF_8), result.getOutputEsdl());
        assertEquals("", result.getLogs());

        assertEquals(1.0, registry.counter(WorkerMetrics.TASKS, "taskType", "grow_optimizer", "outcome", "started").count());
        assertEquals(1.0, registry.counter(WorkerMetrics.TASKS, "taskType", "grow_optimizer", "outcome", "succeeded").count());
        assertEquals(1L, registry.find(WorkerMetrics.TASK_DURATION).tag("outcome", "succeeded").timer().count());
    }

    @Test
    void handle_failure_publishesFailedResultAndThrows() {
        IllegalStateException boom = new IllegalStateException("solver diverged");
        WorkerTaskAdapter adapter = adapter((inputEsdl, workflowConfig, reporter) -> {
            throw boom;
        });

        TaskExecutionException e = assertThrows(TaskExecutionException.class,
                () -> adapter.handle(new TaskContext("task-2", "grow_optimizer"), request()));

        assertSame(boom, e.getCause());
        assertEquals(JOB_ID, e.getJobId());
        assertEquals("task-2", e.getTaskId());
        assertEquals(1, progress.size());
        assertEquals(1, results.size());
        JobResult result = results.get(0);
        assertEquals(JobResult.ResultType.FAILED, result.getResultType());
        assertNull(result.getOutputEsdl());
        assertTrue(result.getLogs().contains("solver diverged"));
        assertEquals(1.0, registry.counter(WorkerMetrics.TASKS, "taskType", "grow_optimizer", "outcome", "failed").count());
        assertEquals(0.0, registry.counter(WorkerMetrics.TASKS, "taskType", "grow_optimizer", "outcome", "succeeded").count());
    }

    @Test
    void handle_errorFromTaskBody_publishesFailedResultAndRethrowsError() {
        WorkerTaskAdapter adapter = adapter((inputEsdl, workflowConfig, reporter) -> {
            throw new AssertionError("invariant broken");
        });

        AssertionError e = assertThrows(AssertionError.class,
                () -> adapter.handle(new TaskContext("task-5", "grow_optimizer"), request()));

        assertEquals("invariant broken", e.getMessage());
        assertEquals(1, results.size());
        assertEquals(JobResult.ResultType.FAILED, results.get(0).getResultType());
        assertTrue(results.get(0).getLogs().contains("invariant broken"));
        assertEquals(1.0, registry.counter(WorkerMetrics.TASKS, "taskType", "grow_optimizer", "outcome", "failed").count());
    }

    @Test
    void handle_nullOutput_isFailure() {
        WorkerTaskAdapter adapter = adapter((inputEsdl, workflowConfig, reporter) -> null);

        assertThrows(TaskExecutionException.class,
                () -> adapter.handle(new TaskContext("task-3", "grow_optimizer"), request()));

        assertEquals(JobResult.ResultType.FAILED, results.get(0).getResultType());
    }

    @Test
    void handle_progressOutOfRange_isFailure() {
        WorkerTaskAdapter adapter = adapter((inputEsdl, workflowConfig, reporter) -> {
            reporter.updateProgress(1.5, "too far");
            return inputEsdl;
        });

        assertThrows(TaskExecutionException.class,
                () -> adapter.handle(new TaskContext("task-4", "grow_optimizer"), request()));

        assertEquals(1, results.size());
        assertEquals(JobResult.ResultType.FAILED, results.get(0).getResultType());
    }
}
