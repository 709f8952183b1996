package com.omotes.orchestrator;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.omotes.broker.InMemoryMessageBus;
import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.ProtocolException;
import com.omotes.protocol.job.JobCancel;
import com.omotes.protocol.job.JobProgressUpdate;
import com.omotes.protocol.job.JobResult;
import com.omotes.protocol.job.JobStatusUpdate;
import com.omotes.protocol.job.JobSubmission;
import com.omotes.protocol.job.WorkerTaskRequest;
import com.omotes.workflow.Job;
import com.omotes.workflow.OmotesQueueNames;
import com.omotes.workflow.WorkflowType;
import com.omotes.workflow.WorkflowTypeManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestratorInterfaceTest {

    private static final WorkflowType OPTIMIZER = new WorkflowType("grow_optimizer", "Optimizer");
    private static final WorkflowType SIMULATOR = new WorkflowType("grow_simulator", "Simulator");

    private InMemoryMessageBus bus;
    private OrchestratorInterface orchestrator;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        orchestrator = new OrchestratorInterface(bus, new WorkflowTypeManager(List.of(OPTIMIZER, SIMULATOR)));
        orchestrator.start();
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
    }

    private static byte[] submission(UUID id, String workflowType) {
        return ProtocolCodec.encode(new JobSubmission(id.toString(), null, workflowType,
                "<esdl/>".getBytes(StandardCharsets.UTF_8), Map.of("solver", "highs")));
    }

    @Test
    void connectToJobSubmissions_subscribesEveryWorkflowType() {
        orchestrator.connectToJobSubmissions((submission, job) -> { });

        assertEquals(Set.of("job_submissions.grow_optimizer", "job_submissions.grow_simulator"), bus.subscribedQueues());
    }

    @Test
    void connectToJobSubmissions_deliversSubmissionWithJobHandle() {
        List<Job> jobs = new ArrayList<>();
        List<JobSubmission> submissions = new ArrayList<>();
        orchestrator.connectToJobSubmissions((submission, job) -> {
            submissions.add(submission);
            jobs.add(job);
        });
        UUID id = UUID.randomUUID();

        bus.publish("job_submissions.grow_simulator", submission(id, "grow_simulator"));

        assertEquals(1, jobs.size());
        assertEquals(id, jobs.get(0).getId());
        assertSame(SIMULATOR, jobs.get(0).getWorkflowType());
        assertEquals(Map.of("solver", "highs"), submissions.get(0).getParams());
    }

    @Test
    void misroutedSubmission_isDroppedWithOneError() {
        ch.qos.logback.classic.Logger logger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(JobSubmissionHandler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            List<Job> jobs = new ArrayList<>();
            orchestrator.connectToJobSubmissions((submission, job) -> jobs.add(job));
            UUID id = UUID.randomUUID();

            bus.publish("job_submissions.grow_optimizer", submission(id, "grow_simulator"));

            assertTrue(jobs.isEmpty());
            List<ILoggingEvent> errors = appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).toList();
            assertEquals(1, errors.size());
            assertTrue(errors.get(0).getFormattedMessage().contains(id.toString()));
            assertTrue(errors.get(0).getFormattedMessage().contains("Dropping message"));
            assertEquals(0, bus.pendingCount("job_submissions.grow_optimizer"));
            assertEquals(0, bus.pendingCount("job_submissions.grow_simulator"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void submissionWithInvalidUuid_isRejected() {
        JobSubmissionHandler handler = new JobSubmissionHandler(OPTIMIZER, (submission, job) -> { });
        byte[] message = ProtocolCodec.encode(new JobSubmission("not-a-uuid", null, "grow_optimizer", new byte[0], Map.of()));

        assertThrows(ProtocolException.class, () -> handler.onMessage(message));
    }

    @Test
    void connectToJobCancellations_deliversCancel() {
        List<JobCancel> cancels = new ArrayList<>();
        orchestrator.connectToJobCancellations(cancels::add);
        UUID id = UUID.randomUUID();

        bus.publish(OmotesQueueNames.jobCancelQueueName(), ProtocolCodec.encode(new JobCancel(id.toString())));

        assertEquals(List.of(new JobCancel(id.toString())), cancels);
    }

    @Test
    void send_publishesToPerJobQueues() {
        Job job = new Job(UUID.randomUUID(), OPTIMIZER);
        List<String> received = new ArrayList<>();
        bus.subscribe(OmotesQueueNames.jobProgressQueueName(job), m -> received.add("progress"));
        bus.subscribe(OmotesQueueNames.jobStatusQueueName(job), m -> received.add("status"));
        bus.subscribe(OmotesQueueNames.jobResultsQueueName(job), m -> received.add("result"));
        String jobId = job.getId().toString();

        orchestrator.sendJobStatusUpdate(job, new JobStatusUpdate(jobId, JobStatusUpdate.JobStatus.RUNNING));
        orchestrator.sendJobProgressUpdate(job, new JobProgressUpdate(jobId, null, null, 0.3, "busy"));
        orchestrator.sendJobResult(job, new JobResult(jobId, null, null, JobResult.ResultType.SUCCEEDED, new byte[0], ""));

        assertEquals(List.of("status", "progress", "result"), received);
    }

    @Test
    void dispatchTask_publishesToTaskTypeQueue() {
        List<WorkerTaskRequest> requests = new ArrayList<>();
        bus.subscribe("grow_optimizer", m -> requests.add(ProtocolCodec.decode(m, WorkerTaskRequest.class)));
        byte[] esdl = "<esdl/>".getBytes(StandardCharsets.UTF_8);

        orchestrator.dispatchTask("grow_optimizer", new WorkerTaskRequest("job-1", "grow_optimizer", esdl, Map.of("k", true)));

        assertEquals(1, requests.size());
        assertEquals("job-1", requests.get(0).getJobId());
        assertArrayEquals(esdl, requests.get(0).getInputEsdl());
        assertEquals(Map.of("k", true), requests.get(0).getParams());
    }

    @Test
    void connectToTaskEvents_decodesWorkerMessages() {
        List<JobProgressUpdate> progress = new ArrayList<>();
        List<JobResult> results = new ArrayList<>();
        orchestrator.connectToTaskProgressUpdates("progress_events", progress::add);
        orchestrator.connectToTaskResults("result_events", results::add);

        bus.publish("progress_events", ProtocolCodec.encode(new JobProgressUpdate("job-1", "t-1", "grow_optimizer", 0.5, "half")));
        bus.publish("result_events", ProtocolCodec.encode(
                new JobResult("job-1", "t-1", "grow_optimizer", JobResult.ResultType.FAILED, null, "boom")));

        assertEquals(0.5, progress.get(0).getProgress());
        assertEquals("t-1", progress.get(0).getTaskId());
        assertEquals(JobResult.ResultType.FAILED, results.get(0).getResultType());
        assertEquals("boom", results.get(0).getLogs());
    }
}
