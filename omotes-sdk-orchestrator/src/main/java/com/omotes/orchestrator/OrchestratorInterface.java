package com.omotes.orchestrator;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.bus.MessageBus;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Orchestrator side of the job protocol: takes submissions and cancellations from the SDK,
 * dispatches work to workers, and sends progress, status and results back to the SDK.
 * <p>
 * All sends are fire-and-forget; delivery is the message bus's concern.
 */
public final class OrchestratorInterface {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorInterface.class);

    private final MessageBus messageBus;
    private final WorkflowTypeManager workflowTypeManager;

    public OrchestratorInterface(MessageBus messageBus, WorkflowTypeManager workflowTypeManager) {
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.workflowTypeManager = Objects.requireNonNull(workflowTypeManager, "workflowTypeManager");
    }

    public void start() {
        messageBus.start();
        log.info("Orchestrator interface started with {} workflow type(s)", workflowTypeManager.getAllWorkflows().size());
    }

    public void stop() {
        messageBus.close();
        log.info("Orchestrator interface stopped");
    }

    public WorkflowTypeManager getWorkflowTypeManager() {
        return workflowTypeManager;
    }

    /**
     * Subscribes to the submission queue of every known workflow type.
     *
     * @param onNewJob called with each accepted submission and its job handle
     */
    public void connectToJobSubmissions(BiConsumer<JobSubmission, Job> onNewJob) {
        Objects.requireNonNull(onNewJob, "onNewJob");
        for (WorkflowType workflowType : workflowTypeManager.getAllWorkflows()) {
            JobSubmissionHandler handler = new JobSubmissionHandler(workflowType, onNewJob);
            String queueName = OmotesQueueNames.jobSubmissionQueueName(workflowType);
            messageBus.subscribe(queueName, handler::onMessage);
            log.info("Listening for job submissions on {}", queueName);
        }
    }

    /** Subscribes to the cancellation queue shared by all workflow types. */
    public void connectToJobCancellations(Consumer<JobCancel> onCancel) {
        Objects.requireNonNull(onCancel, "onCancel");
        messageBus.subscribe(OmotesQueueNames.jobCancelQueueName(),
                message -> onCancel.accept(ProtocolCodec.decode(message, JobCancel.class)));
        log.info("Listening for job cancellations on {}", OmotesQueueNames.jobCancelQueueName());
    }

    public void sendJobProgressUpdate(Job job, JobProgressUpdate progressUpdate) {
        log.debug("Job {} progress {}: {}", job.getId(), progressUpdate.getProgress(), progressUpdate.getMessage());
        messageBus.publish(OmotesQueueNames.jobProgressQueueName(job), ProtocolCodec.encode(progressUpdate));
    }

    public void sendJobStatusUpdate(Job job, JobStatusUpdate statusUpdate) {
        log.debug("Job {} status {}", job.getId(), statusUpdate.getStatus());
        messageBus.publish(OmotesQueueNames.jobStatusQueueName(job), ProtocolCodec.encode(statusUpdate));
    }

    public void sendJobResult(Job job, JobResult result) {
        log.info("Job {} finished with {}", job.getId(), result.getResultType());
        messageBus.publish(OmotesQueueNames.jobResultsQueueName(job), ProtocolCodec.encode(result));
    }

    /**
     * Sends a work item to the workers of a task type. The task type is the name of the workers' queue.
     */
    public void dispatchTask(String taskType, WorkerTaskRequest request) {
        Objects.requireNonNull(taskType, "taskType");
        log.info("Dispatching job {} to task type {}", request.getJobId(), taskType);
        messageBus.publish(taskType, ProtocolCodec.encode(request));
    }

    /** Subscribes to the progress events workers publish on the given queue. */
    public void connectToTaskProgressUpdates(String queueName, Consumer<JobProgressUpdate> onProgress) {
        Objects.requireNonNull(onProgress, "onProgress");
        messageBus.subscribe(queueName, message -> onProgress.accept(ProtocolCodec.decode(message, JobProgressUpdate.class)));
        log.info("Listening for task progress on {}", queueName);
    }

    /** Subscribes to the results workers publish on the given queue. */
    public void connectToTaskResults(String queueName, Consumer<JobResult> onResult) {
        Objects.requireNonNull(onResult, "onResult");
        messageBus.subscribe(queueName, message -> onResult.accept(ProtocolCodec.decode(message, JobResult.class)));
        log.info("Listening for task results on {}", queueName);
    }
}
