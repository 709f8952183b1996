package com.omotes.sdk;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.bus.MessageBus;
import com.omotes.protocol.job.JobCancel;
import com.omotes.protocol.job.JobSubmission;
import com.omotes.workflow.Job;
import com.omotes.workflow.OmotesQueueNames;
import com.omotes.workflow.WorkflowConfigParameters;
import com.omotes.workflow.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Client-side session: submits jobs, listens to their progress, status and result, and cancels them.
 * <p>
 * Each job has three queues: a result queue consumed exactly once, and progress and status queues
 * consumed until {@link #disconnectFromSubmittedJob(Job)}. The {@link Job} returned by
 * {@link #submitJob} is all that is needed to {@link #connectToSubmittedJob reconnect} after a restart,
 * so callers that must survive restarts should store it durably.
 */
public final class OmotesInterface {

    private static final Logger log = LoggerFactory.getLogger(OmotesInterface.class);

    private final MessageBus messageBus;

    public OmotesInterface(MessageBus messageBus) {
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
    }

    public void start() {
        messageBus.start();
        log.info("OMOTES SDK started");
    }

    public void stop() {
        messageBus.close();
        log.info("OMOTES SDK stopped");
    }

    /**
     * (Re)connects to the queues of a job without submitting anything. Assumes the job exists;
     * otherwise the callbacks are never called.
     *
     * @param autoDisconnect when true, {@link #disconnectFromSubmittedJob(Job)} runs after
     *                       {@code onFinished} returns normally; not when it throws
     */
    public void connectToSubmittedJob(Job job, JobCallbacks callbacks, boolean autoDisconnect) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(callbacks, "callbacks");
        JobSubmissionCallbackHandler handler = new JobSubmissionCallbackHandler(job, callbacks,
                autoDisconnect ? () -> disconnectFromSubmittedJob(job) : null);

        // Result last: a result already waiting is delivered at once and may auto-disconnect.
        messageBus.subscribe(OmotesQueueNames.jobProgressQueueName(job), handler::onProgressUpdate);
        messageBus.subscribe(OmotesQueueNames.jobStatusQueueName(job), handler::onStatusUpdate);
        messageBus.receiveOnce(OmotesQueueNames.jobResultsQueueName(job), null, handler::onFinished, null);
        log.info("Connected to job {} of workflow type {}", job.getId(), job.getWorkflowType().getWorkflowTypeName());
    }

    /**
     * Stops listening to all queues of the job. Idempotent and safe to call from inside the job's
     * own result callback.
     */
    public void disconnectFromSubmittedJob(Job job) {
        Objects.requireNonNull(job, "job");
        messageBus.unsubscribe(OmotesQueueNames.jobResultsQueueName(job));
        messageBus.unsubscribe(OmotesQueueNames.jobProgressQueueName(job));
        messageBus.unsubscribe(OmotesQueueNames.jobStatusQueueName(job));
        log.info("Disconnected from job {}", job.getId());
    }

    /**
     * Submits a new job. The job's queues are subscribed before the submission is published so that
     * no update can be missed.
     *
     * @param esdl           input ESDL document
     * @param params         parameter values by key name, in their runtime types; every parameter the
     *                       workflow type declares must have a value
     * @param workflowType   workflow to run
     * @param jobTimeout     how long the job may run before it times out; null for no limit
     * @param callbacks      job event callbacks
     * @param autoDisconnect disconnect after the result callback returns normally
     * @return the job handle
     * @throws com.omotes.workflow.parameter.MissingFieldException   when a declared parameter has no value
     * @throws com.omotes.workflow.parameter.WrongFieldTypeException when a value has the wrong type
     */
    public Job submitJob(String esdl, Map<String, ?> params, WorkflowType workflowType, Duration jobTimeout,
                         JobCallbacks callbacks, boolean autoDisconnect) {
        Objects.requireNonNull(esdl, "esdl");
        Objects.requireNonNull(workflowType, "workflowType");
        Map<String, Object> wireParams = WorkflowConfigParameters.toWireParameters(workflowType, params);
        Job job = new Job(UUID.randomUUID(), workflowType);

        connectToSubmittedJob(job, callbacks, autoDisconnect);

        Long timeoutMs = jobTimeout != null ? jobTimeout.toMillis() : null;
        JobSubmission submission = new JobSubmission(job.getId().toString(), timeoutMs,
                workflowType.getWorkflowTypeName(), esdl.getBytes(StandardCharsets.UTF_8), wireParams);
        messageBus.publish(OmotesQueueNames.jobSubmissionQueueName(workflowType), ProtocolCodec.encode(submission));
        log.info("Submitted job {} for workflow type {}", job.getId(), workflowType.getWorkflowTypeName());
        return job;
    }

    /**
     * Requests cancellation of the job. Does not disconnect: the outcome arrives as a status update
     * and a result on the job's queues.
     */
    public void cancelJob(Job job) {
        Objects.requireNonNull(job, "job");
        messageBus.publish(OmotesQueueNames.jobCancelQueueName(), ProtocolCodec.encode(new JobCancel(job.getId().toString())));
        log.info("Requested cancellation of job {}", job.getId());
    }
}
