package com.omotes.orchestrator;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.ProtocolException;
import com.omotes.protocol.job.JobSubmission;
import com.omotes.workflow.Job;
import com.omotes.workflow.OmotesQueueNames;
import com.omotes.workflow.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.function.BiConsumer;

/**
 * Receives the submissions of one workflow type's queue. A submission naming another workflow
 * type is dropped with an error; it is neither requeued nor forwarded to the right queue.
 */
final class JobSubmissionHandler {

    private static final Logger log = LoggerFactory.getLogger(JobSubmissionHandler.class);

    private final WorkflowType workflowType;
    private final BiConsumer<JobSubmission, Job> onNewJob;

    JobSubmissionHandler(WorkflowType workflowType, BiConsumer<JobSubmission, Job> onNewJob) {
        this.workflowType = workflowType;
        this.onNewJob = onNewJob;
    }

    void onMessage(byte[] message) {
        JobSubmission submission = ProtocolCodec.decode(message, JobSubmission.class);
        if (!workflowType.getWorkflowTypeName().equals(submission.getWorkflowType())) {
            log.error("Received a job submission (id: {}) that was meant for workflow type {} but found it on queue {}. "
                            + "Dropping message.",
                    submission.getUuid(), submission.getWorkflowType(), OmotesQueueNames.jobSubmissionQueueName(workflowType));
            return;
        }
        if (submission.getUuid() == null) {
            throw new ProtocolException("Job submission has no uuid");
        }
        UUID jobId;
        try {
            jobId = UUID.fromString(submission.getUuid());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Job submission has an invalid uuid: " + submission.getUuid(), e);
        }
        onNewJob.accept(submission, new Job(jobId, workflowType));
    }
}
