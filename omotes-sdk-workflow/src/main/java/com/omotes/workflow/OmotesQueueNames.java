package com.omotes.workflow;

/**
 * Names of the broker queues shared by the SDK, the orchestrator and the workers. Names are built
 * by plain concatenation; ids and workflow type names are not escaped.
 */
public final class OmotesQueueNames {

    private static final String JOB_SUBMISSIONS_PREFIX = "job_submissions.";
    private static final String JOBS_PREFIX = "jobs.";
    private static final String JOB_CANCELLATIONS = "job_cancellations";

    private OmotesQueueNames() {
    }

    /** {@code job_submissions.<workflow type name>} */
    public static String jobSubmissionQueueName(WorkflowType workflowType) {
        return JOB_SUBMISSIONS_PREFIX + workflowType.getWorkflowTypeName();
    }

    /** {@code jobs.<job id>.result} */
    public static String jobResultsQueueName(Job job) {
        return JOBS_PREFIX + job.getId() + ".result";
    }

    /** {@code jobs.<job id>.progress} */
    public static String jobProgressQueueName(Job job) {
        return JOBS_PREFIX + job.getId() + ".progress";
    }

    /** {@code jobs.<job id>.status} */
    public static String jobStatusQueueName(Job job) {
        return JOBS_PREFIX + job.getId() + ".status";
    }

    /** The single queue carrying cancellations of every workflow type. */
    public static String jobCancelQueueName() {
        return JOB_CANCELLATIONS;
    }
}
