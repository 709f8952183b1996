package com.omotes.worker;

/**
 * Thrown when a task body failed. The failed result has been published before this is thrown.
 */
public class TaskExecutionException extends RuntimeException {

    private final String jobId;
    private final String taskId;

    public TaskExecutionException(String jobId, String taskId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.taskId = taskId;
    }

    public String getJobId() {
        return jobId;
    }

    public String getTaskId() {
        return taskId;
    }
}
