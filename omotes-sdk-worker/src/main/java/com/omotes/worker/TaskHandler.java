package com.omotes.worker;

import com.omotes.protocol.job.WorkerTaskRequest;

/** Executes one received work item. */
@FunctionalInterface
public interface TaskHandler {

    /**
     * @throws TaskExecutionException when the task failed; its failure has already been reported
     */
    void handle(TaskContext context, WorkerTaskRequest request);
}
