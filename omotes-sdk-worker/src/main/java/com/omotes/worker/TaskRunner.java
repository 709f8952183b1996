package com.omotes.worker;

/**
 * Runtime that receives work items for a task type and runs them through a {@link TaskHandler}.
 */
public interface TaskRunner {

    /** Starts taking work items of the task type. */
    void start(String taskType, TaskHandler handler);

    void stop();
}
