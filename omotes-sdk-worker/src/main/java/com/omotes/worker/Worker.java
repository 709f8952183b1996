package com.omotes.worker;

import com.omotes.broker.RedisMessageBus;
import com.omotes.protocol.bus.MessageBus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A worker for a single task type: receives work items through its {@link TaskRunner} and runs
 * them with the task function, reporting progress and results on the worker event queues.
 */
public final class Worker {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final WorkerConfig config;
    private final String taskType;
    private final MessageBus messageBus;
    private final TaskRunner taskRunner;
    private final WorkerMetrics metrics;
    private final WorkerTaskAdapter adapter;

    public Worker(WorkerConfig config, String taskType, WorkerTaskFunction taskFunction,
                  MessageBus messageBus, TaskRunner taskRunner, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.taskType = Objects.requireNonNull(taskType, "taskType");
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.taskRunner = Objects.requireNonNull(taskRunner, "taskRunner");
        this.metrics = new WorkerMetrics(meterRegistry);
        this.adapter = new WorkerTaskAdapter(config, messageBus, taskFunction, metrics);
    }

    /**
     * Worker on the Redis broker of the configuration, taking work items from the task type's queue.
     */
    public static Worker create(WorkerConfig config, String taskType, WorkerTaskFunction taskFunction) {
        MessageBus messageBus = new RedisMessageBus(config.getBrokerConfig());
        return new Worker(config, taskType, taskFunction, messageBus, new BusTaskRunner(messageBus), new SimpleMeterRegistry());
    }

    public void start() {
        log.info("Starting worker to work on task {}", taskType);
        messageBus.start();
        taskRunner.start(taskType, adapter);
        log.info("Worker for task {} reporting progress to {} and results to {} (log level {})",
                taskType, config.getTaskProgressQueueName(), config.getTaskResultQueueName(), config.getLogLevel());
    }

    public void stop() {
        taskRunner.stop();
        messageBus.close();
        log.info("Worker for task {} stopped", taskType);
    }

    public String getTaskType() {
        return taskType;
    }

    public WorkerMetrics getMetrics() {
        return metrics;
    }
}
