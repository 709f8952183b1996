package com.omotes.worker;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.bus.MessageBus;
import com.omotes.protocol.job.WorkerTaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * {@link TaskRunner} that takes work items from the message bus queue named after the task type.
 * Each execution gets a fresh task id. Items run one at a time on the bus's consumer loop.
 */
public final class BusTaskRunner implements TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(BusTaskRunner.class);

    private final MessageBus messageBus;
    private String taskType;

    public BusTaskRunner(MessageBus messageBus) {
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
    }

    @Override
    public synchronized void start(String taskType, TaskHandler handler) {
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(handler, "handler");
        if (this.taskType != null) {
            throw new IllegalStateException("Task runner already started for task type " + this.taskType);
        }
        this.taskType = taskType;
        messageBus.subscribe(taskType, message -> run(taskType, handler, message));
        log.info("Listening for {} tasks on queue {}", taskType, taskType);
    }

    @Override
    public synchronized void stop() {
        if (taskType != null) {
            messageBus.unsubscribe(taskType);
            log.info("Stopped listening for {} tasks", taskType);
            taskType = null;
        }
    }

    private void run(String taskType, TaskHandler handler, byte[] message) {
        WorkerTaskRequest request = ProtocolCodec.decode(message, WorkerTaskRequest.class);
        TaskContext context = new TaskContext(UUID.randomUUID().toString(), taskType);
        try {
            handler.handle(context, request);
        } catch (TaskExecutionException e) {
            log.error("Failure detected for task {} of job {}", e.getTaskId(), e.getJobId());
        }
    }
}
