package com.omotes.worker;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.bus.MessageBus;
import com.omotes.protocol.job.JobProgressUpdate;
import com.omotes.protocol.job.JobResult;
import com.omotes.protocol.job.WorkerTaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Runs the task function for one work item and reports on the worker event queues: progress 0.0
 * before the function runs, progress 1.0 and a SUCCEEDED result after it returns. When the function
 * throws, a FAILED result carrying the failure is published and {@link TaskExecutionException} is
 * thrown to the runner; an {@link Error} is rethrown as is after the FAILED result.
 */
public final class WorkerTaskAdapter implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkerTaskAdapter.class);

    static final String STARTED_MESSAGE = "Job calculation started";
    static final String FINISHED_MESSAGE = "Calculation finished.";

    private final WorkerConfig config;
    private final MessageBus messageBus;
    private final WorkerTaskFunction taskFunction;
    private final WorkerMetrics metrics;

    public WorkerTaskAdapter(WorkerConfig config, MessageBus messageBus, WorkerTaskFunction taskFunction, WorkerMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.taskFunction = Objects.requireNonNull(taskFunction, "taskFunction");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void handle(TaskContext context, WorkerTaskRequest request) {
        String jobId = request.getJobId();
        String taskType = context.getTaskType();
        log.info("Worker started new task {} ({}) for job {}", context.getTaskId(), taskType, jobId);
        metrics.taskStarted(taskType);
        long startNanos = System.nanoTime();
        ProgressReporter progress = (fraction, message) -> publishProgress(context, jobId, fraction, message);

        String outputEsdl;
        try {
            progress.updateProgress(0.0, STARTED_MESSAGE);
            String inputEsdl = new String(request.getInputEsdl(), StandardCharsets.UTF_8);
            outputEsdl = taskFunction.execute(inputEsdl, request.getParams(), progress);
            if (outputEsdl == null) {
                throw new IllegalStateException("Task function returned no output ESDL");
            }
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Task {} ({}) for job {} failed: {}", context.getTaskId(), taskType, jobId, t.getMessage(), t);
            publishResult(new JobResult(jobId, context.getTaskId(), taskType, JobResult.ResultType.FAILED, null, describe(t)));
            metrics.taskFinished(taskType, false, System.nanoTime() - startNanos);
            if (t instanceof Error) {
                throw (Error) t;
            }
            throw new TaskExecutionException(jobId, context.getTaskId(),
                    "Task " + context.getTaskId() + " for job " + jobId + " failed: " + t.getMessage(), t);
        }

        progress.updateProgress(1.0, FINISHED_MESSAGE);
        publishResult(new JobResult(jobId, context.getTaskId(), taskType, JobResult.ResultType.SUCCEEDED,
                outputEsdl.getBytes(StandardCharsets.UTF_8), ""));
        metrics.taskFinished(taskType, true, System.nanoTime() - startNanos);
        log.info("Task {} for job {} succeeded", context.getTaskId(), jobId);
    }

    private void publishProgress(TaskContext context, String jobId, double fraction, String message) {
        log.debug("Sending progress update. Progress {} for job {} (task {}) with message {}",
                fraction, jobId, context.getTaskId(), message);
        JobProgressUpdate update = new JobProgressUpdate(jobId, context.getTaskId(), context.getTaskType(), fraction, message);
        messageBus.publish(config.getTaskProgressQueueName(), ProtocolCodec.encode(update));
    }

    private void publishResult(JobResult result) {
        messageBus.publish(config.getTaskResultQueueName(), ProtocolCodec.encode(result));
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getClass().getName() + ": " + t.getMessage() : t.getClass().getName();
    }
}
