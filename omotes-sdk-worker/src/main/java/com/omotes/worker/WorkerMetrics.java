package com.omotes.worker;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Task metrics of a worker: counter {@value #TASKS} tagged with taskType and outcome
 * (started, succeeded, failed) and timer {@value #TASK_DURATION} tagged with taskType and outcome.
 */
public final class WorkerMetrics {

    public static final String TASKS = "omotes.worker.tasks";
    public static final String TASK_DURATION = "omotes.worker.task.duration";

    private final MeterRegistry registry;

    public WorkerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public WorkerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void taskStarted(String taskType) {
        registry.counter(TASKS, "taskType", taskType, "outcome", "started").increment();
    }

    void taskFinished(String taskType, boolean succeeded, long durationNanos) {
        String outcome = succeeded ? "succeeded" : "failed";
        registry.counter(TASKS, "taskType", taskType, "outcome", outcome).increment();
        Timer.builder(TASK_DURATION)
                .tag("taskType", taskType)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
