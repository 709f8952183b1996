package com.omotes.worker;

import com.omotes.broker.BrokerConfig;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Worker configuration loaded from environment variables.
 * <p>
 * OMOTES_TASK_PROGRESS_QUEUE, OMOTES_TASK_RESULT_QUEUE: queues the worker reports to (defaults
 * omotes_task_progress_events and omotes_task_result_events). OMOTES_WORKER_LOG_LEVEL: level the
 * hosting application should give the logging backend (default INFO). The SDK only logs through the
 * SLF4J API and does not apply this level itself; the application that binds a backend must read
 * {@link #getLogLevel()} and configure it. Broker settings as in {@link BrokerConfig}.
 */
public final class WorkerConfig {

    private static final String ENV_TASK_PROGRESS_QUEUE = "OMOTES_TASK_PROGRESS_QUEUE";
    private static final String ENV_TASK_RESULT_QUEUE = "OMOTES_TASK_RESULT_QUEUE";
    private static final String ENV_LOG_LEVEL = "OMOTES_WORKER_LOG_LEVEL";

    private static final String DEFAULT_TASK_PROGRESS_QUEUE = "omotes_task_progress_events";
    private static final String DEFAULT_TASK_RESULT_QUEUE = "omotes_task_result_events";
    private static final String DEFAULT_LOG_LEVEL = "INFO";

    private final BrokerConfig brokerConfig;
    private final String taskProgressQueueName;
    private final String taskResultQueueName;
    private final String logLevel;

    private WorkerConfig(Builder b) {
        this.brokerConfig = b.brokerConfig;
        this.taskProgressQueueName = b.taskProgressQueueName;
        this.taskResultQueueName = b.taskResultQueueName;
        this.logLevel = b.logLevel;
    }

    public BrokerConfig getBrokerConfig() {
        return brokerConfig;
    }

    public String getTaskProgressQueueName() {
        return taskProgressQueueName;
    }

    public String getTaskResultQueueName() {
        return taskResultQueueName;
    }

    /**
     * Upper-case level name (TRACE, DEBUG, INFO, WARN, ERROR). Not applied by the worker; the hosting
     * application sets it on its logging backend.
     */
    public String getLogLevel() {
        return logLevel;
    }

    public static WorkerConfig fromEnvironment() {
        return fromEnvironment(System::getenv, BrokerConfig.fromEnvironment());
    }

    static WorkerConfig fromEnvironment(Function<String, String> env, BrokerConfig brokerConfig) {
        return builder()
                .brokerConfig(brokerConfig)
                .taskProgressQueueName(getEnv(env, ENV_TASK_PROGRESS_QUEUE, DEFAULT_TASK_PROGRESS_QUEUE))
                .taskResultQueueName(getEnv(env, ENV_TASK_RESULT_QUEUE, DEFAULT_TASK_RESULT_QUEUE))
                .logLevel(getEnv(env, ENV_LOG_LEVEL, DEFAULT_LOG_LEVEL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private BrokerConfig brokerConfig = BrokerConfig.builder().build();
        private String taskProgressQueueName = DEFAULT_TASK_PROGRESS_QUEUE;
        private String taskResultQueueName = DEFAULT_TASK_RESULT_QUEUE;
        private String logLevel = DEFAULT_LOG_LEVEL;

        public Builder brokerConfig(BrokerConfig brokerConfig) {
            this.brokerConfig = Objects.requireNonNull(brokerConfig, "brokerConfig");
            return this;
        }

        public Builder taskProgressQueueName(String taskProgressQueueName) {
            this.taskProgressQueueName = Objects.requireNonNull(taskProgressQueueName, "taskProgressQueueName");
            return this;
        }

        public Builder taskResultQueueName(String taskResultQueueName) {
            this.taskResultQueueName = Objects.requireNonNull(taskResultQueueName, "taskResultQueueName");
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel").trim().toUpperCase(Locale.ROOT);
            return this;
        }

        public WorkerConfig build() {
            return new WorkerConfig(this);
        }
    }
}
