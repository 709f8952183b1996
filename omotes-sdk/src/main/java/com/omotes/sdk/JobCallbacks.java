package com.omotes.sdk;

import com.omotes.protocol.job.JobProgressUpdate;
import com.omotes.protocol.job.JobResult;
import com.omotes.protocol.job.JobStatusUpdate;
import com.omotes.workflow.Job;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Callbacks for the events of one job. {@code onFinished} is required; progress and status
 * callbacks are optional and default to ignoring the update.
 */
public final class JobCallbacks {

    private final BiConsumer<Job, JobResult> onFinished;
    private final BiConsumer<Job, JobProgressUpdate> onProgressUpdate;
    private final BiConsumer<Job, JobStatusUpdate> onStatusUpdate;

    private JobCallbacks(Builder b) {
        this.onFinished = Objects.requireNonNull(b.onFinished, "onFinished");
        this.onProgressUpdate = b.onProgressUpdate != null ? b.onProgressUpdate : (job, update) -> { };
        this.onStatusUpdate = b.onStatusUpdate != null ? b.onStatusUpdate : (job, update) -> { };
    }

    /** Callbacks that only handle the result. */
    public static JobCallbacks onFinished(BiConsumer<Job, JobResult> onFinished) {
        return builder().onFinished(onFinished).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BiConsumer<Job, JobResult> getOnFinished() {
        return onFinished;
    }

    public BiConsumer<Job, JobProgressUpdate> getOnProgressUpdate() {
        return onProgressUpdate;
    }

    public BiConsumer<Job, JobStatusUpdate> getOnStatusUpdate() {
        return onStatusUpdate;
    }

    public static final class Builder {
        private BiConsumer<Job, JobResult> onFinished;
        private BiConsumer<Job, JobProgressUpdate> onProgressUpdate;
        private BiConsumer<Job, JobStatusUpdate> onStatusUpdate;

        public Builder onFinished(BiConsumer<Job, JobResult> onFinished) {
            this.onFinished = onFinished;
            return this;
        }

        public Builder onProgressUpdate(BiConsumer<Job, JobProgressUpdate> onProgressUpdate) {
            this.onProgressUpdate = onProgressUpdate;
            return this;
        }

        public Builder onStatusUpdate(BiConsumer<Job, JobStatusUpdate> onStatusUpdate) {
            this.onStatusUpdate = onStatusUpdate;
            return this;
        }

        /**
         * @throws NullPointerException when no {@code onFinished} callback was set
         */
        public JobCallbacks build() {
            return new JobCallbacks(this);
        }
    }
}
