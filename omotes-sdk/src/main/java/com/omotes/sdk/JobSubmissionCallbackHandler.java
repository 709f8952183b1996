package com.omotes.sdk;

import com.omotes.protocol.ProtocolCodec;
import com.omotes.protocol.job.JobProgressUpdate;
import com.omotes.protocol.job.JobResult;
import com.omotes.protocol.job.JobStatusUpdate;
import com.omotes.workflow.Job;

/**
 * Decodes the raw messages of one job's queues and hands them to the caller's callbacks.
 * Decoding failures propagate as {@link com.omotes.protocol.ProtocolException} to the message bus,
 * which logs and skips the message.
 */
final class JobSubmissionCallbackHandler {

    private final Job job;
    private final JobCallbacks callbacks;
    private final Runnable afterFinished;

    /**
     * @param afterFinished run after {@code onFinished} returns normally; null for none
     */
    JobSubmissionCallbackHandler(Job job, JobCallbacks callbacks, Runnable afterFinished) {
        this.job = job;
        this.callbacks = callbacks;
        this.afterFinished = afterFinished;
    }

    void onFinished(byte[] message) {
        JobResult result = ProtocolCodec.decode(message, JobResult.class);
        callbacks.getOnFinished().accept(job, result);
        if (afterFinished != null) {
            afterFinished.run();
        }
    }

    void onProgressUpdate(byte[] message) {
        callbacks.getOnProgressUpdate().accept(job, ProtocolCodec.decode(message, JobProgressUpdate.class));
    }

    void onStatusUpdate(byte[] message) {
        callbacks.getOnStatusUpdate().accept(job, ProtocolCodec.decode(message, JobStatusUpdate.class));
    }
}
