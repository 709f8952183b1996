/**
 * Worker side of the OMOTES job protocol.
 *
 * <ul>
 *   <li>{@link com.omotes.worker.Worker} – one task type, explicit {@link com.omotes.worker.WorkerConfig}</li>
 *   <li>{@link com.omotes.worker.WorkerTaskAdapter} – runs a {@link com.omotes.worker.WorkerTaskFunction} and publishes progress and result</li>
 *   <li>{@link com.omotes.worker.TaskRunner} – the execution runtime; {@link com.omotes.worker.BusTaskRunner} takes work from the message bus</li>
 *   <li>{@link com.omotes.worker.WorkerMetrics} – Micrometer task counters and timers</li>
 * </ul>
 */
package com.omotes.worker;
