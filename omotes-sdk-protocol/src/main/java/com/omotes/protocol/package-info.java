/**
 * OMOTES wire protocol shared by the SDK, the orchestrator and the workers.
 *
 * <ul>
 *   <li>{@link com.omotes.protocol.job} – job lifecycle messages (submission, cancellation, progress, status, result, task dispatch)</li>
 *   <li>{@link com.omotes.protocol.workflow} – available-workflows catalog and the tagged union of parameter messages</li>
 *   <li>{@link com.omotes.protocol.bus} – the {@link com.omotes.protocol.bus.MessageBus} transport capability</li>
 *   <li>{@link com.omotes.protocol.ProtocolCodec} – binary encode/decode of every message</li>
 * </ul>
 */
package com.omotes.protocol;
