package com.questrail.dfx.protocol.ws.internal.exec;

/**
 * Outcome of one {@link ResultSubscriptionFlow#subscribe} call.
 *
 * @param done {@code true} if no chunks remain for the recording (or the call was cancelled)
 * @param chunksDelivered results handed to the sink by this call
 */
public record SubscriptionResult(boolean done, int chunksDelivered) {
}
