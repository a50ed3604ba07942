package com.questrail.dfx.protocol.ws.internal.exec;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and running flows.
 * Flows check it at the top of every loop iteration. Once set it stays set.
 */
public final class CancellationToken
{
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel()
    {
        cancelled.set(true);
    }

    public boolean isCancelled()
    {
        return cancelled.get();
    }
}
