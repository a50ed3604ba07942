package com.questrail.dfx.protocol.ws.codec.impl;

import com.questrail.dfx.protocol.ws.codec.DfxFrameDecoder;
import com.questrail.dfx.protocol.ws.internal.frame.DfxInboundMessage;

import java.util.Objects;

/**
 * DefaultDfxFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DfxFrameDecoder}.
 *
 * <p>Delegates classification to {@link DfxFraming#classify(byte[])} and wraps
 * the bytes unchanged.</p>
 */
public final class DefaultDfxFrameDecoder implements DfxFrameDecoder
{
    @Override
    public DfxInboundMessage decode(byte[] message)
    {
        Objects.requireNonNull(message, "message");
        return new DfxInboundMessage(message, DfxFraming.classify(message));
    }
}
