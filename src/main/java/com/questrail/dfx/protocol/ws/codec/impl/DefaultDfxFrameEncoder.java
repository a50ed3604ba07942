package com.questrail.dfx.protocol.ws.codec.impl;

import com.questrail.dfx.protocol.ws.codec.DfxFrameEncoder;
import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;

import java.util.Objects;

/**
 * DefaultDfxFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DfxFrameEncoder}.
 *
 * <p>Pure concatenation. No length prefix, no terminator, no padding beyond the
 * fixed header widths.</p>
 */
public final class DefaultDfxFrameEncoder implements DfxFrameEncoder
{
    @Override
    public byte[] encode(DfxRequestFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final byte[] action = DfxFraming.fixedWidth(frame.actionCode(), DfxFraming.ACTION_CODE_WIDTH);
        final byte[] requestId = DfxFraming.fixedWidth(frame.requestId(), DfxFraming.REQUEST_ID_WIDTH);
        final byte[] body = frame.body();

        byte[] out = new byte[DfxFraming.REQUEST_HEADER_WIDTH + body.length];
        System.arraycopy(action, 0, out, 0, action.length);
        System.arraycopy(requestId, 0, out, DfxFraming.ACTION_CODE_WIDTH, requestId.length);
        System.arraycopy(body, 0, out, DfxFraming.REQUEST_HEADER_WIDTH, body.length);
        return out;
    }
}
