/*
 * Copyright © 2025 The H2mux authors
 *
 * This file is part of H2mux, a HTTP/2 stream multiplexing Java library
 *
 * H2mux is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * H2mux is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.h2mux.core.event;

import tech.kwik.h2mux.core.Http2ErrorCode;

public class StreamReset extends Http2Event {

    private final int streamId;
    private final long errorCode;
    private final boolean remoteReset;

    public StreamReset(int streamId, long errorCode, boolean remoteReset) {
        this.streamId = streamId;
        this.errorCode = errorCode;
        this.remoteReset = remoteReset;
    }

    public int getStreamId() {
        return streamId;
    }

    public long getErrorCode() {
        return errorCode;
    }

    /**
     * @return  true when the peer sent RST_STREAM, false when the codec reset the stream itself.
     */
    public boolean isRemoteReset() {
        return remoteReset;
    }

    @Override
    public void accept(Http2EventHandler handler) {
        handler.onStreamReset(this);
    }

    @Override
    public String toString() {
        return "StreamReset[" + streamId + "|" + Http2ErrorCode.name(errorCode) + "]";
    }
}
