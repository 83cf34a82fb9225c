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
package tech.kwik.h2mux;

import tech.kwik.h2mux.core.Http2ErrorCode;

import java.io.IOException;

/**
 * https://www.rfc-editor.org/rfc/rfc9113.html#name-stream-error-handling
 * "A stream error is an error related to a specific stream that does not affect processing of other streams."
 */
public class StreamResetException extends IOException {

    private final int streamId;
    private final long http2ErrorCode;

    public StreamResetException(int streamId, long http2ErrorCode) {
        super("Stream " + streamId + " was reset: " + Http2ErrorCode.name(http2ErrorCode));
        this.streamId = streamId;
        this.http2ErrorCode = http2ErrorCode;
    }

    public StreamResetException(int streamId, long http2ErrorCode, Throwable cause) {
        super("Stream " + streamId + " was reset: " + Http2ErrorCode.name(http2ErrorCode), cause);
        this.streamId = streamId;
        this.http2ErrorCode = http2ErrorCode;
    }

    public int getStreamId() {
        return streamId;
    }

    public long getHttp2ErrorCode() {
        return http2ErrorCode;
    }
}
