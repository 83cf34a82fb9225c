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
import java.net.InetAddress;

/**
 * The peer sent GOAWAY.
 * https://www.rfc-editor.org/rfc/rfc9113.html#name-goaway
 * "The GOAWAY frame is used to initiate shutdown of a connection or to signal serious error conditions."
 */
public class RemoteTerminatedConnectionException extends IOException {

    private final long http2ErrorCode;
    private final int lastStreamId;

    public RemoteTerminatedConnectionException(InetAddress peerAddress, long http2ErrorCode, int lastStreamId) {
        super("Received GOAWAY frame (" + Http2ErrorCode.name(http2ErrorCode) + ") from " + peerAddress);
        this.http2ErrorCode = http2ErrorCode;
        this.lastStreamId = lastStreamId;
    }

    public long getHttp2ErrorCode() {
        return http2ErrorCode;
    }

    public int getLastStreamId() {
        return lastStreamId;
    }
}
