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

/**
 * The peer sent GOAWAY.
 */
public class ConnectionTerminated extends Http2Event {

    private final long errorCode;
    private final int lastStreamId;
    private final byte[] additionalData;

    public ConnectionTerminated(long errorCode, int lastStreamId, byte[] additionalData) {
        this.errorCode = errorCode;
        this.lastStreamId = lastStreamId;
        this.additionalData = additionalData != null? additionalData: new byte[0];
    }

    public long getErrorCode() {
        return errorCode;
    }

    public int getLastStreamId() {
        return lastStreamId;
    }

    public byte[] getAdditionalData() {
        return additionalData;
    }

    @Override
    public void accept(Http2EventHandler handler) {
        handler.onConnectionTerminated(this);
    }

    @Override
    public String toString() {
        return "ConnectionTerminated[" + Http2ErrorCode.name(errorCode) + "|last stream " + lastStreamId + "]";
    }
}
