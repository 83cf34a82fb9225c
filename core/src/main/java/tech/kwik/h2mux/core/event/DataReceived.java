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

import java.nio.ByteBuffer;

public class DataReceived extends Http2Event {

    private final int streamId;
    private final ByteBuffer data;
    private final int flowControlledLength;

    /**
     * @param flowControlledLength  the number of bytes that counted against the flow-control window, which includes
     *                              padding and can therefore be larger than the data size.
     */
    public DataReceived(int streamId, ByteBuffer data, int flowControlledLength) {
        this.streamId = streamId;
        this.data = data;
        this.flowControlledLength = flowControlledLength;
    }

    public int getStreamId() {
        return streamId;
    }

    public ByteBuffer getData() {
        return data;
    }

    public int getFlowControlledLength() {
        return flowControlledLength;
    }

    @Override
    public void accept(Http2EventHandler handler) {
        handler.onDataReceived(this);
    }

    @Override
    public String toString() {
        return "DataReceived[" + streamId + "|" + data.remaining() + "]";
    }
}
