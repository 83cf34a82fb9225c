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
package tech.kwik.h2mux.core;

import tech.kwik.h2mux.core.event.Http2Event;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * The HTTP/2 protocol engine of one connection: translates between raw bytes and frames, maintains HPACK state and
 * does the flow-control window arithmetic. It performs no I/O: bytes it wants to send accumulate until drained with
 * {@link #dataToSend()}, which must be done after every call that mutates its state.
 */
public interface Http2Codec {

    /**
     * Parses the given bytes.
     * @return  the events the bytes produced, in the order in which they must be processed.
     * @throws ProtocolViolationException  when the bytes violate the protocol; the connection cannot be used anymore.
     */
    List<Http2Event> receiveData(ByteBuffer data) throws ProtocolViolationException;

    ByteBuffer dataToSend();

    /**
     * Queues the connection preface and the initial SETTINGS frame.
     */
    void initiateConnection();

    /**
     * Opens the stream with the given id by queueing a HEADERS frame.
     * @param headers  the header fields, pseudo-header fields first.
     */
    void sendHeaders(int streamId, List<Map.Entry<String, String>> headers, boolean endStream);

    /**
     * Queues a DATA frame. The caller must respect the flow-control window and maximum frame size.
     */
    void sendData(int streamId, ByteBuffer data, boolean endStream);

    /**
     * Queues an empty DATA frame with the END_STREAM flag set.
     */
    void endStream(int streamId);

    void resetStream(int streamId, long errorCode);

    /**
     * Informs the flow controller that the application consumed the given amount of (flow-controlled) bytes, so the
     * peer's window can be replenished.
     */
    void acknowledgeReceivedData(int flowControlledLength, int streamId);

    /**
     * @return  the number of bytes that may be sent on the given stream, which is bounded by the connection window.
     */
    int localFlowControlWindow(int streamId);

    int maxOutboundFrameSize();

    /**
     * Queues a GOAWAY frame with the given error code.
     */
    void closeConnection(long errorCode);

    /**
     * @return  SETTINGS_MAX_CONCURRENT_STREAMS as advertised by this endpoint.
     */
    long localMaxConcurrentStreams();

    /**
     * @return  SETTINGS_MAX_CONCURRENT_STREAMS as advertised by the peer; may change during the connection's lifetime.
     */
    long remoteMaxConcurrentStreams();

    int openOutboundStreams();

    int openInboundStreams();
}
