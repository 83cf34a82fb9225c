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

import java.nio.ByteBuffer;

/**
 * Callbacks from the transport into the connection. Implementations process calls one at a time.
 */
public interface Http2TransportListener {

    void onTransportEstablished();

    /**
     * Called when the TLS handshake has completed, so the negotiated application protocol is known.
     */
    void onHandshakeCompleted();

    void onBytesReceived(ByteBuffer data);

    /**
     * @param cause  the reason the transport was lost, or null when it was closed cleanly.
     */
    void onTransportLost(Throwable cause);
}
