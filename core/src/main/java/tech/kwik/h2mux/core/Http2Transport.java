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

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.security.cert.X509Certificate;
import java.util.Optional;

/**
 * The duplex byte channel an HTTP/2 connection runs on. Establishing the connection, TLS and ALPN are the
 * responsibility of the implementation; the connection only writes to it, asks it to close and queries the properties
 * of the peer. Incoming bytes and state changes are reported to a {@link Http2TransportListener}.
 */
public interface Http2Transport {

    void write(ByteBuffer data) throws IOException;

    /**
     * Requests the transport to close. Any data already written should still be delivered. Once closed, the transport
     * must call {@link Http2TransportListener#onTransportLost(Throwable)}.
     */
    void loseConnection();

    boolean isConnected();

    InetSocketAddress peerAddress();

    Optional<X509Certificate> peerCertificate();

    /**
     * @return  the application protocol negotiated with ALPN, or null when none was negotiated.
     */
    String negotiatedProtocol();
}
