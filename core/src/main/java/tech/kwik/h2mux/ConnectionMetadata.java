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

import java.net.InetAddress;
import java.net.URI;
import java.security.cert.X509Certificate;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a connection. The connection replaces its instance when the peer address becomes known
 * (transport established) and when the peer certificate becomes known (settings acknowledged).
 */
public final class ConnectionMetadata {

    private final URI uri;
    private final InetAddress peerAddress;
    private final X509Certificate peerCertificate;
    private final long maxResponseSize;
    private final long warnResponseSize;

    public ConnectionMetadata(URI uri, long maxResponseSize, long warnResponseSize) {
        this(uri, null, null, maxResponseSize, warnResponseSize);
    }

    private ConnectionMetadata(URI uri, InetAddress peerAddress, X509Certificate peerCertificate, long maxResponseSize, long warnResponseSize) {
        this.uri = Objects.requireNonNull(uri);
        this.peerAddress = peerAddress;
        this.peerCertificate = peerCertificate;
        this.maxResponseSize = maxResponseSize;
        this.warnResponseSize = warnResponseSize;
    }

    public ConnectionMetadata withPeerAddress(InetAddress address) {
        return new ConnectionMetadata(uri, address, peerCertificate, maxResponseSize, warnResponseSize);
    }

    public ConnectionMetadata withPeerCertificate(X509Certificate certificate) {
        return new ConnectionMetadata(uri, peerAddress, certificate, maxResponseSize, warnResponseSize);
    }

    public URI getUri() {
        return uri;
    }

    public Optional<InetAddress> getPeerAddress() {
        return Optional.ofNullable(peerAddress);
    }

    public Optional<X509Certificate> getPeerCertificate() {
        return Optional.ofNullable(peerCertificate);
    }

    public long getMaxResponseSize() {
        return maxResponseSize;
    }

    public long getWarnResponseSize() {
        return warnResponseSize;
    }

    @Override
    public String toString() {
        return "ConnectionMetadata[" + uri + "|" + peerAddress + "]";
    }
}
