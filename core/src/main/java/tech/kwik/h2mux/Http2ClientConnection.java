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

import tech.kwik.h2mux.core.Http2TransportListener;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A client-side HTTP/2 connection to one peer, multiplexing requests as streams. Requests are started in the order
 * they are submitted, as far as the concurrent stream limit negotiated with the peer allows.
 */
public interface Http2ClientConnection extends Http2TransportListener {

    static Http2ClientConnectionBuilder newBuilder() {
        return new Http2ClientConnectionBuilder();
    }

    /**
     * Submits a request for execution on this connection. Never blocks.
     * <p>
     * The returned future completes with the response, or exceptionally with
     * <ul>
     * <li>{@link StreamResetException} when the stream was reset by either side,</li>
     * <li>{@link ConnectionLostException} when the connection was lost after the request was sent,</li>
     * <li>{@link InactiveStreamClosedException} when the connection was lost before the request was sent,</li>
     * <li>{@link InvalidHostnameException} when the request does not target the peer of this connection,</li>
     * <li>{@link MaxSizeExceededException} when the response exceeds the configured maximum size.</li>
     * </ul>
     * The future normally completes on a later event of the connection, never within this call. There are two
     * exceptions: when the connection is already lost, the returned future has already failed with
     * {@link InactiveStreamClosedException}; and when the request can be started right away but targets another host,
     * it has already failed with {@link InvalidHostnameException}.
     * @param request  the request to send
     * @return  future that completes exactly once
     */
    CompletableFuture<HttpResponse<byte[]>> submit(HttpRequest request);

    /**
     * A single-fire notification for the loss of this connection, completing with all errors that caused it (empty
     * when the connection was closed cleanly). Once completed, the connection cannot be used for new requests.
     * @return
     */
    CompletableFuture<List<Throwable>> connectionLost();

    ConnectionMetadata getMetadata();

    /**
     * @return  whether the transport is open and the peer acknowledged this endpoint's settings.
     */
    boolean isReady();
}
