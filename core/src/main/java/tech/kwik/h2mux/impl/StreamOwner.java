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
package tech.kwik.h2mux.impl;

import tech.kwik.h2mux.ConnectionMetadata;

import java.nio.ByteBuffer;

/**
 * What a stream may ask of the connection that owns it. Streams never change connection state themselves.
 */
interface StreamOwner {

    ConnectionMetadata getMetadata();

    /**
     * The stream closed itself (i.e. not because of a codec event or connection teardown); it must be unregistered
     * and its capacity offered to waiting streams.
     */
    void streamClosed(Http2Stream stream);

    /**
     * The request body publisher produced data; may be called from any thread.
     */
    void requestBodyReceived(Http2Stream stream, ByteBuffer data);

    void requestBodyCompleted(Http2Stream stream);

    void requestBodyFailed(Http2Stream stream, Throwable error);
}
