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

import java.net.ProtocolException;

/**
 * Signals that the bytes fed to the codec violate the HTTP/2 protocol. This is always a connection error.
 * https://www.rfc-editor.org/rfc/rfc9113.html#name-connection-error-handling
 * "A connection error is any error that prevents further processing of the frame layer or corrupts any connection
 *  state."
 */
public class ProtocolViolationException extends ProtocolException {

    private final long http2ErrorCode;

    public ProtocolViolationException(String message) {
        this(message, Http2ErrorCode.PROTOCOL_ERROR);
    }

    public ProtocolViolationException(String message, long http2ErrorCode) {
        super(message);
        this.http2ErrorCode = http2ErrorCode;
    }

    public long getHttp2ErrorCode() {
        return http2ErrorCode;
    }
}
