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

/**
 * https://www.rfc-editor.org/rfc/rfc9113.html#name-error-codes
 * "Error codes are 32-bit fields that are used in RST_STREAM and GOAWAY frames to convey the reasons for the stream
 *  or connection error."
 */
public final class Http2ErrorCode {

    // "The associated condition is not a result of an error. For example, a GOAWAY might include this code to indicate
    //  graceful shutdown of a connection."
    public static final long NO_ERROR = 0x00;
    // "The endpoint detected an unspecific protocol error. This error is for use when a more specific error code is
    //  not available."
    public static final long PROTOCOL_ERROR = 0x01;
    // "The endpoint encountered an unexpected internal error."
    public static final long INTERNAL_ERROR = 0x02;
    // "The endpoint detected that its peer violated the flow-control protocol."
    public static final long FLOW_CONTROL_ERROR = 0x03;
    // "The endpoint sent a SETTINGS frame but did not receive a response in a timely manner."
    public static final long SETTINGS_TIMEOUT = 0x04;
    // "The endpoint received a frame after a stream was half-closed."
    public static final long STREAM_CLOSED = 0x05;
    // "The endpoint received a frame with an invalid size."
    public static final long FRAME_SIZE_ERROR = 0x06;
    // "The endpoint refused the stream prior to performing any application processing."
    public static final long REFUSED_STREAM = 0x07;
    // "The endpoint uses this error code to indicate that the stream is no longer needed."
    public static final long CANCEL = 0x08;
    // "The endpoint is unable to maintain the field section compression context for the connection."
    public static final long COMPRESSION_ERROR = 0x09;
    // "The connection established in response to a CONNECT request was reset or abnormally closed."
    public static final long CONNECT_ERROR = 0x0a;
    // "The endpoint detected that its peer is exhibiting a behavior that might be generating excessive load."
    public static final long ENHANCE_YOUR_CALM = 0x0b;
    // "The underlying transport has properties that do not meet minimum security requirements."
    public static final long INADEQUATE_SECURITY = 0x0c;
    // "The endpoint requires that HTTP/1.1 be used instead of HTTP/2."
    public static final long HTTP_1_1_REQUIRED = 0x0d;

    private static final String[] NAMES = {
            "NO_ERROR", "PROTOCOL_ERROR", "INTERNAL_ERROR", "FLOW_CONTROL_ERROR", "SETTINGS_TIMEOUT",
            "STREAM_CLOSED", "FRAME_SIZE_ERROR", "REFUSED_STREAM", "CANCEL", "COMPRESSION_ERROR",
            "CONNECT_ERROR", "ENHANCE_YOUR_CALM", "INADEQUATE_SECURITY", "HTTP_1_1_REQUIRED"
    };

    private Http2ErrorCode() {
    }

    /**
     * Returns a readable name for the given error code, for use in log and exception messages.
     * https://www.rfc-editor.org/rfc/rfc9113.html#section-7
     * "Unknown or unsupported error codes MUST NOT trigger any special behavior."
     */
    public static String name(long errorCode) {
        if (errorCode >= 0 && errorCode < NAMES.length) {
            return NAMES[(int) errorCode];
        }
        return "0x" + Long.toHexString(errorCode);
    }
}
