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

/**
 * Why a stream was closed. Callers use this (through the type of failure) to decide whether a request can be retried,
 * and where.
 */
public enum StreamCloseReason {

    /** The exchange finished normally. */
    ENDED,

    /** Either side aborted the exchange; the connection is still usable. */
    RESET,

    /** The connection was torn down after the request was sent. */
    CONNECTION_LOST,

    /** The connection was torn down before the request could be sent. */
    INACTIVE,

    /** The authority of the request does not match the connection. */
    INVALID_HOSTNAME,

    /** The response is larger than the configured maximum response size. */
    MAXSIZE_EXCEEDED
}
