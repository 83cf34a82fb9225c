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

import java.time.Duration;

public interface Http2ConnectionSettings {

    /**
     * The time the connection may be idle (no bytes sent or received) before it is closed.
     * @return
     */
    Duration idleTimeout();

    /**
     * The maximum size of a response body; streams with larger responses are reset. 0 means no limit.
     * @return
     */
    long maxResponseSize();

    /**
     * The response body size above which a warning is logged. 0 disables the warning.
     * @return
     */
    long warnResponseSize();
}
