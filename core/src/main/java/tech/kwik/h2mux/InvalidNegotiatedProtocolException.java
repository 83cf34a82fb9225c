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

import java.io.IOException;

public class InvalidNegotiatedProtocolException extends IOException {

    private final String negotiatedProtocol;

    public InvalidNegotiatedProtocolException(String negotiatedProtocol) {
        super("Expected h2 as negotiated protocol, received " + negotiatedProtocol);
        this.negotiatedProtocol = negotiatedProtocol;
    }

    public String getNegotiatedProtocol() {
        return negotiatedProtocol;
    }
}
