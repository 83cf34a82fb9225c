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
import java.util.List;
import java.util.stream.Collectors;

/**
 * The connection was lost after the request was sent; whether the peer processed the request is unknown. Carries all
 * errors that led to losing the connection, in the order they occurred.
 */
public class ConnectionLostException extends IOException {

    private final List<Throwable> causes;

    public ConnectionLostException(List<Throwable> causes) {
        super(message(causes), causes.isEmpty()? null: causes.get(0));
        this.causes = List.copyOf(causes);
    }

    public List<Throwable> getCauses() {
        return causes;
    }

    private static String message(List<Throwable> causes) {
        if (causes.isEmpty()) {
            return "Connection was closed";
        }
        return "Connection was lost: " + causes.stream()
                .map(Throwable::toString)
                .collect(Collectors.joining(", "));
    }
}
