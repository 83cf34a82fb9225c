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
package tech.kwik.h2mux.core.event;

/**
 * The peer acknowledged the SETTINGS this endpoint sent, which completes the connection setup.
 */
public class SettingsAcknowledged extends Http2Event {

    @Override
    public void accept(Http2EventHandler handler) {
        handler.onSettingsAcknowledged(this);
    }

    @Override
    public String toString() {
        return "SettingsAcknowledged";
    }
}
