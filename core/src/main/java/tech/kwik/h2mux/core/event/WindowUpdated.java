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
 * The flow-control window of a stream, or of the whole connection when the stream id is 0, was increased.
 */
public class WindowUpdated extends Http2Event {

    public static final int CONNECTION = 0;

    private final int streamId;
    private final int delta;

    public WindowUpdated(int streamId, int delta) {
        this.streamId = streamId;
        this.delta = delta;
    }

    public int getStreamId() {
        return streamId;
    }

    public int getDelta() {
        return delta;
    }

    public boolean isConnectionWindow() {
        return streamId == CONNECTION;
    }

    @Override
    public void accept(Http2EventHandler handler) {
        handler.onWindowUpdated(this);
    }

    @Override
    public String toString() {
        return "WindowUpdated[" + streamId + "|+" + delta + "]";
    }
}
