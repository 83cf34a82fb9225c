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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bookkeeping of the streams of one connection: the registered streams by id, the streams waiting for admission (in
 * arrival order) and the streams that were admitted. Not thread-safe; owned by the connection.
 */
class StreamRegistry {

    private final Map<Integer, Http2Stream> streams;
    private final Deque<Http2Stream> pendingQueue;
    private final Set<Integer> admitted;

    StreamRegistry() {
        streams = new LinkedHashMap<>();
        pendingQueue = new ArrayDeque<>();
        admitted = new HashSet<>();
    }

    /**
     * Registers the stream and appends it to the admission queue.
     * @throws IllegalStateException  when a stream with the same id is registered
     */
    void register(Http2Stream stream) {
        if (streams.putIfAbsent(stream.getStreamId(), stream) != null) {
            throw new IllegalStateException("Stream " + stream.getStreamId() + " is already registered");
        }
        stream.enqueued();
        pendingQueue.add(stream);
    }

    /**
     * Removes the head of the admission queue and counts it as active, provided less than the given number of streams
     * are active.
     * @return  the admitted stream, or null when no stream could be admitted
     */
    Http2Stream pollAdmissible(long allowedConcurrency) {
        if (pendingQueue.isEmpty() || admitted.size() >= allowedConcurrency) {
            return null;
        }
        Http2Stream stream = pendingQueue.poll();
        admitted.add(stream.getStreamId());
        return stream;
    }

    Http2Stream get(int streamId) {
        return streams.get(streamId);
    }

    /**
     * Unregisters the stream; when it was admitted, the number of active streams is decreased.
     * @return  the removed stream, or null when no stream with that id was registered
     */
    Http2Stream remove(int streamId) {
        Http2Stream stream = streams.remove(streamId);
        if (stream != null && ! admitted.remove(streamId)) {
            pendingQueue.remove(stream);
        }
        return stream;
    }

    /**
     * Unregisters all streams.
     * @return  the streams that were registered, in registration order
     */
    List<Http2Stream> drain() {
        List<Http2Stream> all = new ArrayList<>(streams.values());
        streams.clear();
        pendingQueue.clear();
        admitted.clear();
        return all;
    }

    List<Http2Stream> streams() {
        return new ArrayList<>(streams.values());
    }

    int activeCount() {
        return admitted.size();
    }

    int pendingCount() {
        return pendingQueue.size();
    }

    int size() {
        return streams.size();
    }

    boolean isEmpty() {
        return streams.isEmpty();
    }
}
