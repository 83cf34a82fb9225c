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
package tech.kwik.h2mux.test;

import tech.kwik.h2mux.core.Http2Codec;
import tech.kwik.h2mux.core.ProtocolViolationException;
import tech.kwik.h2mux.core.event.Http2Event;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Codec that returns scripted events and records what it is asked to send. Every mutating call queues a few marker
 * bytes, so the connection has something to write.
 */
public class TestCodec implements Http2Codec {

    private final Deque<Object> script = new ArrayDeque<>();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final List<Integer> openedStreams = new ArrayList<>();
    private final Map<Integer, List<Map.Entry<String, String>>> sentHeaders = new HashMap<>();
    private final Map<Integer, ByteArrayOutputStream> sentData = new HashMap<>();
    private final Map<Integer, Integer> dataFrameCount = new HashMap<>();
    private final List<Integer> endedStreams = new ArrayList<>();
    private final Map<Integer, Long> resetStreams = new LinkedHashMap<>();
    private final Map<Integer, Integer> acknowledged = new HashMap<>();
    private final List<Long> closeConnectionCodes = new ArrayList<>();
    private final Map<Integer, Integer> windows = new HashMap<>();
    private boolean connectionInitiated;
    private long localMaxConcurrentStreams = 100;
    private long remoteMaxConcurrentStreams = 100;
    private int defaultWindow = 65535;
    private int maxOutboundFrameSize = 16384;
    private int openOutboundStreams;
    private int openInboundStreams;

    /**
     * Queues the events returned by the next call to receiveData.
     */
    public TestCodec willProduce(Http2Event... events) {
        script.add(List.of(events));
        return this;
    }

    public TestCodec willFailWith(ProtocolViolationException violation) {
        script.add(violation);
        return this;
    }

    @SuppressWarnings("unchecked")
    @Override
    public List<Http2Event> receiveData(ByteBuffer data) throws ProtocolViolationException {
        data.position(data.limit());
        Object next = script.poll();
        if (next instanceof ProtocolViolationException) {
            write("GOAWAY");
            throw (ProtocolViolationException) next;
        }
        return next != null? (List<Http2Event>) next: List.of();
    }

    @Override
    public ByteBuffer dataToSend() {
        ByteBuffer data = ByteBuffer.wrap(output.toByteArray());
        output.reset();
        return data;
    }

    @Override
    public void initiateConnection() {
        connectionInitiated = true;
        write("PRI");
    }

    @Override
    public void sendHeaders(int streamId, List<Map.Entry<String, String>> headers, boolean endStream) {
        openedStreams.add(streamId);
        sentHeaders.put(streamId, headers);
        if (endStream) {
            endedStreams.add(streamId);
        }
        write("HEADERS" + streamId);
    }

    @Override
    public void sendData(int streamId, ByteBuffer data, boolean endStream) {
        byte[] bytes = new byte[data.remaining()];
        data.get(bytes);
        sentData.computeIfAbsent(streamId, id -> new ByteArrayOutputStream()).write(bytes, 0, bytes.length);
        dataFrameCount.merge(streamId, 1, Integer::sum);
        windows.put(streamId, localFlowControlWindow(streamId) - bytes.length);
        if (endStream) {
            endedStreams.add(streamId);
        }
        write("DATA" + streamId);
    }

    @Override
    public void endStream(int streamId) {
        endedStreams.add(streamId);
        write("DATA" + streamId);
    }

    @Override
    public void resetStream(int streamId, long errorCode) {
        resetStreams.put(streamId, errorCode);
        write("RST_STREAM" + streamId);
    }

    @Override
    public void acknowledgeReceivedData(int flowControlledLength, int streamId) {
        acknowledged.merge(streamId, flowControlledLength, Integer::sum);
    }

    @Override
    public int localFlowControlWindow(int streamId) {
        return windows.getOrDefault(streamId, defaultWindow);
    }

    @Override
    public int maxOutboundFrameSize() {
        return maxOutboundFrameSize;
    }

    @Override
    public void closeConnection(long errorCode) {
        closeConnectionCodes.add(errorCode);
        write("GOAWAY");
    }

    @Override
    public long localMaxConcurrentStreams() {
        return localMaxConcurrentStreams;
    }

    @Override
    public long remoteMaxConcurrentStreams() {
        return remoteMaxConcurrentStreams;
    }

    @Override
    public int openOutboundStreams() {
        return openOutboundStreams;
    }

    @Override
    public int openInboundStreams() {
        return openInboundStreams;
    }

    private void write(String marker) {
        byte[] bytes = marker.getBytes(StandardCharsets.US_ASCII);
        output.write(bytes, 0, bytes.length);
    }

    public TestCodec localMaxConcurrentStreams(long max) {
        localMaxConcurrentStreams = max;
        return this;
    }

    public TestCodec remoteMaxConcurrentStreams(long max) {
        remoteMaxConcurrentStreams = max;
        return this;
    }

    public TestCodec window(int streamId, int window) {
        windows.put(streamId, window);
        return this;
    }

    public TestCodec defaultWindow(int window) {
        defaultWindow = window;
        return this;
    }

    public TestCodec maxOutboundFrameSize(int size) {
        maxOutboundFrameSize = size;
        return this;
    }

    public TestCodec openOutboundStreams(int count) {
        openOutboundStreams = count;
        return this;
    }

    public boolean isConnectionInitiated() {
        return connectionInitiated;
    }

    public List<Integer> getOpenedStreams() {
        return openedStreams;
    }

    public List<Map.Entry<String, String>> getSentHeaders(int streamId) {
        return sentHeaders.get(streamId);
    }

    public byte[] getSentData(int streamId) {
        ByteArrayOutputStream data = sentData.get(streamId);
        return data != null? data.toByteArray(): new byte[0];
    }

    public int getDataFrameCount(int streamId) {
        return dataFrameCount.getOrDefault(streamId, 0);
    }

    public List<Integer> getEndedStreams() {
        return endedStreams;
    }

    public Map<Integer, Long> getResetStreams() {
        return resetStreams;
    }

    public int getAcknowledged(int streamId) {
        return acknowledged.getOrDefault(streamId, 0);
    }

    public List<Long> getCloseConnectionCodes() {
        return closeConnectionCodes;
    }

    public static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TestCodec" + openedStreams;
    }
}
