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

import tech.kwik.core.log.Logger;
import tech.kwik.h2mux.ConnectionMetadata;
import tech.kwik.h2mux.Http2ClientConnection;
import tech.kwik.h2mux.Http2ConnectionSettings;
import tech.kwik.h2mux.InactiveStreamClosedException;
import tech.kwik.h2mux.InvalidNegotiatedProtocolException;
import tech.kwik.h2mux.RemoteTerminatedConnectionException;
import tech.kwik.h2mux.StreamCloseReason;
import tech.kwik.h2mux.StreamResetException;
import tech.kwik.h2mux.core.Http2Codec;
import tech.kwik.h2mux.core.Http2ErrorCode;
import tech.kwik.h2mux.core.Http2Transport;
import tech.kwik.h2mux.core.ProtocolViolationException;
import tech.kwik.h2mux.core.event.ConnectionTerminated;
import tech.kwik.h2mux.core.event.DataReceived;
import tech.kwik.h2mux.core.event.Http2Event;
import tech.kwik.h2mux.core.event.Http2EventHandler;
import tech.kwik.h2mux.core.event.RemoteSettingsChanged;
import tech.kwik.h2mux.core.event.ResponseReceived;
import tech.kwik.h2mux.core.event.SettingsAcknowledged;
import tech.kwik.h2mux.core.event.StreamEnded;
import tech.kwik.h2mux.core.event.StreamReset;
import tech.kwik.h2mux.core.event.UnknownFrameReceived;
import tech.kwik.h2mux.core.event.WindowUpdated;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Client side of an HTTP/2 connection. Owns the codec and is the only component that writes to the transport.
 * <p>
 * All entry points (caller requests, transport callbacks, the idle timer) are synchronized, so for one connection
 * codec calls, event dispatch and admission decisions never interleave. Connections share no state.
 */
public class Http2ClientConnectionImpl implements Http2ClientConnection {

    // https://www.rfc-editor.org/rfc/rfc9113.html#name-http-2-version-identificati
    public static final String APPLICATION_PROTOCOL = "h2";

    private final Http2Codec codec;
    private final Http2Transport transport;
    private final Http2ConnectionSettings settings;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Logger logger;
    private final StreamRegistry registry;
    private final List<Throwable> connectionLostErrors;
    private final CompletableFuture<List<Throwable>> connectionLost;
    private final Http2EventHandler eventDispatcher;
    private final StreamOwner streamCallbacks;
    private volatile ConnectionMetadata metadata;
    // https://www.rfc-editor.org/rfc/rfc9113.html#name-stream-identifiers
    // "Streams initiated by a client MUST use odd-numbered stream identifiers"
    private int nextStreamId = 1;
    private boolean settingsAcknowledged;
    private boolean admitting;
    private boolean goAwaySent;
    private boolean closed;
    private ScheduledFuture<?> idleTimer;
    private long idleTimerGeneration;

    public Http2ClientConnectionImpl(URI uri, Http2Codec codec, Http2Transport transport, Http2ConnectionSettings settings,
                                     ScheduledExecutorService scheduler, Logger logger) {
        this(uri, codec, transport, settings, scheduler, false, logger);
    }

    public Http2ClientConnectionImpl(URI uri, Http2Codec codec, Http2Transport transport, Http2ConnectionSettings settings,
                                     ScheduledExecutorService scheduler, boolean ownsScheduler, Logger logger) {
        this.codec = Objects.requireNonNull(codec);
        this.transport = Objects.requireNonNull(transport);
        this.settings = Objects.requireNonNull(settings);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.ownsScheduler = ownsScheduler;
        this.logger = Objects.requireNonNull(logger);
        metadata = new ConnectionMetadata(uri, settings.maxResponseSize(), settings.warnResponseSize());
        registry = new StreamRegistry();
        connectionLostErrors = new ArrayList<>();
        connectionLost = new CompletableFuture<>();
        eventDispatcher = new EventDispatcher();
        streamCallbacks = new StreamCallbacks();
    }

    @Override
    public synchronized CompletableFuture<HttpResponse<byte[]>> submit(HttpRequest request) {
        Objects.requireNonNull(request);
        if (closed) {
            return CompletableFuture.failedFuture(new InactiveStreamClosedException(request));
        }
        Http2Stream stream = new Http2Stream(nextStreamId, request, codec, streamCallbacks, logger);
        nextStreamId += 2;
        registry.register(stream);

        admitPending();
        flush();
        return stream.getCompletion();
    }

    @Override
    public CompletableFuture<List<Throwable>> connectionLost() {
        return connectionLost;
    }

    @Override
    public ConnectionMetadata getMetadata() {
        return metadata;
    }

    @Override
    public synchronized boolean isReady() {
        return ! closed && transport.isConnected() && settingsAcknowledged;
    }

    /**
     * The number of concurrent streams is limited by both this endpoint's and the peer's setting. The peer may change
     * its setting at any time, so this value must not be cached.
     */
    long allowedConcurrency() {
        return Math.min(codec.localMaxConcurrentStreams(), codec.remoteMaxConcurrentStreams());
    }

    synchronized int activeStreamCount() {
        return registry.activeCount();
    }

    synchronized int pendingStreamCount() {
        return registry.pendingCount();
    }

    @Override
    public synchronized void onTransportEstablished() {
        startIdleTimer();

        InetSocketAddress destination = transport.peerAddress();
        logger.debug("Connection made to " + destination);
        if (destination != null) {
            metadata = metadata.withPeerAddress(destination.getAddress());
        }

        codec.initiateConnection();
        flush();
    }

    @Override
    public synchronized void onHandshakeCompleted() {
        String negotiatedProtocol = transport.negotiatedProtocol();
        if (! APPLICATION_PROTOCOL.equals(negotiatedProtocol)) {
            // The connection preface cannot have been processed by the peer, so there is no point in sending GOAWAY.
            loseConnectionWithError(List.of(new InvalidNegotiatedProtocolException(negotiatedProtocol)));
        }
    }

    @Override
    public synchronized void onBytesReceived(ByteBuffer data) {
        if (closed) {
            logger.debug("Ignoring " + data.remaining() + " bytes received on closed connection");
            return;
        }
        resetIdleTimer();

        ProtocolViolationException protocolViolation = null;
        try {
            List<Http2Event> events = codec.receiveData(data);
            for (Http2Event event : events) {
                event.accept(eventDispatcher);
            }
        }
        catch (ProtocolViolationException e) {
            logger.error("Protocol violation by peer: " + e.getMessage());
            protocolViolation = e;
        }
        // Also after a protocol violation, as the codec will have queued a GOAWAY frame.
        flush();
        if (protocolViolation != null) {
            loseConnectionWithError(List.of(protocolViolation));
        }
    }

    /**
     * Closes the connection because no bytes were sent or received during the idle timeout period.
     */
    public synchronized void onIdleTimeout() {
        if (closed) {
            return;
        }
        long errorCode = hasOpenStreams()? Http2ErrorCode.PROTOCOL_ERROR: Http2ErrorCode.NO_ERROR;
        sendGoAway(errorCode);
        flush();

        connectionLostErrors.add(new HttpTimeoutException("Connection was idle for more than " + settings.idleTimeout().toSeconds() + "s"));
        transport.loseConnection();
        onTransportLost(null);
    }

    @Override
    public synchronized void onTransportLost(Throwable cause) {
        if (closed) {
            return;
        }
        closed = true;
        cancelIdleTimer();

        if (cause != null) {
            connectionLostErrors.add(cause);
        }
        List<Throwable> errors = List.copyOf(connectionLostErrors);
        connectionLost.complete(errors);

        List<Http2Stream> streams = registry.drain();
        for (Http2Stream stream : streams) {
            if (stream.isRequestSent()) {
                stream.close(StreamCloseReason.CONNECTION_LOST, errors, true);
            }
            else {
                stream.close(StreamCloseReason.INACTIVE, List.of(), true);
            }
        }
        if (! goAwaySent) {
            sendGoAway(Http2ErrorCode.NO_ERROR);
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Starts queued streams in arrival order, as long as the connection is ready and the concurrent stream limit
     * allows.
     */
    private void admitPending() {
        if (admitting) {
            // The outer invocation re-evaluates its condition after each admitted stream.
            return;
        }
        admitting = true;
        try {
            Http2Stream stream;
            while (isReady() && (stream = registry.pollAdmissible(allowedConcurrency())) != null) {
                stream.initiate();
            }
        }
        finally {
            admitting = false;
        }
    }

    private boolean hasOpenStreams() {
        // Streams waiting for admission count as well: they would be lost.
        return codec.openOutboundStreams() > 0
                || codec.openInboundStreams() > 0
                || registry.activeCount() > 0
                || registry.pendingCount() > 0;
    }

    private void loseConnectionWithError(List<Throwable> errors) {
        connectionLostErrors.addAll(errors);
        transport.loseConnection();
    }

    private void sendGoAway(long errorCode) {
        goAwaySent = true;
        codec.closeConnection(errorCode);
    }

    private void flush() {
        if (closed) {
            return;
        }
        ByteBuffer data = codec.dataToSend();
        if (data == null || ! data.hasRemaining()) {
            return;
        }
        resetIdleTimer();
        try {
            transport.write(data);
        }
        catch (IOException e) {
            loseConnectionWithError(List.of(e));
        }
    }

    private void startIdleTimer() {
        if (idleTimer != null) {
            idleTimer.cancel(false);
        }
        long generation = ++idleTimerGeneration;
        idleTimer = scheduler.schedule(() -> idleTimerExpired(generation), settings.idleTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void resetIdleTimer() {
        if (idleTimer != null && ! closed) {
            startIdleTimer();
        }
    }

    private void cancelIdleTimer() {
        if (idleTimer != null) {
            idleTimer.cancel(false);
            idleTimer = null;
        }
        idleTimerGeneration++;
    }

    private synchronized void idleTimerExpired(long generation) {
        // A timer that fired while it was being reset is stale.
        if (generation == idleTimerGeneration) {
            onIdleTimeout();
        }
    }

    private class EventDispatcher implements Http2EventHandler {

        @Override
        public void onResponseReceived(ResponseReceived event) {
            Http2Stream stream = registry.get(event.getStreamId());
            if (stream == null) {
                ignore(event);
                return;
            }
            stream.receiveHeaders(event.getHeaders());
        }

        @Override
        public void onDataReceived(DataReceived event) {
            Http2Stream stream = registry.get(event.getStreamId());
            if (stream == null) {
                ignore(event);
                // Still counts against the connection window.
                codec.acknowledgeReceivedData(event.getFlowControlledLength(), event.getStreamId());
                return;
            }
            stream.receiveData(event.getData(), event.getFlowControlledLength());
        }

        @Override
        public void onStreamEnded(StreamEnded event) {
            Http2Stream stream = registry.remove(event.getStreamId());
            if (stream == null) {
                ignore(event);
                return;
            }
            stream.close(StreamCloseReason.ENDED, List.of(), true);
            admitPending();
        }

        @Override
        public void onStreamReset(StreamReset event) {
            Http2Stream stream = registry.remove(event.getStreamId());
            if (stream == null) {
                ignore(event);
                return;
            }
            stream.close(StreamCloseReason.RESET, List.of(new StreamResetException(event.getStreamId(), event.getErrorCode())), true);
            admitPending();
        }

        @Override
        public void onWindowUpdated(WindowUpdated event) {
            if (event.isConnectionWindow()) {
                registry.streams().forEach(Http2Stream::receiveWindowUpdate);
            }
            else {
                Http2Stream stream = registry.get(event.getStreamId());
                if (stream == null) {
                    ignore(event);
                    return;
                }
                stream.receiveWindowUpdate();
            }
        }

        @Override
        public void onSettingsAcknowledged(SettingsAcknowledged event) {
            settingsAcknowledged = true;
            metadata = metadata.withPeerCertificate(transport.peerCertificate().orElse(null));
            admitPending();
        }

        @Override
        public void onRemoteSettingsChanged(RemoteSettingsChanged event) {
            // The peer may have raised its concurrent stream limit.
            admitPending();
        }

        @Override
        public void onConnectionTerminated(ConnectionTerminated event) {
            loseConnectionWithError(List.of(new RemoteTerminatedConnectionException(
                    metadata.getPeerAddress().orElse(null), event.getErrorCode(), event.getLastStreamId())));
        }

        @Override
        public void onUnknownFrameReceived(UnknownFrameReceived event) {
            logger.debug("Unknown frame received: " + event);
        }

        private void ignore(Http2Event event) {
            logger.debug("Ignoring " + event + " for unknown stream");
        }
    }

    private class StreamCallbacks implements StreamOwner {

        @Override
        public ConnectionMetadata getMetadata() {
            return metadata;
        }

        @Override
        public void streamClosed(Http2Stream stream) {
            synchronized (Http2ClientConnectionImpl.this) {
                registry.remove(stream.getStreamId());
                admitPending();
            }
        }

        @Override
        public void requestBodyReceived(Http2Stream stream, ByteBuffer data) {
            synchronized (Http2ClientConnectionImpl.this) {
                stream.appendRequestBody(data);
                flush();
            }
        }

        @Override
        public void requestBodyCompleted(Http2Stream stream) {
            synchronized (Http2ClientConnectionImpl.this) {
                stream.completeRequestBody();
                flush();
            }
        }

        @Override
        public void requestBodyFailed(Http2Stream stream, Throwable error) {
            synchronized (Http2ClientConnectionImpl.this) {
                stream.failRequestBody(error);
                flush();
            }
        }
    }
}
