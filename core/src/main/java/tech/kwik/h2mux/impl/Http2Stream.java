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
import tech.kwik.h2mux.ConnectionLostException;
import tech.kwik.h2mux.ConnectionMetadata;
import tech.kwik.h2mux.InactiveStreamClosedException;
import tech.kwik.h2mux.InvalidHostnameException;
import tech.kwik.h2mux.MaxSizeExceededException;
import tech.kwik.h2mux.StreamCloseReason;
import tech.kwik.h2mux.StreamResetException;
import tech.kwik.h2mux.core.Http2Codec;
import tech.kwik.h2mux.core.Http2ErrorCode;

import java.io.ByteArrayOutputStream;
import java.net.InetAddress;
import java.net.ProtocolException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * One request/response exchange on a connection. All methods are called by the owning connection, one at a time.
 */
public class Http2Stream {

    public enum State {
        CREATED,
        PENDING_ADMISSION,
        OPEN,
        HALF_CLOSED_LOCAL,
        CLOSED
    }

    private final int streamId;
    private final HttpRequest request;
    private final Http2Codec codec;
    private final StreamOwner owner;
    private final Logger logger;
    private final CompletableFuture<HttpResponse<byte[]>> completion;
    private final Deque<ByteBuffer> requestBody;
    private final ByteArrayOutputStream responseBody;
    private State state;
    private StreamCloseReason closeReason;
    private boolean requestSent;
    private boolean requestBodyComplete;
    private Flow.Subscription requestBodySubscription;
    private List<Map.Entry<String, String>> receivedHeaderFields;
    private HeaderBlock responseHeaders;
    private boolean reachedWarnSize;

    Http2Stream(int streamId, HttpRequest request, Http2Codec codec, StreamOwner owner, Logger logger) {
        this.streamId = streamId;
        this.request = request;
        this.codec = codec;
        this.owner = owner;
        this.logger = logger;
        completion = new CompletableFuture<>();
        requestBody = new ArrayDeque<>();
        responseBody = new ByteArrayOutputStream();
        state = State.CREATED;
    }

    void enqueued() {
        if (state != State.CREATED) {
            throw new IllegalStateException("Stream " + streamId + " cannot be queued in state " + state);
        }
        state = State.PENDING_ADMISSION;
    }

    /**
     * Opens the stream and sends the request. Only valid for a stream that is waiting for admission.
     */
    void initiate() {
        if (state != State.PENDING_ADMISSION) {
            throw new IllegalStateException("Stream " + streamId + " cannot be initiated in state " + state);
        }
        ConnectionMetadata metadata = owner.getMetadata();
        if (! isValidAuthority(metadata)) {
            close(StreamCloseReason.INVALID_HOSTNAME, List.of(new InvalidHostnameException(request.uri(), metadata.getUri())), false);
            return;
        }

        Optional<HttpRequest.BodyPublisher> bodyPublisher = request.bodyPublisher()
                .filter(publisher -> publisher.contentLength() != 0);
        codec.sendHeaders(streamId, HeaderBlock.forRequest(request).toHeaderList(), bodyPublisher.isEmpty());
        requestSent = true;
        state = bodyPublisher.isPresent()? State.OPEN: State.HALF_CLOSED_LOCAL;

        bodyPublisher.ifPresent(publisher -> publisher.subscribe(new RequestBodySubscriber()));
    }

    /**
     * Sends as much of the buffered request body as the flow-control window allows; the rest is sent when the window
     * is updated.
     */
    void sendData() {
        if (state != State.OPEN) {
            return;
        }
        while (! requestBody.isEmpty()) {
            int window = codec.localFlowControlWindow(streamId);
            if (window <= 0) {
                return;
            }
            ByteBuffer buffer = requestBody.peek();
            int chunkSize = Math.min(buffer.remaining(), Math.min(window, codec.maxOutboundFrameSize()));
            ByteBuffer chunk = buffer.slice();
            chunk.limit(chunkSize);
            buffer.position(buffer.position() + chunkSize);
            if (! buffer.hasRemaining()) {
                requestBody.poll();
            }
            boolean last = requestBodyComplete && requestBody.isEmpty();
            codec.sendData(streamId, chunk, last);
            if (last) {
                state = State.HALF_CLOSED_LOCAL;
                return;
            }
        }
        if (requestBodyComplete) {
            codec.endStream(streamId);
            state = State.HALF_CLOSED_LOCAL;
        }
    }

    void appendRequestBody(ByteBuffer data) {
        if (state != State.OPEN || requestBodyComplete) {
            return;
        }
        ByteBuffer copy = ByteBuffer.allocate(data.remaining());
        copy.put(data);
        copy.flip();
        requestBody.add(copy);
        sendData();
    }

    void completeRequestBody() {
        if (state != State.OPEN || requestBodyComplete) {
            return;
        }
        requestBodyComplete = true;
        sendData();
    }

    void failRequestBody(Throwable error) {
        if (state == State.CLOSED) {
            return;
        }
        logger.error("Request body for stream " + streamId + " failed", error);
        codec.resetStream(streamId, Http2ErrorCode.INTERNAL_ERROR);
        close(StreamCloseReason.RESET, List.of(new StreamResetException(streamId, Http2ErrorCode.INTERNAL_ERROR, error)), false);
    }

    void receiveHeaders(List<Map.Entry<String, String>> headers) {
        if (state == State.CLOSED) {
            return;
        }
        if (responseHeaders != null) {
            // Trailer section: merged on field level, so repeated fields keep their separate values.
            receivedHeaderFields.addAll(headers);
            responseHeaders = HeaderBlock.parse(receivedHeaderFields);
            return;
        }
        receivedHeaderFields = new ArrayList<>(headers);
        responseHeaders = HeaderBlock.parse(receivedHeaderFields);

        long expectedSize = responseHeaders.contentLength().orElse(-1);
        ConnectionMetadata metadata = owner.getMetadata();
        if (metadata.getMaxResponseSize() > 0 && expectedSize > metadata.getMaxResponseSize()) {
            logger.error("Cancelling request " + request.uri() + ": expected response size (" + expectedSize
                    + ") larger than maximum response size (" + metadata.getMaxResponseSize() + ")");
            abort(new MaxSizeExceededException(expectedSize, metadata.getMaxResponseSize()));
            return;
        }
        if (metadata.getWarnResponseSize() > 0 && expectedSize > metadata.getWarnResponseSize()) {
            reachedWarnSize = true;
            logger.warn("Expected response size (" + expectedSize + ") larger than warn size ("
                    + metadata.getWarnResponseSize() + ") in request " + request.uri());
        }
    }

    void receiveData(ByteBuffer data, int flowControlledLength) {
        if (state == State.CLOSED) {
            return;
        }
        byte[] bytes = new byte[data.remaining()];
        data.get(bytes);
        responseBody.write(bytes, 0, bytes.length);
        codec.acknowledgeReceivedData(flowControlledLength, streamId);

        long size = responseBody.size();
        ConnectionMetadata metadata = owner.getMetadata();
        if (metadata.getMaxResponseSize() > 0 && size > metadata.getMaxResponseSize()) {
            logger.error("Received more (" + size + ") bytes than maximum response size ("
                    + metadata.getMaxResponseSize() + ") in request " + request.uri());
            abort(new MaxSizeExceededException(size, metadata.getMaxResponseSize()));
            return;
        }
        if (metadata.getWarnResponseSize() > 0 && size > metadata.getWarnResponseSize() && ! reachedWarnSize) {
            reachedWarnSize = true;
            logger.warn("Received more (" + size + ") bytes than warn size (" + metadata.getWarnResponseSize()
                    + ") in request " + request.uri());
        }
    }

    void receiveWindowUpdate() {
        sendData();
    }

    /**
     * Closes the stream and completes the response future; does nothing when the stream is already closed.
     * @param reason
     * @param causes  the errors that lead to closing; for connection loss all errors that lead to losing the connection
     * @param fromConnection  whether the connection initiated the close (and thus already unregistered the stream)
     */
    void close(StreamCloseReason reason, List<Throwable> causes, boolean fromConnection) {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        closeReason = reason;
        requestBody.clear();
        if (requestBodySubscription != null && ! requestBodyComplete) {
            requestBodySubscription.cancel();
        }

        if (! fromConnection) {
            owner.streamClosed(this);
        }

        switch (reason) {
            case ENDED:
                completeWithResponse();
                break;
            case CONNECTION_LOST:
                completion.completeExceptionally(new ConnectionLostException(causes));
                break;
            case INACTIVE:
                completion.completeExceptionally(new InactiveStreamClosedException(request));
                break;
            case RESET:
                completion.completeExceptionally(causes.isEmpty()?
                        new StreamResetException(streamId, Http2ErrorCode.CANCEL): causes.get(0));
                break;
            case INVALID_HOSTNAME:
            case MAXSIZE_EXCEEDED:
                completion.completeExceptionally(causes.get(0));
                break;
            default:
                throw new IllegalArgumentException("Unknown close reason " + reason);
        }
    }

    private void abort(MaxSizeExceededException error) {
        codec.resetStream(streamId, Http2ErrorCode.CANCEL);
        close(StreamCloseReason.MAXSIZE_EXCEEDED, List.of(error), false);
    }

    private void completeWithResponse() {
        if (responseHeaders == null) {
            completion.completeExceptionally(new ProtocolException("Stream " + streamId + " ended without response headers"));
            return;
        }
        String status = responseHeaders.getPseudoHeader(HeaderBlock.PSEUDO_HEADER_STATUS);
        int statusCode;
        try {
            statusCode = Integer.parseInt(status);
        }
        catch (NumberFormatException e) {
            completion.completeExceptionally(new ProtocolException("Invalid :status pseudo-header '" + status + "'"));
            return;
        }
        ConnectionMetadata metadata = owner.getMetadata();
        completion.complete(new Http2Response(request, statusCode, responseHeaders.headers(), responseBody.toByteArray(),
                metadata.getPeerAddress().orElse(null), metadata.getPeerCertificate().orElse(null)));
    }

    /**
     * A request is valid for this connection when its authority equals the authority of the connection uri, either by
     * host name or by the ip address of the peer.
     */
    private boolean isValidAuthority(ConnectionMetadata metadata) {
        URI requestUri = request.uri();
        URI connectionUri = metadata.getUri();
        if (requestUri.getHost() == null || HeaderBlock.port(requestUri) != HeaderBlock.port(connectionUri)) {
            return false;
        }
        if (requestUri.getHost().equalsIgnoreCase(connectionUri.getHost())) {
            return true;
        }
        Optional<InetAddress> peerAddress = metadata.getPeerAddress();
        return peerAddress.isPresent() && requestUri.getHost().equals(peerAddress.get().getHostAddress());
    }

    public int getStreamId() {
        return streamId;
    }

    public HttpRequest getRequest() {
        return request;
    }

    public State getState() {
        return state;
    }

    public Optional<StreamCloseReason> getCloseReason() {
        return Optional.ofNullable(closeReason);
    }

    public boolean isRequestSent() {
        return requestSent;
    }

    public CompletableFuture<HttpResponse<byte[]>> getCompletion() {
        return completion;
    }

    @Override
    public String toString() {
        return "Stream " + streamId + " (" + state + ")";
    }

    private class RequestBodySubscriber implements Flow.Subscriber<ByteBuffer> {

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            requestBodySubscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(ByteBuffer item) {
            owner.requestBodyReceived(Http2Stream.this, item);
        }

        @Override
        public void onError(Throwable throwable) {
            owner.requestBodyFailed(Http2Stream.this, throwable);
        }

        @Override
        public void onComplete() {
            owner.requestBodyCompleted(Http2Stream.this);
        }
    }
}
