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

import tech.kwik.core.concurrent.DaemonThreadFactory;
import tech.kwik.core.log.Logger;
import tech.kwik.core.log.NullLogger;
import tech.kwik.h2mux.core.Http2Codec;
import tech.kwik.h2mux.core.Http2Transport;
import tech.kwik.h2mux.impl.Http2ClientConnectionImpl;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * A builder of {@linkplain Http2ClientConnection HTTP/2 client connections}.
 * <p>
 * The codec and transport are mandatory; the connection takes ownership of the codec, the transport remains owned by
 * the caller, who must forward transport events to the built connection.
 * Defaults: idle timeout 240 seconds, maximum response size 1 GiB, warning above 32 MiB.
 */
public class Http2ClientConnectionBuilder {

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(240);
    public static final long DEFAULT_MAX_RESPONSE_SIZE = 1024 * 1024 * 1024;
    public static final long DEFAULT_WARN_RESPONSE_SIZE = 32 * 1024 * 1024;

    private URI uri;
    private Http2Codec codec;
    private Http2Transport transport;
    private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
    private long maxResponseSize = DEFAULT_MAX_RESPONSE_SIZE;
    private long warnResponseSize = DEFAULT_WARN_RESPONSE_SIZE;
    private ScheduledExecutorService scheduler;
    private Logger logger;

    Http2ClientConnectionBuilder() {
    }

    /**
     * The base URI of the peer; requests with a different authority are rejected.
     * @param uri
     * @return this builder
     */
    public Http2ClientConnectionBuilder uri(URI uri) {
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("URI must contain a host");
        }
        this.uri = uri;
        return this;
    }

    public Http2ClientConnectionBuilder codec(Http2Codec codec) {
        this.codec = codec;
        return this;
    }

    public Http2ClientConnectionBuilder transport(Http2Transport transport) {
        this.transport = transport;
        return this;
    }

    public Http2ClientConnectionBuilder idleTimeout(Duration idleTimeout) {
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idle timeout must be > 0");
        }
        this.idleTimeout = idleTimeout;
        return this;
    }

    public Http2ClientConnectionBuilder maxResponseSize(long maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("max size must be >= 0");
        }
        maxResponseSize = maxSize;
        return this;
    }

    public Http2ClientConnectionBuilder warnResponseSize(long warnSize) {
        if (warnSize < 0) {
            throw new IllegalArgumentException("warn size must be >= 0");
        }
        warnResponseSize = warnSize;
        return this;
    }

    /**
     * The executor that runs the idle timer. When not set, the connection creates a single daemon thread.
     * @param scheduler
     * @return this builder
     */
    public Http2ClientConnectionBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public Http2ClientConnectionBuilder logger(Logger logger) {
        this.logger = logger;
        return this;
    }

    public Http2ClientConnection build() {
        if (uri == null) {
            throw new IllegalStateException("Cannot build connection without uri");
        }
        if (codec == null) {
            throw new IllegalStateException("Cannot build connection without codec");
        }
        if (transport == null) {
            throw new IllegalStateException("Cannot build connection without transport");
        }
        Http2ConnectionSettings settings = new ConnectionSettings(idleTimeout, maxResponseSize, warnResponseSize);
        ScheduledExecutorService timerExecutor = scheduler != null? scheduler:
                Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("h2mux-idle-timer"));
        return new Http2ClientConnectionImpl(uri, codec, transport, settings, timerExecutor, scheduler == null,
                logger != null? logger: new NullLogger());
    }

    private static class ConnectionSettings implements Http2ConnectionSettings {

        private final Duration idleTimeout;
        private final long maxResponseSize;
        private final long warnResponseSize;

        ConnectionSettings(Duration idleTimeout, long maxResponseSize, long warnResponseSize) {
            this.idleTimeout = idleTimeout;
            this.maxResponseSize = maxResponseSize;
            this.warnResponseSize = warnResponseSize;
        }

        @Override
        public Duration idleTimeout() {
            return idleTimeout;
        }

        @Override
        public long maxResponseSize() {
            return maxResponseSize;
        }

        @Override
        public long warnResponseSize() {
            return warnResponseSize;
        }
    }
}
