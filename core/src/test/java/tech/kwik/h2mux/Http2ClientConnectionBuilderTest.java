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

import org.junit.jupiter.api.Test;
import tech.kwik.h2mux.core.Http2Transport;
import tech.kwik.h2mux.test.TestCodec;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class Http2ClientConnectionBuilderTest {

    private static final URI URI_WITH_HOST = URI.create("https://www.example.com");

    @Test
    void buildingWithoutCodecShouldFail() {
        Http2ClientConnectionBuilder builder = Http2ClientConnection.newBuilder()
                .uri(URI_WITH_HOST)
                .transport(mock(Http2Transport.class));

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildingWithoutTransportShouldFail() {
        Http2ClientConnectionBuilder builder = Http2ClientConnection.newBuilder()
                .uri(URI_WITH_HOST)
                .codec(new TestCodec());

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildingWithoutUriShouldFail() {
        Http2ClientConnectionBuilder builder = Http2ClientConnection.newBuilder()
                .codec(new TestCodec())
                .transport(mock(Http2Transport.class));

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void uriWithoutHostShouldBeRejected() {
        assertThatThrownBy(() -> Http2ClientConnection.newBuilder().uri(URI.create("/relative/path")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidLimitsShouldBeRejected() {
        Http2ClientConnectionBuilder builder = Http2ClientConnection.newBuilder();

        assertThatThrownBy(() -> builder.idleTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.maxResponseSize(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.warnResponseSize(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builtConnectionShouldUseDefaults() {
        Http2ClientConnection connection = Http2ClientConnection.newBuilder()
                .uri(URI_WITH_HOST)
                .codec(new TestCodec())
                .transport(mock(Http2Transport.class))
                .build();

        assertThat(connection.getMetadata().getUri()).isEqualTo(URI_WITH_HOST);
        assertThat(connection.getMetadata().getMaxResponseSize()).isEqualTo(1024L * 1024 * 1024);
        assertThat(connection.getMetadata().getWarnResponseSize()).isEqualTo(32L * 1024 * 1024);
        assertThat(connection.isReady()).isFalse();
    }

    @Test
    void idleTimerShouldUseConfiguredTimeoutAndScheduler() {
        // Given
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        Http2ClientConnection connection = Http2ClientConnection.newBuilder()
                .uri(URI_WITH_HOST)
                .codec(new TestCodec())
                .transport(mock(Http2Transport.class))
                .idleTimeout(Duration.ofSeconds(30))
                .scheduler(scheduler)
                .build();

        // When
        connection.onTransportEstablished();

        // Then
        verify(scheduler, atLeastOnce()).schedule(any(Runnable.class), eq(30_000L), eq(TimeUnit.MILLISECONDS));
    }
}
