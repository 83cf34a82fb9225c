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
package tech.kwik.h2mux.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Http2ErrorCodeTest {

    @Test
    void knownCodeShouldHaveName() {
        assertThat(Http2ErrorCode.name(Http2ErrorCode.NO_ERROR)).isEqualTo("NO_ERROR");
        assertThat(Http2ErrorCode.name(Http2ErrorCode.PROTOCOL_ERROR)).isEqualTo("PROTOCOL_ERROR");
        assertThat(Http2ErrorCode.name(Http2ErrorCode.HTTP_1_1_REQUIRED)).isEqualTo("HTTP_1_1_REQUIRED");
    }

    @Test
    void unknownCodeShouldBeShownInHex() {
        assertThat(Http2ErrorCode.name(0x1f)).contains("1f");
    }
}
