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

public class MaxSizeExceededException extends IOException {

    private final long size;
    private final long maxSize;

    public MaxSizeExceededException(long size, long maxSize) {
        super("Response size (" + size + ") larger than maximum response size (" + maxSize + ")");
        this.size = size;
        this.maxSize = maxSize;
    }

    public long getSize() {
        return size;
    }

    public long getMaxSize() {
        return maxSize;
    }
}
