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

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * A header section as exchanged with the codec: pseudo-header fields followed by regular fields.
 * https://www.rfc-editor.org/rfc/rfc9113.html#name-http-control-data
 */
public class HeaderBlock {

    // https://www.rfc-editor.org/rfc/rfc9113.html#name-request-pseudo-header-field
    public static final String PSEUDO_HEADER_METHOD = ":method";
    public static final String PSEUDO_HEADER_SCHEME = ":scheme";
    public static final String PSEUDO_HEADER_AUTHORITY = ":authority";
    public static final String PSEUDO_HEADER_PATH = ":path";
    // https://www.rfc-editor.org/rfc/rfc9113.html#name-response-pseudo-header-fiel
    public static final String PSEUDO_HEADER_STATUS = ":status";

    public static final int DEFAULT_HTTPS_PORT = 443;
    public static final int DEFAULT_HTTP_PORT = 80;

    private final Map<String, String> pseudoHeaders;
    private final HttpHeaders httpHeaders;

    public HeaderBlock(HttpHeaders headers, Map<String, String> pseudoHeaders) {
        if (pseudoHeaders.keySet().stream().anyMatch(key -> ! key.startsWith(":"))) {
            throw new IllegalArgumentException("Pseudo headers must start with ':'");
        }
        this.pseudoHeaders = Objects.requireNonNull(pseudoHeaders);
        if (headers != null) {
            this.httpHeaders = headers;
        }
        else {
            httpHeaders = HttpHeaders.of(Collections.emptyMap(), (a,b) -> true);
        }
    }

    /**
     * https://www.rfc-editor.org/rfc/rfc9113.html#section-8.3.1
     * "All HTTP/2 requests MUST include exactly one valid value for the ":method", ":scheme", and ":path" pseudo-header
     *  fields, unless they are CONNECT requests"
     */
    public static HeaderBlock forRequest(HttpRequest request) {
        Map<String, String> pseudoHeaders = new LinkedHashMap<>();
        pseudoHeaders.put(PSEUDO_HEADER_METHOD, request.method());
        pseudoHeaders.put(PSEUDO_HEADER_SCHEME, scheme(request.uri()));
        pseudoHeaders.put(PSEUDO_HEADER_AUTHORITY, extractAuthority(request.uri()));
        pseudoHeaders.put(PSEUDO_HEADER_PATH, extractPath(request.uri()));
        return new HeaderBlock(request.headers(), pseudoHeaders);
    }

    /**
     * Converts a header list produced by the codec.
     * https://www.rfc-editor.org/rfc/rfc9113.html#name-http-control-data
     * "Pseudo-header fields are not HTTP header fields."
     */
    public static HeaderBlock parse(List<Map.Entry<String, String>> headerList) {
        Map<String, String> pseudoHeaders = new LinkedHashMap<>();
        headerList.stream()
                .filter(entry -> entry.getKey().startsWith(":"))
                .forEach(entry -> pseudoHeaders.putIfAbsent(entry.getKey(), entry.getValue()));
        Map<String, List<String>> headersMap = headerList.stream()
                .filter(entry -> ! entry.getKey().startsWith(":"))
                .collect(Collectors.toMap(entry -> entry.getKey().toLowerCase(), HeaderBlock::mapValue, HeaderBlock::mergeValues, LinkedHashMap::new));
        return new HeaderBlock(HttpHeaders.of(headersMap, (key, value) -> true), pseudoHeaders);
    }

    public List<Map.Entry<String, String>> toHeaderList() {
        List<Map.Entry<String, String>> headerList = new ArrayList<>();
        pseudoHeaders.entrySet().forEach(entry -> headerList.add(new AbstractMap.SimpleEntry<>(entry)));
        httpHeaders.map().entrySet().forEach(entry -> {
            String value = entry.getValue().stream().collect(Collectors.joining(","));
            // https://www.rfc-editor.org/rfc/rfc9113.html#section-8.2
            // "Field names MUST be converted to lowercase when constructing an HTTP/2 message."
            headerList.add(new AbstractMap.SimpleEntry<>(entry.getKey().toLowerCase(), value));
        });
        return headerList;
    }

    public String getPseudoHeader(String header) {
        return pseudoHeaders.get(header);
    }

    public HttpHeaders headers() {
        return httpHeaders;
    }

    public OptionalLong contentLength() {
        try {
            return httpHeaders.firstValueAsLong("content-length");
        }
        catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    static String scheme(URI uri) {
        return uri.getScheme() != null? uri.getScheme().toLowerCase(): "https";
    }

    static int port(URI uri) {
        int port = uri.getPort();
        if (port <= 0) {
            port = "http".equals(scheme(uri))? DEFAULT_HTTP_PORT: DEFAULT_HTTPS_PORT;
        }
        return port;
    }

    static String extractPath(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isBlank()) {
            path = "/";
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }

    static String extractAuthority(URI uri) {
        return uri.getHost() + ":" + port(uri);
    }

    private static List<String> mapValue(Map.Entry<String, String> entry) {
        return List.of(entry.getValue());
    }

    private static List<String> mergeValues(List<String> value1, List<String> value2) {
        List<String> result = new ArrayList<>();
        result.addAll(value1);
        result.addAll(value2);
        return result;
    }
}
