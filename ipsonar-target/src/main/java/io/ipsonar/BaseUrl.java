/*
 * (c) Copyright 2025 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.ipsonar;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.io.ByteArrayOutputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated server base URL. The {@link #server() string form} always ends with exactly one {@code /}, and
 * endpoint paths are rendered relative to it.
 */
public final class BaseUrl {

    private final String server;
    private final String protocol;
    private final String host;
    private final int port;
    private final ImmutableList<String> basePathSegments;

    private BaseUrl(String server, URL url) {
        this.server = server;
        this.protocol = url.getProtocol();
        this.host = url.getHost();
        this.port = url.getPort();
        String strippedBasePath = stripSlashes(url.getPath());
        this.basePathSegments = strippedBasePath.isEmpty() ? ImmutableList.of() : ImmutableList.of(strippedBasePath);
    }

    /**
     * Parses and validates the given server URL, appending a trailing {@code /} if it is missing.
     *
     * @throws SafeIllegalArgumentException if the URL is not an absolute http(s) URL, or carries a query, fragment or
     * user info
     */
    public static BaseUrl of(String server) {
        Preconditions.checkArgumentNotNull(server, "server must not be null");
        URI uri;
        try {
            uri = new URI(server);
        } catch (URISyntaxException e) {
            throw new SafeIllegalArgumentException("Failed to parse base URL", e, UnsafeArg.of("server", server));
        }
        // schemes are case-insensitive
        String protocol = uri.getScheme() == null ? null : Ascii.toLowerCase(uri.getScheme());
        if (!"http".equals(protocol) && !"https".equals(protocol)) {
            throw new SafeIllegalArgumentException(
                    "unsupported protocol", SafeArg.of("protocol", uri.getScheme()), UnsafeArg.of("server", server));
        }
        if (Strings.isNullOrEmpty(uri.getHost())) {
            throw new SafeIllegalArgumentException("baseUrl host must be set", UnsafeArg.of("server", server));
        }
        if (uri.getRawQuery() != null) {
            throw new SafeIllegalArgumentException(
                    "baseUrl query must be empty", UnsafeArg.of("query", uri.getRawQuery()));
        }
        if (uri.getRawFragment() != null) {
            throw new SafeIllegalArgumentException(
                    "baseUrl ref must be empty", UnsafeArg.of("ref", uri.getRawFragment()));
        }
        if (uri.getRawUserInfo() != null) {
            // the user info may contain credential information and mustn't be logged
            throw new SafeIllegalArgumentException("baseUrl user info must be empty");
        }
        String path = Strings.nullToEmpty(uri.getRawPath());
        if (!UrlEncoder.isPath(path)) {
            throw new SafeIllegalArgumentException(
                    "invalid characters in baseUrl path", UnsafeArg.of("path", path));
        }
        try {
            String withProtocol = protocol + server.substring(protocol.length());
            String normalized = withProtocol.endsWith("/") ? withProtocol : withProtocol + "/";
            return new BaseUrl(normalized, uri.toURL());
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new SafeIllegalArgumentException("Malformed base URL", e, UnsafeArg.of("server", server));
        }
    }

    /** The effective server URL, ending with exactly one trailing {@code /}. */
    public String server() {
        return server;
    }

    /**
     * Renders the URL of the given endpoint: the base path, then the endpoint's path filled with {@code pathParams},
     * then the query parameters in insertion order.
     */
    public URL render(Endpoint endpoint, Map<String, String> pathParams, ListMultimap<String, String> queryParams) {
        DefaultUrlBuilder url = new DefaultUrlBuilder(protocol, host, port, basePathSegments);
        endpoint.renderPath(pathParams, url);
        queryParams.forEach(url::queryParam);
        return url.build();
    }

    @Override
    public String toString() {
        return "BaseUrl{server=" + server + '}';
    }

    private static String stripSlashes(String path) {
        if (path.isEmpty() || path.equals("/")) {
            return "";
        }
        int stripStart = path.startsWith("/") ? 1 : 0;
        int stripEnd = path.endsWith("/") ? 1 : 0;
        return path.substring(stripStart, Math.max(stripStart, path.length() - stripEnd));
    }

    /** A simplistic URL builder, not tuned for performance. */
    @VisibleForTesting
    static final class DefaultUrlBuilder implements UrlBuilder {

        private static final Joiner PATH_JOINER = Joiner.on('/');
        private static final Joiner.MapJoiner QUERY_JOINER = Joiner.on('&').withKeyValueSeparator('=');

        private final String protocol;
        private final String host;
        private final int port;
        private final List<String> pathSegments;
        private final ListMultimap<String, String> queryNamesAndValues =
                Multimaps.newListMultimap(new LinkedHashMap<>(), ArrayList::new);

        DefaultUrlBuilder(String protocol, String host, int port, List<String> encodedBasePath) {
            Preconditions.checkArgument(
                    port >= -1 && port <= 65535, "port must be in range [0, 65535] or default [-1]");
            this.protocol = protocol;
            this.host = host;
            this.port = port;
            this.pathSegments = new ArrayList<>(encodedBasePath);
        }

        @Override
        public DefaultUrlBuilder pathSegment(String thePath) {
            this.pathSegments.add(UrlEncoder.encodePathSegment(thePath));
            return this;
        }

        @Override
        public DefaultUrlBuilder queryParam(String name, String value) {
            this.queryNamesAndValues.put(
                    UrlEncoder.encodeQueryNameOrValue(name), UrlEncoder.encodeQueryNameOrValue(value));
            return this;
        }

        URL build() {
            StringBuilder file = new StringBuilder();
            file.append('/');
            PATH_JOINER.appendTo(file, pathSegments);
            if (!queryNamesAndValues.isEmpty()) {
                file.append('?');
                QUERY_JOINER.appendTo(file, queryNamesAndValues.entries());
            }
            try {
                return new URL(protocol, host, port, file.toString());
            } catch (MalformedURLException e) {
                throw new SafeIllegalArgumentException("Malformed URL", e);
            }
        }
    }

    /** Encodes URL components per https://tools.ietf.org/html/rfc3986 . */
    @VisibleForTesting
    static final class UrlEncoder {
        private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
        private static final CharMatcher ALPHA = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
        private static final CharMatcher UNRESERVED = DIGIT.or(ALPHA).or(CharMatcher.anyOf("-._~"));
        private static final CharMatcher SUB_DELIMS = CharMatcher.anyOf("!$&'()*+,;=");
        private static final CharMatcher IS_P_CHAR = UNRESERVED.or(CharMatcher.anyOf(":@"));
        private static final CharMatcher IS_PATH =
                UNRESERVED.or(SUB_DELIMS).or(CharMatcher.anyOf(":@/%"));
        // Sub-delimiters are percent-encoded in query components so that '&', '=' and '+' inside values survive
        private static final CharMatcher IS_QUERY_CHAR = IS_P_CHAR.or(CharMatcher.anyOf("/?"));

        private UrlEncoder() {}

        static boolean isPath(String path) {
            return IS_PATH.matchesAllOf(path);
        }

        static String encodePathSegment(String pathComponent) {
            return encode(pathComponent, IS_P_CHAR);
        }

        static String encodeQueryNameOrValue(String nameOrValue) {
            return encode(nameOrValue, IS_QUERY_CHAR);
        }

        // percent-encodes every byte of the UTF-8 representation except those matched by charactersToKeep
        @VisibleForTesting
        static String encode(String source, CharMatcher charactersToKeep) {
            byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
            ByteArrayOutputStream bos = new ByteArrayOutputStream(source.length());
            boolean wasChanged = false;
            for (byte b : bytes) {
                char unsigned = (char) (b & 0xFF);
                if (charactersToKeep.matches(unsigned)) {
                    bos.write(b);
                } else {
                    bos.write('%');
                    bos.write(Character.toUpperCase(Character.forDigit((b >> 4) & 0xF, 16)));
                    bos.write(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
                    wasChanged = true;
                }
            }
            return wasChanged ? new String(bos.toByteArray(), StandardCharsets.UTF_8) : source;
        }
    }
}
