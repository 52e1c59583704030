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

package io.ipsonar.httpurlconnection;

import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.primitives.Ints;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import io.ipsonar.Channel;
import io.ipsonar.Request;
import io.ipsonar.RequestBody;
import io.ipsonar.Response;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/** The default {@link Channel}, backed by {@link HttpURLConnection}. Instances are safe for concurrent use. */
public final class HttpUrlConnectionChannel implements Channel {
    private static final SafeLogger log = SafeLoggerFactory.get(HttpUrlConnectionChannel.class);

    private static final int CHUNK_SIZE = 1024 * 8;

    private final ChannelConfig config;

    private HttpUrlConnectionChannel(ChannelConfig config) {
        this.config = config;
    }

    public static HttpUrlConnectionChannel create() {
        return new HttpUrlConnectionChannel(ChannelConfig.DEFAULT);
    }

    public static HttpUrlConnectionChannel create(ChannelConfig config) {
        return new HttpUrlConnectionChannel(config);
    }

    @Override
    public Response execute(Request request) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) request.url().openConnection();
        connection.setRequestMethod(request.httpMethod().name());

        // Fill headers
        request.headerParams().forEach(connection::addRequestProperty);

        connection.setConnectTimeout(Ints.checkedCast(config.connectTimeout().toMillis()));
        connection.setReadTimeout(Ints.checkedCast(config.readTimeout().toMillis()));
        connection.setInstanceFollowRedirects(config.followRedirects());

        // Never ask users for credentials
        connection.setAllowUserInteraction(false);
        connection.setDoOutput(request.body().isPresent());
        connection.setDoInput(true);

        if (request.body().isPresent()) {
            RequestBody body = request.body().get();
            OptionalLong contentLength = body.contentLength();
            if (contentLength.isPresent()) {
                connection.setFixedLengthStreamingMode(contentLength.getAsLong());
            } else {
                connection.setChunkedStreamingMode(CHUNK_SIZE);
            }
            connection.setRequestProperty("content-type", body.contentType());
            try (OutputStream requestBodyStream = connection.getOutputStream()) {
                body.writeTo(requestBodyStream);
            } finally {
                body.close();
            }
        }
        HttpUrlConnectionResponse response = new HttpUrlConnectionResponse(connection);
        log.debug(
                "Received response",
                SafeArg.of("method", request.httpMethod()),
                SafeArg.of("status", response.code()),
                UnsafeArg.of("url", request.url()));
        return response;
    }

    @Override
    public String toString() {
        return "HttpUrlConnectionChannel{config=" + config + '}';
    }

    private static final class HttpUrlConnectionResponse implements Response {

        private final HttpURLConnection connection;
        private final int code;

        @Nullable
        private final String reasonPhrase;

        @Nullable
        private InputStream body;

        HttpUrlConnectionResponse(HttpURLConnection connection) throws IOException {
            this.connection = connection;
            // blocks until the response is received
            this.code = connection.getResponseCode();
            this.reasonPhrase = connection.getResponseMessage();
        }

        @Override
        public synchronized InputStream body() {
            if (body == null) {
                body = openBody();
            }
            return body;
        }

        private InputStream openBody() {
            if (code >= 400) {
                InputStream errorStream = connection.getErrorStream();
                return errorStream != null ? errorStream : InputStream.nullInputStream();
            }
            try {
                return connection.getInputStream();
            } catch (IOException e) {
                throw new SafeRuntimeException("Failed to read response stream", e, SafeArg.of("status", code));
            }
        }

        @Override
        public int code() {
            return code;
        }

        @Override
        public String status() {
            return reasonPhrase == null || reasonPhrase.isEmpty() ? Integer.toString(code) : code + " " + reasonPhrase;
        }

        @Override
        public ListMultimap<String, String> headers() {
            ListMultimap<String, String> headers = MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER)
                    .arrayListValues()
                    .build();
            connection.getHeaderFields().forEach((headerName, headerValues) -> {
                if (headerName != null) {
                    headers.putAll(headerName, Iterables.filter(headerValues, Objects::nonNull));
                }
            });
            return headers;
        }

        @Override
        public Optional<String> getFirstHeader(String header) {
            return Optional.ofNullable(connection.getHeaderField(header));
        }

        @Override
        public void close() {
            try {
                body().close();
            } catch (IOException e) {
                log.warn("Failed to close response", SafeArg.of("status", code), e);
            }
        }

        @Override
        public String toString() {
            return "HttpUrlConnectionResponse{code=" + code + '}';
        }
    }
}
