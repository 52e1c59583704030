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

package io.ipsonar.client;

import com.google.common.io.ByteStreams;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIoException;
import io.ipsonar.Response;
import io.ipsonar.serde.Encoding;
import io.ipsonar.serde.Encodings;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Decodes raw responses into the typed responses of each operation. The body is read completely and the response
 * closed, whatever the outcome. A body is decoded only when its status is declared for the operation and its
 * {@code Content-Type} names a JSON media type; otherwise only the raw fields are populated.
 *
 * <p>A JSON {@code null} body on a declared status is a decoding failure, not an empty value.
 */
public final class IpSonarResponses {

    private static final Encoding JSON = Encodings.json();

    private static final Encoding.Deserializer<IpGeolocation> IP_GEOLOCATION = JSON.deserializer(IpGeolocation.class);
    private static final Encoding.Deserializer<BatchLookupIpResponse> BATCH_LOOKUP_IP_RESPONSE =
            JSON.deserializer(BatchLookupIpResponse.class);
    private static final Encoding.Deserializer<ErrorMessage> ERROR_MESSAGE = JSON.deserializer(ErrorMessage.class);

    private IpSonarResponses() {}

    public static LookupResponse parseLookupResponse(Response response) throws IOException {
        RawResponse raw = RawResponse.read(response);
        LookupResponse.Builder builder = new LookupResponse.Builder();
        builder.statusCode(raw.statusCode)
                .status(raw.status)
                .contentType(raw.contentType)
                .body(raw.body);
        if (raw.isJson()) {
            String operation = IpSonarEndpoints.LOOKUP.endpointName();
            switch (raw.statusCode) {
                case 200:
                    builder.ok(raw.decode(IP_GEOLOCATION, operation));
                    break;
                case 401:
                    builder.unauthorized(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 404:
                    builder.notFound(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 422:
                    builder.unprocessableEntity(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 429:
                    builder.tooManyRequests(raw.decode(ERROR_MESSAGE, operation));
                    break;
                default:
                    break;
            }
        }
        return builder.build();
    }

    public static LookupMyResponse parseLookupMyResponse(Response response) throws IOException {
        RawResponse raw = RawResponse.read(response);
        LookupMyResponse.Builder builder = new LookupMyResponse.Builder();
        builder.statusCode(raw.statusCode)
                .status(raw.status)
                .contentType(raw.contentType)
                .body(raw.body);
        if (raw.isJson()) {
            String operation = IpSonarEndpoints.LOOKUP_MY.endpointName();
            switch (raw.statusCode) {
                case 200:
                    builder.ok(raw.decode(IP_GEOLOCATION, operation));
                    break;
                case 401:
                    builder.unauthorized(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 429:
                    builder.tooManyRequests(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 500:
                    builder.internalServerError(raw.decode(ERROR_MESSAGE, operation));
                    break;
                default:
                    break;
            }
        }
        return builder.build();
    }

    public static BatchLookupResponse parseBatchLookupResponse(Response response) throws IOException {
        RawResponse raw = RawResponse.read(response);
        BatchLookupResponse.Builder builder = new BatchLookupResponse.Builder();
        builder.statusCode(raw.statusCode)
                .status(raw.status)
                .contentType(raw.contentType)
                .body(raw.body);
        if (raw.isJson()) {
            String operation = IpSonarEndpoints.BATCH_LOOKUP.endpointName();
            switch (raw.statusCode) {
                case 200:
                    builder.ok(raw.decode(BATCH_LOOKUP_IP_RESPONSE, operation));
                    break;
                case 401:
                    builder.unauthorized(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 422:
                    builder.unprocessableEntity(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 429:
                    builder.tooManyRequests(raw.decode(ERROR_MESSAGE, operation));
                    break;
                case 500:
                    builder.internalServerError(raw.decode(ERROR_MESSAGE, operation));
                    break;
                default:
                    break;
            }
        }
        return builder.build();
    }

    static int countPresent(Optional<?>... values) {
        int present = 0;
        for (Optional<?> value : values) {
            if (value.isPresent()) {
                present++;
            }
        }
        return present;
    }

    private static final class RawResponse {
        private final int statusCode;
        private final String status;
        private final Optional<String> contentType;
        private final byte[] body;

        private RawResponse(int statusCode, String status, Optional<String> contentType, byte[] body) {
            this.statusCode = statusCode;
            this.status = status;
            this.contentType = contentType;
            this.body = body;
        }

        static RawResponse read(Response response) throws IOException {
            try (Response closing = response;
                    InputStream body = closing.body()) {
                return new RawResponse(
                        closing.code(),
                        closing.status(),
                        closing.getFirstHeader("Content-Type"),
                        ByteStreams.toByteArray(body));
            }
        }

        boolean isJson() {
            return Encodings.isJson(contentType.orElse(null));
        }

        <T> T decode(Encoding.Deserializer<T> deserializer, String operation) throws IOException {
            try {
                return deserializer.deserialize(new ByteArrayInputStream(body));
            } catch (IOException e) {
                throw new SafeIoException(
                        "Failed to decode response body",
                        e,
                        SafeArg.of("operation", operation),
                        SafeArg.of("statusCode", statusCode));
            }
        }
    }
}
