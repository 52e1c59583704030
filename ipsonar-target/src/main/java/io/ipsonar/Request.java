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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;

/** A fully constructed outbound HTTP request: method, absolute URL, headers and an optional body. */
@ThreadSafe
public final class Request {

    private final HttpMethod httpMethod;
    private final URL url;
    private final ListMultimap<String, String> headerParams;
    private final Optional<RequestBody> body;

    private Request(Builder builder) {
        httpMethod = Preconditions.checkNotNull(builder.httpMethod, "httpMethod must be set");
        url = Preconditions.checkNotNull(builder.url, "url must be set");
        body = builder.body;
        headerParams = builder.unmodifiableHeaderParams();
        if (body.isPresent() && !httpMethod.permitsBody()) {
            throw new SafeIllegalArgumentException(
                    "Request method does not permit a body", SafeArg.of("method", httpMethod));
        }
    }

    public HttpMethod httpMethod() {
        return httpMethod;
    }

    /** The absolute URL of this request, including the encoded query string. */
    public URL url() {
        return url;
    }

    /**
     * The HTTP headers for this request, encoded as a map of {@code header-name: header-value}.
     * Headers names are compared in a case-insensitive fashion as per
     * https://tools.ietf.org/html/rfc7540#section-8.1.2.
     */
    public ListMultimap<String, String> headerParams() {
        return headerParams;
    }

    /** Retrieves the first value of the given header. */
    public Optional<String> getFirstHeader(String header) {
        List<String> values = headerParams.get(header);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /** The HTTP request body for this request or empty if this request does not contain a body. */
    public Optional<RequestBody> body() {
        return body;
    }

    @Override
    public String toString() {
        return "Request{"
                + "httpMethod="
                + httpMethod
                // Values are excluded to avoid the risk of logging credentials
                + ", headerParamsKeys="
                + headerParams.keySet()
                + ", body="
                + body
                + '}';
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Request request = (Request) other;
        return httpMethod == request.httpMethod
                && url.toString().equals(request.url.toString())
                && headerParams.equals(request.headerParams)
                && body.equals(request.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(httpMethod, url.toString(), headerParams, body);
    }

    public static Builder builder() {
        return new Builder();
    }

    @NotThreadSafe
    public static final class Builder {

        @SuppressWarnings("UnnecessaryLambda") // Avoid unnecessary allocation
        private static final com.google.common.base.Supplier<List<String>> MAP_VALUE_FACTORY = () -> new ArrayList<>(1);

        @Nullable
        private HttpMethod httpMethod;

        @Nullable
        private URL url;

        private ListMultimap<String, String> headerParams = ImmutableListMultimap.of();

        private boolean headersMutable = false;

        private Optional<RequestBody> body = Optional.empty();

        private Builder() {}

        public Request.Builder from(Request existing) {
            Preconditions.checkNotNull(existing, "Request.builder().from() requires a non-null instance");

            httpMethod = existing.httpMethod;
            url = existing.url;
            headerParams = existing.headerParams;
            headersMutable = false;
            body = existing.body;
            return this;
        }

        public Request.Builder httpMethod(HttpMethod value) {
            httpMethod = Preconditions.checkNotNull(value, "httpMethod");
            return this;
        }

        public Request.Builder url(URL value) {
            url = Preconditions.checkNotNull(value, "url");
            return this;
        }

        /** Appends a value to the given header. */
        public Request.Builder putHeaderParams(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            mutableHeaderParams().put(key, value);
            return this;
        }

        /** Replaces all values of the given header with the given value. */
        public Request.Builder setHeader(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            ListMultimap<String, String> headers = mutableHeaderParams();
            headers.removeAll(key);
            headers.put(key, value);
            return this;
        }

        public Request.Builder body(RequestBody value) {
            body = Optional.of(Preconditions.checkNotNull(value, "body"));
            return this;
        }

        private ListMultimap<String, String> mutableHeaderParams() {
            if (!headersMutable) {
                headersMutable = true;
                ListMultimap<String, String> mutable =
                        Multimaps.newListMultimap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER), MAP_VALUE_FACTORY);
                if (!headerParams.isEmpty()) {
                    headerParams.forEach(mutable::put);
                }
                headerParams = mutable;
            }
            return headerParams;
        }

        private ListMultimap<String, String> unmodifiableHeaderParams() {
            if (!headersMutable) {
                return headerParams;
            }
            // Detach from this builder so that later mutations do not leak into built requests
            ListMultimap<String, String> copy =
                    Multimaps.newListMultimap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER), MAP_VALUE_FACTORY);
            headerParams.forEach(copy::put);
            return Multimaps.unmodifiableListMultimap(copy);
        }

        public Request build() {
            return new Request(this);
        }
    }
}
