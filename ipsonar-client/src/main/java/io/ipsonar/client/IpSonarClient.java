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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import io.ipsonar.BaseUrl;
import io.ipsonar.Channel;
import io.ipsonar.Endpoint;
import io.ipsonar.Request;
import io.ipsonar.RequestBody;
import io.ipsonar.RequestEditor;
import io.ipsonar.Response;
import io.ipsonar.httpurlconnection.HttpUrlConnectionChannel;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Low-level client of the ip-sonar API. Every operation returns the raw {@link Response}, whatever its status code;
 * the caller owns the response and must close it. Use {@link IpSonarClientWithResponses} for decoded results.
 *
 * <p>Instances are immutable and may be shared between threads if the configured {@link Channel} allows it, which
 * the default one does.
 */
public final class IpSonarClient {
    private static final SafeLogger log = SafeLoggerFactory.get(IpSonarClient.class);

    private final BaseUrl baseUrl;
    private final Channel channel;
    private final ImmutableList<RequestEditor> requestEditors;

    private IpSonarClient(BaseUrl baseUrl, Channel channel, List<RequestEditor> requestEditors) {
        this.baseUrl = baseUrl;
        this.channel = channel;
        this.requestEditors = ImmutableList.copyOf(requestEditors);
    }

    /**
     * Creates a client for the given server, e.g. {@link IpSonar#API_SERVER}, applying the options in order.
     *
     * @throws com.palantir.logsafe.exceptions.SafeIllegalArgumentException if the server, or a base URL passed with
     * {@link ClientOptions#withBaseUrl(String)}, is not a valid http(s) URL
     */
    public static IpSonarClient create(String server, ClientOption... options) {
        Builder builder = new Builder(BaseUrl.of(server));
        for (ClientOption option : options) {
            Preconditions.checkNotNull(option, "ClientOption must not be null").apply(builder);
        }
        return builder.build();
    }

    /** The effective server base URL, always ending with {@code /}. */
    public String server() {
        return baseUrl.server();
    }

    public Channel channel() {
        return channel;
    }

    /** Looks up the geolocation of {@code ip}. */
    public Response lookup(String ip, @Nullable LookupParams params, RequestEditor... editors) throws IOException {
        return execute(IpSonarEndpoints.LOOKUP, IpSonarRequests.newLookupRequest(baseUrl, ip, params), editors);
    }

    /** Looks up the geolocation of the address the server sees the request coming from. */
    public Response lookupMy(@Nullable LookupMyParams params, RequestEditor... editors) throws IOException {
        return execute(IpSonarEndpoints.LOOKUP_MY, IpSonarRequests.newLookupMyRequest(baseUrl, params), editors);
    }

    /** Looks up the geolocation of every address of {@code body} in a single request. */
    public Response batchLookup(
            @Nullable BatchLookupParams params, BatchLookupRequestBody body, RequestEditor... editors)
            throws IOException {
        return execute(
                IpSonarEndpoints.BATCH_LOOKUP,
                IpSonarRequests.newBatchLookupRequest(baseUrl, params, body),
                editors);
    }

    /** Like {@link #batchLookup} but sends a caller-encoded body with the body's content type. */
    public Response batchLookupWithBody(
            @Nullable BatchLookupParams params, RequestBody body, RequestEditor... editors) throws IOException {
        return execute(
                IpSonarEndpoints.BATCH_LOOKUP,
                IpSonarRequests.newBatchLookupRequestWithBody(baseUrl, params, body),
                editors);
    }

    private Response execute(Endpoint endpoint, Request request, RequestEditor... editors) throws IOException {
        Request edited = applyEditors(request, editors);
        log.debug(
                "Executing request",
                SafeArg.of("endpoint", endpoint.endpointName()),
                SafeArg.of("method", edited.httpMethod()),
                UnsafeArg.of("url", edited.url()));
        return channel.execute(edited);
    }

    // Client editors run first, then per-call editors; the first failure propagates before anything is sent
    private Request applyEditors(Request request, RequestEditor... editors) throws IOException {
        Request current = request;
        for (RequestEditor editor : requestEditors) {
            current = edit(editor, current);
        }
        for (RequestEditor editor : editors) {
            current = edit(Preconditions.checkNotNull(editor, "RequestEditor must not be null"), current);
        }
        return current;
    }

    private static Request edit(RequestEditor editor, Request request) throws IOException {
        return Preconditions.checkNotNull(editor.edit(request), "RequestEditor must not return null");
    }

    @Override
    public String toString() {
        return "IpSonarClient{baseUrl=" + baseUrl + ", channel=" + channel + ", requestEditors="
                + requestEditors.size() + '}';
    }

    /** Mutable construction state handed to each {@link ClientOption}. */
    public static final class Builder {
        private BaseUrl baseUrl;

        @Nullable
        private Channel channel;

        private final List<RequestEditor> requestEditors = new ArrayList<>();

        private Builder(BaseUrl baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder channel(Channel value) {
            channel = Preconditions.checkNotNull(value, "channel");
            return this;
        }

        public Builder baseUrl(String value) {
            baseUrl = BaseUrl.of(value);
            return this;
        }

        public Builder addRequestEditor(RequestEditor value) {
            requestEditors.add(Preconditions.checkNotNull(value, "requestEditor"));
            return this;
        }

        @CheckReturnValue
        IpSonarClient build() {
            return new IpSonarClient(
                    baseUrl, channel != null ? channel : HttpUrlConnectionChannel.create(), requestEditors);
        }
    }
}
