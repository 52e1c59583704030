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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.palantir.logsafe.Preconditions;
import io.ipsonar.BaseUrl;
import io.ipsonar.Endpoint;
import io.ipsonar.Request;
import io.ipsonar.RequestBody;
import io.ipsonar.serde.Encoding;
import io.ipsonar.serde.Encodings;
import java.io.IOException;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Builds the outbound {@link Request} of each operation without sending it. {@link IpSonarClient} uses these before
 * applying its request editors; they are public for callers that drive a {@link io.ipsonar.Channel} directly.
 */
public final class IpSonarRequests {

    static final String FIELDS_QUERY_PARAMETER = "fields";
    static final String LOCALE_CODE_QUERY_PARAMETER = "locale_code";

    private static final Encoding JSON = Encodings.json();

    private IpSonarRequests() {}

    public static Request newLookupRequest(BaseUrl server, String ip, @Nullable LookupParams params) {
        Preconditions.checkNotNull(ip, "ip parameter must not be null");
        return request(
                server, IpSonarEndpoints.LOOKUP, ImmutableMap.of(IpSonarEndpoints.IP_PARAMETER, ip), params)
                .build();
    }

    public static Request newLookupMyRequest(BaseUrl server, @Nullable LookupMyParams params) {
        return request(server, IpSonarEndpoints.LOOKUP_MY, ImmutableMap.of(), params)
                .build();
    }

    /** Builds a batch lookup request whose body is the JSON encoding of {@code body}. */
    public static Request newBatchLookupRequest(
            BaseUrl server, @Nullable BatchLookupParams params, BatchLookupRequestBody body) throws IOException {
        Preconditions.checkNotNull(body, "body parameter must not be null");
        return newBatchLookupRequestWithBody(
                server, params, Encodings.body(JSON, BatchLookupRequestBody.class, body));
    }

    /** Builds a batch lookup request with a caller-encoded body, sent with the body's own content type. */
    public static Request newBatchLookupRequestWithBody(
            BaseUrl server, @Nullable BatchLookupParams params, RequestBody body) {
        Preconditions.checkNotNull(body, "body parameter must not be null");
        return request(server, IpSonarEndpoints.BATCH_LOOKUP, ImmutableMap.of(), params)
                .body(body)
                .build();
    }

    private static Request.Builder request(
            BaseUrl server,
            Endpoint endpoint,
            Map<String, String> pathParams,
            @Nullable QueryParameters params) {
        Preconditions.checkNotNull(server, "server must not be null");
        return Request.builder()
                .httpMethod(endpoint.httpMethod())
                .url(server.render(endpoint, pathParams, queryParams(params)));
    }

    private static ListMultimap<String, String> queryParams(@Nullable QueryParameters params) {
        if (params == null) {
            return ImmutableListMultimap.of();
        }
        ImmutableListMultimap.Builder<String, String> query = ImmutableListMultimap.builder();
        params.fields().ifPresent(fields -> query.put(FIELDS_QUERY_PARAMETER, fields));
        params.localeCode().ifPresent(localeCode -> query.put(LOCALE_CODE_QUERY_PARAMETER, localeCode));
        return query.build();
    }
}
