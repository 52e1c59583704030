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

import com.palantir.logsafe.Preconditions;
import io.ipsonar.RequestBody;
import io.ipsonar.RequestEditor;
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * Wraps an {@link IpSonarClient} and decodes every response into the typed response of its operation. Responses are
 * read fully and closed before returning. No status code is treated as an error: inspect
 * {@link IpSonarResponse#statusCode()} or the typed fields instead.
 */
public final class IpSonarClientWithResponses {

    private final IpSonarClient client;

    private IpSonarClientWithResponses(IpSonarClient client) {
        this.client = client;
    }

    /** Creates a wrapper around a new {@link IpSonarClient#create(String, ClientOption...) base client}. */
    public static IpSonarClientWithResponses create(String server, ClientOption... options) {
        return of(IpSonarClient.create(server, options));
    }

    public static IpSonarClientWithResponses of(IpSonarClient client) {
        return new IpSonarClientWithResponses(Preconditions.checkNotNull(client, "client must not be null"));
    }

    /** The wrapped base client. */
    public IpSonarClient client() {
        return client;
    }

    public LookupResponse lookup(String ip, @Nullable LookupParams params, RequestEditor... editors)
            throws IOException {
        return IpSonarResponses.parseLookupResponse(client.lookup(ip, params, editors));
    }

    public LookupMyResponse lookupMy(@Nullable LookupMyParams params, RequestEditor... editors) throws IOException {
        return IpSonarResponses.parseLookupMyResponse(client.lookupMy(params, editors));
    }

    public BatchLookupResponse batchLookup(
            @Nullable BatchLookupParams params, BatchLookupRequestBody body, RequestEditor... editors)
            throws IOException {
        return IpSonarResponses.parseBatchLookupResponse(client.batchLookup(params, body, editors));
    }

    public BatchLookupResponse batchLookupWithBody(
            @Nullable BatchLookupParams params, RequestBody body, RequestEditor... editors) throws IOException {
        return IpSonarResponses.parseBatchLookupResponse(client.batchLookupWithBody(params, body, editors));
    }

    @Override
    public String toString() {
        return "IpSonarClientWithResponses{client=" + client + '}';
    }
}
