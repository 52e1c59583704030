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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/** A {@link Channel} test double which records every request and answers with canned responses. */
public final class RecordingChannel implements Channel {

    private final Supplier<Response> responses;
    private final List<Request> requests = new ArrayList<>();

    private RecordingChannel(Supplier<Response> responses) {
        this.responses = responses;
    }

    /** Answers every request with a fresh response from the supplier. */
    public static RecordingChannel answering(Supplier<Response> responses) {
        return new RecordingChannel(responses);
    }

    /** Answers every request with a {@code 200} response carrying the given JSON body. */
    public static RecordingChannel answeringJson(String body) {
        return answering(() -> TestResponse.json(200, body));
    }

    @Override
    public synchronized Response execute(Request request) throws IOException {
        requests.add(request);
        return responses.get();
    }

    public synchronized List<Request> requests() {
        return ImmutableList.copyOf(requests);
    }

    public synchronized Request lastRequest() {
        Preconditions.checkState(!requests.isEmpty(), "No request was executed");
        return requests.get(requests.size() - 1);
    }
}
