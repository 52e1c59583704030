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
import io.ipsonar.Request;
import io.ipsonar.RequestEditor;

/** Common {@link RequestEditor}s. */
public final class RequestEditors {

    private RequestEditors() {}

    /** Sets the given header, replacing any value already present. */
    public static RequestEditor header(String name, String value) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(value, "value");
        return request -> Request.builder().from(request).setHeader(name, value).build();
    }

    /** Sends the given API key in the {@value IpSonar#API_KEY_HEADER} header. */
    public static RequestEditor apiKey(String apiKey) {
        return header(IpSonar.API_KEY_HEADER, apiKey);
    }
}
