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

import java.util.Optional;

/**
 * Common view of the decoded responses. A response of any status code is returned, never thrown; callers inspect
 * {@link #statusCode()} or the status-specific fields of the concrete type. At most one of those fields is present.
 */
public interface IpSonarResponse {

    int statusCode();

    /** Status line without the protocol version, e.g. {@code 200 OK}. */
    String status();

    Optional<String> contentType();

    /** The complete raw response body. */
    byte[] body();
}
