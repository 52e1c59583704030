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

import java.util.Map;

/**
 * Defines a single HTTP endpoint of the ip-sonar API in terms of a {@link #renderPath path} and
 * {@link #httpMethod HTTP method}.
 */
public interface Endpoint {

    /** Appends this endpoint's path, relative to the base URL, to the given builder. */
    void renderPath(Map<String, String> params, UrlBuilder url);

    HttpMethod httpMethod();

    String endpointName();
}
