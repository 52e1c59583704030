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

import io.ipsonar.Endpoint;
import io.ipsonar.HttpMethod;
import io.ipsonar.PathTemplate;
import io.ipsonar.UrlBuilder;
import java.util.Map;

/** The endpoints of the ip-sonar API, relative to the server base URL. */
public final class IpSonarEndpoints {

    static final String IP_PARAMETER = "ip";

    /** {@code GET v1/{ip}}: geolocation of the given address. */
    public static final Endpoint LOOKUP = new Endpoint() {
        private final PathTemplate pathTemplate =
                PathTemplate.builder().fixed("v1").variable(IP_PARAMETER).build();

        @Override
        public void renderPath(Map<String, String> params, UrlBuilder url) {
            pathTemplate.fill(params, url);
        }

        @Override
        public HttpMethod httpMethod() {
            return HttpMethod.GET;
        }

        @Override
        public String endpointName() {
            return "lookup";
        }
    };

    /** {@code GET v1/my}: geolocation of the address the request arrives from. */
    public static final Endpoint LOOKUP_MY = new Endpoint() {
        private final PathTemplate pathTemplate =
                PathTemplate.builder().fixed("v1").fixed("my").build();

        @Override
        public void renderPath(Map<String, String> params, UrlBuilder url) {
            pathTemplate.fill(params, url);
        }

        @Override
        public HttpMethod httpMethod() {
            return HttpMethod.GET;
        }

        @Override
        public String endpointName() {
            return "lookupMy";
        }
    };

    /** {@code POST v1/batch}: geolocation of every address in the JSON body. */
    public static final Endpoint BATCH_LOOKUP = new Endpoint() {
        private final PathTemplate pathTemplate =
                PathTemplate.builder().fixed("v1").fixed("batch").build();

        @Override
        public void renderPath(Map<String, String> params, UrlBuilder url) {
            pathTemplate.fill(params, url);
        }

        @Override
        public HttpMethod httpMethod() {
            return HttpMethod.POST;
        }

        @Override
        public String endpointName() {
            return "batchLookup";
        }
    };

    private IpSonarEndpoints() {}
}
