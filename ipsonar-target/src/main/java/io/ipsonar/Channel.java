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

import java.io.IOException;

/**
 * A channel is an abstraction of the HTTP transport used by the ip-sonar clients. It receives a fully constructed
 * {@link Request} and returns the raw {@link Response}, allowing the default transport to be replaced by an
 * instrumented client or a test double.
 *
 * <h4>Behavior</h4>
 * Implementations block until the response status and headers are available. Any response, whatever its status code,
 * is returned rather than thrown. Network failures, timeouts and DNS failures are thrown as {@link IOException}.
 * Channels never retry.
 */
@FunctionalInterface
public interface Channel {
    Response execute(Request request) throws IOException;
}
