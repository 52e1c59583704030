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
 * Edits an outbound {@link Request} before it is handed to the {@link Channel}, for example to attach an
 * authentication header. Editors return an edited copy, usually built with {@link Request.Builder#from(Request)}.
 * A thrown exception aborts the call: subsequent editors do not run and nothing is sent.
 */
@FunctionalInterface
public interface RequestEditor {
    Request edit(Request request) throws IOException;
}
