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

/** Query modifiers shared by every lookup operation. */
public interface QueryParameters {

    /** Comma separated list of the {@link IpGeolocation} attributes to return, e.g. {@code ip,country_code}. */
    Optional<String> fields();

    /** Locale of the returned names, e.g. {@code en}. */
    Optional<String> localeCode();
}
