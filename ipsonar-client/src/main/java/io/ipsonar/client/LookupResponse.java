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
import java.util.Optional;
import org.immutables.value.Value;

/** Decoded response of {@link IpSonarClientWithResponses#lookup}. */
@Value.Immutable
public interface LookupResponse extends IpSonarResponse {

    /** Present for a 200 JSON response. */
    Optional<IpGeolocation> ok();

    Optional<ErrorMessage> unauthorized();

    Optional<ErrorMessage> notFound();

    Optional<ErrorMessage> unprocessableEntity();

    Optional<ErrorMessage> tooManyRequests();

    @Value.Check
    default void check() {
        Preconditions.checkState(
                IpSonarResponses.countPresent(
                                ok(), unauthorized(), notFound(), unprocessableEntity(), tooManyRequests())
                        <= 1,
                "At most one decoded body may be present");
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableLookupResponse.Builder {}
}
