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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/** Body of 401, 404, 422, 429 and 500 responses. */
@Value.Immutable
@JsonDeserialize(as = ImmutableErrorMessage.class)
@JsonSerialize(as = ImmutableErrorMessage.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ErrorMessage {

    @JsonProperty("message")
    @Value.Default
    default String message() {
        return "";
    }

    static ErrorMessage of(String message) {
        return builder().message(message).build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableErrorMessage.Builder {}
}
