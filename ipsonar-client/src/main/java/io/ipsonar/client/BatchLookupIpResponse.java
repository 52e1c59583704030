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
import java.util.List;
import org.immutables.value.Value;

/**
 * Successful batch lookup result. The server answers with one entry per submitted address in submission order; this
 * client does not verify it.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableBatchLookupIpResponse.class)
@JsonSerialize(as = ImmutableBatchLookupIpResponse.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface BatchLookupIpResponse {

    @JsonProperty("data")
    List<IpGeolocation> data();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableBatchLookupIpResponse.Builder {}
}
