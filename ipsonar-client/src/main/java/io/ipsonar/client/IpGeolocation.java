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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Geolocation of a single IP address. Every attribute is optional: an empty value means the server does not know it
 * (or it was not selected via {@code fields}), which is distinct from an empty string.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableIpGeolocation.class)
@JsonSerialize(as = ImmutableIpGeolocation.class)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface IpGeolocation {

    @JsonProperty("ip")
    Optional<String> ip();

    /** ISO 3166-1 alpha-2 country code. */
    @JsonProperty("country_code")
    Optional<String> countryCode();

    @JsonProperty("country_name")
    Optional<String> countryName();

    @JsonProperty("city_name")
    Optional<String> cityName();

    @JsonProperty("continent_code")
    Optional<String> continentCode();

    @JsonProperty("continent_name")
    Optional<String> continentName();

    @JsonProperty("latitude")
    Optional<Float> latitude();

    @JsonProperty("longitude")
    Optional<Float> longitude();

    /** IANA time zone name, e.g. {@code America/New_York}. */
    @JsonProperty("timezone")
    Optional<String> timezone();

    @JsonProperty("postal_code")
    Optional<String> postalCode();

    /** Radius in meters around the coordinates within which the address is located. */
    @JsonProperty("accuracy_radius")
    Optional<Integer> accuracyRadius();

    @JsonProperty("is_in_eu")
    Optional<Boolean> isInEu();

    @JsonProperty("subdivision_1_code")
    Optional<String> subdivision1Code();

    @JsonProperty("subdivision_1_name")
    Optional<String> subdivision1Name();

    @JsonProperty("subdivision_2_code")
    Optional<String> subdivision2Code();

    @JsonProperty("subdivision_2_name")
    Optional<String> subdivision2Name();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableIpGeolocation.Builder {}
}
