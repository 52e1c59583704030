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

package io.ipsonar.httpurlconnection;

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.time.Duration;
import org.immutables.value.Value;

/** Transport settings of {@link HttpUrlConnectionChannel}. */
@Value.Immutable
public interface ChannelConfig {

    ChannelConfig DEFAULT = builder().build();

    @Value.Default
    default Duration connectTimeout() {
        return Duration.ofSeconds(10);
    }

    /** Maximum time to wait for data once connected. Zero disables the timeout. */
    @Value.Default
    default Duration readTimeout() {
        return Duration.ofSeconds(30);
    }

    @Value.Default
    default boolean followRedirects() {
        return false;
    }

    @Value.Check
    default void check() {
        Preconditions.checkArgument(
                !connectTimeout().isNegative(),
                "connectTimeout must not be negative",
                SafeArg.of("connectTimeout", connectTimeout()));
        Preconditions.checkArgument(
                !readTimeout().isNegative(),
                "readTimeout must not be negative",
                SafeArg.of("readTimeout", readTimeout()));
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableChannelConfig.Builder {}
}
