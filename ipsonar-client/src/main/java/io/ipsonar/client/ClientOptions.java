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
import io.ipsonar.Channel;
import io.ipsonar.RequestEditor;

/** Factories for the supported {@link ClientOption}s. */
public final class ClientOptions {

    private ClientOptions() {}

    /** Sends requests through the given channel instead of the default {@code HttpURLConnection} one. */
    public static ClientOption withChannel(Channel channel) {
        Preconditions.checkNotNull(channel, "channel");
        return builder -> builder.channel(channel);
    }

    /**
     * Overrides the server base URL. The URL is validated when the option is applied, and a trailing {@code /} is
     * appended if missing.
     */
    public static ClientOption withBaseUrl(String baseUrl) {
        return builder -> builder.baseUrl(baseUrl);
    }

    /** Appends an editor applied to every request of the client, after previously registered editors. */
    public static ClientOption withRequestEditor(RequestEditor editor) {
        Preconditions.checkNotNull(editor, "editor");
        return builder -> builder.addRequestEditor(editor);
    }
}
