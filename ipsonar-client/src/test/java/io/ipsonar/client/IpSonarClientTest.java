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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeNullPointerException;
import io.ipsonar.Channel;
import io.ipsonar.HttpMethod;
import io.ipsonar.RecordingChannel;
import io.ipsonar.Request;
import io.ipsonar.RequestBody;
import io.ipsonar.RequestEditor;
import io.ipsonar.Response;
import io.ipsonar.TestResponse;
import io.ipsonar.httpurlconnection.HttpUrlConnectionChannel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class IpSonarClientTest {

    private static final String SERVER = "https://api.example.com";

    @Mock
    private Channel channel;

    private final RecordingChannel recording = RecordingChannel.answering(TestResponse::new);

    @Test
    public void create_appendsTrailingSlash() {
        assertThat(IpSonarClient.create(SERVER).server()).isEqualTo("https://api.example.com/");
        assertThat(IpSonarClient.create(SERVER + "/").server()).isEqualTo("https://api.example.com/");
    }

    @Test
    public void create_acceptsUpperCaseScheme() throws IOException {
        IpSonarClient client = IpSonarClient.create("HTTPS://api.example.com", ClientOptions.withChannel(recording));
        assertThat(client.server()).isEqualTo("https://api.example.com/");

        client.lookupMy(null).close();
        assertThat(recording.lastRequest().url()).hasToString("https://api.example.com/v1/my");
    }

    @Test
    public void create_usesHttpUrlConnectionChannelByDefault() {
        assertThat(IpSonarClient.create(IpSonar.API_SERVER).channel()).isInstanceOf(HttpUrlConnectionChannel.class);
    }

    @Test
    public void create_rejectsInvalidServer() {
        assertThatThrownBy(() -> IpSonarClient.create("not a url")).isInstanceOf(SafeIllegalArgumentException.class);
        assertThatThrownBy(() -> IpSonarClient.create("ftp://api.example.com"))
                .isInstanceOf(SafeIllegalArgumentException.class);
        assertThatThrownBy(() -> IpSonarClient.create(SERVER, ClientOptions.withBaseUrl("https://a.com?x=y")))
                .isInstanceOf(SafeIllegalArgumentException.class);
    }

    @Test
    public void options_areAppliedInOrder() {
        IpSonarClient client = IpSonarClient.create(
                SERVER,
                ClientOptions.withBaseUrl("http://first.example.com"),
                ClientOptions.withChannel(channel),
                ClientOptions.withBaseUrl("http://second.example.com/base"),
                ClientOptions.withChannel(recording));
        assertThat(client.server()).isEqualTo("http://second.example.com/base/");
        assertThat(client.channel()).isSameAs(recording);
    }

    @Test
    public void lookup_buildsGetRequest() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(recording));
        client.lookup("8.8.8.8", null).close();

        Request request = recording.lastRequest();
        assertThat(request.httpMethod()).isEqualTo(HttpMethod.GET);
        assertThat(request.url()).hasToString("https://api.example.com/v1/8.8.8.8");
        assertThat(request.body()).isEmpty();
        assertThat(request.headerParams().isEmpty()).isTrue();
    }

    @Test
    public void lookup_addsOnlyPresentQueryParameters() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(recording));

        client.lookup("8.8.8.8", LookupParams.builder().fields("ip,country_code").build())
                .close();
        assertThat(recording.lastRequest().url().getQuery()).isEqualTo("fields=ip%2Ccountry_code");

        client.lookup("8.8.8.8", LookupParams.builder().localeCode("de").build())
                .close();
        assertThat(recording.lastRequest().url().getQuery()).isEqualTo("locale_code=de");

        client.lookup(
                        "8.8.8.8",
                        LookupParams.builder().fields("ip").localeCode("en").build())
                .close();
        assertThat(recording.lastRequest().url().getQuery()).isEqualTo("fields=ip&locale_code=en");

        client.lookup("8.8.8.8", LookupParams.builder().build()).close();
        assertThat(recording.lastRequest().url().getQuery()).isNull();
    }

    @Test
    public void lookup_encodesIpAsSinglePathSegment() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER + "/proxy", ClientOptions.withChannel(recording));
        client.lookup("10.0.0.1/8?x", null).close();
        assertThat(recording.lastRequest().url()).hasToString("https://api.example.com/proxy/v1/10.0.0.1%2F8%3Fx");

        client.lookup("2001:db8::1", null).close();
        assertThat(recording.lastRequest().url()).hasToString("https://api.example.com/proxy/v1/2001:db8::1");
    }

    @Test
    public void lookup_rejectsNullIp() {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(channel));
        assertThatThrownBy(() -> client.lookup(null, null)).isInstanceOf(SafeNullPointerException.class);
    }

    @Test
    public void lookupMy_buildsGetRequest() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(recording));
        client.lookupMy(LookupMyParams.builder().localeCode("fr").build()).close();

        Request request = recording.lastRequest();
        assertThat(request.httpMethod()).isEqualTo(HttpMethod.GET);
        assertThat(request.url()).hasToString("https://api.example.com/v1/my?locale_code=fr");
    }

    @Test
    public void batchLookup_sendsJsonBody() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(recording));
        client.batchLookup(
                        BatchLookupParams.builder().fields("ip").build(),
                        BatchLookupRequestBody.of(ImmutableList.of("1.1.1.1", "8.8.8.8")))
                .close();

        Request request = recording.lastRequest();
        assertThat(request.httpMethod()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).hasToString("https://api.example.com/v1/batch?fields=ip");
        assertThat(request.body()).isPresent();
        RequestBody body = request.body().get();
        assertThat(body.contentType()).isEqualTo("application/json");
        assertThat(write(body)).isEqualTo("{\"data\":[\"1.1.1.1\",\"8.8.8.8\"]}");
    }

    @Test
    public void batchLookup_rejectsNullBody() {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(channel));
        assertThatThrownBy(() -> client.batchLookup(null, null)).isInstanceOf(SafeNullPointerException.class);
    }

    @Test
    public void batchLookupWithBody_sendsBodyUnchanged() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(recording));
        RequestBody body = new TextBody("1.1.1.1\n8.8.8.8");
        client.batchLookupWithBody(null, body).close();

        Request request = recording.lastRequest();
        assertThat(request.httpMethod()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).hasToString("https://api.example.com/v1/batch");
        assertThat(request.body()).containsSame(body);
    }

    @Test
    public void editors_runClientEditorsThenPerCallEditors() throws IOException {
        IpSonarClient client = IpSonarClient.create(
                SERVER,
                ClientOptions.withChannel(recording),
                ClientOptions.withRequestEditor(appendHeader("X-Order", "client-1")),
                ClientOptions.withRequestEditor(appendHeader("X-Order", "client-2")));

        client.lookupMy(null, appendHeader("X-Order", "call-1"), appendHeader("X-Order", "call-2"))
                .close();

        assertThat(recording.lastRequest().headerParams().get("x-order"))
                .containsExactly("client-1", "client-2", "call-1", "call-2");
    }

    @Test
    public void editors_apiKeyHeaderIsReplacedByLaterEditors() throws IOException {
        IpSonarClient client = IpSonarClient.create(
                SERVER,
                ClientOptions.withChannel(recording),
                ClientOptions.withRequestEditor(RequestEditors.apiKey("client-key")));

        client.lookup("8.8.8.8", null).close();
        assertThat(recording.lastRequest().getFirstHeader(IpSonar.API_KEY_HEADER)).hasValue("client-key");

        client.lookup("8.8.8.8", null, RequestEditors.apiKey("call-key")).close();
        assertThat(recording.lastRequest().headerParams().get("x-api-key")).containsExactly("call-key");
    }

    @Test
    public void editors_failFastWithoutSendingRequest() throws IOException {
        List<String> invoked = new ArrayList<>();
        IOException failure = new IOException("no credentials");
        IpSonarClient client = IpSonarClient.create(
                SERVER,
                ClientOptions.withChannel(channel),
                ClientOptions.withRequestEditor(request -> {
                    invoked.add("first");
                    throw failure;
                }),
                ClientOptions.withRequestEditor(request -> {
                    invoked.add("second");
                    return request;
                }));

        assertThatThrownBy(() -> client.lookup("8.8.8.8", null)).isSameAs(failure);
        assertThat(invoked).containsExactly("first");
        verify(channel, never()).execute(any());
    }

    @Test
    public void editors_perCallFailureStopsLaterPerCallEditors() throws IOException {
        List<String> invoked = new ArrayList<>();
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(channel));

        assertThatThrownBy(() -> client.lookupMy(
                        null,
                        request -> {
                            invoked.add("first");
                            throw new IllegalStateException("boom");
                        },
                        request -> {
                            invoked.add("second");
                            return request;
                        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertThat(invoked).containsExactly("first");
        verify(channel, never()).execute(any());
    }

    @Test
    public void editors_mustNotReturnNull() throws IOException {
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(channel));
        assertThatThrownBy(() -> client.lookupMy(null, request -> null))
                .isInstanceOf(SafeNullPointerException.class);
        verify(channel, never()).execute(any());
    }

    @Test
    public void execute_returnsRawResponseUnclosed() throws IOException {
        TestResponse response = TestResponse.json(500, "{\"message\":\"oops\"}");
        when(channel.execute(any())).thenReturn(response);
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(channel));

        try (Response actual = client.lookupMy(null)) {
            assertThat(actual).isSameAs(response);
            assertThat(response.isClosed()).isFalse();
        }
        assertThat(response.isClosed()).isTrue();
    }

    @Test
    public void execute_propagatesTransportFailures() throws IOException {
        IOException failure = new IOException("connection reset");
        when(channel.execute(any())).thenThrow(failure);
        IpSonarClient client = IpSonarClient.create(SERVER, ClientOptions.withChannel(channel));

        assertThatThrownBy(() -> client.lookup("8.8.8.8", null)).isSameAs(failure);
    }

    private static RequestEditor appendHeader(String name, String value) {
        return request -> Request.builder().from(request).putHeaderParams(name, value).build();
    }

    private static String write(RequestBody body) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        body.writeTo(output);
        return new String(output.toByteArray(), StandardCharsets.UTF_8);
    }

    private static final class TextBody implements RequestBody {
        private final byte[] bytes;

        TextBody(String content) {
            this.bytes = content.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void writeTo(OutputStream output) throws IOException {
            output.write(bytes);
        }

        @Override
        public String contentType() {
            return "text/plain";
        }

        @Override
        public boolean repeatable() {
            return true;
        }

        @Override
        public void close() {}
    }
}
