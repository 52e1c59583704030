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
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.exceptions.SafeIoException;
import io.ipsonar.TestResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public final class IpSonarResponsesTest {

    private static final String GEOLOCATION = "{\"ip\":\"192.168.1.1\",\"country_code\":\"US\",\"is_in_eu\":false}";
    private static final String ERROR = "{\"message\":\"Invalid API key\"}";

    @Test
    public void lookup_ok() throws IOException {
        TestResponse raw = TestResponse.json(200, GEOLOCATION).status("200 OK");
        LookupResponse response = IpSonarResponses.parseLookupResponse(raw);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.status()).isEqualTo("200 OK");
        assertThat(response.contentType()).hasValue("application/json");
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo(GEOLOCATION);
        assertThat(response.ok()).hasValueSatisfying(geolocation -> {
            assertThat(geolocation.ip()).hasValue("192.168.1.1");
            assertThat(geolocation.countryCode()).hasValue("US");
            assertThat(geolocation.isInEu()).hasValue(false);
            assertThat(geolocation.cityName()).isEmpty();
        });
        assertThat(response.unauthorized()).isEmpty();
        assertThat(response.notFound()).isEmpty();
        assertThat(response.unprocessableEntity()).isEmpty();
        assertThat(response.tooManyRequests()).isEmpty();
        assertThat(raw.isClosed()).isTrue();
        assertThat(raw.body().closeCount()).isEqualTo(2);
    }

    @Test
    public void lookup_errorStatuses() throws IOException {
        assertThat(IpSonarResponses.parseLookupResponse(TestResponse.json(401, ERROR))
                        .unauthorized())
                .hasValue(ErrorMessage.of("Invalid API key"));
        assertThat(IpSonarResponses.parseLookupResponse(TestResponse.json(404, ERROR))
                        .notFound())
                .hasValue(ErrorMessage.of("Invalid API key"));
        assertThat(IpSonarResponses.parseLookupResponse(TestResponse.json(422, ERROR))
                        .unprocessableEntity())
                .hasValue(ErrorMessage.of("Invalid API key"));
        assertThat(IpSonarResponses.parseLookupResponse(TestResponse.json(429, ERROR))
                        .tooManyRequests())
                .hasValue(ErrorMessage.of("Invalid API key"));
    }

    @Test
    public void lookup_undeclaredStatusKeepsRawBody() throws IOException {
        LookupResponse response = IpSonarResponses.parseLookupResponse(TestResponse.json(500, "not even json"));

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("not even json");
        assertThat(response.ok()).isEmpty();
        assertThat(response.unauthorized()).isEmpty();
        assertThat(response.notFound()).isEmpty();
        assertThat(response.unprocessableEntity()).isEmpty();
        assertThat(response.tooManyRequests()).isEmpty();
    }

    @Test
    public void lookup_nonJsonContentTypeIsNotDecoded() throws IOException {
        TestResponse raw = TestResponse.withBody(GEOLOCATION).contentType("text/plain");
        LookupResponse response = IpSonarResponses.parseLookupResponse(raw);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.contentType()).hasValue("text/plain");
        assertThat(response.ok()).isEmpty();
        assertThat(response.body()).containsExactly(GEOLOCATION.getBytes(StandardCharsets.UTF_8));
        assertThat(raw.isClosed()).isTrue();
    }

    @Test
    public void lookup_missingContentTypeIsNotDecoded() throws IOException {
        LookupResponse response = IpSonarResponses.parseLookupResponse(TestResponse.withBody(GEOLOCATION));

        assertThat(response.contentType()).isEmpty();
        assertThat(response.ok()).isEmpty();
    }

    @Test
    public void lookup_jsonContentTypeWithParameters() throws IOException {
        LookupResponse response = IpSonarResponses.parseLookupResponse(
                TestResponse.withBody(GEOLOCATION).contentType("application/json; charset=utf-8"));

        assertThat(response.ok()).isPresent();
    }

    @Test
    public void lookup_malformedJsonFails() {
        TestResponse raw = TestResponse.json(200, "{\"ip\":");
        SafeIoException exception =
                catchThrowableOfType(() -> IpSonarResponses.parseLookupResponse(raw), SafeIoException.class);

        assertThat(exception).hasMessageStartingWith("Failed to decode response body");
        assertThat(exception).hasCauseInstanceOf(IOException.class);
        assertThat(exception.getArgs())
                .containsExactly(SafeArg.of("operation", "lookup"), SafeArg.of("statusCode", 200));
        assertThat(raw.isClosed()).isTrue();
    }

    @Test
    public void lookup_jsonNullFails() {
        assertThatThrownBy(() -> IpSonarResponses.parseLookupResponse(TestResponse.json(200, "null")))
                .isInstanceOf(SafeIoException.class)
                .hasMessageStartingWith("Failed to decode response body");
    }

    @Test
    public void lookup_malformedErrorBodyFails() {
        assertThatThrownBy(() -> IpSonarResponses.parseLookupResponse(TestResponse.json(404, "<html>")))
                .isInstanceOf(SafeIoException.class)
                .hasMessageStartingWith("Failed to decode response body");
    }

    @Test
    public void errorMessage_defaultsToEmpty() throws IOException {
        LookupResponse response = IpSonarResponses.parseLookupResponse(TestResponse.json(429, "{}"));
        assertThat(response.tooManyRequests()).hasValue(ErrorMessage.of(""));
    }

    @Test
    public void lookupMy_statuses() throws IOException {
        LookupMyResponse ok = IpSonarResponses.parseLookupMyResponse(TestResponse.json(200, GEOLOCATION));
        assertThat(ok.ok().flatMap(IpGeolocation::ip)).hasValue("192.168.1.1");

        assertThat(IpSonarResponses.parseLookupMyResponse(TestResponse.json(401, ERROR))
                        .unauthorized())
                .isPresent();
        assertThat(IpSonarResponses.parseLookupMyResponse(TestResponse.json(429, ERROR))
                        .tooManyRequests())
                .isPresent();
        assertThat(IpSonarResponses.parseLookupMyResponse(TestResponse.json(500, ERROR))
                        .internalServerError())
                .hasValue(ErrorMessage.of("Invalid API key"));
    }

    @Test
    public void lookupMy_notFoundIsUndeclared() throws IOException {
        LookupMyResponse response = IpSonarResponses.parseLookupMyResponse(
                TestResponse.json(404, ERROR).status("404 Not Found"));

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.status()).isEqualTo("404 Not Found");
        assertThat(response.ok()).isEmpty();
        assertThat(response.unauthorized()).isEmpty();
        assertThat(response.tooManyRequests()).isEmpty();
        assertThat(response.internalServerError()).isEmpty();
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo(ERROR);
    }

    @Test
    public void batchLookup_ok() throws IOException {
        String body = "{\"data\":[{\"ip\":\"1.1.1.1\",\"city_name\":\"\"},{\"ip\":\"8.8.8.8\"},{}]}";
        BatchLookupResponse response = IpSonarResponses.parseBatchLookupResponse(TestResponse.json(200, body));

        assertThat(response.ok()).hasValueSatisfying(batch -> {
            assertThat(batch.data()).hasSize(3);
            assertThat(batch.data().get(0).ip()).hasValue("1.1.1.1");
            assertThat(batch.data().get(0).cityName()).hasValue("");
            assertThat(batch.data().get(1).ip()).hasValue("8.8.8.8");
            assertThat(batch.data().get(1).cityName()).isEmpty();
            assertThat(batch.data().get(2)).isEqualTo(IpGeolocation.builder().build());
        });
    }

    @Test
    public void batchLookup_statuses() throws IOException {
        assertThat(IpSonarResponses.parseBatchLookupResponse(TestResponse.json(401, ERROR))
                        .unauthorized())
                .isPresent();
        assertThat(IpSonarResponses.parseBatchLookupResponse(TestResponse.json(422, ERROR))
                        .unprocessableEntity())
                .isPresent();
        assertThat(IpSonarResponses.parseBatchLookupResponse(TestResponse.json(429, ERROR))
                        .tooManyRequests())
                .isPresent();
        assertThat(IpSonarResponses.parseBatchLookupResponse(TestResponse.json(500, ERROR))
                        .internalServerError())
                .isPresent();
    }

    @Test
    public void batchLookup_notFoundIsUndeclared() throws IOException {
        BatchLookupResponse response = IpSonarResponses.parseBatchLookupResponse(TestResponse.json(404, ERROR));

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.ok()).isEmpty();
        assertThat(response.unauthorized()).isEmpty();
        assertThat(response.unprocessableEntity()).isEmpty();
        assertThat(response.tooManyRequests()).isEmpty();
        assertThat(response.internalServerError()).isEmpty();
    }

    @Test
    public void batchLookup_malformedJsonReportsOperation() {
        SafeIoException exception = catchThrowableOfType(
                () -> IpSonarResponses.parseBatchLookupResponse(TestResponse.json(422, "{")), SafeIoException.class);
        assertThat(exception.getArgs())
                .containsExactly(SafeArg.of("operation", "batchLookup"), SafeArg.of("statusCode", 422));
    }

    @Test
    public void typedResponses_allowAtMostOneDecodedBody() {
        assertThatThrownBy(() -> LookupResponse.builder()
                        .statusCode(200)
                        .status("200")
                        .body(new byte[0])
                        .ok(IpGeolocation.builder().build())
                        .notFound(ErrorMessage.of("both"))
                        .build())
                .isInstanceOf(SafeIllegalStateException.class);
    }
}
