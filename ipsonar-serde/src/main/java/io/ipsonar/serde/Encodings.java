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

package io.ipsonar.serde;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.base.Suppliers;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIoException;
import io.ipsonar.RequestBody;
import java.io.IOException;
import java.util.Locale;
import java.util.function.Supplier;
import javax.annotation.Nullable;

public final class Encodings {

    private static final String JSON_CONTENT_TYPE = "application/json";

    private Encodings() {}

    private static final Supplier<ObjectMapper> JSON_MAPPER = Suppliers.memoize(Encodings::newJsonMapper);

    /** Returns the JSON encoding used for all ip-sonar request and response bodies. */
    public static Encoding json() {
        return new JacksonEncoding(JSON_MAPPER.get(), JSON_CONTENT_TYPE);
    }

    /** Serializes the given value into a repeatable {@link RequestBody} of this encoding's content type. */
    public static <T> RequestBody body(Encoding encoding, Class<T> type, T value) throws IOException {
        return EncodedRequestBody.of(encoding.serializer(type), value, encoding.getContentType());
    }

    /** Returns true if the given <pre>Content-Type</pre> value denotes any JSON media type. */
    public static boolean isJson(@Nullable String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    private static ObjectMapper newJsonMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(new GuavaModule())
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                // See documentation on Encoding.Serializer#serialize: Implementations must not close the stream.
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
    }

    private static final class JacksonEncoding implements Encoding {

        private final ObjectMapper mapper;
        private final String contentType;

        JacksonEncoding(ObjectMapper mapper, String contentType) {
            this.mapper = Preconditions.checkNotNull(mapper, "ObjectMapper is required");
            this.contentType = contentType;
        }

        @Override
        public <T> Serializer<T> serializer(Class<T> type) {
            ObjectWriter writer = mapper.writerFor(type);
            return (value, output) ->
                    writer.writeValue(output, Preconditions.checkNotNull(value, "cannot serialize null value"));
        }

        @Override
        public <T> Deserializer<T> deserializer(Class<T> type) {
            ObjectReader reader = mapper.readerFor(type);
            return input -> {
                T value = reader.readValue(input);
                if (value == null) {
                    throw new SafeIoException(
                            "cannot deserialize a JSON null value", SafeArg.of("type", type.getSimpleName()));
                }
                return value;
            };
        }

        @Override
        public String getContentType() {
            return contentType;
        }

        @Override
        public String toString() {
            return "JacksonEncoding{" + contentType + '}';
        }
    }
}
