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

import com.palantir.logsafe.Preconditions;
import io.ipsonar.RequestBody;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.OptionalLong;

/** A {@link RequestBody} holding an eagerly serialized value, so that it can be written any number of times. */
final class EncodedRequestBody implements RequestBody {

    private final byte[] bytes;
    private final String contentType;

    private EncodedRequestBody(byte[] bytes, String contentType) {
        this.bytes = bytes;
        this.contentType = contentType;
    }

    static <T> EncodedRequestBody of(Encoding.Serializer<T> serializer, T value, String contentType)
            throws IOException {
        Preconditions.checkNotNull(value, "cannot serialize null value");
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        serializer.serialize(value, output);
        return new EncodedRequestBody(output.toByteArray(), contentType);
    }

    @Override
    public void writeTo(OutputStream output) throws IOException {
        output.write(bytes);
    }

    @Override
    public String contentType() {
        return contentType;
    }

    @Override
    public boolean repeatable() {
        return true;
    }

    @Override
    public OptionalLong contentLength() {
        return OptionalLong.of(bytes.length);
    }

    @Override
    public void close() {}

    @Override
    public String toString() {
        return "EncodedRequestBody{contentType=" + contentType + ", contentLength=" + bytes.length + '}';
    }
}
