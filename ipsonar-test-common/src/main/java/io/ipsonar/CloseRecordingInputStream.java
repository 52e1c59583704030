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

package io.ipsonar;

import com.palantir.logsafe.exceptions.SafeIoException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicInteger;

/** Counts {@link #close()} calls and fails reads once closed, as a socket-backed stream would. */
public final class CloseRecordingInputStream extends FilterInputStream {

    private final AtomicInteger closeCount = new AtomicInteger();

    public CloseRecordingInputStream(InputStream delegate) {
        super(delegate);
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    public int closeCount() {
        return closeCount.get();
    }

    @Override
    public int read() throws IOException {
        checkOpen();
        return super.read();
    }

    @Override
    public int read(byte[] bytes, int off, int len) throws IOException {
        checkOpen();
        return super.read(bytes, off, len);
    }

    @Override
    public long skip(long count) throws IOException {
        checkOpen();
        return super.skip(count);
    }

    @Override
    public int available() throws IOException {
        checkOpen();
        return super.available();
    }

    @Override
    public void close() throws IOException {
        closeCount.incrementAndGet();
        super.close();
    }

    private void checkOpen() throws IOException {
        if (isClosed()) {
            throw new SafeIoException("Stream is closed");
        }
    }
}
