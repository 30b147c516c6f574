/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.cirjson.io;

import java.io.DataInput;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Adapts a {@link DataInput} to an {@link InputStream} that reads one byte at a time, so that a
 * parser never consumes more bytes than the document contains. End of the data input is reported
 * as end of stream.
 */
public class DataInputSource extends InputStream {
    private final DataInput input;

    private boolean eof;

    public DataInputSource(final DataInput input) {
        this.input = input;
    }

    @Override
    public int read() throws IOException {
        if (eof) {
            return -1;
        }
        try {
            return input.readUnsignedByte();
        } catch (final EOFException e) {
            eof = true;
            return -1;
        }
    }

    @Override
    public int read(final byte[] b, final int off, final int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        final int c = read();
        if (c < 0) {
            return -1;
        }
        b[off] = (byte) c;
        return 1;
    }
}
