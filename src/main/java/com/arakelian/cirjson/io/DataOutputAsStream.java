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

import java.io.DataOutput;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Adapts a {@link DataOutput} to the {@link OutputStream} interface expected by byte generators.
 */
public class DataOutputAsStream extends OutputStream {
    private final DataOutput output;

    public DataOutputAsStream(final DataOutput output) {
        this.output = output;
    }

    @Override
    public void write(final byte[] b) throws IOException {
        output.write(b, 0, b.length);
    }

    @Override
    public void write(final byte[] b, final int offset, final int length) throws IOException {
        output.write(b, offset, length);
    }

    @Override
    public void write(final int b) throws IOException {
        output.write(b);
    }
}
