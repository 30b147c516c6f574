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

package com.arakelian.cirjson;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arakelian.cirjson.exc.CirJsonIOException;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.arakelian.cirjson.io.CirJsonEncoding;
import com.arakelian.cirjson.io.ContentReference;
import com.arakelian.cirjson.io.DataInputSource;
import com.arakelian.cirjson.io.DataOutputAsStream;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.io.SerializedString;
import com.arakelian.cirjson.json.ByteSourceCirJsonBootstrapper;
import com.arakelian.cirjson.json.ReaderBasedCirJsonParser;
import com.arakelian.cirjson.json.UTF8CirJsonGenerator;
import com.arakelian.cirjson.json.UTF8StreamCirJsonParser;
import com.arakelian.cirjson.json.WriterBasedCirJsonGenerator;
import com.arakelian.cirjson.json.async.NonBlockingByteArrayCirJsonParser;
import com.arakelian.cirjson.sym.ByteQuadsCanonicalizer;
import com.arakelian.cirjson.sym.CharsToNameCanonicalizer;
import com.arakelian.cirjson.util.BufferRecycler;
import com.arakelian.cirjson.util.DefaultPrettyPrinter;
import com.google.common.base.Preconditions;

/**
 * Thread-safe factory for CirJSON parsers and generators. A factory owns the root symbol tables
 * that its parsers share, so it should be reused rather than created per document.
 */
public class CirJsonFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(CirJsonFactory.class);

    private final CirJsonFactoryOptions options;

    private final CharsToNameCanonicalizer rootCharSymbols;

    private final ByteQuadsCanonicalizer rootByteSymbols;

    private final SerializableString rootValueSeparator;

    public CirJsonFactory() {
        this(CirJsonFactoryOptions.defaults());
    }

    public CirJsonFactory(final CirJsonFactoryOptions options) {
        this.options = Preconditions.checkNotNull(options, "options must be non-null");
        this.rootCharSymbols = CharsToNameCanonicalizer.createRoot(
                options.getStreamReadConstraints(),
                options.isCanonicalizePropertyNames(),
                options.isInternPropertyNames());
        this.rootByteSymbols = ByteQuadsCanonicalizer.createRoot(options.isInternPropertyNames());
        final String sep = options.getRootValueSeparator();
        this.rootValueSeparator = sep != null ? new SerializedString(sep) : null;
    }

    private ContentReference contentReference(final boolean textual, final Object content) {
        if (!StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION.enabledIn(options.getStreamReadFeatures())) {
            return ContentReference.redacted();
        }
        return ContentReference.construct(textual, content);
    }

    private ContentReference contentReference(
            final boolean textual,
            final Object content,
            final int offset,
            final int length) {
        if (!StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION.enabledIn(options.getStreamReadFeatures())) {
            return ContentReference.redacted();
        }
        return ContentReference.construct(textual, content, offset, length);
    }

    /**
     * Creates an I/O context with a buffer recycler taken from the configured pool. The recycler
     * goes back to the pool when the parser or generator using the context is closed.
     *
     * @param contentRef
     *            reference to the input or output
     * @param managedResource
     *            true if the factory opened the input or output itself
     * @param encoding
     *            encoding, if known
     * @return new context
     */
    protected IOContext createContext(
            final ContentReference contentRef,
            final boolean managedResource,
            final CirJsonEncoding encoding) {
        final BufferRecycler recycler = options.getRecyclerPool().acquireAndLinkPooled();
        return new IOContext(options.getStreamReadConstraints(), options.getStreamWriteConstraints(), recycler,
                contentRef, managedResource, encoding).markBufferRecyclerReleased();
    }

    public CirJsonGenerator createGenerator(final DataOutput out) throws IOException {
        return createGenerator(ObjectWriteContext.empty(), out);
    }

    public CirJsonGenerator createGenerator(final File file, final CirJsonEncoding encoding) throws IOException {
        return createGenerator(ObjectWriteContext.empty(), file.toPath(), encoding);
    }

    public CirJsonGenerator createGenerator(final ObjectWriteContext writeCtxt, final DataOutput out)
            throws IOException {
        return createGenerator(writeCtxt, new DataOutputAsStream(out), CirJsonEncoding.UTF8);
    }

    public CirJsonGenerator createGenerator(
            final ObjectWriteContext writeCtxt,
            final OutputStream out,
            final CirJsonEncoding encoding) throws IOException {
        return createGenerator(writeCtxt, out, encoding, false);
    }

    private CirJsonGenerator createGenerator(
            final ObjectWriteContext writeCtxt,
            final OutputStream out,
            final CirJsonEncoding encoding,
            final boolean managedResource) throws IOException {
        Preconditions.checkNotNull(out, "out must be non-null");
        Preconditions.checkNotNull(encoding, "encoding must be non-null");
        final IOContext ctxt = createContext(ContentReference.construct(false, out), managedResource, encoding);
        if (encoding == CirJsonEncoding.UTF8) {
            return new UTF8CirJsonGenerator(writeCtxt, ctxt, options.getStreamWriteFeatures(),
                    options.getFormatWriteFeatures(), out, prettyPrinter(writeCtxt), rootValueSeparator,
                    characterEscapes(writeCtxt));
        }
        final Writer writer = new OutputStreamWriter(out, encoding.getJavaName());
        return new WriterBasedCirJsonGenerator(writeCtxt, ctxt, options.getStreamWriteFeatures(),
                options.getFormatWriteFeatures(), writer, prettyPrinter(writeCtxt), rootValueSeparator,
                    characterEscapes(writeCtxt));
    }

    public CirJsonGenerator createGenerator(
            final ObjectWriteContext writeCtxt,
            final Path path,
            final CirJsonEncoding encoding) throws IOException {
        final OutputStream out;
        try {
            out = Files.newOutputStream(path);
        } catch (final IOException e) {
            throw CirJsonIOException.wrap(e);
        }
        LOGGER.debug("Writing {} to {}", encoding, path);
        return createGenerator(writeCtxt, out, encoding, true);
    }

    public CirJsonGenerator createGenerator(final ObjectWriteContext writeCtxt, final Writer writer) {
        Preconditions.checkNotNull(writer, "writer must be non-null");
        final IOContext ctxt = createContext(ContentReference.construct(false, writer), false, null);
        return new WriterBasedCirJsonGenerator(writeCtxt, ctxt, options.getStreamWriteFeatures(),
                options.getFormatWriteFeatures(), writer, prettyPrinter(writeCtxt), rootValueSeparator,
                    characterEscapes(writeCtxt));
    }

    public CirJsonGenerator createGenerator(final OutputStream out) throws IOException {
        return createGenerator(ObjectWriteContext.empty(), out, CirJsonEncoding.UTF8);
    }

    public CirJsonGenerator createGenerator(final OutputStream out, final CirJsonEncoding encoding)
            throws IOException {
        return createGenerator(ObjectWriteContext.empty(), out, encoding);
    }

    public CirJsonGenerator createGenerator(final Path path, final CirJsonEncoding encoding) throws IOException {
        return createGenerator(ObjectWriteContext.empty(), path, encoding);
    }

    public CirJsonGenerator createGenerator(final Writer writer) {
        return createGenerator(ObjectWriteContext.empty(), writer);
    }

    /**
     * Creates a parser that is fed bytes by the caller instead of reading them, and reports
     * {@link CirJsonToken#NOT_AVAILABLE} when it needs more. Input must be UTF-8.
     *
     * @return non-blocking parser
     */
    public NonBlockingByteArrayCirJsonParser createNonBlockingByteArrayParser() {
        return createNonBlockingByteArrayParser(ObjectReadContext.empty());
    }

    public NonBlockingByteArrayCirJsonParser createNonBlockingByteArrayParser(final ObjectReadContext readCtxt) {
        final IOContext ctxt = createContext(ContentReference.redacted(), false, CirJsonEncoding.UTF8);
        return new NonBlockingByteArrayCirJsonParser(readCtxt, ctxt, options.getStreamReadFeatures(),
                options.getFormatReadFeatures(), rootByteSymbols.makeChild());
    }

    public CirJsonParser createParser(final byte[] data) throws IOException {
        return createParser(ObjectReadContext.empty(), data, 0, data.length);
    }

    public CirJsonParser createParser(final byte[] data, final int offset, final int len) throws IOException {
        return createParser(ObjectReadContext.empty(), data, offset, len);
    }

    public CirJsonParser createParser(final char[] content) {
        return createParser(ObjectReadContext.empty(), content, 0, content.length);
    }

    public CirJsonParser createParser(final char[] content, final int offset, final int len) {
        return createParser(ObjectReadContext.empty(), content, offset, len);
    }

    public CirJsonParser createParser(final DataInput input) throws IOException {
        return createParser(ObjectReadContext.empty(), input);
    }

    public CirJsonParser createParser(final File file) throws IOException {
        return createParser(ObjectReadContext.empty(), file.toPath());
    }

    public CirJsonParser createParser(final InputStream in) throws IOException {
        return createParser(ObjectReadContext.empty(), in);
    }

    public CirJsonParser createParser(
            final ObjectReadContext readCtxt,
            final byte[] data,
            final int offset,
            final int len) throws IOException {
        Preconditions.checkNotNull(data, "data must be non-null");
        Preconditions.checkPositionIndexes(offset, offset + len, data.length);
        final IOContext ctxt = createContext(contentReference(false, data, offset, len), true, null);
        return new ByteSourceCirJsonBootstrapper(ctxt, data, offset, len).constructParser(readCtxt,
                options.getStreamReadFeatures(), options.getFormatReadFeatures(), rootByteSymbols, rootCharSymbols);
    }

    public CirJsonParser createParser(
            final ObjectReadContext readCtxt,
            final char[] content,
            final int offset,
            final int len) {
        Preconditions.checkNotNull(content, "content must be non-null");
        Preconditions.checkPositionIndexes(offset, offset + len, content.length);
        final IOContext ctxt = createContext(contentReference(true, content, offset, len), true, null);
        return new ReaderBasedCirJsonParser(readCtxt, ctxt, options.getStreamReadFeatures(),
                options.getFormatReadFeatures(), rootCharSymbols.makeChild(), content, offset, offset + len);
    }

    /**
     * Creates a parser over a {@link DataInput}. Input must be UTF-8; a leading byte order mark is
     * skipped. The parser reads one byte at a time so that it never consumes bytes past the end of
     * the document.
     *
     * @param readCtxt
     *            object read context
     * @param input
     *            data input
     * @return new parser
     * @throws IOException
     *             if the input starts with a broken byte order mark
     */
    public CirJsonParser createParser(final ObjectReadContext readCtxt, final DataInput input) throws IOException {
        Preconditions.checkNotNull(input, "input must be non-null");
        final IOContext ctxt = createContext(contentReference(false, input), false, CirJsonEncoding.UTF8);
        final int first = ByteSourceCirJsonBootstrapper.skipUTF8BOM(input);
        final byte[] buf = ctxt.allocReadIOBuffer();
        int end = 0;
        if (first >= 0) {
            buf[end++] = (byte) first;
        }
        return new UTF8StreamCirJsonParser(readCtxt, ctxt, options.getStreamReadFeatures(),
                options.getFormatReadFeatures(), new DataInputSource(input), rootByteSymbols.makeChild(), buf, 0,
                end, 0, true);
    }

    public CirJsonParser createParser(final ObjectReadContext readCtxt, final InputStream in) throws IOException {
        Preconditions.checkNotNull(in, "in must be non-null");
        final IOContext ctxt = createContext(contentReference(false, in), false, null);
        return new ByteSourceCirJsonBootstrapper(ctxt, in).constructParser(readCtxt,
                options.getStreamReadFeatures(), options.getFormatReadFeatures(), rootByteSymbols, rootCharSymbols);
    }

    public CirJsonParser createParser(final ObjectReadContext readCtxt, final Path path) throws IOException {
        final InputStream in;
        try {
            in = Files.newInputStream(path);
        } catch (final IOException e) {
            throw CirJsonIOException.wrap(e);
        }
        LOGGER.debug("Reading {}", path);
        final IOContext ctxt = createContext(contentReference(false, path), true, null);
        return new ByteSourceCirJsonBootstrapper(ctxt, in).constructParser(readCtxt,
                options.getStreamReadFeatures(), options.getFormatReadFeatures(), rootByteSymbols, rootCharSymbols);
    }

    public CirJsonParser createParser(final ObjectReadContext readCtxt, final Reader reader) {
        Preconditions.checkNotNull(reader, "reader must be non-null");
        final IOContext ctxt = createContext(contentReference(true, reader), false, null);
        return new ReaderBasedCirJsonParser(readCtxt, ctxt, options.getStreamReadFeatures(),
                options.getFormatReadFeatures(), reader, rootCharSymbols.makeChild());
    }

    public CirJsonParser createParser(final ObjectReadContext readCtxt, final String content) {
        Preconditions.checkNotNull(content, "content must be non-null");
        final char[] chars = content.toCharArray();
        return createParser(readCtxt, chars, 0, chars.length);
    }

    public CirJsonParser createParser(final Path path) throws IOException {
        return createParser(ObjectReadContext.empty(), path);
    }

    public CirJsonParser createParser(final Reader reader) {
        return createParser(ObjectReadContext.empty(), reader);
    }

    public CirJsonParser createParser(final String content) {
        return createParser(ObjectReadContext.empty(), content);
    }

    public CirJsonFactoryOptions getOptions() {
        return options;
    }

    public boolean isEnabled(final CirJsonReadFeature f) {
        return f.enabledIn(options.getFormatReadFeatures());
    }

    public boolean isEnabled(final CirJsonWriteFeature f) {
        return f.enabledIn(options.getFormatWriteFeatures());
    }

    public boolean isEnabled(final StreamReadFeature f) {
        return f.enabledIn(options.getStreamReadFeatures());
    }

    public boolean isEnabled(final StreamWriteFeature f) {
        return f.enabledIn(options.getStreamWriteFeatures());
    }

    private CharacterEscapes characterEscapes(final ObjectWriteContext writeCtxt) {
        final CharacterEscapes esc = writeCtxt.getCharacterEscapes();
        return esc != null ? esc : options.getCharacterEscapes();
    }

    private PrettyPrinter prettyPrinter(final ObjectWriteContext writeCtxt) {
        final PrettyPrinter pp = writeCtxt.getPrettyPrinter();
        if (pp != null) {
            return pp;
        }
        return options.isPretty() ? new DefaultPrettyPrinter() : null;
    }
}
