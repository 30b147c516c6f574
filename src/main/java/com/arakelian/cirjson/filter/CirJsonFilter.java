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

package com.arakelian.cirjson.filter;

import java.io.IOException;
import java.io.StringWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.ObjectWriteContext;
import com.arakelian.cirjson.PrettyPrinter;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.util.DefaultPrettyPrinter;
import com.google.common.base.Preconditions;

/**
 * Performs high-speed filtering of a CirJSON document. The document is streamed from a parser to
 * a {@link FilteringGeneratorDelegate}, so no tree is built and no value is materialized that is
 * not written.
 *
 * This class is particularly useful for redacting a CirJSON document (for security purposes), as
 * well as for producing smaller documents prior to deserialization, where only a small number of
 * fields may actually be used. The output always carries identifiers numbered in document order.
 */
public class CirJsonFilter {
    private static final class PrettyWriteContext implements ObjectWriteContext {
        @Override
        public PrettyPrinter getPrettyPrinter() {
            return new DefaultPrettyPrinter();
        }

        @Override
        public void writeValue(final CirJsonGenerator g, final Object value) throws IOException {
            ObjectWriteContext.empty().writeValue(g, value);
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(CirJsonFilter.class);

    /** Path separator when CirJSON is nested **/
    public static final char PATH_SEPARATOR = PathTokenFilter.PATH_SEPARATOR;

    private static final CirJsonFactory DEFAULT_FACTORY = new CirJsonFactory();

    /**
     * Returns the compact version of the given CirJSON string
     *
     * @param s
     *            input string
     * @return compact version of the given CirJSON string
     * @throws IOException
     *             if invalid CirJSON
     */
    public static CharSequence compact(final CharSequence s) throws IOException {
        return identityTransform(s, false);
    }

    /**
     * Returns the compact version of the given CirJSON string; if the input string cannot be
     * parsed for whatever reason, the original input value is returned as-is
     *
     * @param s
     *            input string
     * @return compact version of the given string or original string if invalid CirJSON
     */
    public static CharSequence compactQuietly(final CharSequence s) {
        return identityTransformQuietly(s, false);
    }

    public static CharSequence filter(final CharSequence json, final CirJsonFilterOptions options)
            throws IOException {
        if (json == null || json.length() == 0) {
            return json;
        }

        if (options == null || options.isEmpty() && !options.isIdentityTransform()) {
            return json;
        }

        final CirJsonFactory factory = options.getFactory() != null ? options.getFactory() : DEFAULT_FACTORY;
        final boolean pretty = options.getPretty().orElse(Boolean.FALSE).booleanValue();
        final ObjectWriteContext writeCtxt = pretty ? new PrettyWriteContext() : ObjectWriteContext.empty();

        final StringWriter sw = new StringWriter();
        try (final CirJsonParser parser = factory.createParser(json.toString());
                final CirJsonGenerator generator = factory.createGenerator(writeCtxt, sw)) {
            final CirJsonFilter filter = new CirJsonFilter(parser, generator, options);
            filter.process();
        }

        final StringBuffer buf = sw.getBuffer();
        if (buf.length() == json.length() && buf.toString().contentEquals(json)) {
            // do not needlessly allocate new String if they're identical
            return json;
        }
        return buf.toString();
    }

    private static CharSequence identityTransform(final CharSequence s, final boolean pretty)
            throws IOException {
        if (isCirJsonObjectOrArray(s)) {
            final CirJsonFilterOptions opts = ImmutableCirJsonFilterOptions.builder() //
                    .identityTransform(true) //
                    .pretty(pretty) //
                    .build();
            return filter(s, opts);
        }
        return s;
    }

    private static CharSequence identityTransformQuietly(final CharSequence s, final boolean pretty) {
        try {
            return identityTransform(s, pretty);
        } catch (final IOException e) {
            LOGGER.debug("Unable to transform CirJSON, returning input as-is: {}", e.getMessage());
            return s;
        }
    }

    private static boolean isCirJsonObjectOrArray(final CharSequence s) {
        if (s == null || s.length() == 0) {
            return false;
        }
        final int length = s.length();
        int end = length;
        int start = 0;

        while (start < end && Character.isWhitespace(s.charAt(start))) {
            start++;
        }
        while (start < end && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        final int trimmedLength = end - start;
        if (trimmedLength < 2) {
            return false;
        }
        final char first = s.charAt(start);
        final char last = s.charAt(end - 1);
        return first == '{' && last == '}' || first == '[' && last == ']';
    }

    /**
     * Returns the pretty version of the given string
     *
     * @param str
     *            input string
     * @return pretty version of the given string
     * @throws IOException
     *             if invalid CirJSON
     */
    public static CharSequence prettyify(final CharSequence str) throws IOException {
        return identityTransform(str, true);
    }

    /**
     * Returns the pretty version of the given string; if the input string cannot be parsed for
     * whatever reason, the original input value is returned as-is
     *
     * @param str
     *            input string
     * @return pretty version of the given string or the original string if invalid CirJSON
     */
    public static CharSequence prettyifyQuietly(final CharSequence str) {
        return identityTransformQuietly(str, true);
    }

    private static TokenFilter createTokenFilter(final CirJsonFilterOptions options) {
        if (!options.hasIncludes() && !options.hasExcludes()) {
            return TokenFilter.INCLUDE_ALL;
        }
        return new PathTokenFilter(options.getIncludes(), options.getExcludes());
    }

    /**
     * Filtering options
     */
    private final CirJsonFilterOptions options;

    /**
     * Streaming parser over the input document
     */
    private final CirJsonParser parser;

    /**
     * Generator that drops everything the options exclude before writing to the output
     */
    private final FilteringGeneratorDelegate generator;

    /**
     * Current object depth
     */
    private int depth;

    public CirJsonFilter(
            final CirJsonParser parser,
            final CirJsonGenerator generator,
            final CirJsonFilterOptions options) {
        Preconditions.checkArgument(parser != null, "parser must be non-null");
        Preconditions.checkArgument(generator != null, "generator must be non-null");
        Preconditions.checkArgument(options != null, "options must be non-null");
        this.parser = parser;
        this.options = options;
        this.generator = new FilteringGeneratorDelegate(generator, createTokenFilter(options),
                options.getInclusion(), true);
    }

    /**
     * Returns the property path of the input document that is currently being processed.
     *
     * @return current path, for example <code>/a/b</code>
     */
    public CharSequence getCurrentPath() {
        return parser.getParsingContext().pathAsString();
    }

    public final int getDepth() {
        return depth;
    }

    /**
     * Returns the generator that writes the output. Content written to it directly is not
     * filtered.
     *
     * @return output generator
     */
    public final CirJsonGenerator getGenerator() {
        return generator.getDelegate();
    }

    public final int getMatchCount() {
        return generator.getMatchCount();
    }

    public final CirJsonFilterOptions getOptions() {
        return options;
    }

    private boolean isObjectWritten() {
        final TokenFilterContext ctx = generator.getFilterContext();
        return ctx.isInObject() && ctx.isStartHandled();
    }

    public CirJsonFilter process() throws IOException {
        depth = 0;
        CirJsonToken token = parser.nextToken();
        if (token != CirJsonToken.START_OBJECT && token != CirJsonToken.START_ARRAY) {
            throw new StreamReadException(parser, "Expected start of object or array, but encountered: " + token);
        }

        final CirJsonFilterCallback callback = options.getCallback();
        CirJsonToken last = null;
        int level = 0;
        do {
            switch (token) {
            case START_OBJECT:
                depth++;
                level++;
                generator.copyCurrentEvent(parser);
                break;
            case START_ARRAY:
                level++;
                generator.copyCurrentEvent(parser);
                break;
            case END_OBJECT:
                if (callback != null && isObjectWritten()) {
                    callback.beforeEndObject(this);
                }
                generator.copyCurrentEvent(parser);
                depth--;
                level--;
                break;
            case END_ARRAY:
                generator.copyCurrentEvent(parser);
                level--;
                break;
            case VALUE_STRING:
                generator.copyCurrentEvent(parser);
                if (callback != null && last == CirJsonToken.CIRJSON_ID_PROPERTY_NAME && isObjectWritten()) {
                    callback.afterStartObject(this);
                }
                break;
            default:
                generator.copyCurrentEvent(parser);
                break;
            }
            if (level == 0) {
                break;
            }
            last = token;
            token = parser.nextToken();
        } while (token != null);

        if (level != 0) {
            throw new StreamReadException(parser, "Unexpected end of input");
        }
        token = parser.nextToken();
        if (token != null) {
            throw new StreamReadException(parser, "Expected end of input");
        }
        return this;
    }
}
