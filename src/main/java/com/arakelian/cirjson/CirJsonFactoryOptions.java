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

import java.util.Optional;
import java.util.Set;

import javax.annotation.Nullable;

import org.immutables.value.Value;

import com.arakelian.cirjson.io.CharacterEscapes;
import com.arakelian.cirjson.util.BufferRecycler;
import com.arakelian.cirjson.util.CirJsonRecyclerPools;
import com.arakelian.cirjson.util.DefaultPrettyPrinter;
import com.arakelian.cirjson.util.RecyclerPool;

/**
 * Configuration of a {@link CirJsonFactory}. Features not named in an enabled or disabled set keep
 * their default state.
 *
 * <pre>
 * CirJsonFactoryOptions options = ImmutableCirJsonFactoryOptions.builder() //
 *         .addEnabledReadFeatures(CirJsonReadFeature.ALLOW_TRAILING_COMMA) //
 *         .pretty(true) //
 *         .build();
 * </pre>
 */
@Value.Immutable(copy = false)
@Value.Style(get = { "get*", "is*" })
public abstract class CirJsonFactoryOptions {
    private static final CirJsonFactoryOptions DEFAULTS = ImmutableCirJsonFactoryOptions.builder().build();

    public static CirJsonFactoryOptions defaults() {
        return DEFAULTS;
    }

    private static <F extends Enum<F> & CirJsonFeature> int mask(
            final int defaults,
            final Set<F> enabled,
            final Set<F> disabled) {
        int flags = defaults;
        for (final F f : enabled) {
            flags |= f.getMask();
        }
        for (final F f : disabled) {
            flags &= ~f.getMask();
        }
        return flags;
    }

    /**
     * Returns the custom escaping used by generators, or null for the standard escapes.
     *
     * @return character escapes, may be null
     */
    @Nullable
    public abstract CharacterEscapes getCharacterEscapes();

    public abstract Set<CirJsonReadFeature> getDisabledReadFeatures();

    public abstract Set<StreamReadFeature> getDisabledStreamReadFeatures();

    public abstract Set<StreamWriteFeature> getDisabledStreamWriteFeatures();

    public abstract Set<CirJsonWriteFeature> getDisabledWriteFeatures();

    public abstract Set<CirJsonReadFeature> getEnabledReadFeatures();

    public abstract Set<StreamReadFeature> getEnabledStreamReadFeatures();

    public abstract Set<StreamWriteFeature> getEnabledStreamWriteFeatures();

    public abstract Set<CirJsonWriteFeature> getEnabledWriteFeatures();

    @Value.Derived
    public int getFormatReadFeatures() {
        return mask(
                CirJsonFeature.collectDefaults(CirJsonReadFeature.class),
                getEnabledReadFeatures(),
                getDisabledReadFeatures());
    }

    @Value.Derived
    public int getFormatWriteFeatures() {
        return mask(
                CirJsonFeature.collectDefaults(CirJsonWriteFeature.class),
                getEnabledWriteFeatures(),
                getDisabledWriteFeatures());
    }

    /**
     * Returns true if generators should indent their output with a {@link DefaultPrettyPrinter}.
     *
     * @return true if generators pretty print
     */
    public abstract Optional<Boolean> getPretty();

    @Value.Default
    public RecyclerPool<BufferRecycler> getRecyclerPool() {
        return CirJsonRecyclerPools.defaultPool();
    }

    /**
     * Returns the separator written between root-level values by generators without a pretty
     * printer.
     *
     * @return root value separator
     */
    @Value.Default
    public String getRootValueSeparator() {
        return DefaultPrettyPrinter.DEFAULT_ROOT_VALUE_SEPARATOR;
    }

    @Value.Default
    public StreamReadConstraints getStreamReadConstraints() {
        return StreamReadConstraints.defaults();
    }

    @Value.Derived
    public int getStreamReadFeatures() {
        return mask(
                CirJsonFeature.collectDefaults(StreamReadFeature.class),
                getEnabledStreamReadFeatures(),
                getDisabledStreamReadFeatures());
    }

    @Value.Default
    public StreamWriteConstraints getStreamWriteConstraints() {
        return StreamWriteConstraints.defaults();
    }

    @Value.Derived
    public int getStreamWriteFeatures() {
        return mask(
                CirJsonFeature.collectDefaults(StreamWriteFeature.class),
                getEnabledStreamWriteFeatures(),
                getDisabledStreamWriteFeatures());
    }

    /**
     * Returns true if property names should be canonicalized through the factory's symbol
     * tables, so that repeated names share one String instance.
     *
     * @return true if property names are canonicalized
     */
    @Value.Default
    public boolean isCanonicalizePropertyNames() {
        return true;
    }

    @Value.Default
    public boolean isInternPropertyNames() {
        return false;
    }

    public final boolean isPretty() {
        return getPretty().orElse(Boolean.FALSE).booleanValue();
    }
}
