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

import java.util.Optional;
import java.util.Set;

import javax.annotation.Nullable;

import org.immutables.value.Value;

import com.arakelian.cirjson.CirJsonFactory;
import com.arakelian.cirjson.filter.TokenFilter.Inclusion;

@Value.Immutable(copy = false)
@Value.Style(get = { "get*", "is*" })
public abstract class CirJsonFilterOptions {
    @Nullable
    public abstract CirJsonFilterCallback getCallback();

    @Nullable
    public abstract Set<String> getExcludes();

    /**
     * Returns the factory used to create the parser and generator, or null for a shared default
     * factory.
     *
     * @return factory, may be null
     */
    @Nullable
    public abstract CirJsonFactory getFactory();

    @Nullable
    public abstract Set<String> getIncludes();

    @Value.Default
    public Inclusion getInclusion() {
        return Inclusion.INCLUDE_ALL_AND_PATH;
    }

    public abstract Optional<Boolean> getPretty();

    public final boolean hasCallback() {
        return getCallback() != null;
    }

    public final boolean hasExcludes() {
        final Set<String> excludes = getExcludes();
        return excludes != null && excludes.size() != 0;
    }

    public final boolean hasIncludes() {
        final Set<String> includes = getIncludes();
        return includes != null && includes.size() != 0;
    }

    public final boolean isEmpty() {
        return !hasIncludes() && !hasExcludes() && !hasCallback();
    }

    /**
     * Returns true if an identity-transform is requested, e.g. includes and excludes are empty but
     * caller still wants filter applied for pretty printing or for renumbering identifiers.
     *
     * @return true if an identity-transform is requested
     */
    @Value.Default
    public boolean isIdentityTransform() {
        return false;
    }
}
