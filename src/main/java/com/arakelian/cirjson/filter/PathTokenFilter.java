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

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Filter that includes or excludes properties by path. A path is the list of property names
 * leading to a value, separated by {@link #PATH_SEPARATOR}; arrays do not add a segment, so
 * <code>a/b</code> matches property <code>b</code> of every object in an array under
 * <code>a</code>.
 *
 * <p>
 * Excludes are checked first and remove the whole subtree below them. If any includes are given,
 * a property is kept only if it is on one of them, or on the way to one of them; otherwise
 * everything that is not excluded is kept. Containers on the way to an include are written even
 * when nothing below them matches.
 * </p>
 */
public class PathTokenFilter extends TokenFilter {
    /** Path separator when CirJSON is nested **/
    public static final char PATH_SEPARATOR = '/';

    private static String normalize(final String path) {
        if (path.length() > 0 && path.charAt(0) == PATH_SEPARATOR) {
            // ignore leading slash
            return path.substring(1);
        }
        return path;
    }

    private static ImmutableSet<String> normalize(final Set<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return ImmutableSet.of();
        }
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (final String path : paths) {
            builder.add(normalize(path));
        }
        return builder.build();
    }

    /**
     * Returns true if <code>path</code> equals <code>prefix</code> or lies below it.
     */
    private static boolean pathStartsWith(final String path, final String prefix) {
        if (!path.startsWith(prefix)) {
            return false;
        }
        // path must start with prefix + "/"
        return path.length() == prefix.length() || path.charAt(prefix.length()) == PATH_SEPARATOR;
    }

    /** Path patterns which are included **/
    private final ImmutableSet<String> includes;

    /** Path patterns which are excluded **/
    private final ImmutableSet<String> excludes;

    /** Path of the object whose properties this filter checks, empty at the root **/
    private final String path;

    public PathTokenFilter(final Set<String> includes, final Set<String> excludes) {
        this(normalize(includes), normalize(excludes), "");
    }

    private PathTokenFilter(
            final ImmutableSet<String> includes,
            final ImmutableSet<String> excludes,
            final String path) {
        this.includes = includes;
        this.excludes = excludes;
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    private boolean hasExcludeBelow(final String p) {
        for (final String exclude : excludes) {
            if (exclude.length() > p.length() && pathStartsWith(exclude, p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Containers on the way to an include are kept, like their names.
     */
    @Override
    public boolean includeEmptyArray(final boolean contentsFiltered) {
        return true;
    }

    @Override
    public boolean includeEmptyObject(final boolean contentsFiltered) {
        return true;
    }

    @Override
    public TokenFilter includeProperty(final String name) {
        final String p = path.isEmpty() ? name : path + PATH_SEPARATOR + name;

        // excludes are always processed first!
        for (final String exclude : excludes) {
            if (pathStartsWith(p, exclude)) {
                return null;
            }
        }

        boolean within = includes.isEmpty();
        boolean onTheWay = false;
        for (final String include : includes) {
            if (pathStartsWith(p, include)) {
                within = true;
                break;
            }
            if (pathStartsWith(include, p)) {
                // need to go deeper for a match
                onTheWay = true;
            }
        }

        if (within) {
            return hasExcludeBelow(p) ? new PathTokenFilter(includes, excludes, p) : INCLUDE_ALL;
        }
        return onTheWay ? new PathTokenFilter(includes, excludes, p) : null;
    }

    @Override
    public String toString() {
        return "PathTokenFilter[" + (path.isEmpty() ? "/" : path) + "]";
    }
}
