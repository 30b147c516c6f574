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

import com.google.common.io.BaseEncoding;

/**
 * Standard {@link Base64Variant} instances.
 */
public final class Base64Variants {
    /** Standard alphabet with padding, lines wrapped at 76 characters **/
    public static final Base64Variant MIME = new Base64Variant("MIME", BaseEncoding.base64(), true, 76);

    /** Same as {@link #MIME} without line wrapping; the default **/
    public static final Base64Variant MIME_NO_LINEFEEDS = new Base64Variant("MIME-NO-LINEFEEDS",
            BaseEncoding.base64(), true, Integer.MAX_VALUE);

    /** Standard alphabet with padding, lines wrapped at 64 characters **/
    public static final Base64Variant PEM = new Base64Variant("PEM", BaseEncoding.base64(), true, 64);

    /** URL-safe alphabet without padding or line wrapping **/
    public static final Base64Variant MODIFIED_FOR_URL = new Base64Variant("MODIFIED-FOR-URL",
            BaseEncoding.base64Url(), false, Integer.MAX_VALUE);

    public static Base64Variant getDefaultVariant() {
        return MIME_NO_LINEFEEDS;
    }

    public static Base64Variant valueOf(final String name) throws IllegalArgumentException {
        if (MIME.getName().equals(name)) {
            return MIME;
        }
        if (MIME_NO_LINEFEEDS.getName().equals(name)) {
            return MIME_NO_LINEFEEDS;
        }
        if (PEM.getName().equals(name)) {
            return PEM;
        }
        if (MODIFIED_FOR_URL.getName().equals(name)) {
            return MODIFIED_FOR_URL;
        }
        throw new IllegalArgumentException("No Base64Variant with name '" + name + "'");
    }

    private Base64Variants() {
    }
}
