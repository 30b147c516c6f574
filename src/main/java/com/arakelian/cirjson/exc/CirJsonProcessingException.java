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

package com.arakelian.cirjson.exc;

import java.io.IOException;

import com.arakelian.cirjson.CirJsonLocation;

/**
 * Base class for all problems encountered while reading or writing CirJSON content. Like the
 * readers and writers that throw it, this is a checked {@link IOException}.
 */
public class CirJsonProcessingException extends IOException {
    private static final long serialVersionUID = 1L;

    /** Location of the problem, if known **/
    protected transient CirJsonLocation location;

    public CirJsonProcessingException(final String msg) {
        this(msg, null, null);
    }

    public CirJsonProcessingException(final String msg, final CirJsonLocation location) {
        this(msg, location, null);
    }

    public CirJsonProcessingException(final String msg, final CirJsonLocation location, final Throwable cause) {
        super(msg, cause);
        this.location = location;
    }

    public CirJsonProcessingException(final String msg, final Throwable cause) {
        this(msg, null, cause);
    }

    /**
     * Returns the location of the problem within the input or output, or null if not available.
     *
     * @return location of the problem
     */
    public CirJsonLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        if (msg == null) {
            msg = "N/A";
        }
        final String suffix = getMessageSuffix();
        if (location == null && suffix == null) {
            return msg;
        }

        final StringBuilder sb = new StringBuilder(100);
        sb.append(msg);
        if (suffix != null) {
            sb.append(suffix);
        }
        if (location != null) {
            sb.append("\n at ").append(location.toString());
        }
        return sb.toString();
    }

    /**
     * Returns extra information appended to the message, by default none.
     *
     * @return message suffix or null
     */
    protected String getMessageSuffix() {
        return null;
    }

    /**
     * Returns the message without location information.
     *
     * @return the original message
     */
    public String getOriginalMessage() {
        return super.getMessage();
    }

    /**
     * Returns the parser or generator that threw this exception, if known.
     *
     * @return the source of this exception
     */
    public Object getProcessor() {
        return null;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + getMessage();
    }
}
