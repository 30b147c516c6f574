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

/**
 * Integer ids of {@link CirJsonToken} values, usable in {@code switch} statements.
 */
public final class CirJsonTokenId {
    public static final int ID_NOT_AVAILABLE = -1;

    public static final int ID_NO_TOKEN = 0;

    public static final int ID_START_OBJECT = 1;

    public static final int ID_END_OBJECT = 2;

    public static final int ID_START_ARRAY = 3;

    public static final int ID_END_ARRAY = 4;

    public static final int ID_PROPERTY_NAME = 5;

    public static final int ID_STRING = 6;

    public static final int ID_NUMBER_INT = 7;

    public static final int ID_NUMBER_FLOAT = 8;

    public static final int ID_TRUE = 9;

    public static final int ID_FALSE = 10;

    public static final int ID_NULL = 11;

    public static final int ID_EMBEDDED_OBJECT = 12;

    public static final int ID_CIRJSON_ID_PROPERTY_NAME = 13;

    private CirJsonTokenId() {
    }
}
