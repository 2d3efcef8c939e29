/*
 * Copyright 2015-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package uk.co.real_logic.floats;

public enum LogTag
{
    /**
     * Logs special literals (nan, inf) that short-circuit the decimal conversion.
     */
    FLOAT_PARSING,

    /**
     * Logs inputs with more significant digits than the target format takes into account. The extra digits only
     * move the decimal exponent, they don't take part in rounding.
     */
    DIGIT_TRUNCATION,

    /**
     * Logs inputs whose exponent has so many digits that the value is saturated to zero or infinity without
     * computing it.
     */
    EXPONENT_SATURATION;

    private final char[] logStr;

    LogTag()
    {
        logStr = ("[" + name() + "]").toCharArray();
    }

    public char[] logStr()
    {
        return logStr;
    }
}
