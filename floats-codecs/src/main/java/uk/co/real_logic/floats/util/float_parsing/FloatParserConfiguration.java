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
package uk.co.real_logic.floats.util.float_parsing;

public final class FloatParserConfiguration
{
    /**
     * Boolean system property to stop recognising "nan", "inf", "+inf" and "-inf". Defaults to false.
     * <p>
     * When set those literals are rejected with an {@link InvalidCharacterException} like any other letters,
     * which suits inputs where only finite numbers are legal.
     */
    public static final String DISABLE_SPECIAL_LITERALS_PROPERTY = "floats.parser.disable_special_literals";

    private boolean specialLiteralsEnabled = !Boolean.getBoolean(DISABLE_SPECIAL_LITERALS_PROPERTY);
    private DigitTruncationHandler digitTruncationHandler;

    public FloatParserConfiguration()
    {
    }

    /**
     * Sets whether special literals are parsed into NaN and infinities.
     *
     * Defaults to the inverse of the value of the {@link #DISABLE_SPECIAL_LITERALS_PROPERTY} system property.
     *
     * @param specialLiteralsEnabled true to accept "nan" and "inf" literals, false to reject them.
     * @return this
     */
    public FloatParserConfiguration specialLiteralsEnabled(final boolean specialLiteralsEnabled)
    {
        this.specialLiteralsEnabled = specialLiteralsEnabled;
        return this;
    }

    /**
     * Sets a handler to be notified when significant digits beyond the precision of the format are dropped.
     * Optional, by default they are dropped silently.
     *
     * @param digitTruncationHandler the handler, or null to drop digits silently.
     * @return this
     */
    public FloatParserConfiguration digitTruncationHandler(final DigitTruncationHandler digitTruncationHandler)
    {
        this.digitTruncationHandler = digitTruncationHandler;
        return this;
    }

    public boolean specialLiteralsEnabled()
    {
        return specialLiteralsEnabled;
    }

    public DigitTruncationHandler digitTruncationHandler()
    {
        return digitTruncationHandler;
    }
}
