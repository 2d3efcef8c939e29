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

import org.agrona.AsciiNumberFormatException;

/**
 * Thrown when text doesn't match the decimal floating point grammar:
 * <pre>
 *   "nan" | "inf" | "+inf" | "-inf" | [sign] digit* ["." digit*] [("e"|"E") [sign] digit+]
 * </pre>
 * This is the only failure of parsing, values too large or too small to represent are not errors.
 */
public class InvalidCharacterException extends AsciiNumberFormatException
{
    private static final long serialVersionUID = 1L;

    /**
     * Reported by {@link #index()} when the input was empty.
     */
    public static final int NO_INDEX = -1;

    private final int index;

    public InvalidCharacterException(final String message, final int index)
    {
        super(message);
        this.index = index;
    }

    /**
     * @return the position of the offending character within the parsed data, or {@link #NO_INDEX}.
     */
    public int index()
    {
        return index;
    }

    static InvalidCharacterException emptyInput()
    {
        return new InvalidCharacterException("empty input isn't a valid number", NO_INDEX);
    }

    static <Data> InvalidCharacterException invalidCharacter(
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length,
        final int index)
    {
        return new InvalidCharacterException(
            "'" + charReader.charAt(data, index) + "' isn't a valid character @ " + index + " in: " +
            charReader.asString(data, offset, length),
            index);
    }

    static <Data> InvalidCharacterException missingExponentDigits(
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        final int index = offset + length;
        return new InvalidCharacterException(
            "missing exponent digits @ " + index + " in: " + charReader.asString(data, offset, length),
            index);
    }
}
