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

import uk.co.real_logic.floats.fields.FloatFormat;

import static uk.co.real_logic.floats.util.float_parsing.CharReader.NOT_A_DIGIT;
import static uk.co.real_logic.floats.util.float_parsing.DecimalValue.NO_TRUNCATION;
import static uk.co.real_logic.floats.util.float_parsing.InvalidCharacterException.invalidCharacter;
import static uk.co.real_logic.floats.util.float_parsing.InvalidCharacterException.missingExponentDigits;

/**
 * Reads {@code [sign] digit* ["." digit*] [("e"|"E") [sign] digit+]} in a single forward pass.
 * <p>
 * At most {@link FloatFormat#maxSignificantDigits()} digits are accumulated into the mantissa, leading zeros not
 * counting towards that. Later digits are scanned so that the position of the decimal point still scales the
 * exponent correctly, but their values are dropped.
 */
public final class DecimalLexer
{
    /**
     * Exponents with more significant digits than this saturate to zero or infinity.
     */
    public static final int MAX_EXPONENT_DIGITS = 5;

    private static final char LOWER_CASE_E = 'e';
    private static final char UPPER_CASE_E = 'E';
    private static final char PLUS = '+';
    private static final char MINUS = '-';
    private static final char DOT = '.';

    private DecimalLexer()
    {
    }

    public static <Data> DecimalValue lex(
        final DecimalValue result,
        final FloatFormat format,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        if (length == 0)
        {
            throw InvalidCharacterException.emptyInput();
        }

        final int end = offset + length;
        final int maxDigits = format.maxSignificantDigits();
        int index = offset;

        boolean negative = false;
        final char first = charReader.charAt(data, index);
        if (first == MINUS)
        {
            negative = true;
            index++;
        }
        else if (first == PLUS)
        {
            index++;
        }

        long mantissa = 0;
        int digitCount = 0;
        int dotIndex = NO_TRUNCATION;
        int truncationIndex = NO_TRUNCATION;
        for (; index < end; index++)
        {
            final int digit = charReader.digitAt(data, index);
            if (digit == NOT_A_DIGIT)
            {
                if (charReader.charAt(data, index) != DOT)
                {
                    break;
                }
                if (dotIndex != NO_TRUNCATION)
                {
                    throw invalidCharacter(charReader, data, offset, length, index);
                }
                dotIndex = index;
                continue;
            }

            if (digitCount < maxDigits)
            {
                mantissa = 10 * mantissa + digit;
                if (mantissa != 0)
                {
                    digitCount++;
                }
            }
            else if (truncationIndex == NO_TRUNCATION)
            {
                truncationIndex = index;
            }
        }

        if (dotIndex == NO_TRUNCATION)
        {
            dotIndex = index;
        }
        int endOfDigits = truncationIndex == NO_TRUNCATION ? index : truncationIndex;

        int exponent = 0;
        boolean negativeExponent = false;
        boolean exponentSaturated = false;
        if (index < end && isExponentMarker(charReader.charAt(data, index)))
        {
            index++;
            if (index < end)
            {
                final char sign = charReader.charAt(data, index);
                if (sign == MINUS || sign == PLUS)
                {
                    negativeExponent = sign == MINUS;
                    index++;
                }
            }

            if (index == end)
            {
                throw missingExponentDigits(charReader, data, offset, length);
            }

            int exponentDigits = 0;
            for (; index < end; index++)
            {
                final int digit = charReader.digitAt(data, index);
                if (digit == NOT_A_DIGIT)
                {
                    throw invalidCharacter(charReader, data, offset, length, index);
                }

                // Keep validating the remaining digits, but stop accumulating before the int could overflow.
                if (exponentDigits > MAX_EXPONENT_DIGITS)
                {
                    exponentSaturated = true;
                }
                else
                {
                    exponent = 10 * exponent + digit;
                    if (exponent != 0)
                    {
                        exponentDigits++;
                    }
                }
            }
        }

        if (index < end)
        {
            throw invalidCharacter(charReader, data, offset, length, index);
        }

        if (exponentSaturated)
        {
            final DecimalValue.Magnitude magnitude = negativeExponent || mantissa == 0 ?
                DecimalValue.Magnitude.ZERO : DecimalValue.Magnitude.INFINITE;
            return result.set(negative, mantissa, digitCount, 0, magnitude, truncationIndex, true);
        }

        if (negativeExponent)
        {
            exponent = -exponent;
        }

        // The decimal point occupies a position of its own when it lies within the accumulated digits.
        if (endOfDigits > dotIndex)
        {
            endOfDigits--;
        }
        exponent -= endOfDigits - dotIndex;

        final int decimalMagnitude = digitCount + exponent;
        final DecimalValue.Magnitude magnitude;
        if (mantissa == 0 || decimalMagnitude <= format.minDecimalExponent())
        {
            magnitude = DecimalValue.Magnitude.ZERO;
        }
        else if (decimalMagnitude >= format.maxDecimalExponent())
        {
            magnitude = DecimalValue.Magnitude.INFINITE;
        }
        else
        {
            magnitude = DecimalValue.Magnitude.FINITE;
        }

        return result.set(negative, mantissa, digitCount, exponent, magnitude, truncationIndex, false);
    }

    private static boolean isExponentMarker(final char charValue)
    {
        return charValue == LOWER_CASE_E || charValue == UPPER_CASE_E;
    }
}
