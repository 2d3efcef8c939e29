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

import uk.co.real_logic.floats.fields.Float128;

/**
 * Conversions between the formats computed natively and the formats the JVM has no arithmetic for.
 */
public final class FormatConversions
{
    private static final int SINGLE_SIGN_SHIFT = 31;
    private static final int SINGLE_EXPONENT_SHIFT = 23;
    private static final int SINGLE_EXPONENT_MASK = 0xFF;
    private static final int SINGLE_MANTISSA_MASK = 0x7F_FFFF;
    private static final int SINGLE_IMPLICIT_BIT = 0x80_0000;
    private static final int SINGLE_EXPONENT_BIAS = 127;

    private static final int HALF_SIGN_SHIFT = 15;
    private static final int HALF_EXPONENT_SHIFT = 10;
    private static final int HALF_MAX_EXPONENT = 0x1F;
    private static final int HALF_QUIET_NAN_BIT = 0x200;
    private static final int HALF_EXPONENT_BIAS = 15;
    private static final int HALF_MANTISSA_BITS = 10;
    private static final int HALF_DROPPED_BITS = SINGLE_EXPONENT_SHIFT - HALF_MANTISSA_BITS;

    private static final long DOUBLE_SIGN_MASK = 0x8000_0000_0000_0000L;
    private static final int DOUBLE_MANTISSA_BITS = 52;
    private static final long DOUBLE_MANTISSA_MASK = (1L << DOUBLE_MANTISSA_BITS) - 1;
    private static final int DOUBLE_EXPONENT_MASK = 0x7FF;
    private static final int DOUBLE_EXPONENT_BIAS = 1023;
    private static final int DOUBLE_EXPONENT_BITS = 11;

    private static final long QUAD_MAX_EXPONENT = 0x7FFF;
    private static final int QUAD_EXPONENT_BIAS = 16383;
    // 112 - 52 mantissa bits to fill in below the double's
    private static final int QUAD_LOW_SHIFT = 60;
    private static final int QUAD_HIGH_SHIFT = DOUBLE_MANTISSA_BITS - Float128.HIGH_MANTISSA_BITS;

    private FormatConversions()
    {
    }

    /**
     * Narrows a binary32 value to the binary16 bit pattern nearest to it, ties to even.
     * <p>
     * Values at least as large as the largest half plus half an ulp become infinity, those no larger than half the
     * smallest subnormal half become zero. NaNs become the quiet NaN {@code 0x7E00} with the sign kept.
     *
     * @param value the value to narrow.
     * @return the binary16 bit pattern.
     */
    public static short floatToHalfBits(final float value)
    {
        final int bits = Float.floatToRawIntBits(value);
        final int sign = bits >>> SINGLE_SIGN_SHIFT;
        int exponent = (bits >>> SINGLE_EXPONENT_SHIFT) & SINGLE_EXPONENT_MASK;
        int mantissa = bits & SINGLE_MANTISSA_MASK;

        int outExponent = 0;
        int outMantissa = 0;

        if (exponent == SINGLE_EXPONENT_MASK)
        {
            outExponent = HALF_MAX_EXPONENT;
            outMantissa = mantissa != 0 ? HALF_QUIET_NAN_BIT : 0;
        }
        else
        {
            exponent = exponent - SINGLE_EXPONENT_BIAS + HALF_EXPONENT_BIAS;
            if (exponent >= HALF_MAX_EXPONENT)
            {
                outExponent = HALF_MAX_EXPONENT;
            }
            else if (exponent <= 0)
            {
                // Below half the smallest subnormal everything flushes to zero.
                if (exponent >= -HALF_MANTISSA_BITS)
                {
                    mantissa |= SINGLE_IMPLICIT_BIT;
                    final int shift = HALF_DROPPED_BITS + 1 - exponent;
                    outMantissa = mantissa >> shift;

                    final int lowBits = mantissa & ((1 << shift) - 1);
                    final int halfway = 1 << (shift - 1);
                    if (lowBits + (outMantissa & 1) > halfway)
                    {
                        outMantissa++;
                    }
                }
            }
            else
            {
                outExponent = exponent;
                outMantissa = mantissa >> HALF_DROPPED_BITS;
                if ((mantissa & ((1 << HALF_DROPPED_BITS) - 1)) + (outMantissa & 1) > 1 << (HALF_DROPPED_BITS - 1))
                {
                    outMantissa++;
                }
            }
        }

        // A carry out of the mantissa moves into the exponent, which rounds up to the next binade or infinity.
        return (short)((sign << HALF_SIGN_SHIFT) | (outExponent << HALF_EXPONENT_SHIFT) + outMantissa);
    }

    /**
     * Widens a binary64 value to binary128. Every double is exactly representable, subnormal doubles become normal
     * quads.
     *
     * @param value  the value to widen.
     * @param result the value to write into.
     * @return result
     */
    public static Float128 doubleToQuad(final double value, final Float128 result)
    {
        final long bits = Double.doubleToRawLongBits(value);
        final long sign = bits & DOUBLE_SIGN_MASK;
        final int exponent = (int)(bits >>> DOUBLE_MANTISSA_BITS) & DOUBLE_EXPONENT_MASK;
        long mantissa = bits & DOUBLE_MANTISSA_MASK;

        final long quadExponent;
        if (exponent == DOUBLE_EXPONENT_MASK)
        {
            quadExponent = QUAD_MAX_EXPONENT;
        }
        else if (exponent == 0)
        {
            if (mantissa == 0)
            {
                return result.set(sign, 0);
            }

            final int shift = Long.numberOfLeadingZeros(mantissa) - DOUBLE_EXPONENT_BITS;
            mantissa = (mantissa << shift) & DOUBLE_MANTISSA_MASK;
            quadExponent = 1 - DOUBLE_EXPONENT_BIAS - shift + QUAD_EXPONENT_BIAS;
        }
        else
        {
            quadExponent = exponent - DOUBLE_EXPONENT_BIAS + QUAD_EXPONENT_BIAS;
        }

        return result.set(
            sign | (quadExponent << Float128.HIGH_MANTISSA_BITS) | (mantissa >>> QUAD_HIGH_SHIFT),
            mantissa << QUAD_LOW_SHIFT);
    }
}
