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

import static uk.co.real_logic.floats.util.Pow5Arithmetic.floorLog2;

/**
 * Packs sign, exponent and mantissa into the bit pattern of a format of at most 64 bits, rounding to nearest with
 * ties to even.
 */
public final class IeeeAssembler
{
    private IeeeAssembler()
    {
    }

    public static long assemble(final FloatFormat format, final BinaryValue value, final boolean negative)
    {
        final int mantissaBits = format.mantissaBits();
        final int bias = format.exponentBias();
        final long m2 = value.mantissa();
        final int e2 = value.exponent();

        int ieeeExponent = Math.max(0, e2 + bias + floorLog2(m2));
        if (ieeeExponent > format.maxBiasedExponent() - 1)
        {
            return infinity(format, negative);
        }

        // Subnormals share the exponent of the smallest normal value.
        final int shift = (ieeeExponent == 0 ? 1 : ieeeExponent) - e2 - bias - mantissaBits;

        final boolean exact = value.exact() && (m2 & ((1L << (shift - 1)) - 1)) == 0;
        final long lastRemovedBit = (m2 >>> (shift - 1)) & 1;
        final boolean roundUp = lastRemovedBit != 0 && (!exact || ((m2 >>> shift) & 1) != 0);

        long ieeeMantissa = (m2 >>> shift) + (roundUp ? 1 : 0);
        ieeeMantissa &= (1L << mantissaBits) - 1;
        if (ieeeMantissa == 0 && roundUp)
        {
            // carried into the exponent
            ieeeExponent++;
        }

        return sign(format, negative) | ((long)ieeeExponent << mantissaBits) | ieeeMantissa;
    }

    public static long zero(final FloatFormat format, final boolean negative)
    {
        return sign(format, negative);
    }

    public static long infinity(final FloatFormat format, final boolean negative)
    {
        return sign(format, negative) | ((long)format.maxBiasedExponent() << format.mantissaBits());
    }

    /**
     * @param format target format.
     * @return the canonical quiet NaN, with only the top mantissa bit set.
     */
    public static long nan(final FloatFormat format)
    {
        return infinity(format, false) | (1L << (format.mantissaBits() - 1));
    }

    private static long sign(final FloatFormat format, final boolean negative)
    {
        return negative ? 1L << format.signShift() : 0L;
    }
}
