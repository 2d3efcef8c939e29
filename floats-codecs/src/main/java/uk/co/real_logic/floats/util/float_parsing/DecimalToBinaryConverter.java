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
import uk.co.real_logic.floats.util.DoublePow5Arithmetic;
import uk.co.real_logic.floats.util.Pow5Arithmetic;
import uk.co.real_logic.floats.util.SinglePow5Arithmetic;

import static uk.co.real_logic.floats.util.Pow5Arithmetic.ceilLog2Pow5;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.floorLog2;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.log2Pow5;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.multipleOfPowerOf2;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.multipleOfPowerOf5;

/**
 * Converts {@code mantissa * 10^exponent} into {@code m2 * 2^e2} where m2 has two or three bits more than the
 * mantissa of the format, enough for {@link IeeeAssembler} to round correctly.
 * <p>
 * Only handles values whose decimal magnitude lies strictly between the thresholds of the format.
 */
public final class DecimalToBinaryConverter
{
    public static final DecimalToBinaryConverter SINGLE =
        new DecimalToBinaryConverter(FloatFormat.SINGLE, SinglePow5Arithmetic.INSTANCE);
    public static final DecimalToBinaryConverter DOUBLE =
        new DecimalToBinaryConverter(FloatFormat.DOUBLE, DoublePow5Arithmetic.INSTANCE);

    private final FloatFormat format;
    private final Pow5Arithmetic arithmetic;
    private final int targetBits;

    private DecimalToBinaryConverter(final FloatFormat format, final Pow5Arithmetic arithmetic)
    {
        this.format = format;
        this.arithmetic = arithmetic;
        this.targetBits = format.mantissaBits() + 1;
    }

    public static DecimalToBinaryConverter forFormat(final FloatFormat format)
    {
        switch (format)
        {
            case SINGLE:
                return SINGLE;

            case DOUBLE:
                return DOUBLE;

            default:
                throw new IllegalArgumentException(format + " isn't computed natively, use " + format.computeFormat());
        }
    }

    public FloatFormat format()
    {
        return format;
    }

    /**
     * @param result   the value to write into.
     * @param mantissa positive decimal mantissa of at most {@link FloatFormat#maxSignificantDigits()} digits.
     * @param exponent decimal exponent, within the thresholds of the format once the digit count is added.
     * @return result
     */
    public BinaryValue convert(final BinaryValue result, final long mantissa, final int exponent)
    {
        final int e2;
        final long m2;
        final boolean exact;
        if (exponent >= 0)
        {
            e2 = floorLog2(mantissa) + exponent + log2Pow5(exponent) - targetBits;
            m2 = arithmetic.mulPow5DivPow2(mantissa, exponent, e2 - exponent);
            exact = multipleOfPowerOf2(mantissa, e2 - exponent);
        }
        else
        {
            e2 = floorLog2(mantissa) + exponent - ceilLog2Pow5(-exponent) - targetBits;
            m2 = arithmetic.mulPow5InvDivPow2(mantissa, -exponent, e2 - exponent);
            exact = multipleOfPowerOf2(mantissa, e2 - exponent) && multipleOfPowerOf5(mantissa, -exponent);
        }

        return result.set(m2, e2, exact);
    }
}
