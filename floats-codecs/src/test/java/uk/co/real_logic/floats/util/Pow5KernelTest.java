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
package uk.co.real_logic.floats.util;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import uk.co.real_logic.floats.fields.FloatFormat;

import java.math.BigInteger;
import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.both;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.ceilLog2Pow5;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.floorLog2;
import static uk.co.real_logic.floats.util.Pow5Arithmetic.log2Pow5;

/**
 * Checks the fixed width kernels against big integer arithmetic over their whole tables, for shifts chosen the way
 * the decimal to binary conversion chooses them.
 */
@RunWith(Parameterized.class)
public class Pow5KernelTest
{
    private static final BigInteger FIVE = BigInteger.valueOf(5);

    @Parameters(name = "{0}")
    public static Iterable<Object[]> data()
    {
        return Arrays.asList(new Object[][]
        {
            {
                FloatFormat.SINGLE,
                SinglePow5Arithmetic.INSTANCE,
                SinglePow5Arithmetic.POW5_BITCOUNT,
                SinglePow5Arithmetic.maxPow5Exponent(),
                SinglePow5Arithmetic.maxPow5InvExponent(),
                new long[]{1, 7, 10, 65_536, 16_777_217, 123_456_789, 999_999_999}
            },
            {
                FloatFormat.DOUBLE,
                DoublePow5Arithmetic.INSTANCE,
                DoublePow5Arithmetic.POW5_BITCOUNT,
                DoublePow5Arithmetic.maxPow5Exponent(),
                DoublePow5Arithmetic.maxPow5InvExponent(),
                new long[]{1, 3, 17, 9_007_199_254_740_993L, 12_345_678_901_234_567L, 99_999_999_999_999_999L}
            },
        });
    }

    private final FloatFormat format;
    private final Pow5Arithmetic arithmetic;
    private final int pow5BitCount;
    private final int maxPow5Exponent;
    private final int maxPow5InvExponent;
    private final long[] mantissas;

    public Pow5KernelTest(
        final FloatFormat format,
        final Pow5Arithmetic arithmetic,
        final int pow5BitCount,
        final int maxPow5Exponent,
        final int maxPow5InvExponent,
        final long[] mantissas)
    {
        this.format = format;
        this.arithmetic = arithmetic;
        this.pow5BitCount = pow5BitCount;
        this.maxPow5Exponent = maxPow5Exponent;
        this.maxPow5InvExponent = maxPow5InvExponent;
        this.mantissas = mantissas;
    }

    @Test
    public void shouldCoverDecimalExponentRange()
    {
        final int maxDigits = format.maxSignificantDigits();
        assertThat(maxPow5Exponent, greaterThanOrEqualTo(format.maxDecimalExponent() - 2));
        assertThat(maxPow5InvExponent, greaterThanOrEqualTo(maxDigits - format.minDecimalExponent() - 1));
    }

    @Test
    public void shouldMultiplyByPowersOfFive()
    {
        final int targetBits = format.mantissaBits() + 1;
        for (final long mantissa : mantissas)
        {
            for (int exponent = 0; exponent <= maxPow5Exponent; exponent++)
            {
                final int shift = floorLog2(mantissa) + log2Pow5(exponent) - targetBits;
                final BigInteger product = BigInteger.valueOf(mantissa).multiply(FIVE.pow(exponent));
                final long expected = shift >= 0 ? product.shiftRight(shift).longValueExact() :
                    product.shiftLeft(-shift).longValueExact();

                final long result = arithmetic.mulPow5DivPow2(mantissa, exponent, shift);

                final String message = mantissa + " * 5^" + exponent + " / 2^" + shift;
                if (FIVE.pow(exponent).bitLength() <= pow5BitCount)
                {
                    assertEquals(message, expected, result);
                }
                else
                {
                    assertThat(
                        message, result, both(greaterThanOrEqualTo(expected - 1)).and(lessThanOrEqualTo(expected)));
                }
            }
        }
    }

    @Test
    public void shouldDivideByPowersOfFive()
    {
        final int targetBits = format.mantissaBits() + 1;
        for (final long mantissa : mantissas)
        {
            for (int exponent = 1; exponent <= maxPow5InvExponent; exponent++)
            {
                final int shift = floorLog2(mantissa) - ceilLog2Pow5(exponent) - targetBits;
                final BigInteger dividend = shift >= 0 ? BigInteger.valueOf(mantissa) :
                    BigInteger.valueOf(mantissa).shiftLeft(-shift);
                final BigInteger divisor = shift >= 0 ? FIVE.pow(exponent).shiftLeft(shift) : FIVE.pow(exponent);
                final long expected = dividend.divide(divisor).longValueExact();

                final long result = arithmetic.mulPow5InvDivPow2(mantissa, exponent, shift);

                assertThat(
                    mantissa + " / 5^" + exponent + " / 2^" + shift,
                    result,
                    both(greaterThanOrEqualTo(expected)).and(lessThanOrEqualTo(expected + 1)));
            }
        }
    }
}
