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

/**
 * Fixed width integer arithmetic for scaling a decimal mantissa by powers of 5 and 2 without a big integer type.
 * <p>
 * Implementations are bound to the integer width of one binary format. Powers of 5 come from precomputed tables
 * normalised to a fixed number of bits, so {@code value * 5^e} is formed as a wide product of {@code value} with a
 * table entry and then shifted down, which keeps every intermediate inside a pair of {@code long}s.
 * <p>
 * All methods assume their arguments were bounded beforehand by the decimal exponent thresholds of the format,
 * no range checks are made.
 */
public abstract class Pow5Arithmetic
{
    /**
     * The largest exponent for which {@link #log2Pow5(int)} is exact.
     */
    public static final int MAX_LOG2_POW5_EXPONENT = 3528;

    // floor(log2(5) * 2^19)
    private static final int LOG2_5_TIMES_2_POW_19 = 1_217_359;

    /**
     * Computes &#x23a3;{@code value} &#xb7; 5<sup>{@code pow5Exponent}</sup> / 2<sup>{@code shift}</sup>&#x23a6;.
     *
     * @param value        a decimal mantissa within the digit cap of the format.
     * @param pow5Exponent non negative exponent of 5.
     * @param shift        exponent of 2 to divide by, may be negative.
     * @return the floored quotient.
     */
    public abstract long mulPow5DivPow2(long value, int pow5Exponent, int shift);

    /**
     * Computes &#x23a3;{@code value} / (5<sup>{@code pow5Exponent}</sup> &#xb7; 2<sup>{@code shift}</sup>)&#x23a6;.
     *
     * @param value        a decimal mantissa within the digit cap of the format.
     * @param pow5Exponent positive exponent of 5.
     * @param shift        exponent of 2 to divide by, may be negative.
     * @return the floored quotient.
     */
    public abstract long mulPow5InvDivPow2(long value, int pow5Exponent, int shift);

    /**
     * @param value    a non negative value.
     * @param exponent the exponent of 2, values of zero or below are trivially divisors.
     * @return true if 2<sup>{@code exponent}</sup> divides {@code value}.
     */
    public static boolean multipleOfPowerOf2(final long value, final int exponent)
    {
        if (exponent <= 0)
        {
            return true;
        }

        if (exponent >= Long.SIZE)
        {
            return value == 0;
        }

        return (value & ((1L << exponent) - 1)) == 0;
    }

    /**
     * @param value    a non negative value.
     * @param exponent the exponent of 5.
     * @return true if 5<sup>{@code exponent}</sup> divides {@code value}.
     */
    public static boolean multipleOfPowerOf5(final long value, final int exponent)
    {
        if (value == 0)
        {
            return true;
        }

        long remaining = value;
        for (int count = 0; count < exponent; count++)
        {
            if (remaining % 5 != 0)
            {
                return false;
            }
            remaining /= 5;
        }

        return true;
    }

    /**
     * @param value a positive value.
     * @return &#x23a3;log<sub>2</sub>({@code value})&#x23a6;
     */
    public static int floorLog2(final long value)
    {
        return Long.SIZE - 1 - Long.numberOfLeadingZeros(value);
    }

    /**
     * @param exponent between 0 and {@link #MAX_LOG2_POW5_EXPONENT}.
     * @return &#x23a3;log<sub>2</sub>(5<sup>{@code exponent}</sup>)&#x23a6;
     */
    public static int log2Pow5(final int exponent)
    {
        return (int)(((long)exponent * LOG2_5_TIMES_2_POW_19) >>> 19);
    }

    /**
     * Same as {@link #pow5Bits(int)} as no positive power of 5 is a power of 2, so only valid from an exponent of 1:
     * the result for 0 is 1 rather than 0.
     *
     * @param exponent between 1 and {@link #MAX_LOG2_POW5_EXPONENT}.
     * @return &#x23a1;log<sub>2</sub>(5<sup>{@code exponent}</sup>)&#x23a4;
     */
    public static int ceilLog2Pow5(final int exponent)
    {
        return pow5Bits(exponent);
    }

    /**
     * @param exponent between 0 and {@link #MAX_LOG2_POW5_EXPONENT}.
     * @return the number of bits in the binary representation of 5<sup>{@code exponent}</sup>.
     */
    public static int pow5Bits(final int exponent)
    {
        return log2Pow5(exponent) + 1;
    }
}
