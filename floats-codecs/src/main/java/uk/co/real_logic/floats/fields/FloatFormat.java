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
package uk.co.real_logic.floats.fields;

/**
 * Constant parameters of the IEEE-754 binary interchange formats that decimal text is parsed into.
 * <p>
 * The decimal exponent thresholds bound the input that reaches the power of 5 arithmetic: a value whose decimal
 * digit count plus decimal exponent is at most {@link #minDecimalExponent()} is below half the smallest subnormal
 * and rounds to zero, one whose sum is at least {@link #maxDecimalExponent()} is above the largest finite value.
 * <p>
 * The JVM has no arithmetic for {@link #HALF} and {@link #QUAD}. Those are computed in the format returned by
 * {@link #computeFormat()} and converted afterwards, so the digit cap and thresholds that apply to them during
 * parsing are those of the computing format.
 */
public enum FloatFormat
{
    HALF(16, 10, 5, 15, 5, -8, 6),
    SINGLE(32, 23, 8, 127, 9, -46, 40),
    DOUBLE(64, 52, 11, 1023, 17, -324, 310),
    QUAD(128, 112, 15, 16383, 36, -4966, 4934);

    private final int totalBits;
    private final int mantissaBits;
    private final int exponentBits;
    private final int exponentBias;
    private final int maxSignificantDigits;
    private final int minDecimalExponent;
    private final int maxDecimalExponent;
    private final int maxBiasedExponent;

    FloatFormat(
        final int totalBits,
        final int mantissaBits,
        final int exponentBits,
        final int exponentBias,
        final int maxSignificantDigits,
        final int minDecimalExponent,
        final int maxDecimalExponent)
    {
        if (mantissaBits + exponentBits + 1 != totalBits)
        {
            throw new IllegalStateException(
                "sign, exponent and mantissa bits don't add up to " + totalBits + " for " + name());
        }

        this.totalBits = totalBits;
        this.mantissaBits = mantissaBits;
        this.exponentBits = exponentBits;
        this.exponentBias = exponentBias;
        this.maxSignificantDigits = maxSignificantDigits;
        this.minDecimalExponent = minDecimalExponent;
        this.maxDecimalExponent = maxDecimalExponent;
        this.maxBiasedExponent = (1 << exponentBits) - 1;
    }

    public int totalBits()
    {
        return totalBits;
    }

    /**
     * @return number of stored mantissa bits, excluding the implicit leading one.
     */
    public int mantissaBits()
    {
        return mantissaBits;
    }

    public int exponentBits()
    {
        return exponentBits;
    }

    public int exponentBias()
    {
        return exponentBias;
    }

    /**
     * Significant decimal digits that take part in rounding. Further digits only move the decimal exponent.
     *
     * @return the number of significant decimal digits accumulated into the decimal mantissa.
     */
    public int maxSignificantDigits()
    {
        return maxSignificantDigits;
    }

    public int minDecimalExponent()
    {
        return minDecimalExponent;
    }

    public int maxDecimalExponent()
    {
        return maxDecimalExponent;
    }

    /**
     * @return the all ones biased exponent that encodes infinity and NaN.
     */
    public int maxBiasedExponent()
    {
        return maxBiasedExponent;
    }

    /**
     * @return the position of the sign bit, counted from the least significant bit.
     */
    public int signShift()
    {
        return exponentBits + mantissaBits;
    }

    /**
     * @return true if values of this format are computed directly rather than converted from another format.
     */
    public boolean isNative()
    {
        return computeFormat() == this;
    }

    /**
     * The format whose arithmetic produces values of this format.
     *
     * @return {@link #SINGLE} for {@link #HALF}, {@link #DOUBLE} for {@link #QUAD}, otherwise this format.
     */
    public FloatFormat computeFormat()
    {
        switch (this)
        {
            case HALF:
                return SINGLE;

            case QUAD:
                return DOUBLE;

            default:
                return this;
        }
    }
}
