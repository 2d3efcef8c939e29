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

/**
 * Decimal form of a number as read by the {@link DecimalLexer}: {@code (-1)^negative * mantissa * 10^exponent}.
 * <p>
 * Mutable so that a single instance can be reused between parses.
 */
public final class DecimalValue
{
    public static final int NO_TRUNCATION = -1;

    public enum Magnitude
    {
        /**
         * Rounds to a signed zero in the target format, mantissa and exponent are meaningless.
         */
        ZERO,

        /**
         * Within the range where the mantissa and exponent need converting.
         */
        FINITE,

        /**
         * Rounds to a signed infinity in the target format, mantissa and exponent are meaningless.
         */
        INFINITE
    }

    private boolean negative;
    private long mantissa;
    private int digitCount;
    private int exponent;
    private Magnitude magnitude = Magnitude.ZERO;
    private int truncationIndex = NO_TRUNCATION;
    private boolean exponentSaturated;

    DecimalValue set(
        final boolean negative,
        final long mantissa,
        final int digitCount,
        final int exponent,
        final Magnitude magnitude,
        final int truncationIndex,
        final boolean exponentSaturated)
    {
        this.negative = negative;
        this.mantissa = mantissa;
        this.digitCount = digitCount;
        this.exponent = exponent;
        this.magnitude = magnitude;
        this.truncationIndex = truncationIndex;
        this.exponentSaturated = exponentSaturated;
        return this;
    }

    public boolean negative()
    {
        return negative;
    }

    public long mantissa()
    {
        return mantissa;
    }

    /**
     * @return digits accumulated into the mantissa, not counting leading zeros.
     */
    public int digitCount()
    {
        return digitCount;
    }

    public int exponent()
    {
        return exponent;
    }

    public Magnitude magnitude()
    {
        return magnitude;
    }

    /**
     * @return absolute index of the first significant digit that was dropped, or {@link #NO_TRUNCATION}.
     */
    public int truncationIndex()
    {
        return truncationIndex;
    }

    /**
     * @return true if the exponent had too many digits to compute and the magnitude was decided from its sign.
     */
    public boolean exponentSaturated()
    {
        return exponentSaturated;
    }

    public String toString()
    {
        return "DecimalValue{" +
            "negative=" + negative +
            ", mantissa=" + mantissa +
            ", digitCount=" + digitCount +
            ", exponent=" + exponent +
            ", magnitude=" + magnitude +
            ", truncationIndex=" + truncationIndex +
            ", exponentSaturated=" + exponentSaturated +
            '}';
    }
}
