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

import uk.co.real_logic.floats.util.float_parsing.FloatParsing;

/**
 * Bit pattern of an IEEE-754 binary128 (quad precision) value, held as two unsigned 64 bit halves.
 * <p>
 * The JVM has no 128 bit floating point type, so this is a mutable flyweight in the manner of the other field
 * types: parsers write into a caller supplied instance instead of allocating one per value.
 * <p>
 * Layout of {@link #high()}: 1 sign bit, 15 exponent bits, the top 48 mantissa bits. {@link #low()} holds the
 * remaining 64 mantissa bits.
 */
public final class Float128
{
    public static final int HIGH_MANTISSA_BITS = 48;

    private static final long SIGN_MASK = 0x8000_0000_0000_0000L;
    private static final long EXPONENT_MASK = 0x7FFF_0000_0000_0000L;
    private static final long HIGH_MANTISSA_MASK = 0x0000_FFFF_FFFF_FFFFL;
    private static final int MAX_BIASED_EXPONENT = 0x7FFF;
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private long high;
    private long low;

    public Float128()
    {
        this(0, 0);
    }

    public Float128(final long high, final long low)
    {
        this.high = high;
        this.low = low;
    }

    public Float128 set(final long high, final long low)
    {
        this.high = high;
        this.low = low;
        return this;
    }

    public Float128 set(final Float128 other)
    {
        return set(other.high, other.low);
    }

    public long high()
    {
        return high;
    }

    public long low()
    {
        return low;
    }

    public boolean isNegative()
    {
        return (high & SIGN_MASK) != 0;
    }

    public int biasedExponent()
    {
        return (int)((high & EXPONENT_MASK) >>> HIGH_MANTISSA_BITS);
    }

    public boolean isNaNValue()
    {
        return biasedExponent() == MAX_BIASED_EXPONENT && hasMantissa();
    }

    public boolean isInfinite()
    {
        return biasedExponent() == MAX_BIASED_EXPONENT && !hasMantissa();
    }

    public boolean isZero()
    {
        return (high & ~SIGN_MASK) == 0 && low == 0;
    }

    /**
     * Parses decimal text into this value.
     *
     * @param string the decimal text, see {@link FloatParsing#parseQuad(CharSequence)} for the grammar.
     * @return this
     */
    public Float128 fromString(final CharSequence string)
    {
        return FloatParsing.parseQuad(this, string);
    }

    public void appendTo(final StringBuilder builder)
    {
        builder.append("0x");
        appendHex(builder, high);
        appendHex(builder, low);
    }

    public String toString()
    {
        final StringBuilder builder = new StringBuilder(34);
        appendTo(builder);
        return builder.toString();
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (o == null || getClass() != o.getClass())
        {
            return false;
        }

        final Float128 that = (Float128)o;
        return high == that.high && low == that.low;
    }

    public int hashCode()
    {
        final int result = Long.hashCode(high);
        return 31 * result + Long.hashCode(low);
    }

    private boolean hasMantissa()
    {
        return (high & HIGH_MANTISSA_MASK) != 0 || low != 0;
    }

    private static void appendHex(final StringBuilder builder, final long value)
    {
        for (int shift = Long.SIZE - 4; shift >= 0; shift -= 4)
        {
            builder.append(HEX_DIGITS[(int)(value >>> shift) & 0xF]);
        }
    }
}
