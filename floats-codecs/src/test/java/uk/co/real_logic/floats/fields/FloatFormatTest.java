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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class FloatFormatTest
{
    @Test
    public void shouldMatchBitLayoutsOfTheJvmTypes()
    {
        assertEquals(Float.SIZE, FloatFormat.SINGLE.totalBits());
        assertEquals(-Math.getExponent(Math.ulp(1.0f)), FloatFormat.SINGLE.mantissaBits());
        assertEquals(Float.MAX_EXPONENT, FloatFormat.SINGLE.exponentBias());

        assertEquals(Double.SIZE, FloatFormat.DOUBLE.totalBits());
        assertEquals(-Math.getExponent(Math.ulp(1.0)), FloatFormat.DOUBLE.mantissaBits());
        assertEquals(Double.MAX_EXPONENT, FloatFormat.DOUBLE.exponentBias());
    }

    @Test
    public void shouldPlaceMantissaBelowExponentLikeTheJvmTypes()
    {
        final int singleBits = Float.floatToRawIntBits(1.0f);
        assertEquals(FloatFormat.SINGLE.mantissaBits(), Integer.numberOfTrailingZeros(singleBits));
        assertEquals(FloatFormat.SINGLE.exponentBias(), singleBits >>> FloatFormat.SINGLE.mantissaBits());

        final long doubleBits = Double.doubleToRawLongBits(1.0);
        assertEquals(FloatFormat.DOUBLE.mantissaBits(), Long.numberOfTrailingZeros(doubleBits));
        assertEquals(FloatFormat.DOUBLE.exponentBias(), doubleBits >>> FloatFormat.DOUBLE.mantissaBits());
    }

    @Test
    public void shouldHaveAllOnesMaxBiasedExponent()
    {
        assertEquals(0x1F, FloatFormat.HALF.maxBiasedExponent());
        assertEquals(0xFF, FloatFormat.SINGLE.maxBiasedExponent());
        assertEquals(0x7FF, FloatFormat.DOUBLE.maxBiasedExponent());
        assertEquals(0x7FFF, FloatFormat.QUAD.maxBiasedExponent());
    }

    @Test
    public void shouldPlaceSignInMostSignificantBit()
    {
        for (final FloatFormat format : FloatFormat.values())
        {
            assertEquals(format.name(), format.totalBits() - 1, format.signShift());
            assertEquals(format.name(), (1 << (format.exponentBits() - 1)) - 1, format.exponentBias());
        }
    }

    @Test
    public void shouldComputeNarrowAndWideFormatsNatively()
    {
        assertSame(FloatFormat.SINGLE, FloatFormat.HALF.computeFormat());
        assertSame(FloatFormat.SINGLE, FloatFormat.SINGLE.computeFormat());
        assertSame(FloatFormat.DOUBLE, FloatFormat.DOUBLE.computeFormat());
        assertSame(FloatFormat.DOUBLE, FloatFormat.QUAD.computeFormat());

        assertFalse(FloatFormat.HALF.isNative());
        assertTrue(FloatFormat.SINGLE.isNative());
        assertTrue(FloatFormat.DOUBLE.isNative());
        assertFalse(FloatFormat.QUAD.isNative());
    }

    @Test
    public void shouldBoundDecimalExponentsAroundTheRepresentableRange()
    {
        assertEquals(
            (int)Math.floor(Math.log10(Float.MAX_VALUE)) + 2, FloatFormat.SINGLE.maxDecimalExponent());
        assertEquals(
            (int)Math.floor(Math.log10(Double.MAX_VALUE)) + 2, FloatFormat.DOUBLE.maxDecimalExponent());
        assertTrue(FloatFormat.SINGLE.minDecimalExponent() < Math.log10(Float.MIN_VALUE));
        assertTrue(FloatFormat.DOUBLE.minDecimalExponent() < Math.log10(Double.MIN_VALUE));
    }
}
