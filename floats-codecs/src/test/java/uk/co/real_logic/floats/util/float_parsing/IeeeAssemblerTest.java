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

import org.junit.Test;
import uk.co.real_logic.floats.fields.FloatFormat;

import static org.junit.Assert.assertEquals;
import static uk.co.real_logic.floats.fields.FloatFormat.DOUBLE;
import static uk.co.real_logic.floats.fields.FloatFormat.HALF;
import static uk.co.real_logic.floats.fields.FloatFormat.SINGLE;

public class IeeeAssemblerTest
{
    private final BinaryValue value = new BinaryValue();

    @Test
    public void shouldAssembleNormalValues()
    {
        assertAssembled(SINGLE, 16_777_216L, -24, true, false, 0x3F80_0000L);
        assertAssembled(DOUBLE, 9_007_199_254_740_992L, -53, true, false, 0x3FF0_0000_0000_0000L);
    }

    @Test
    public void shouldRoundTiesToEven()
    {
        assertAssembled(SINGLE, 16_777_217L, 0, true, false, 0x4B80_0000L);
        assertAssembled(SINGLE, 16_777_219L, 0, true, false, 0x4B80_0002L);
        assertAssembled(DOUBLE, 9_007_199_254_740_993L, 0, true, false, 0x4340_0000_0000_0000L);
    }

    @Test
    public void shouldRoundUpWhenBitsWereLostBelowHalfway()
    {
        assertAssembled(SINGLE, 16_777_217L, 0, false, false, 0x4B80_0001L);
        assertAssembled(DOUBLE, 9_007_199_254_740_993L, 0, false, true, 0xC340_0000_0000_0001L);
    }

    @Test
    public void shouldCarryMantissaOverflowIntoExponent()
    {
        assertAssembled(SINGLE, 33_554_431L, -25, false, false, 0x3F80_0000L);
        assertAssembled(DOUBLE, 18_014_398_509_481_983L, -54, false, false, 0x3FF0_0000_0000_0000L);
    }

    @Test
    public void shouldAssembleSubnormals()
    {
        assertAssembled(SINGLE, 16_777_216L, -173, true, false, 0x0000_0001L);
        assertAssembled(DOUBLE, 9_007_199_254_740_992L, -1127, true, false, 0x0000_0000_0000_0001L);
    }

    @Test
    public void shouldRoundHalfOfSmallestSubnormal()
    {
        assertAssembled(SINGLE, 16_777_216L, -174, true, false, 0L);
        assertAssembled(SINGLE, 16_777_216L, -174, false, false, 0x0000_0001L);
        assertAssembled(DOUBLE, 9_007_199_254_740_992L, -1128, true, false, 0L);
        assertAssembled(DOUBLE, 9_007_199_254_740_992L, -1128, false, false, 0x0000_0000_0000_0001L);
    }

    @Test
    public void shouldRoundLargestSubnormalUpToSmallestNormal()
    {
        assertAssembled(SINGLE, 16_777_215L, -150, true, false, 0x0080_0000L);
    }

    @Test
    public void shouldOverflowToInfinity()
    {
        assertAssembled(SINGLE, 16_777_216L, 104, true, false, 0x7F80_0000L);
        assertAssembled(SINGLE, 16_777_216L, 104, true, true, 0xFF80_0000L);
        assertAssembled(DOUBLE, 9_007_199_254_740_992L, 971, true, false, 0x7FF0_0000_0000_0000L);
    }

    @Test
    public void shouldEncodeSpecialValues()
    {
        assertEquals(0x8000L, IeeeAssembler.zero(HALF, true));
        assertEquals(0x7C00L, IeeeAssembler.infinity(HALF, false));
        assertEquals(0x7E00L, IeeeAssembler.nan(HALF));
        assertEquals(Float.floatToRawIntBits(Float.NaN), (int)IeeeAssembler.nan(SINGLE));
        assertEquals(Double.doubleToRawLongBits(Double.NaN), IeeeAssembler.nan(DOUBLE));
        assertEquals(Double.doubleToRawLongBits(Double.NEGATIVE_INFINITY), IeeeAssembler.infinity(DOUBLE, true));
        assertEquals(Double.doubleToRawLongBits(-0.0), IeeeAssembler.zero(DOUBLE, true));
    }

    private void assertAssembled(
        final FloatFormat format,
        final long mantissa,
        final int exponent,
        final boolean exact,
        final boolean negative,
        final long expectedBits)
    {
        value.set(mantissa, exponent, exact);

        assertEquals(
            value + " as " + format,
            Long.toHexString(expectedBits),
            Long.toHexString(IeeeAssembler.assemble(format, value, negative)));
    }
}
