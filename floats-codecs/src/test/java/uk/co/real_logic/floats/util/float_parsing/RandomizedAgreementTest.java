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

import java.util.Random;

import static org.junit.Assert.assertEquals;

/**
 * Compares against the JDK's correctly rounded parsers for inputs within the digit cap of each format, where no
 * digits are dropped and the result must be exact.
 */
public class RandomizedAgreementTest
{
    private static final int ITERATIONS = 50_000;
    private static final long SEED = 0x5EED_F10A7L;

    private final IeeeFloatParser parser = new IeeeFloatParser();
    private final StringBuilder builder = new StringBuilder();

    @Test
    public void shouldAgreeWithParseDouble()
    {
        final Random random = new Random(SEED);
        for (int i = 0; i < ITERATIONS; i++)
        {
            final String input = randomDecimal(random, 17, -345, 330);

            final long expected = Double.doubleToRawLongBits(Double.parseDouble(input));
            final long actual = Double.doubleToRawLongBits(parser.parseDouble(input));

            assertEquals(input, Long.toHexString(expected), Long.toHexString(actual));
        }
    }

    @Test
    public void shouldAgreeWithParseFloat()
    {
        final Random random = new Random(SEED + 1);
        for (int i = 0; i < ITERATIONS; i++)
        {
            final String input = randomDecimal(random, 9, -60, 45);

            final int expected = Float.floatToRawIntBits(Float.parseFloat(input));
            final int actual = Float.floatToRawIntBits(parser.parseFloat(input));

            assertEquals(input, Integer.toHexString(expected), Integer.toHexString(actual));
        }
    }

    @Test
    public void shouldAgreeWithParseDoubleNearSubnormalBoundary()
    {
        final Random random = new Random(SEED + 2);
        for (int i = 0; i < ITERATIONS; i++)
        {
            final String input = randomDecimal(random, 17, -325, -305);

            assertEquals(input, Double.parseDouble(input), parser.parseDouble(input), 0.0);
        }
    }

    @Test
    public void shouldAgreeWithParseFloatOnIntegers()
    {
        final Random random = new Random(SEED + 3);
        for (int i = 0; i < ITERATIONS; i++)
        {
            final String input = Integer.toString(random.nextInt(1_000_000_000));

            assertEquals(input, Float.parseFloat(input), parser.parseFloat(input), 0.0f);
        }
    }

    private String randomDecimal(final Random random, final int maxDigits, final int minExponent, final int maxExponent)
    {
        final StringBuilder builder = this.builder;
        builder.setLength(0);

        if (random.nextBoolean())
        {
            builder.append('-');
        }

        final int digits = 1 + random.nextInt(maxDigits);
        final int dotPosition = random.nextInt(digits + 1);
        for (int i = 0; i < digits; i++)
        {
            if (i == dotPosition)
            {
                builder.append('.');
            }
            final int digit = i == 0 ? 1 + random.nextInt(9) : random.nextInt(10);
            builder.append((char)('0' + digit));
        }

        if (random.nextInt(4) != 0)
        {
            builder.append(random.nextBoolean() ? 'e' : 'E');
            builder.append(minExponent + random.nextInt(maxExponent - minExponent + 1));
        }

        return builder.toString();
    }
}
