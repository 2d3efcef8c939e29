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
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import uk.co.real_logic.floats.fields.Float128;
import uk.co.real_logic.floats.fields.FloatFormat;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static uk.co.real_logic.floats.util.float_parsing.InvalidCharacterException.NO_INDEX;

@RunWith(Parameterized.class)
public class InvalidInputTest
{
    @Parameters(name = "{index}: \"{0}\" @ {1}")
    public static Iterable<Object[]> data()
    {
        return Arrays.asList(new Object[][]
        {
            {"", NO_INDEX},
            {" 1", 0},
            {"1 ", 1},
            {"1abc", 1},
            {"1..2", 2},
            {"1.2.3", 3},
            {"--1", 1},
            {"+-1", 1},
            {"1e", 2},
            {"1e+", 3},
            {"1e-", 3},
            {"e", 1},
            {"1e5.5", 3},
            {"1e-5x", 4},
            {"1e99999x", 7},
            {"1e1234567890x", 12},
            {"0x10", 1},
            {"1_000", 1},
            {"1,5", 1},
            {"١", 0},
            {"nan ", 0},
            {"infinity", 0},
            {"-nan", 1},
        });
    }

    private final String input;
    private final int index;
    private final IeeeFloatParser parser = new IeeeFloatParser();

    public InvalidInputTest(final String input, final int index)
    {
        this.input = input;
        this.index = index;
    }

    @Test
    public void shouldRejectInEveryFormat()
    {
        for (final FloatFormat format : FloatFormat.values())
        {
            assertInvalid(format, input, 0, index);
        }
    }

    @Test
    public void shouldReportAbsoluteIndexWithOffset()
    {
        final String extendedInput = "abc" + input + "xyz";
        final int expectedIndex = index == NO_INDEX ? NO_INDEX : index + 3;

        assertInvalid(FloatFormat.DOUBLE, extendedInput, 3, expectedIndex);
        assertInvalid(FloatFormat.QUAD, extendedInput, 3, expectedIndex);
    }

    @Test
    public void shouldBeNumberFormatExceptionWithReadableMessage()
    {
        try
        {
            FloatParsing.parseDouble(input);
            fail("Expected an InvalidCharacterException for: " + input);
        }
        catch (final NumberFormatException e)
        {
            assertThat(e, instanceOf(InvalidCharacterException.class));
            if (index != NO_INDEX)
            {
                assertThat(e.getMessage(), containsString("@ " + index + " in: " + input));
            }
        }
    }

    private void assertInvalid(final FloatFormat format, final String data, final int offset, final int expectedIndex)
    {
        try
        {
            if (format == FloatFormat.QUAD)
            {
                parser.parseQuad(new Float128(), CharSequenceCharReader.INSTANCE, data, offset, input.length());
            }
            else
            {
                parser.parseBits(format, CharSequenceCharReader.INSTANCE, data, offset, input.length());
            }
            fail("Expected an InvalidCharacterException for " + format + ": " + input);
        }
        catch (final InvalidCharacterException e)
        {
            assertEquals(format + ": " + e.getMessage(), expectedIndex, e.index());
        }
    }
}
