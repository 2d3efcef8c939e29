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

import static org.junit.Assert.assertEquals;

public class CharFormatterTest
{
    @Test
    public void shouldFormatNoFields()
    {
        final String format = "abc";
        final CharFormatter formatter = new CharFormatter(format);

        assertFormatsTo(format, formatter);
    }

    @Test
    public void shouldFormatSingleField()
    {
        final String format = "ab%sc";
        final CharFormatter formatter = new CharFormatter(format)
            .with("D");

        assertFormatsTo("abDc", formatter);
    }

    @Test
    public void shouldFormatNewlines()
    {
        final String format = "ab%sc%n";
        final CharFormatter formatter = new CharFormatter(format)
            .with("D");

        assertFormatsTo("abDc" + System.lineSeparator(), formatter);
    }

    @Test
    public void shouldClearFormatter()
    {
        final String format = "ab%sc%s";
        final CharFormatter formatter = new CharFormatter(format)
            .with("D")
            .with("E")
            .clear()
            .with("F")
            .with("G");

        assertFormatsTo("abFcG", formatter);
    }

    @Test
    public void shouldFormatValuesLongerThanDefaultLength()
    {
        final String input = "0.123456789012345678901234567890123456789e-10";
        final CharFormatter formatter = new CharFormatter("Saturated exponent of %s, %s is %s")
            .with(input)
            .with("DOUBLE")
            .with("zero");

        assertFormatsTo("Saturated exponent of " + input + ", DOUBLE is zero", formatter);
    }

    @Test
    public void shouldFormatIntegers()
    {
        final String format = "Dropped significant digits of %s from position %s";
        final CharFormatter formatter = new CharFormatter(format)
            .with("1234567890.5")
            .with(9);

        assertFormatsTo("Dropped significant digits of 1234567890.5 from position 9", formatter);
    }

    @Test(expected = IllegalStateException.class)
    public void shouldNotAppendIncompleteFormatter()
    {
        final CharFormatter formatter = new CharFormatter("%s and %s")
            .with("one");

        formatter.appendTo(new StringBuilder());
    }

    @Test(expected = IllegalStateException.class)
    public void shouldRejectTooManyArguments()
    {
        new CharFormatter("only %s")
            .with("one")
            .with("two");
    }

    @Test
    public void shouldFormatIntegerExtremes()
    {
        final CharFormatter formatter = new CharFormatter("[%s, %s, %s]")
            .with(Integer.MIN_VALUE)
            .with(0)
            .with(Integer.MAX_VALUE);

        assertFormatsTo("[-2147483648, 0, 2147483647]", formatter);
    }

    @Test
    public void shouldFormatAdjacentAndTrailingPlaceholders()
    {
        final CharFormatter formatter = new CharFormatter("%s%s=%s")
            .with("-")
            .with("inf")
            .with("SINGLE");

        assertFormatsTo("-inf=SINGLE", formatter);
        assertEquals("-inf=SINGLE", formatter.toString());
    }

    @Test
    public void shouldReuseArgumentsAfterShorterValues()
    {
        final CharFormatter formatter = new CharFormatter("Parsed special literal %s as %s")
            .with("+INF")
            .with("DOUBLE")
            .clear()
            .with("nan")
            .with("HALF");

        assertFormatsTo("Parsed special literal nan as HALF", formatter);
    }

    private void assertFormatsTo(final String format, final CharFormatter formatter)
    {
        final StringBuilder builder = new StringBuilder();
        formatter.appendTo(builder);

        assertEquals(format, builder.toString());
    }
}
