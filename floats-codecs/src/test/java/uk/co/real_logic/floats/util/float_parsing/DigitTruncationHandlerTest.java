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
import uk.co.real_logic.floats.fields.Float128;
import uk.co.real_logic.floats.fields.FloatFormat;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class DigitTruncationHandlerTest
{
    private static final String MANY_DIGITS = "123456789012345678901234567890";

    private final DigitTruncationHandler handler = mock(DigitTruncationHandler.class);
    private final IeeeFloatParser parser = new IeeeFloatParser(
        new FloatParserConfiguration().digitTruncationHandler(handler));

    @Test
    public void shouldNotifyPositionOfFirstDroppedDigit()
    {
        parser.parseDouble(MANY_DIGITS);

        verify(handler).onDigitTruncation(
            eq(FloatFormat.DOUBLE), eq(CharSequenceCharReader.INSTANCE), eq(MANY_DIGITS), eq(0), eq(30), eq(17));
    }

    @Test
    public void shouldNotifyWithTargetFormatAndComputingFormatCap()
    {
        parser.parseHalf(MANY_DIGITS);
        parser.parseQuad(MANY_DIGITS);

        verify(handler).onDigitTruncation(
            eq(FloatFormat.HALF), eq(CharSequenceCharReader.INSTANCE), eq(MANY_DIGITS), eq(0), eq(30), eq(9));
        verify(handler).onDigitTruncation(
            eq(FloatFormat.QUAD), eq(CharSequenceCharReader.INSTANCE), eq(MANY_DIGITS), eq(0), eq(30), eq(17));
    }

    @Test
    public void shouldNotifyPositionRelativeToOffset()
    {
        final String message = "35=D|44=" + MANY_DIGITS + "|";

        parser.parseFloat(CharSequenceCharReader.INSTANCE, message, 8, MANY_DIGITS.length());

        verify(handler).onDigitTruncation(
            eq(FloatFormat.SINGLE), eq(CharSequenceCharReader.INSTANCE), eq(message), eq(8), eq(30), eq(9));
    }

    @Test
    public void shouldNotNotifyWithinDigitCap()
    {
        parser.parseDouble("1234567890.1234567");
        parser.parseFloat("0.000000000000000000000000123456789");
        parser.parseDouble("1.2e30");

        verifyNoInteractions(handler);
    }

    @Test
    public void shouldKeepResultOfSilentTruncation()
    {
        final IeeeFloatParser silentParser = new IeeeFloatParser();

        assertEquals(silentParser.parseDouble(MANY_DIGITS), parser.parseDouble(MANY_DIGITS), 0.0);
        assertEquals(silentParser.parseDouble("1.2345678901234567"), parser.parseDouble("1.23456789012345678999"), 0.0);
    }

    @Test
    public void shouldPropagateRejectionFromHandler()
    {
        final IllegalArgumentException rejection = new IllegalArgumentException("too precise");
        doThrow(rejection).when(handler).onDigitTruncation(any(), any(), any(), anyInt(), anyInt(), anyInt());

        try
        {
            parser.parseQuad(new Float128(), CharSequenceCharReader.INSTANCE, MANY_DIGITS, 0, MANY_DIGITS.length());
            fail("Expected the handler's exception");
        }
        catch (final IllegalArgumentException e)
        {
            assertEquals(rejection, e);
        }
    }

    @Test(expected = IllegalStateException.class)
    public void shouldRejectWithCustomHandler()
    {
        final IeeeFloatParser strictParser = new IeeeFloatParser(
            new FloatParserConfiguration().digitTruncationHandler(new RejectingDigitTruncationHandler()));

        strictParser.parseFloat("3.14159265358979");
    }

    static class RejectingDigitTruncationHandler implements DigitTruncationHandler
    {
        public <Data> void onDigitTruncation(
            final FloatFormat format,
            final CharReader<Data> charReader,
            final Data data,
            final int offset,
            final int length,
            final int positionOfTruncation)
        {
            throw new IllegalStateException(
                charReader.asString(data, offset, length) + " has more than " +
                format.computeFormat().maxSignificantDigits() + " significant digits");
        }
    }
}
