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
package uk.co.real_logic.floats;

import org.junit.Before;
import org.junit.Test;
import uk.co.real_logic.floats.util.CharFormatter;
import uk.co.real_logic.floats.util.float_parsing.FloatParsing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.Assume.assumeTrue;

public class DebugLoggerTest
{
    @Before
    public void setUp()
    {
        assumeTrue("run with -Dfloats.debug=all", DebugLogger.isEnabled(LogTag.FLOAT_PARSING));
        CapturingDebugAppender.clear();
    }

    @Test
    public void shouldLogThroughServiceLoadedAppender()
    {
        DebugLogger.log(LogTag.FLOAT_PARSING, new CharFormatter("parsed %s digits").with(3));

        assertThat(CapturingDebugAppender.lines(LogTag.FLOAT_PARSING), contains("parsed 3 digits"));
    }

    @Test
    public void shouldLogSpecialLiterals()
    {
        FloatParsing.parseDouble("-Inf");

        assertThat(
            CapturingDebugAppender.lines(LogTag.FLOAT_PARSING),
            hasItem("Parsed special literal -Inf as DOUBLE"));
    }

    @Test
    public void shouldLogDigitTruncation()
    {
        FloatParsing.parseFloat("3.14159265358979");

        assertThat(
            CapturingDebugAppender.lines(LogTag.DIGIT_TRUNCATION),
            hasItem("Dropped significant digits of 3.14159265358979 from position 10, " +
                "SINGLE only takes 9 into account"));
    }

    @Test
    public void shouldLogExponentSaturation()
    {
        FloatParsing.parseHalf("-2e-1234567");

        assertThat(
            CapturingDebugAppender.lines(LogTag.EXPONENT_SATURATION),
            hasItem("Saturated exponent of -2e-1234567, HALF is zero"));
    }

    @Test
    public void shouldNotLogOrdinaryNumbers()
    {
        FloatParsing.parseDouble("1.25e300");

        assertThat(CapturingDebugAppender.lines(LogTag.FLOAT_PARSING), empty());
        assertThat(CapturingDebugAppender.lines(LogTag.DIGIT_TRUNCATION), empty());
        assertThat(CapturingDebugAppender.lines(LogTag.EXPONENT_SATURATION), empty());
    }
}
