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

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.sameInstance;

public class PrintingDebugAppenderTest
{
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final PrintingDebugAppender appender = new PrintingDebugAppender(new PrintStream(captured, true));

    @Test
    public void shouldPrefixLinesWithTimeThreadAndTag()
    {
        appender.makeLocalAppender().log(LogTag.DIGIT_TRUNCATION, "dropped digits");

        final String threadName = Thread.currentThread().getName();
        assertThat(output(), matchesPattern(
            "\\d+:" + Pattern.quote(threadName) + "\\[DIGIT_TRUNCATION] dropped digits\\R"));
    }

    @Test
    public void shouldWriteOneLinePerMessage()
    {
        final AbstractDebugAppender.ThreadLocalAppender localAppender = appender.makeLocalAppender();
        final StringBuilder message = new StringBuilder("1e-99999999");

        localAppender.log(LogTag.EXPONENT_SATURATION, message);
        message.setLength(0);
        localAppender.log(LogTag.FLOAT_PARSING, message.append("nan"));

        final String[] lines = output().split("\\R");
        assertThat(Arrays.asList(lines), hasSize(2));
        assertThat(lines[0], matchesPattern(".*\\[EXPONENT_SATURATION] 1e-99999999"));
        assertThat(lines[1], matchesPattern(".*\\[FLOAT_PARSING] nan"));
    }

    @Test
    public void shouldDefaultToStandardOutWithoutDebugFile()
    {
        final PrintStream originalOut = System.out;
        final PrintStream replacement = new PrintStream(captured, true);
        System.setOut(replacement);
        try
        {
            new PrintingDebugAppender().makeLocalAppender().log(LogTag.FLOAT_PARSING, "inf");
        }
        finally
        {
            System.setOut(originalOut);
        }

        assertThat(output(), matchesPattern(".*\\[FLOAT_PARSING] inf\\R"));
        assertThat(System.out, sameInstance(originalOut));
    }

    private String output()
    {
        return new String(captured.toByteArray(), UTF_8);
    }
}
