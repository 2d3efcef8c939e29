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

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.Objects;

import static uk.co.real_logic.floats.CommonConfiguration.DEBUG_FILE;
import static uk.co.real_logic.floats.CommonConfiguration.DEBUG_FILE_PROPERTY;

/**
 * Prints each message on a line of its own as {@code <epoch millis>:<thread>[<TAG>] <message>}, to the file named by
 * {@link CommonConfiguration#DEBUG_FILE_PROPERTY} or to standard out.
 */
public class PrintingDebugAppender extends AbstractDebugAppender
{
    private final PrintStream output;

    public PrintingDebugAppender()
    {
        this(openOutput());
    }

    public PrintingDebugAppender(final PrintStream output)
    {
        this.output = Objects.requireNonNull(output, "output");
    }

    public ThreadLocalAppender makeLocalAppender()
    {
        return new PrintingThreadLocalAppender(":" + DebugLogger.threadName());
    }

    private static PrintStream openOutput()
    {
        if (DEBUG_FILE == null)
        {
            return System.out;
        }

        try
        {
            return new PrintStream(new FileOutputStream(DEBUG_FILE, true), true);
        }
        catch (final FileNotFoundException ex)
        {
            throw new IllegalStateException(
                "Unable to open " + DEBUG_FILE + " for debug logging, please check " + DEBUG_FILE_PROPERTY, ex);
        }
    }

    class PrintingThreadLocalAppender extends ThreadLocalAppender
    {
        private final StringBuilder line = new StringBuilder();
        private final String threadPrefix;

        PrintingThreadLocalAppender(final String threadPrefix)
        {
            this.threadPrefix = threadPrefix;
        }

        public void log(final LogTag tag, final CharSequence message)
        {
            final StringBuilder line = this.line;
            line.setLength(0);
            line.append(System.currentTimeMillis())
                .append(threadPrefix)
                .append(tag.logStr())
                .append(' ')
                .append(message);

            // lines from different threads mustn't interleave
            synchronized (output)
            {
                output.println(line);
                output.flush();
            }
        }
    }
}
