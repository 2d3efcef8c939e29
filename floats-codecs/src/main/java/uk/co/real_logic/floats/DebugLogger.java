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

import uk.co.real_logic.floats.AbstractDebugAppender.ThreadLocalAppender;
import uk.co.real_logic.floats.util.CharFormatter;

import java.util.Iterator;
import java.util.ServiceLoader;

import static uk.co.real_logic.floats.CommonConfiguration.*;

/**
 * A logger purely for debug data. Not optimised for high performance logging, but all logging calls must be removable
 * by the optimiser.
 */
public final class DebugLogger
{
    private static final AbstractDebugAppender APPENDER;
    private static final ThreadLocal<ThreadLocalLogger> THREAD_LOCAL = ThreadLocal.withInitial(ThreadLocalLogger::new);

    static
    {
        final ServiceLoader<AbstractDebugAppender> loader = ServiceLoader.load(AbstractDebugAppender.class);
        final Iterator<AbstractDebugAppender> it = loader.iterator();
        if (it.hasNext())
        {
            APPENDER = it.next();
            if (DEBUG_FILE != null)
            {
                System.err.println("Warning: -D" + DEBUG_FILE_PROPERTY + " has been set, despite a custom " +
                    "AbstractDebugAppender (" + APPENDER.getClass() + ") being configured via the service loader. " +
                    "The file property will be ignored and your custom appender used instead.");
            }
        }
        else
        {
            APPENDER = new PrintingDebugAppender();
        }
    }

    private DebugLogger()
    {
    }

    public static void log(
        final LogTag tag,
        final CharFormatter formatter)
    {
        if (isEnabled(tag))
        {
            THREAD_LOCAL.get().log(tag, formatter);
        }
    }

    public static void log(
        final LogTag tag,
        final String message)
    {
        if (isEnabled(tag))
        {
            THREAD_LOCAL.get().log(tag, message);
        }
    }

    public static boolean isEnabled(final LogTag tag)
    {
        return DEBUG_PRINT_MESSAGES && DEBUG_TAGS.contains(tag);
    }

    static String threadName()
    {
        return Thread.currentThread().getName();
    }

    static class ThreadLocalLogger
    {
        private final StringBuilder builder = new StringBuilder();
        private final ThreadLocalAppender appender;
        final boolean isThreadEnabled;

        ThreadLocalLogger()
        {
            final String threadName = threadName();
            isThreadEnabled = DEBUG_PRINT_THREAD == null || DEBUG_PRINT_THREAD.equals(threadName);
            appender = APPENDER.makeLocalAppender();
        }

        public void log(
            final LogTag tag, final String message)
        {
            appendStart();
            builder.append(message);
            finish(tag);
        }

        public void log(
            final LogTag tag,
            final CharFormatter formatter)
        {
            appendStart();
            formatter.appendTo(builder);
            finish(tag);
        }

        private void appendStart()
        {
            builder.setLength(0);
        }

        private void finish(final LogTag tag)
        {
            if (isThreadEnabled)
            {
                appender.log(tag, builder);
            }
        }
    }
}
