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

import java.util.ArrayList;
import java.util.List;

/**
 * Reusable message template for debug logging. Each {@code %s} in the format string is filled in order by the
 * {@code with} methods and {@code %n} becomes the line separator.
 * <p>
 * Argument storage grows to fit the largest value seen and is then reused, so a formatter held in a field and
 * {@link #clear() cleared} before each message stops allocating once warmed up.
 */
public class CharFormatter
{
    private static final String PLACEHOLDER = "%s";
    private static final String NEWLINE = "%n";

    private final String formatString;
    private final String[] segments;
    private final StringBuilder[] arguments;

    private int argumentCount = 0;

    public CharFormatter(final String formatString)
    {
        this.formatString = formatString;

        final List<String> segments = new ArrayList<>();
        int start = 0;
        int placeholder;
        while ((placeholder = formatString.indexOf(PLACEHOLDER, start)) != -1)
        {
            segments.add(expandNewlines(formatString.substring(start, placeholder)));
            start = placeholder + PLACEHOLDER.length();
        }
        segments.add(expandNewlines(formatString.substring(start)));

        this.segments = segments.toArray(new String[0]);
        arguments = new StringBuilder[this.segments.length - 1];
        for (int i = 0; i < arguments.length; i++)
        {
            arguments[i] = new StringBuilder();
        }
    }

    public CharFormatter with(final CharSequence value)
    {
        nextArgument().append(value);
        return this;
    }

    public CharFormatter with(final int value)
    {
        nextArgument().append(value);
        return this;
    }

    public CharFormatter clear()
    {
        argumentCount = 0;
        return this;
    }

    /**
     * @param builder the builder to append the formatted message to.
     * @throws IllegalStateException if fewer arguments than placeholders have been supplied since the last clear.
     */
    public void appendTo(final StringBuilder builder)
    {
        final StringBuilder[] arguments = this.arguments;
        if (argumentCount != arguments.length)
        {
            throw new IllegalStateException("Only " + argumentCount + " of " + arguments.length +
                " arguments supplied to: " + formatString);
        }

        final String[] segments = this.segments;
        for (int i = 0; i < arguments.length; i++)
        {
            builder.append(segments[i]).append(arguments[i]);
        }
        builder.append(segments[arguments.length]);
    }

    @Override
    public String toString()
    {
        final StringBuilder builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }

    private StringBuilder nextArgument()
    {
        if (argumentCount >= arguments.length)
        {
            throw new IllegalStateException("Attempting to add argument number " + (argumentCount + 1) +
                " to a " + arguments.length + " argument CharFormatter: " + formatString);
        }

        final StringBuilder argument = arguments[argumentCount++];
        argument.setLength(0);
        return argument;
    }

    private static String expandNewlines(final String segment)
    {
        return segment.replace(NEWLINE, System.lineSeparator());
    }
}
