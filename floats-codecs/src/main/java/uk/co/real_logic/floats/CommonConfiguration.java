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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

import static java.lang.System.getProperty;
import static java.util.stream.Collectors.toCollection;

/**
 * Process wide configuration, read once from system properties when the class is loaded.
 */
public final class CommonConfiguration
{
    /**
     * Property name for the flag to enable or disable debug logging. Either "all" (or "true") or a comma separated
     * list of {@link LogTag} names.
     */
    public static final String DEBUG_PRINT_MESSAGES_PROPERTY = "floats.debug";
    /**
     * Property name for the flag to specify a thread to print
     */
    public static final String DEBUG_PRINT_THREAD_PROPERTY = "floats.debug.thread";
    /**
     * Property name for the file to log debug messages to, default is standard output
     */
    public static final String DEBUG_FILE_PROPERTY = "floats.debug.file";

    // ------------------------------------------------
    //          Static Configuration
    // ------------------------------------------------

    /**
     * These are static final fields in order to give the optimiser more scope
     */
    public static final boolean DEBUG_PRINT_MESSAGES;
    public static final Set<LogTag> DEBUG_TAGS;
    public static final String DEBUG_PRINT_THREAD;
    public static final String DEBUG_FILE = getProperty(DEBUG_FILE_PROPERTY);

    static
    {
        final String debugPrintMessagesValue = getProperty(DEBUG_PRINT_MESSAGES_PROPERTY);
        boolean debugPrintMessages = false;
        Set<LogTag> debugTags = Collections.emptySet();
        if (debugPrintMessagesValue != null)
        {
            if ("all".equalsIgnoreCase(debugPrintMessagesValue) || "true".equalsIgnoreCase(debugPrintMessagesValue))
            {
                debugPrintMessages = true;
                debugTags = EnumSet.allOf(LogTag.class);
            }
            else
            {
                try
                {
                    debugTags = Stream
                        .of(debugPrintMessagesValue.split(","))
                        .map(String::trim)
                        .map(LogTag::valueOf)
                        .collect(toCollection(() -> EnumSet.noneOf(LogTag.class)));

                    debugPrintMessages = !debugTags.isEmpty();
                }
                catch (final IllegalArgumentException ex)
                {
                    System.err.println("Ignoring -D" + DEBUG_PRINT_MESSAGES_PROPERTY + "=" +
                        debugPrintMessagesValue + ": " + ex.getMessage());
                }
            }
        }

        final String debugPrintThreadValue = getProperty(DEBUG_PRINT_THREAD_PROPERTY);
        DEBUG_PRINT_THREAD = debugPrintThreadValue;
        DEBUG_PRINT_MESSAGES = debugPrintMessages;
        DEBUG_TAGS = debugTags;
    }

    private CommonConfiguration()
    {
    }
}
