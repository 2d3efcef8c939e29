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

/**
 * Destination for the lines written through {@link DebugLogger}, extend it to bridge parser diagnostics into the
 * logging framework of an application.
 * <p>
 * Register the subclass as a {@link java.util.ServiceLoader} provider of this type, the first provider found wins.
 * Without one a {@link PrintingDebugAppender} is used.
 */
public abstract class AbstractDebugAppender
{
    /**
     * Created once per logging thread, so implementations may keep mutable scratch state without synchronisation.
     */
    public abstract static class ThreadLocalAppender
    {
        /**
         * @param logTag  the tag the message was logged under.
         * @param message the formatted message, without a line separator. Only valid for the duration of the call.
         */
        public abstract void log(LogTag logTag, CharSequence message);
    }

    public abstract ThreadLocalAppender makeLocalAppender();
}
