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

import uk.co.real_logic.floats.fields.FloatFormat;

public interface DigitTruncationHandler
{
    /**
     * Invoked at most once per parse, when the input has more significant digits than
     * {@link FloatFormat#maxSignificantDigits()} of the computing format. The parsed value doesn't depend on the
     * dropped digits, implementations may throw in order to reject such input.
     *
     * @param format target format of the parse
     * @param charReader reads chars, and copies text for messages, out of the data
     * @param data buffer containing the decimal text
     * @param offset offset within the buffer where the decimal text starts
     * @param length length of the decimal text
     * @param positionOfTruncation position within the decimal text of the first digit that was dropped
     * @param <Data> generic buffer
     */
    <Data> void onDigitTruncation(
        FloatFormat format,
        CharReader<Data> charReader,
        Data data,
        int offset,
        int length,
        int positionOfTruncation);
}
