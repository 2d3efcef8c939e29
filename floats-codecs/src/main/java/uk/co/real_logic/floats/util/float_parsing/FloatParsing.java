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

import org.agrona.DirectBuffer;
import uk.co.real_logic.floats.fields.Float128;
import uk.co.real_logic.floats.fields.FloatFormat;

/**
 * Static entry points for parsing decimal text, safe to call from any thread. Each thread parses with its own
 * {@link IeeeFloatParser} using the configuration defaults.
 */
public final class FloatParsing
{
    private static final ThreadLocal<IeeeFloatParser> PARSER = ThreadLocal.withInitial(IeeeFloatParser::new);

    private FloatParsing()
    {
    }

    /**
     * @param string decimal text.
     * @return the binary16 bit pattern nearest to the text.
     * @throws InvalidCharacterException if the text doesn't match the grammar.
     */
    public static short parseHalf(final CharSequence string)
    {
        return PARSER.get().parseHalf(string);
    }

    public static float parseFloat(final CharSequence string)
    {
        return PARSER.get().parseFloat(string);
    }

    public static float parseFloat(final DirectBuffer buffer, final int offset, final int length)
    {
        return PARSER.get().parseFloat(buffer, offset, length);
    }

    public static double parseDouble(final CharSequence string)
    {
        return PARSER.get().parseDouble(string);
    }

    public static double parseDouble(final DirectBuffer buffer, final int offset, final int length)
    {
        return PARSER.get().parseDouble(buffer, offset, length);
    }

    /**
     * Parses into binary128. The value is computed in binary64 and widened, so it carries no more precision than
     * {@link #parseDouble(CharSequence)}.
     *
     * @param string decimal text.
     * @return a new value holding the result.
     * @throws InvalidCharacterException if the text doesn't match the grammar.
     */
    public static Float128 parseQuad(final CharSequence string)
    {
        return PARSER.get().parseQuad(string);
    }

    public static Float128 parseQuad(final Float128 result, final CharSequence string)
    {
        return PARSER.get().parseQuad(result, CharSequenceCharReader.INSTANCE, string, 0, string.length());
    }

    public static long parseBits(final FloatFormat format, final CharSequence string)
    {
        return PARSER.get().parseBits(format, CharSequenceCharReader.INSTANCE, string, 0, string.length());
    }
}
