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
import uk.co.real_logic.floats.DebugLogger;
import uk.co.real_logic.floats.LogTag;
import uk.co.real_logic.floats.fields.Float128;
import uk.co.real_logic.floats.fields.FloatFormat;
import uk.co.real_logic.floats.util.CharFormatter;

import java.util.Objects;

import static uk.co.real_logic.floats.util.float_parsing.DecimalValue.NO_TRUNCATION;

/**
 * Parses decimal text into the nearest value of an IEEE-754 binary format, rounding ties to even.
 * <p>
 * Accepts {@code "nan" | "inf" | "+inf" | "-inf" | [sign] digit* ["." digit*] [("e"|"E") [sign] digit+]}, the
 * special literals in any case. Nothing is trimmed: whitespace is an invalid character. Magnitudes beyond the range
 * of the format give a signed infinity or a signed zero rather than an error.
 * <p>
 * Instances reuse scratch state between calls and so aren't thread safe, see {@link FloatParsing} for a static
 * version.
 */
public final class IeeeFloatParser
{
    private static final int NOT_SPECIAL = 0;
    private static final int NAN = 1;
    private static final int POSITIVE_INFINITY = 2;
    private static final int NEGATIVE_INFINITY = 3;

    private static final char[] NAN_LITERAL = "nan".toCharArray();
    private static final char[] INF_LITERAL = "inf".toCharArray();

    private static final long QUAD_NAN_HIGH = 0x7FFF_8000_0000_0000L;
    private static final long QUAD_INFINITY_HIGH = 0x7FFF_0000_0000_0000L;
    private static final long QUAD_SIGN_MASK = 0x8000_0000_0000_0000L;

    private final DecimalValue decimalValue = new DecimalValue();
    private final BinaryValue binaryValue = new BinaryValue();
    private final FloatParserConfiguration configuration;

    private final CharFormatter specialLiteralFormatter = new CharFormatter("Parsed special literal %s as %s");
    private final CharFormatter truncationFormatter = new CharFormatter(
        "Dropped significant digits of %s from position %s, %s only takes %s into account");
    private final CharFormatter saturationFormatter = new CharFormatter("Saturated exponent of %s, %s is %s");

    public IeeeFloatParser()
    {
        this(new FloatParserConfiguration());
    }

    public IeeeFloatParser(final FloatParserConfiguration configuration)
    {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public FloatParserConfiguration configuration()
    {
        return configuration;
    }

    /**
     * Parses text into the bit pattern of a format of at most 64 bits.
     *
     * @param format     {@link FloatFormat#HALF}, {@link FloatFormat#SINGLE} or {@link FloatFormat#DOUBLE}.
     * @param charReader object that knows how to fetch chars out of the data.
     * @param data       buffer containing the text.
     * @param offset     where the text starts within the data.
     * @param length     length of the text.
     * @param <Data>     generic buffer.
     * @return the bit pattern, right aligned and zero extended.
     * @throws InvalidCharacterException if the text doesn't match the grammar.
     * @throws IllegalArgumentException  for {@link FloatFormat#QUAD} or a negative offset or length.
     */
    public <Data> long parseBits(
        final FloatFormat format,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        if (format == FloatFormat.QUAD)
        {
            throw new IllegalArgumentException(
                "QUAD doesn't fit into a long, use parseQuad(Float128, CharReader, Object, int, int)");
        }
        checkBounds(charReader, offset, length);

        final int special = specialLiteral(format, charReader, data, offset, length);
        if (special != NOT_SPECIAL)
        {
            switch (special)
            {
                case NAN:
                    return IeeeAssembler.nan(format);

                case POSITIVE_INFINITY:
                    return IeeeAssembler.infinity(format, false);

                default:
                    return IeeeAssembler.infinity(format, true);
            }
        }

        final long bits = parseComputed(format, charReader, data, offset, length);
        if (format == FloatFormat.HALF)
        {
            return FormatConversions.floatToHalfBits(Float.intBitsToFloat((int)bits)) & 0xFFFFL;
        }

        return bits;
    }

    public <Data> Float128 parseQuad(
        final Float128 result,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        Objects.requireNonNull(result, "result");
        checkBounds(charReader, offset, length);

        final int special = specialLiteral(FloatFormat.QUAD, charReader, data, offset, length);
        switch (special)
        {
            case NAN:
                return result.set(QUAD_NAN_HIGH, 0);

            case POSITIVE_INFINITY:
                return result.set(QUAD_INFINITY_HIGH, 0);

            case NEGATIVE_INFINITY:
                return result.set(QUAD_SIGN_MASK | QUAD_INFINITY_HIGH, 0);

            default:
                final long bits = parseComputed(FloatFormat.QUAD, charReader, data, offset, length);
                return FormatConversions.doubleToQuad(Double.longBitsToDouble(bits), result);
        }
    }

    public short parseHalf(final CharSequence string)
    {
        return (short)parseBits(FloatFormat.HALF, CharSequenceCharReader.INSTANCE, string, 0, string.length());
    }

    public float parseFloat(final CharSequence string)
    {
        return parseFloat(CharSequenceCharReader.INSTANCE, string, 0, string.length());
    }

    public double parseDouble(final CharSequence string)
    {
        return parseDouble(CharSequenceCharReader.INSTANCE, string, 0, string.length());
    }

    public Float128 parseQuad(final CharSequence string)
    {
        return parseQuad(new Float128(), CharSequenceCharReader.INSTANCE, string, 0, string.length());
    }

    /**
     * Parses US-ASCII text held in a buffer.
     *
     * @param buffer containing the text.
     * @param offset where the text starts within the buffer.
     * @param length length of the text in bytes.
     * @return the nearest float.
     */
    public float parseFloat(final DirectBuffer buffer, final int offset, final int length)
    {
        return parseFloat(DirectBufferCharReader.INSTANCE, buffer, offset, length);
    }

    public double parseDouble(final DirectBuffer buffer, final int offset, final int length)
    {
        return parseDouble(DirectBufferCharReader.INSTANCE, buffer, offset, length);
    }

    public <Data> float parseFloat(
        final CharReader<Data> charReader, final Data data, final int offset, final int length)
    {
        return Float.intBitsToFloat((int)parseBits(FloatFormat.SINGLE, charReader, data, offset, length));
    }

    public <Data> double parseDouble(
        final CharReader<Data> charReader, final Data data, final int offset, final int length)
    {
        return Double.longBitsToDouble(parseBits(FloatFormat.DOUBLE, charReader, data, offset, length));
    }

    private <Data> long parseComputed(
        final FloatFormat format,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        final FloatFormat computeFormat = format.computeFormat();
        final DecimalValue decimal = DecimalLexer.lex(decimalValue, computeFormat, charReader, data, offset, length);

        final int truncationIndex = decimal.truncationIndex();
        if (truncationIndex != NO_TRUNCATION)
        {
            onDigitTruncation(format, computeFormat, charReader, data, offset, length, truncationIndex);
        }

        final boolean negative = decimal.negative();
        switch (decimal.magnitude())
        {
            case ZERO:
                logSaturation(decimal, format, charReader, data, offset, length, "zero");
                return IeeeAssembler.zero(computeFormat, negative);

            case INFINITE:
                logSaturation(decimal, format, charReader, data, offset, length, "infinite");
                return IeeeAssembler.infinity(computeFormat, negative);

            default:
                final BinaryValue binary = DecimalToBinaryConverter.forFormat(computeFormat)
                    .convert(binaryValue, decimal.mantissa(), decimal.exponent());
                return IeeeAssembler.assemble(computeFormat, binary, negative);
        }
    }

    private <Data> void onDigitTruncation(
        final FloatFormat format,
        final FloatFormat computeFormat,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length,
        final int truncationIndex)
    {
        final int positionOfTruncation = truncationIndex - offset;
        if (DebugLogger.isEnabled(LogTag.DIGIT_TRUNCATION))
        {
            DebugLogger.log(LogTag.DIGIT_TRUNCATION, truncationFormatter
                .clear()
                .with(charReader.asString(data, offset, length))
                .with(positionOfTruncation)
                .with(format.name())
                .with(computeFormat.maxSignificantDigits()));
        }

        final DigitTruncationHandler handler = configuration.digitTruncationHandler();
        if (handler != null)
        {
            handler.onDigitTruncation(format, charReader, data, offset, length, positionOfTruncation);
        }
    }

    private <Data> void logSaturation(
        final DecimalValue decimal,
        final FloatFormat format,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length,
        final String result)
    {
        if (decimal.exponentSaturated() && DebugLogger.isEnabled(LogTag.EXPONENT_SATURATION))
        {
            DebugLogger.log(LogTag.EXPONENT_SATURATION, saturationFormatter
                .clear()
                .with(charReader.asString(data, offset, length))
                .with(format.name())
                .with(result));
        }
    }

    private <Data> int specialLiteral(
        final FloatFormat format,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        if (!configuration.specialLiteralsEnabled())
        {
            return NOT_SPECIAL;
        }

        final int special;
        if (matchesIgnoreCase(NAN_LITERAL, charReader, data, offset, length))
        {
            special = NAN;
        }
        else if (matchesIgnoreCase(INF_LITERAL, charReader, data, offset, length))
        {
            special = POSITIVE_INFINITY;
        }
        else if (length == INF_LITERAL.length + 1 &&
            matchesIgnoreCase(INF_LITERAL, charReader, data, offset + 1, length - 1))
        {
            final char sign = charReader.charAt(data, offset);
            special = sign == '+' ? POSITIVE_INFINITY : sign == '-' ? NEGATIVE_INFINITY : NOT_SPECIAL;
        }
        else
        {
            special = NOT_SPECIAL;
        }

        if (special != NOT_SPECIAL && DebugLogger.isEnabled(LogTag.FLOAT_PARSING))
        {
            DebugLogger.log(LogTag.FLOAT_PARSING, specialLiteralFormatter
                .clear()
                .with(charReader.asString(data, offset, length))
                .with(format.name()));
        }

        return special;
    }

    private static <Data> boolean matchesIgnoreCase(
        final char[] literal,
        final CharReader<Data> charReader,
        final Data data,
        final int offset,
        final int length)
    {
        if (length != literal.length)
        {
            return false;
        }

        for (int i = 0; i < length; i++)
        {
            if (toLowerAscii(charReader.charAt(data, offset + i)) != literal[i])
            {
                return false;
            }
        }

        return true;
    }

    private static char toLowerAscii(final char charValue)
    {
        return charValue >= 'A' && charValue <= 'Z' ? (char)(charValue + ('a' - 'A')) : charValue;
    }

    private static void checkBounds(final CharReader<?> charReader, final int offset, final int length)
    {
        Objects.requireNonNull(charReader, "charReader");
        if (offset < 0 || length < 0)
        {
            throw new IllegalArgumentException("offset and length must not be negative: " + offset + ", " + length);
        }
    }
}
