package uk.co.real_logic.floats.util.float_parsing;

import org.agrona.DirectBuffer;

/**
 * Reads US-ASCII encoded text out of a buffer, one byte per character.
 */
public final class DirectBufferCharReader implements CharReader<DirectBuffer>
{
    public static final DirectBufferCharReader INSTANCE = new DirectBufferCharReader();

    private DirectBufferCharReader()
    {

    }

    @Override
    public char charAt(final DirectBuffer data, final int index)
    {
        return (char)(data.getByte(index) & 0xFF);
    }

    @Override
    public int digitAt(final DirectBuffer data, final int index)
    {
        final int digit = data.getByte(index) - '0';
        return digit >= 0 && digit <= 9 ? digit : NOT_A_DIGIT;
    }

    @Override
    public CharSequence asString(final DirectBuffer data, final int offset, final int length)
    {
        return data.getStringWithoutLengthAscii(offset, length);
    }
}
