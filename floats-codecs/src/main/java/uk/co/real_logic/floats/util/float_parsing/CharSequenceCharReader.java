package uk.co.real_logic.floats.util.float_parsing;

/**
 * Reads text held in a {@link CharSequence}, e.g. a {@link String} or a {@link StringBuilder} being filled in.
 */
public final class CharSequenceCharReader implements CharReader<CharSequence>
{
    public static final CharSequenceCharReader INSTANCE = new CharSequenceCharReader();

    private CharSequenceCharReader()
    {

    }

    @Override
    public char charAt(final CharSequence data, final int index)
    {
        return data.charAt(index);
    }

    @Override
    public CharSequence asString(final CharSequence data, final int offset, final int length)
    {
        return data.subSequence(offset, offset + length);
    }
}
