package uk.co.real_logic.floats.util.float_parsing;

/**
 * Strategy for pulling characters of decimal text out of some kind of storage, so that the lexer can run over
 * strings and off-heap buffers alike without copying.
 *
 * @param <Data> the storage the text lives in.
 */
public interface CharReader<Data>
{
    int NOT_A_DIGIT = -1;

    char charAt(Data data, int index);

    /**
     * Copies a region out for error messages and debug logging. Parsing itself only reads through
     * {@link #charAt(Object, int)} and {@link #digitAt(Object, int)}.
     */
    CharSequence asString(Data data, int offset, int length);

    /**
     * @return the value of an ASCII decimal digit at the index or {@link #NOT_A_DIGIT}.
     */
    default int digitAt(final Data data, final int index)
    {
        final int digit = charAt(data, index) - '0';
        return digit >= 0 && digit <= 9 ? digit : NOT_A_DIGIT;
    }
}
