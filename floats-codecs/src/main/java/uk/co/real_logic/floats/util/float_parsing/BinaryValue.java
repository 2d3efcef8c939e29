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

/**
 * Intermediate binary form {@code mantissa * 2^exponent} with a few more mantissa bits than the target format holds,
 * so that it can be rounded once when assembled.
 */
public final class BinaryValue
{
    private long mantissa;
    private int exponent;
    private boolean exact;

    BinaryValue set(final long mantissa, final int exponent, final boolean exact)
    {
        this.mantissa = mantissa;
        this.exponent = exponent;
        this.exact = exact;
        return this;
    }

    public long mantissa()
    {
        return mantissa;
    }

    public int exponent()
    {
        return exponent;
    }

    /**
     * @return true if no non zero bits were lost while scaling the decimal value, needed to break ties to even.
     */
    public boolean exact()
    {
        return exact;
    }

    public String toString()
    {
        return "BinaryValue{" +
            "mantissa=" + mantissa +
            ", exponent=" + exponent +
            ", exact=" + exact +
            '}';
    }
}
