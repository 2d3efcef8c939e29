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

/**
 * Power of 5 arithmetic for binary32 mantissas: decimal mantissas of at most 9 digits, binary results of at most
 * 26 bits.
 * <p>
 * Table entries are unsigned 64 bit values. {@code POW5_SPLIT[e]} holds 5<sup>e</sup> normalised to
 * {@value #POW5_BITCOUNT} bits, {@code POW5_INV_SPLIT[e]} holds
 * &#x23a3;2<sup>pow5Bits(e) - 1 + {@value #POW5_INV_BITCOUNT}</sup> / 5<sup>e</sup>&#x23a6; + 1.
 */
public final class SinglePow5Arithmetic extends Pow5Arithmetic
{
    public static final SinglePow5Arithmetic INSTANCE = new SinglePow5Arithmetic();

    static final int POW5_BITCOUNT = 61;
    static final int POW5_INV_BITCOUNT = 59;

    private static final long MASK_32 = 0xFFFF_FFFFL;

    private SinglePow5Arithmetic()
    {
    }

    public long mulPow5DivPow2(final long value, final int pow5Exponent, final int shift)
    {
        return mulShift(value, POW5_SPLIT[pow5Exponent], shift - pow5Bits(pow5Exponent) + POW5_BITCOUNT);
    }

    public long mulPow5InvDivPow2(final long value, final int pow5Exponent, final int shift)
    {
        return mulShift(
            value, POW5_INV_SPLIT[pow5Exponent], shift + pow5Bits(pow5Exponent) - 1 + POW5_INV_BITCOUNT);
    }

    static int maxPow5Exponent()
    {
        return POW5_SPLIT.length - 1;
    }

    static int maxPow5InvExponent()
    {
        return POW5_INV_SPLIT.length - 1;
    }

    /*
    Computes floor(value * factor / 2^shift) for value < 2^32 and 32 < shift < 96, splitting the factor into
    32 bit halves so both partial products fit into a long.
     */
    private static long mulShift(final long value, final long factor, final int shift)
    {
        final long factorLow = factor & MASK_32;
        final long factorHigh = factor >>> 32;
        final long bits0 = value * factorLow;
        final long bits1 = value * factorHigh;
        final long sum = (bits0 >>> 32) + bits1;
        return sum >>> (shift - 32);
    }

    /*
    The arrays have been computed and checked using full precision.
    Each value is prefixed with a comment indicating the exponent of 5.
     */
    private static final long[] POW5_SPLIT =
    {
        /*  0 */ 0x1000_0000_0000_0000L,
        /*  1 */ 0x1400_0000_0000_0000L,
        /*  2 */ 0x1900_0000_0000_0000L,
        /*  3 */ 0x1F40_0000_0000_0000L,
        /*  4 */ 0x1388_0000_0000_0000L,
        /*  5 */ 0x186A_0000_0000_0000L,
        /*  6 */ 0x1E84_8000_0000_0000L,
        /*  7 */ 0x1312_D000_0000_0000L,
        /*  8 */ 0x17D7_8400_0000_0000L,
        /*  9 */ 0x1DCD_6500_0000_0000L,
        /* 10 */ 0x12A0_5F20_0000_0000L,
        /* 11 */ 0x1748_76E8_0000_0000L,
        /* 12 */ 0x1D1A_94A2_0000_0000L,
        /* 13 */ 0x1230_9CE5_4000_0000L,
        /* 14 */ 0x16BC_C41E_9000_0000L,
        /* 15 */ 0x1C6B_F526_3400_0000L,
        /* 16 */ 0x11C3_7937_E080_0000L,
        /* 17 */ 0x1634_5785_D8A0_0000L,
        /* 18 */ 0x1BC1_6D67_4EC8_0000L,
        /* 19 */ 0x1158_E460_913D_0000L,
        /* 20 */ 0x15AF_1D78_B58C_4000L,
        /* 21 */ 0x1B1A_E4D6_E2EF_5000L,
        /* 22 */ 0x10F0_CF06_4DD5_9200L,
        /* 23 */ 0x152D_02C7_E14A_F680L,
        /* 24 */ 0x1A78_4379_D99D_B420L,
        /* 25 */ 0x108B_2A2C_2802_9094L,
        /* 26 */ 0x14AD_F4B7_3203_34B9L,
        /* 27 */ 0x19D9_71E4_FE84_01E7L,
        /* 28 */ 0x1027_E72F_1F12_8130L,
        /* 29 */ 0x1431_E0FA_E6D7_217CL,
        /* 30 */ 0x193E_5939_A08C_E9DBL,
        /* 31 */ 0x1F8D_EF88_08B0_2452L,
        /* 32 */ 0x13B8_B5B5_056E_16B3L,
        /* 33 */ 0x18A6_E322_46C9_9C60L,
        /* 34 */ 0x1ED0_9BEA_D87C_0378L,
        /* 35 */ 0x1342_6172_C74D_822BL,
        /* 36 */ 0x1812_F9CF_7920_E2B6L,
        /* 37 */ 0x1E17_B843_5769_1B64L,
        /* 38 */ 0x12CE_D32A_16A1_B11EL,
        /* 39 */ 0x1782_87F4_9C4A_1D66L,
        /* 40 */ 0x1D63_29F1_C35C_A4BFL,
        /* 41 */ 0x125D_FA37_1A19_E6F7L,
        /* 42 */ 0x16F5_78C4_E0A0_60B5L,
        /* 43 */ 0x1CB2_D6F6_18C8_78E3L,
        /* 44 */ 0x11EF_C659_CF7D_4B8DL,
        /* 45 */ 0x166B_B7F0_435C_9E71L,
        /* 46 */ 0x1C06_A5EC_5433_C60DL,
    };

    private static final long[] POW5_INV_SPLIT =
    {
        /*  0 */ 0x0800_0000_0000_0001L,
        /*  1 */ 0x0666_6666_6666_6667L,
        /*  2 */ 0x051E_B851_EB85_1EB9L,
        /*  3 */ 0x0418_9374_BC6A_7EFAL,
        /*  4 */ 0x068D_B8BA_C710_CB2AL,
        /*  5 */ 0x053E_2D62_38DA_3C22L,
        /*  6 */ 0x0431_BDE8_2D7B_634EL,
        /*  7 */ 0x06B5_FCA6_AF2B_D216L,
        /*  8 */ 0x055E_63B8_8C23_0E78L,
        /*  9 */ 0x044B_82FA_09B5_A52DL,
        /* 10 */ 0x06DF_37F6_75EF_6EAEL,
        /* 11 */ 0x057F_5FF8_5E59_2558L,
        /* 12 */ 0x0465_E660_4B7A_8447L,
        /* 13 */ 0x0709_709A_125D_A071L,
        /* 14 */ 0x05A1_26E1_A84A_E6C1L,
        /* 15 */ 0x0480_EBE7_B9D5_8567L,
        /* 16 */ 0x0734_ACA5_F622_6F0BL,
        /* 17 */ 0x05C3_BD51_91B5_25A3L,
        /* 18 */ 0x049C_9774_7490_EAE9L,
        /* 19 */ 0x0760_F253_EDB4_AB0EL,
        /* 20 */ 0x05E7_2843_2490_88D8L,
        /* 21 */ 0x04B8_ED02_83A6_D3E0L,
        /* 22 */ 0x078E_4804_05D7_B966L,
        /* 23 */ 0x060B_6CD0_04AC_9452L,
        /* 24 */ 0x04D5_F0A6_6A23_A9DBL,
        /* 25 */ 0x07BC_B43D_769F_762BL,
        /* 26 */ 0x0630_9031_2BB2_C4EFL,
        /* 27 */ 0x04F3_A68D_BC8F_03F3L,
        /* 28 */ 0x07EC_3DAF_9418_0651L,
        /* 29 */ 0x0656_97BF_A9AC_D1DAL,
        /* 30 */ 0x0512_12FF_BAF0_A7E2L,
        /* 31 */ 0x040E_7599_625A_1FE8L,
        /* 32 */ 0x067D_88F5_6A29_CCA6L,
        /* 33 */ 0x0531_3A5D_EE87_D6ECL,
        /* 34 */ 0x0427_61E4_BED3_1256L,
        /* 35 */ 0x06A5_696D_FE1E_83BDL,
        /* 36 */ 0x0551_2124_CB4B_9C97L,
        /* 37 */ 0x0440_E750_A2A2_E3ACL,
        /* 38 */ 0x06CE_3EE7_6A9E_3913L,
        /* 39 */ 0x0571_CBEC_554B_60DCL,
        /* 40 */ 0x045B_0989_DDD5_E717L,
        /* 41 */ 0x06F8_0F42_FC89_71BEL,
        /* 42 */ 0x0593_3F68_CA07_8E31L,
        /* 43 */ 0x0475_CC53_D4D2_D828L,
        /* 44 */ 0x0722_E086_2151_59D9L,
        /* 45 */ 0x05B5_806B_4DDA_AE47L,
        /* 46 */ 0x0491_3389_0B15_5839L,
        /* 47 */ 0x074E_B8DB_44EE_F38EL,
        /* 48 */ 0x05D8_93E2_9D8B_F60BL,
        /* 49 */ 0x04AD_431B_B13C_C4D6L,
        /* 50 */ 0x077B_9E92_B52E_07BCL,
        /* 51 */ 0x05FC_7EDB_C424_D2FDL,
        /* 52 */ 0x04C9_FF16_3683_DBFEL,
        /* 53 */ 0x07A9_9823_8A6C_932FL,
        /* 54 */ 0x0621_4682_D523_A8F3L,
    };
}
