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
 * Power of 5 arithmetic for binary64 mantissas: decimal mantissas of at most 17 digits, binary results of at most
 * 55 bits.
 * <p>
 * Table entries are unsigned 128 bit values stored as consecutive high, low {@code long} pairs.
 * {@code POW5_SPLIT[e]} holds 5<sup>e</sup> normalised to {@value #POW5_BITCOUNT} bits (truncated where
 * 5<sup>e</sup> is wider), {@code POW5_INV_SPLIT[e]} holds
 * &#x23a3;2<sup>pow5Bits(e) - 1 + {@value #POW5_INV_BITCOUNT}</sup> / 5<sup>e</sup>&#x23a6; + 1.
 */
public final class DoublePow5Arithmetic extends Pow5Arithmetic
{
    public static final DoublePow5Arithmetic INSTANCE = new DoublePow5Arithmetic();

    static final int POW5_BITCOUNT = 125;
    static final int POW5_INV_BITCOUNT = 125;

    private DoublePow5Arithmetic()
    {
    }

    public long mulPow5DivPow2(final long value, final int pow5Exponent, final int shift)
    {
        final int index = pow5Exponent << 1;
        return mulShift(
            value,
            POW5_SPLIT[index],
            POW5_SPLIT[index + 1],
            shift - pow5Bits(pow5Exponent) + POW5_BITCOUNT);
    }

    public long mulPow5InvDivPow2(final long value, final int pow5Exponent, final int shift)
    {
        final int index = pow5Exponent << 1;
        return mulShift(
            value,
            POW5_INV_SPLIT[index],
            POW5_INV_SPLIT[index + 1],
            shift + pow5Bits(pow5Exponent) - 1 + POW5_INV_BITCOUNT);
    }

    static int maxPow5Exponent()
    {
        return (POW5_SPLIT.length >> 1) - 1;
    }

    static int maxPow5InvExponent()
    {
        return (POW5_INV_SPLIT.length >> 1) - 1;
    }

    /**
     * Returns the high {@link Long#SIZE} bits of the full product {@code x}{@code y}, both interpreted as
     * unsigned {@code long}s.
     *
     * @param x the first factor.
     * @param y the second factor.
     * @return &#x23a3;{@code x}{@code y} &#xb7; 2<sup>-{@link Long#SIZE}</sup>&#x23a6;
     */
    static long multiplyHighUnsigned(final long x, final long y)
    {
        // Signed high product corrected for the operands' top bits.
        return Math.multiplyHigh(x, y) + ((x >> 63) & y) + ((y >> 63) & x);
    }

    /*
    Computes floor(value * factor / 2^shift) where factor = factorHigh * 2^64 + factorLow and 64 <= shift < 192.

    The product value * factorLow only contributes its high half, as the low half is always shifted out:
        floor(value * factor / 2^64) = value * factorHigh + floor(value * factorLow / 2^64)
    which is a 128 bit quantity held in sumHigh:sumLow before the final shift.
     */
    private static long mulShift(final long value, final long factorHigh, final long factorLow, final int shift)
    {
        final long bits0High = multiplyHighUnsigned(value, factorLow);
        final long bits2Low = value * factorHigh;
        final long bits2High = multiplyHighUnsigned(value, factorHigh);

        final long sumLow = bits0High + bits2Low;
        final long sumHigh = bits2High + (Long.compareUnsigned(sumLow, bits0High) < 0 ? 1 : 0);

        return shiftRight(sumHigh, sumLow, shift - 64);
    }

    private static long shiftRight(final long high, final long low, final int shift)
    {
        if (shift == 0)
        {
            return low;
        }

        if (shift < Long.SIZE)
        {
            return (low >>> shift) | (high << (Long.SIZE - shift));
        }

        return high >>> (shift - Long.SIZE);
    }

    /*
    The arrays have been computed and checked using full precision.
    Each high, low pair is prefixed with a comment indicating the exponent of 5.

    Contrary to common coding conventions, their definitions are located here, at the end of the file, because
    the length of their source would be distracting for reading the rest.
     */
    private static final long[] POW5_SPLIT =
    {
        /*   0 */ 0x1000_0000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   1 */ 0x1400_0000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   2 */ 0x1900_0000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   3 */ 0x1F40_0000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   4 */ 0x1388_0000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   5 */ 0x186A_0000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   6 */ 0x1E84_8000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   7 */ 0x1312_D000_0000_0000L, 0x0000_0000_0000_0000L,
        /*   8 */ 0x17D7_8400_0000_0000L, 0x0000_0000_0000_0000L,
        /*   9 */ 0x1DCD_6500_0000_0000L, 0x0000_0000_0000_0000L,
        /*  10 */ 0x12A0_5F20_0000_0000L, 0x0000_0000_0000_0000L,
        /*  11 */ 0x1748_76E8_0000_0000L, 0x0000_0000_0000_0000L,
        /*  12 */ 0x1D1A_94A2_0000_0000L, 0x0000_0000_0000_0000L,
        /*  13 */ 0x1230_9CE5_4000_0000L, 0x0000_0000_0000_0000L,
        /*  14 */ 0x16BC_C41E_9000_0000L, 0x0000_0000_0000_0000L,
        /*  15 */ 0x1C6B_F526_3400_0000L, 0x0000_0000_0000_0000L,
        /*  16 */ 0x11C3_7937_E080_0000L, 0x0000_0000_0000_0000L,
        /*  17 */ 0x1634_5785_D8A0_0000L, 0x0000_0000_0000_0000L,
        /*  18 */ 0x1BC1_6D67_4EC8_0000L, 0x0000_0000_0000_0000L,
        /*  19 */ 0x1158_E460_913D_0000L, 0x0000_0000_0000_0000L,
        /*  20 */ 0x15AF_1D78_B58C_4000L, 0x0000_0000_0000_0000L,
        /*  21 */ 0x1B1A_E4D6_E2EF_5000L, 0x0000_0000_0000_0000L,
        /*  22 */ 0x10F0_CF06_4DD5_9200L, 0x0000_0000_0000_0000L,
        /*  23 */ 0x152D_02C7_E14A_F680L, 0x0000_0000_0000_0000L,
        /*  24 */ 0x1A78_4379_D99D_B420L, 0x0000_0000_0000_0000L,
        /*  25 */ 0x108B_2A2C_2802_9094L, 0x0000_0000_0000_0000L,
        /*  26 */ 0x14AD_F4B7_3203_34B9L, 0x0000_0000_0000_0000L,
        /*  27 */ 0x19D9_71E4_FE84_01E7L, 0x4000_0000_0000_0000L,
        /*  28 */ 0x1027_E72F_1F12_8130L, 0x8800_0000_0000_0000L,
        /*  29 */ 0x1431_E0FA_E6D7_217CL, 0xAA00_0000_0000_0000L,
        /*  30 */ 0x193E_5939_A08C_E9DBL, 0xD480_0000_0000_0000L,
        /*  31 */ 0x1F8D_EF88_08B0_2452L, 0xC9A0_0000_0000_0000L,
        /*  32 */ 0x13B8_B5B5_056E_16B3L, 0xBE04_0000_0000_0000L,
        /*  33 */ 0x18A6_E322_46C9_9C60L, 0xAD85_0000_0000_0000L,
        /*  34 */ 0x1ED0_9BEA_D87C_0378L, 0xD8E6_4000_0000_0000L,
        /*  35 */ 0x1342_6172_C74D_822BL, 0x878F_E800_0000_0000L,
        /*  36 */ 0x1812_F9CF_7920_E2B6L, 0x6973_E200_0000_0000L,
        /*  37 */ 0x1E17_B843_5769_1B64L, 0x03D0_DA80_0000_0000L,
        /*  38 */ 0x12CE_D32A_16A1_B11EL, 0x8262_8890_0000_0000L,
        /*  39 */ 0x1782_87F4_9C4A_1D66L, 0x22FB_2AB4_0000_0000L,
        /*  40 */ 0x1D63_29F1_C35C_A4BFL, 0xABB9_F561_0000_0000L,
        /*  41 */ 0x125D_FA37_1A19_E6F7L, 0xCB54_395C_A000_0000L,
        /*  42 */ 0x16F5_78C4_E0A0_60B5L, 0xBE29_47B3_C800_0000L,
        /*  43 */ 0x1CB2_D6F6_18C8_78E3L, 0x2DB3_99A0_BA00_0000L,
        /*  44 */ 0x11EF_C659_CF7D_4B8DL, 0xFC90_4004_7440_0000L,
        /*  45 */ 0x166B_B7F0_435C_9E71L, 0x7BB4_5005_9150_0000L,
        /*  46 */ 0x1C06_A5EC_5433_C60DL, 0xDAA1_6406_F5A4_0000L,
        /*  47 */ 0x1184_27B3_B4A0_5BC8L, 0xA8A4_DE84_5986_8000L,
        /*  48 */ 0x15E5_31A0_A1C8_72BAL, 0xD2CE_1625_6FE8_2000L,
        /*  49 */ 0x1B5E_7E08_CA3A_8F69L, 0x8781_9BAE_CBE2_2800L,
        /*  50 */ 0x111B_0EC5_7E64_99A1L, 0xF4B1_014D_3F6D_5900L,
        /*  51 */ 0x1561_D276_DDFD_C00AL, 0x71DD_41A0_8F48_AF40L,
        /*  52 */ 0x1ABA_4714_957D_300DL, 0x0E54_9208_B31A_DB10L,
        /*  53 */ 0x10B4_6C6C_DD6E_3E08L, 0x28F4_DB45_6FF0_C8EAL,
        /*  54 */ 0x14E1_8788_14C9_CD8AL, 0x3332_1216_CBEC_FB24L,
        /*  55 */ 0x1A19_E96A_19FC_40ECL, 0xBFFE_969C_7EE8_39EDL,
        /*  56 */ 0x1050_31E2_503D_A893L, 0xF7FF_1E21_CF51_2434L,
        /*  57 */ 0x1464_3E5A_E44D_12B8L, 0xF5FE_E5AA_4325_6D41L,
        /*  58 */ 0x197D_4DF1_9D60_5767L, 0x337E_9F14_D3EE_C892L,
        /*  59 */ 0x1FDC_A16E_04B8_6D41L, 0x005E_46DA_08EA_7AB6L,
        /*  60 */ 0x13E9_E4E4_C2F3_4448L, 0xA03A_EC48_4592_8CB2L,
        /*  61 */ 0x18E4_5E1D_F3B0_155AL, 0xC849_A75A_56F7_2FDEL,
        /*  62 */ 0x1F1D_75A5_709C_1AB1L, 0x7A5C_1130_ECB4_FBD6L,
        /*  63 */ 0x1372_6987_6661_90AEL, 0xEC79_8ABE_93F1_1D65L,
        /*  64 */ 0x184F_03E9_3FF9_F4DAL, 0xA797_ED6E_38ED_64BFL,
        /*  65 */ 0x1E62_C4E3_8FF8_7211L, 0x517D_E8C9_C728_BDEFL,
        /*  66 */ 0x12FD_BB0E_39FB_474AL, 0xD2EE_B17E_1C79_76B5L,
        /*  67 */ 0x17BD_29D1_C87A_191DL, 0x87AA_5DDD_A397_D462L,
        /*  68 */ 0x1DAC_7446_3A98_9F64L, 0xE994_F555_0C7D_C97BL,
        /*  69 */ 0x128B_C8AB_E49F_639FL, 0x11FD_1955_27CE_9DEDL,
        /*  70 */ 0x172E_BAD6_DDC7_3C86L, 0xD67C_5FAA_71C2_4568L,
        /*  71 */ 0x1CFA_698C_9539_0BA8L, 0x8C1B_7795_0E32_D6C2L,
        /*  72 */ 0x121C_81F7_DD43_A749L, 0x5791_2ABD_28DF_C639L,
        /*  73 */ 0x16A3_A275_D494_911BL, 0xAD75_756C_7317_B7C8L,
        /*  74 */ 0x1C4C_8B13_49B9_B562L, 0x98D2_D2C7_8FDD_A5BAL,
        /*  75 */ 0x11AF_D6EC_0E14_115DL, 0x9F83_C3BC_B9EA_8794L,
        /*  76 */ 0x161B_CCA7_1199_15B5L, 0x0764_B4AB_E865_2979L,
        /*  77 */ 0x1BA2_BFD0_D5FF_5B22L, 0x493D_E1D6_E27E_73D7L,
        /*  78 */ 0x1145_B7E2_85BF_98F5L, 0x6DC6_AD26_4D8F_0866L,
        /*  79 */ 0x1597_25DB_272F_7F32L, 0xC938_586F_E0F2_CA80L,
        /*  80 */ 0x1AFC_EF51_F0FB_5EFFL, 0x7B86_6E8B_D92F_7D20L,
        /*  81 */ 0x10DE_1593_369D_1B5FL, 0xAD34_0517_67BD_AE34L,
        /*  82 */ 0x1515_9AF8_0444_6237L, 0x9881_065D_41AD_19C1L,
        /*  83 */ 0x1A5B_01B6_0555_7AC5L, 0x7EA1_47F4_9218_6032L,
        /*  84 */ 0x1078_E111_C355_6CBBL, 0x6F24_CCF8_DB4F_3C1FL,
        /*  85 */ 0x1497_1956_342A_C7EAL, 0x4AEE_0037_1223_0B27L,
        /*  86 */ 0x19BC_DFAB_C135_79E4L, 0xDDA9_8044_D6AB_CDF0L,
        /*  87 */ 0x1016_0BCB_58C1_6C2FL, 0x0A89_F02B_062B_60B6L,
        /*  88 */ 0x141B_8EBE_2EF1_C73AL, 0xCD2C_6C35_C7B6_38E4L,
        /*  89 */ 0x1922_726D_BAAE_3909L, 0x8077_8743_39A3_C71DL,
        /*  90 */ 0x1F6B_0F09_2959_C74BL, 0xE095_6914_080C_B8E4L,
        /*  91 */ 0x13A2_E965_B9D8_1C8FL, 0x6C5D_61AC_8507_F38EL,
        /*  92 */ 0x188B_A3BF_284E_23B3L, 0x4774_BA17_A649_F072L,
        /*  93 */ 0x1EAE_8CAE_F261_ACA0L, 0x1951_E89D_8FDC_6C8FL,
        /*  94 */ 0x132D_17ED_577D_0BE4L, 0x0FD3_3162_79E9_C3D9L,
        /*  95 */ 0x17F8_5DE8_AD5C_4EDDL, 0x13C7_FDBB_1864_34CFL,
        /*  96 */ 0x1DF6_7562_D8B3_6294L, 0x58B9_FD29_DE7D_4203L,
        /*  97 */ 0x12BA_095D_C770_1D9CL, 0xB774_3E3A_2B0E_4942L,
        /*  98 */ 0x1768_8BB5_394C_2503L, 0xE551_4DC8_B5D1_DB92L,
        /*  99 */ 0x1D42_AEA2_879F_2E44L, 0xDEA5_A13A_E346_5277L,
        /* 100 */ 0x1249_AD25_94C3_7CEBL, 0x0B27_84C4_CE0B_F38AL,
        /* 101 */ 0x16DC_186E_F9F4_5C25L, 0xCDF1_65F6_018E_F06DL,
        /* 102 */ 0x1C93_1E8A_B871_732FL, 0x416D_BF73_81F2_AC88L,
        /* 103 */ 0x11DB_F316_B346_E7FDL, 0x88E4_97A8_3137_ABD5L,
        /* 104 */ 0x1652_EFDC_6018_A1FCL, 0xEB1D_BD92_3D85_96CAL,
        /* 105 */ 0x1BE7_ABD3_781E_CA7CL, 0x25E5_2CF6_CCE6_FC7DL,
        /* 106 */ 0x1170_CB64_2B13_3E8DL, 0x97AF_3C1A_4010_5DCEL,
        /* 107 */ 0x15CC_FE3D_35D8_0E30L, 0xFD9B_0B20_D014_7542L,
        /* 108 */ 0x1B40_3DCC_834E_11BDL, 0x3D01_CDE9_0419_9292L,
        /* 109 */ 0x1108_269F_D210_CB16L, 0x4621_20B1_A28F_FB9BL,
        /* 110 */ 0x154A_3047_C694_FDDBL, 0xD7A9_68DE_0B33_FA82L,
        /* 111 */ 0x1A9C_BC59_B83A_3D52L, 0xCD93_C315_8E00_F923L,
        /* 112 */ 0x10A1_F5B8_1324_6653L, 0xC07C_59ED_78C0_9BB6L,
        /* 113 */ 0x14CA_7326_17ED_7FE8L, 0xB09B_7068_D6F0_C2A3L,
        /* 114 */ 0x19FD_0FEF_9DE8_DFE2L, 0xDCC2_4C83_0CAC_F34CL,
        /* 115 */ 0x103E_29F5_C2B1_8BEDL, 0xC9F9_6FD1_E7EC_180FL,
        /* 116 */ 0x144D_B473_335D_EEE9L, 0x3C77_CBC6_61E7_1E13L,
        /* 117 */ 0x1961_2190_0035_6AA3L, 0x8B95_BEB7_FA60_E598L,
        /* 118 */ 0x1FB9_69F4_0042_C54CL, 0x6E7B_2E65_F8F9_1EFEL,
        /* 119 */ 0x13D3_E238_8029_BB4FL, 0xC50C_FCFF_BB9B_B35FL,
        /* 120 */ 0x18C8_DAC6_A034_2A23L, 0xB650_3C3F_AA82_A037L,
        /* 121 */ 0x1EFB_1178_4841_34ACL, 0xA3E4_4B4F_9523_4844L,
        /* 122 */ 0x135C_EAEB_2D28_C0EBL, 0xE66E_AF11_BD36_0D2BL,
        /* 123 */ 0x1834_25A5_F872_F126L, 0xE00A_5AD6_2C83_9075L,
        /* 124 */ 0x1E41_2F0F_768F_AD70L, 0x980C_F18B_B7A4_7493L,
        /* 125 */ 0x12E8_BD69_AA19_CC66L, 0x5F08_16F7_52C6_C8DCL,
        /* 126 */ 0x17A2_ECC4_14A0_3F7FL, 0xF6CA_1CB5_2778_7B13L,
        /* 127 */ 0x1D8B_A7F5_19C8_4F5FL, 0xF47C_A3E2_7156_99D7L,
        /* 128 */ 0x1277_48F9_301D_319BL, 0xF8CD_E66D_86D6_2026L,
        /* 129 */ 0x1715_1B37_7C24_7E02L, 0xF701_6008_E88B_A830L,
        /* 130 */ 0x1CDA_6205_5B2D_9D83L, 0xB4C1_B80B_22AE_923CL,
        /* 131 */ 0x1208_7D43_58FC_8272L, 0x50F9_1306_F5AD_1B65L,
        /* 132 */ 0x168A_9C94_2F3B_A30EL, 0xE537_57C8_B318_623FL,
        /* 133 */ 0x1C2D_43B9_3B0A_8BD2L, 0x9E85_2DBA_DFDE_7ACFL,
        /* 134 */ 0x119C_4A53_C4E6_9763L, 0xA313_3C94_CBEB_0CC1L,
        /* 135 */ 0x1603_5CE8_B620_3D3CL, 0x8BD8_0BB9_FEE5_CFF1L,
        /* 136 */ 0x1B84_3422_E3A8_4C8BL, 0xAECE_0EA8_7E9F_43EEL,
        /* 137 */ 0x1132_A095_CE49_2FD7L, 0x4D40_C929_4F23_8A75L,
        /* 138 */ 0x157F_48BB_41DB_7BCDL, 0x2090_FB73_A2EC_6D12L,
        /* 139 */ 0x1ADF_1AEA_1252_5AC0L, 0x68B5_3A50_8BA7_8856L,
        /* 140 */ 0x10CB_70D2_4B73_78B8L, 0x4171_4472_5748_B536L,
        /* 141 */ 0x14FE_4D06_DE50_56E6L, 0x51CD_958E_ED1A_E283L,
        /* 142 */ 0x1A3D_E048_95E4_6C9FL, 0xE640_FAF2_A861_9B24L,
        /* 143 */ 0x1066_AC2D_5DAE_C3E3L, 0xEFE8_9CD7_A93D_00F7L,
        /* 144 */ 0x1480_5738_B51A_74DCL, 0xEBE2_C40D_938C_4134L,
        /* 145 */ 0x19A0_6D06_E261_1214L, 0x26DB_7510_F86F_5181L,
        /* 146 */ 0x1004_4424_4D7C_AB4CL, 0x9849_292A_9B45_92F1L,
        /* 147 */ 0x1405_552D_60DB_D61FL, 0xBE5B_7375_4216_F7ADL,
        /* 148 */ 0x1906_AA78_B912_CBA7L, 0xADF2_5052_929C_B598L,
        /* 149 */ 0x1F48_5516_E757_7E91L, 0x996E_E467_3743_E2FFL,
        /* 150 */ 0x138D_352E_5096_AF1AL, 0xFFE5_4EC0_828A_6DDFL,
        /* 151 */ 0x1870_8279_E4BC_5AE1L, 0xBFDE_A270_A32D_0957L,
        /* 152 */ 0x1E8C_A318_5DEB_719AL, 0x2FD6_4B0C_CBF8_4BADL,
        /* 153 */ 0x1317_E5EF_3AB3_2700L, 0x5DE5_EEE7_FF7B_2F4CL,
        /* 154 */ 0x17DD_DF6B_095F_F0C0L, 0x755F_6AA1_FF59_FB1FL,
        /* 155 */ 0x1DD5_5745_CBB7_ECF0L, 0x92B7_454A_7F30_79E7L,
        /* 156 */ 0x12A5_568B_9F52_F416L, 0x5BB2_8B4E_8F7E_4C30L,
        /* 157 */ 0x174E_AC2E_8727_B11BL, 0xF29F_2E22_335D_DF3CL,
        /* 158 */ 0x1D22_573A_28F1_9D62L, 0xEF46_F9AA_C035_570BL,
        /* 159 */ 0x1235_7684_5997_025DL, 0xD58C_5C0A_B821_5667L,
        /* 160 */ 0x16C2_D425_6FFC_C2F5L, 0x4AEF_730D_6629_AC01L,
        /* 161 */ 0x1C73_892E_CBFB_F3B2L, 0x9DAB_4FD0_BFB4_1701L,
        /* 162 */ 0x11C8_35BD_3F7D_784FL, 0xA28B_11E2_77D0_8E60L,
        /* 163 */ 0x163A_432C_8F5C_D663L, 0x8B2D_D65B_15C4_B1F9L,
        /* 164 */ 0x1BC8_D3F7_B334_0BFCL, 0x6DF9_4BF1_DB35_DE77L,
        /* 165 */ 0x115D_847A_D000_877DL, 0xC4BB_CF77_2901_AB0AL,
        /* 166 */ 0x15B4_E599_8400_A95DL, 0x35EA_C354_F342_15CDL,
        /* 167 */ 0x1B22_1EFF_E500_D3B4L, 0x8365_742A_3012_9B40L,
        /* 168 */ 0x10F5_535F_EF20_8450L, 0xD21F_689A_5E0B_A108L,
        /* 169 */ 0x1532_A837_EAE8_A565L, 0x06A7_42C0_F58E_894AL,
        /* 170 */ 0x1A7F_5245_E5A2_CEBEL, 0x4851_1371_32F2_2B9DL,
        /* 171 */ 0x108F_936B_AF85_C136L, 0xED32_AC26_BFD7_5B42L,
        /* 172 */ 0x14B3_7846_9B67_3184L, 0xA87F_5730_6FCD_3212L,
        /* 173 */ 0x19E0_5658_4240_FDE5L, 0xD29F_2CFC_8BC0_7E97L,
        /* 174 */ 0x102C_35F7_2968_9EAFL, 0xA3A3_7C1D_D758_4F1EL,
        /* 175 */ 0x1437_4374_F3C2_C65BL, 0x8C8C_5B25_4D2E_62E6L,
        /* 176 */ 0x1945_1452_30B3_77F2L, 0x6FAF_71EE_A079_FB9FL,
        /* 177 */ 0x1F96_5966_BCE0_55EFL, 0x0B9B_4E6A_4898_7A87L,
        /* 178 */ 0x13BD_F7E0_360C_35B5L, 0x6741_1102_6D5F_4C94L,
        /* 179 */ 0x18AD_75D8_438F_4322L, 0xC111_5543_08B7_1FBAL,
        /* 180 */ 0x1ED8_D34E_5473_13EBL, 0x7155_AA93_CAE4_E7A8L,
        /* 181 */ 0x1347_8410_F4C7_EC73L, 0x26D5_8A9C_5ECF_10C9L,
        /* 182 */ 0x1819_6515_31F9_E78FL, 0xF08A_ED43_7682_D4FBL,
        /* 183 */ 0x1E1F_BE5A_7E78_6173L, 0xECAD_A894_5423_8A3AL,
        /* 184 */ 0x12D3_D6F8_8F0B_3CE8L, 0x73EC_895C_B496_3664L,
        /* 185 */ 0x1788_CCB6_B2CE_0C22L, 0x90E7_ABB3_E1BB_C3FDL,
        /* 186 */ 0x1D6A_FFE4_5F81_8F2BL, 0x3521_96A0_DA2A_B4FDL,
        /* 187 */ 0x1262_DFEE_BBB0_F97BL, 0x0134_FE24_885A_B11EL,
        /* 188 */ 0x16FB_97EA_6A9D_37D9L, 0xC182_3DAD_AA71_5D65L,
        /* 189 */ 0x1CBA_7DE5_0544_85D0L, 0x31E2_CD19_150D_B4BFL,
        /* 190 */ 0x11F4_8EAF_234A_D3A2L, 0x1F2D_C02F_AD28_90F7L,
        /* 191 */ 0x1671_B25A_EC1D_888AL, 0xA6F9_303B_9872_B535L,
        /* 192 */ 0x1C0E_1EF1_A724_EAADL, 0x50B7_7C4A_7E8F_6282L,
        /* 193 */ 0x1188_D357_0877_12ACL, 0x5272_ADAE_8F19_9D91L,
        /* 194 */ 0x15EB_082C_CA94_D757L, 0x670F_591A_32E0_04F6L,
        /* 195 */ 0x1B65_CA37_FD3A_0D2DL, 0x40D3_2F60_BF98_0633L,
        /* 196 */ 0x111F_9E62_FE44_483CL, 0x4883_FD9C_77BF_03E0L,
        /* 197 */ 0x1567_85FB_BDD5_5A4BL, 0x5AA4_FD03_95AE_C4D8L,
        /* 198 */ 0x1AC1_677A_AD4A_B0DEL, 0x314E_3C44_7B1A_760EL,
        /* 199 */ 0x10B8_E0AC_AC4E_AE8AL, 0xDED0_E5AA_CCF0_89C9L,
        /* 200 */ 0x14E7_18D7_D762_5A2DL, 0x9685_1F15_802C_AC3BL,
        /* 201 */ 0x1A20_DF0D_CD3A_F0B8L, 0xFC26_66DA_E037_D74AL,
        /* 202 */ 0x1054_8B68_A044_D673L, 0x9D98_0048_CC22_E68EL,
        /* 203 */ 0x1469_AE42_C856_0C10L, 0x84FE_005A_FF2B_A032L,
        /* 204 */ 0x1984_19D3_7A6B_8F14L, 0xA63D_8071_BEF6_883EL,
        /* 205 */ 0x1FE5_2048_5906_72D9L, 0xCFCC_E08E_2EB4_2A4EL,
        /* 206 */ 0x13EF_342D_37A4_07C8L, 0x21E0_0C58_DD30_9A70L,
        /* 207 */ 0x18EB_0138_858D_09BAL, 0x2A58_0F6F_147C_C10DL,
        /* 208 */ 0x1F25_C186_A6F0_4C28L, 0xB4EE_134A_D99B_F150L,
        /* 209 */ 0x1377_98F4_2856_2F99L, 0x7114_CC0E_C801_76D2L,
        /* 210 */ 0x1855_7F31_326B_BB7FL, 0xCD59_FF12_7A01_D486L,
        /* 211 */ 0x1E6A_DEFD_7F06_AA5FL, 0xC0B0_7ED7_1882_49A8L,
        /* 212 */ 0x1302_CB5E_6F64_2A7BL, 0xD86E_4F46_6F51_6E09L,
        /* 213 */ 0x17C3_7E36_0B3D_351AL, 0xCE89_E318_0B25_C98BL,
        /* 214 */ 0x1DB4_5DC3_8E0C_8261L, 0x822C_5BDE_0DEF_3BEEL,
        /* 215 */ 0x1290_BA9A_38C7_D17CL, 0xF15B_B96A_C8B5_8575L,
        /* 216 */ 0x1734_E940_C6F9_C5DCL, 0x2DB2_A7C5_7AE2_E6D2L,
        /* 217 */ 0x1D02_2390_F8B8_3753L, 0x391F_51B6_D99B_A086L,
        /* 218 */ 0x1221_563A_9B73_2294L, 0x03B3_9312_4801_4454L,
        /* 219 */ 0x16A9_ABC9_424F_EB39L, 0x04A0_77D6_DA01_9569L,
        /* 220 */ 0x1C54_16BB_92E3_E607L, 0x45C8_95CC_9081_FAC3L,
        /* 221 */ 0x11B4_8E35_3BCE_6FC4L, 0x8B9D_5D9F_DA51_3CBAL,
        /* 222 */ 0x1621_B1C2_8AC2_0BB5L, 0xAE84_B507_D0E5_8BE8L,
        /* 223 */ 0x1BAA_1E33_2D72_8EA3L, 0x1A25_E249_C51E_EEE3L,
        /* 224 */ 0x114A_52DF_FC67_9925L, 0xF057_AD6E_1B33_554DL,
        /* 225 */ 0x159C_E797_FB81_7F6FL, 0x6C6D_98C9_A200_2AA1L,
        /* 226 */ 0x1B04_217D_FA61_DF4BL, 0x4788_FEFC_0A80_3549L,
        /* 227 */ 0x10E2_94EE_BC7D_2B8FL, 0x0CB5_9F5D_8690_214EL,
        /* 228 */ 0x151B_3A2A_6B9C_7672L, 0xCFE3_0734_E834_29A1L,
        /* 229 */ 0x1A62_08B5_0683_940FL, 0x83DB_C902_2241_340AL,
        /* 230 */ 0x107D_4571_2412_3C89L, 0xB269_5DA1_5568_C086L,
        /* 231 */ 0x149C_96CD_6D16_CBACL, 0x1F03_B509_AAC2_F0A7L,
        /* 232 */ 0x19C3_BC80_C85C_7E97L, 0x26C4_A24C_1573_ACD1L,
        /* 233 */ 0x101A_55D0_7D39_CF1EL, 0x783A_E56F_8D68_4C03L,
        /* 234 */ 0x1420_EB44_9C88_42E6L, 0x1649_9ECB_70C2_5F03L,
        /* 235 */ 0x1929_2615_C3AA_539FL, 0x9BDC_067E_4CF2_F6C4L,
        /* 236 */ 0x1F73_6F9B_3494_E887L, 0x82D3_081D_E02F_B476L,
        /* 237 */ 0x13A8_25C1_00DD_1154L, 0xB1C3_E512_AC1D_D0C9L,
        /* 238 */ 0x1892_2F31_4114_55A9L, 0xDE34_DE57_5725_44FCL,
        /* 239 */ 0x1EB6_BAFD_9159_6B14L, 0x55C2_15ED_2CEE_963BL,
        /* 240 */ 0x1332_34DE_7AD7_E2ECL, 0xB599_4DB4_3C15_1DE5L,
        /* 241 */ 0x17FE_C216_198D_DBA7L, 0xE2FF_A121_4B1A_655EL,
        /* 242 */ 0x1DFE_729B_9FF1_5291L, 0xDBBF_8969_9DE0_FEB6L,
        /* 243 */ 0x12BF_07A1_43F6_D39BL, 0x2957_B5E2_02AC_9F31L,
        /* 244 */ 0x176E_C989_94F4_8881L, 0xF3AD_A35A_8357_C6FEL,
        /* 245 */ 0x1D4A_7BEB_FA31_AAA2L, 0x7099_0C31_242D_B8BDL,
        /* 246 */ 0x124E_8D73_7C5F_0AA5L, 0x865F_A79E_B69C_9376L,
        /* 247 */ 0x16E2_30D0_5B76_CD4EL, 0xE7F7_9186_6443_B854L,
        /* 248 */ 0x1C9A_BD04_7254_80A2L, 0xA1F5_75E7_FD54_A669L,
        /* 249 */ 0x11E0_B622_C774_D065L, 0xA539_69B0_FE54_E801L,
        /* 250 */ 0x1658_E3AB_7952_047FL, 0x0E87_C41D_3DEA_2202L,
        /* 251 */ 0x1BEF_1C96_57A6_859EL, 0xD229_B524_8D64_AA82L,
        /* 252 */ 0x1175_71DD_F6C8_1383L, 0x435A_1136_D85E_EA91L,
        /* 253 */ 0x15D2_CE55_747A_1864L, 0x1430_9584_8E76_A536L,
        /* 254 */ 0x1B47_81EA_D198_9E7DL, 0x193C_BAE5_B214_4E83L,
        /* 255 */ 0x110C_B132_C2FF_630EL, 0x2FC5_F4CF_8F4C_B112L,
        /* 256 */ 0x154F_DD7F_73BF_3BD1L, 0xBBB7_7203_731F_DD56L,
        /* 257 */ 0x1AA3_D4DF_50AF_0AC6L, 0x2AA5_4E84_4FE7_D4ACL,
        /* 258 */ 0x10A6_650B_926D_66BBL, 0xDAA7_5112_B1F0_E4EBL,
        /* 259 */ 0x14CF_FE4E_7708_C06AL, 0xD151_2557_5E6D_1E26L,
        /* 260 */ 0x1A03_FDE2_14CA_F085L, 0x85A5_6EAD_3608_65B0L,
        /* 261 */ 0x1042_7EAD_4CFE_D653L, 0x7387_652C_41C5_3F8EL,
        /* 262 */ 0x1453_1E58_A03E_8BE8L, 0x5069_3E77_5236_8F71L,
        /* 263 */ 0x1967_E5EE_C84E_2EE2L, 0x6483_8E15_26C4_334EL,
        /* 264 */ 0x1FC1_DF6A_7A61_BA9AL, 0xFDA4_719A_7075_4022L,
        /* 265 */ 0x13D9_2BA2_8C7D_14A0L, 0xDE86_C700_8649_4815L,
        /* 266 */ 0x18CF_768B_2F9C_59C9L, 0x1628_78C0_A7DB_9A1AL,
        /* 267 */ 0x1F03_542D_FB83_703BL, 0x5BB2_96F0_D1D2_80A1L,
        /* 268 */ 0x1362_149C_BD32_2625L, 0x194F_9E56_8323_9064L,
        /* 269 */ 0x183A_99C3_EC7E_AFAEL, 0x5FA3_85EC_23EC_747EL,
        /* 270 */ 0x1E49_4034_E79E_5B99L, 0xF78C_6767_2CE7_919DL,
        /* 271 */ 0x12ED_C821_10C2_F940L, 0x3AB7_C0A0_7C10_BB02L,
        /* 272 */ 0x17A9_3A29_54F3_B790L, 0x4965_B0C8_9B14_E9C3L,
        /* 273 */ 0x1D93_88B3_AA30_A574L, 0x5BBF_1CFA_C1DA_2433L,
        /* 274 */ 0x127C_3570_4A5E_6768L, 0xB957_721C_B928_56A0L,
        /* 275 */ 0x171B_42CC_5CF6_0142L, 0xE7AD_4EA3_E772_6C48L,
        /* 276 */ 0x1CE2_137F_7433_8193L, 0xA198_A24C_E14F_075AL,
        /* 277 */ 0x120D_4C2F_A8A0_30FCL, 0x44FF_6570_0CD1_6498L,
        /* 278 */ 0x1690_9F3B_92C8_3D3BL, 0x563F_3ECC_1005_BDBEL,
        /* 279 */ 0x1C34_C70A_777A_4C8AL, 0x2BCF_0E7F_1407_2D2EL,
        /* 280 */ 0x11A0_FC66_8AAC_6FD6L, 0x5B61_690F_6C84_7C3DL,
        /* 281 */ 0x1609_3B80_2D57_8BCBL, 0xF239_C353_47A5_9B4CL,
        /* 282 */ 0x1B8B_8A60_38AD_6EBEL, 0xEEC8_3428_198F_021FL,
        /* 283 */ 0x1137_367C_236C_6537L, 0x553D_2099_0FF9_6153L,
        /* 284 */ 0x1585_041B_2C47_7E85L, 0x2A8C_68BF_53F7_B9A8L,
        /* 285 */ 0x1AE6_4521_F759_5E26L, 0x752F_82EF_28F5_A812L,
        /* 286 */ 0x10CF_EB35_3A97_DAD8L, 0x093D_B1D5_7999_890BL,
        /* 287 */ 0x1503_E602_893D_D18EL, 0x0B8D_1E4A_D7FF_EB4EL,
        /* 288 */ 0x1A44_DF83_2B8D_45F1L, 0x8E70_65DD_8DFF_E622L,
        /* 289 */ 0x106B_0BB1_FB38_4BB6L, 0xF906_3FAA_78BF_EFD5L,
        /* 290 */ 0x1485_CE9E_7A06_5EA4L, 0xB747_CF95_16EF_EBCAL,
        /* 291 */ 0x19A7_4246_1887_F64DL, 0xE519_C37A_5CAB_E6BDL,
        /* 292 */ 0x1008_896B_CF54_F9F0L, 0xAF30_1A2C_79EB_7036L,
        /* 293 */ 0x140A_ABC6_C32A_386CL, 0xDAFC_20B7_9866_4C43L,
        /* 294 */ 0x190D_56B8_73F4_C688L, 0x11BB_28E5_7E7F_DF54L,
        /* 295 */ 0x1F50_AC66_90F1_F82AL, 0x1629_F31E_DE1F_D72AL,
        /* 296 */ 0x1392_6BC0_1A97_3B1AL, 0x4DDA_37F3_4AD3_E67AL,
        /* 297 */ 0x1877_06B0_213D_09E0L, 0xE150_C5F0_1D88_E019L,
        /* 298 */ 0x1E94_C85C_298C_4C59L, 0x19A4_F76C_24EB_181FL,
        /* 299 */ 0x131C_FD39_99F7_AFB7L, 0xB007_1AA3_9712_EF13L,
        /* 300 */ 0x17E4_3C88_0075_9BA5L, 0x9C08_E14C_7CD7_AAD8L,
        /* 301 */ 0x1DDD_4BAA_0093_028FL, 0x030B_199F_9C0D_958EL,
        /* 302 */ 0x12AA_4F4A_405B_E199L, 0x61E6_F003_C188_7D79L,
        /* 303 */ 0x1754_E31C_D072_D9FFL, 0xBA60_AC04_B1EA_9CD7L,
        /* 304 */ 0x1D2A_1BE4_048F_907FL, 0xA8F8_D705_DE65_440DL,
        /* 305 */ 0x123A_516E_82D9_BA4FL, 0xC99B_8663_AAFF_4A88L,
        /* 306 */ 0x16C8_E5CA_2390_28E3L, 0xBC02_67FC_95BF_1D2AL,
        /* 307 */ 0x1C7B_1F3C_AC74_331CL, 0xAB03_01FB_BB2E_E474L,
        /* 308 */ 0x11CC_F385_EBC8_9FF1L, 0xEAE1_E13D_54FD_4EC9L,
        /* 309 */ 0x1640_3067_66BA_C7EEL, 0x659A_598C_AA3C_A27BL,
        /* 310 */ 0x1BD0_3C81_4069_79E9L, 0xFF00_EFEF_D4CB_CB1AL,
        /* 311 */ 0x1162_25D0_C841_EC32L, 0x3F60_95F5_E4FF_5EF0L,
        /* 312 */ 0x15BA_AF44_FA52_673EL, 0xCF38_BB73_5E3F_36ACL,
        /* 313 */ 0x1B29_5B16_38E7_010EL, 0x8306_EA50_35CF_0457L,
        /* 314 */ 0x10F9_D8ED_E390_60A9L, 0x11E4_5272_21A1_62B6L,
        /* 315 */ 0x1538_4F29_5C74_78D3L, 0x565D_670E_AA09_BB64L,
        /* 316 */ 0x1A86_62F3_B391_9708L, 0x2BF4_C0D2_548C_2A3DL,
        /* 317 */ 0x1093_FDD8_503A_FE65L, 0x1B78_F883_74D7_9A66L,
        /* 318 */ 0x14B8_FD4E_6449_BDFEL, 0x6257_36A4_520D_8100L,
        /* 319 */ 0x19E7_3CA1_FD5C_2D7DL, 0xFAED_044D_6690_E140L,
        /* 320 */ 0x1030_85E5_3E59_9C6EL, 0xBCD4_22B0_601A_8CC8L,
        /* 321 */ 0x143C_A75E_8DF0_038AL, 0x6C09_2B5C_7821_2FFAL,
        /* 322 */ 0x194B_D136_316C_046DL, 0x070B_7633_9629_7BF8L,
        /* 323 */ 0x1F9E_C583_BDC7_0588L, 0x48CE_53C0_7BB3_DAF6L,
        /* 324 */ 0x13C3_3B72_569C_6375L, 0x2D80_F458_4D50_68DAL,
        /* 325 */ 0x18B4_0A4E_EC43_7C52L, 0x78E1_316E_60A4_8310L,
    };

    private static final long[] POW5_INV_SPLIT =
    {
        /*   0 */ 0x2000_0000_0000_0000L, 0x0000_0000_0000_0001L,
        /*   1 */ 0x1999_9999_9999_9999L, 0x9999_9999_9999_999AL,
        /*   2 */ 0x147A_E147_AE14_7AE1L, 0x47AE_147A_E147_AE15L,
        /*   3 */ 0x1062_4DD2_F1A9_FBE7L, 0x6C8B_4395_8106_24DEL,
        /*   4 */ 0x1A36_E2EB_1C43_2CA5L, 0x7A78_6C22_6809_D496L,
        /*   5 */ 0x14F8_B588_E368_F084L, 0x61F9_F01B_866E_43ABL,
        /*   6 */ 0x10C6_F7A0_B5ED_8D36L, 0xB4C7_F349_3858_3622L,
        /*   7 */ 0x1AD7_F29A_BCAF_4857L, 0x87A6_520E_C08D_236AL,
        /*   8 */ 0x1579_8EE2_308C_39DFL, 0x9FB8_41A5_66D7_4F88L,
        /*   9 */ 0x112E_0BE8_26D6_94B2L, 0xE62D_0151_1F12_A607L,
        /*  10 */ 0x1B7C_DFD9_D7BD_BAB7L, 0xD6AE_6881_CB51_09A4L,
        /*  11 */ 0x15FD_7FE1_7964_955FL, 0xDEF1_ED34_A2A7_3AEAL,
        /*  12 */ 0x1197_9981_2DEA_1119L, 0x7F27_F0F6_E885_C8BBL,
        /*  13 */ 0x1C25_C268_4976_81C2L, 0x650C_B4BE_40D6_0DF8L,
        /*  14 */ 0x1684_9B86_A12B_9B01L, 0xEA70_9098_33DE_7193L,
        /*  15 */ 0x1203_AF9E_E756_159BL, 0x21F3_A6E0_297E_C143L,
        /*  16 */ 0x1CD2_B297_D889_BC2BL, 0x6985_D7CD_0F31_3537L,
        /*  17 */ 0x170E_F546_46D4_9689L, 0x2137_DFD7_3F5A_90F9L,
        /*  18 */ 0x1272_5DD1_D243_ABA0L, 0xE75F_E645_CC48_73FAL,
        /*  19 */ 0x1D83_C94F_B6D2_AC34L, 0xA566_3D3C_7A0D_865DL,
        /*  20 */ 0x179C_A10C_9242_235DL, 0x511E_9763_94D7_9EB1L,
        /*  21 */ 0x12E3_B40A_0E9B_4F7DL, 0xDA7E_DF82_DD79_4BC1L,
        /*  22 */ 0x1E39_2010_175E_E596L, 0x2A64_98D1_625B_AC68L,
        /*  23 */ 0x182D_B340_12B2_5144L, 0xEEB6_E0A7_81E2_F053L,
        /*  24 */ 0x1357_C299_A88E_A76AL, 0x5892_4D52_CE4F_26A9L,
        /*  25 */ 0x1EF2_D0F5_DA7D_D8AAL, 0x2750_7BB7_B07E_A441L,
        /*  26 */ 0x18C2_40C4_AECB_13BBL, 0x52A6_C95F_C065_5034L,
        /*  27 */ 0x13CE_9A36_F23C_0FC9L, 0x0EEB_D44C_99EA_A690L,
        /*  28 */ 0x1FB0_F6BE_5060_1941L, 0xB179_53AD_C311_0A80L,
        /*  29 */ 0x195A_5EFE_A6B3_4767L, 0xC12D_DC8B_0274_0867L,
        /*  30 */ 0x1448_4BFE_EBC2_9F86L, 0x3424_B06F_3529_A052L,
        /*  31 */ 0x1039_D665_8968_7F9EL, 0x901D_59F2_90EE_19DBL,
        /*  32 */ 0x19F6_23D5_A8A7_3297L, 0x4CFB_C31D_B4B0_295FL,
        /*  33 */ 0x14C4_E977_BA1F_5BACL, 0x3D96_35B1_5D59_BAB2L,
        /*  34 */ 0x109D_8792_FB4C_4956L, 0x97AB_5E27_7DE1_6228L,
        /*  35 */ 0x1A95_A5B7_F87A_0EF0L, 0xF2AB_C9D8_C968_9D0DL,
        /*  36 */ 0x1544_8493_2D2E_725AL, 0x5BBC_A17A_3ABA_173EL,
        /*  37 */ 0x1103_9D42_8A8B_8EAEL, 0xAFCA_1AC8_2EFB_45CBL,
        /*  38 */ 0x1B38_FB9D_AA78_E44AL, 0xB2DC_F7A6_B192_0945L,
        /*  39 */ 0x15C7_2FB1_552D_836EL, 0xF57D_92EB_C141_A104L,
        /*  40 */ 0x116C_2627_7757_9C58L, 0xC464_7589_6767_B403L,
        /*  41 */ 0x1BE0_3D0B_F225_C6F4L, 0x6D6D_88DB_D8A5_ECD2L,
        /*  42 */ 0x164C_FDA3_281E_38C3L, 0x8ABE_0716_46EB_23DBL,
        /*  43 */ 0x11D7_314F_534B_609CL, 0x6EFE_6C11_D255_B649L,
        /*  44 */ 0x1C8B_8218_8545_6760L, 0xB197_134F_B6EF_8A0EL,
        /*  45 */ 0x16D6_01AD_376A_B91AL, 0x27AC_0F72_F8BF_A1A5L,
        /*  46 */ 0x1244_CE24_2C55_60E1L, 0xB956_72C2_6099_4E1EL,
        /*  47 */ 0x1D3A_E36D_13BB_CE35L, 0xF557_1E03_CDC2_1695L,
        /*  48 */ 0x1762_4F8A_762F_D82BL, 0x2AAC_1803_0B01_ABABL,
        /*  49 */ 0x12B5_0C6E_C4F3_1355L, 0xBBBC_E002_6F34_8956L,
        /*  50 */ 0x1DEE_7A4A_D4B8_1EEFL, 0x92C7_CCD0_B1ED_A889L,
        /*  51 */ 0x17F1_FB6F_1093_4BF2L, 0xDBD3_0A40_8E57_BA07L,
        /*  52 */ 0x1327_FC58_DA0F_6FF5L, 0x7CA8_D500_71DF_C806L,
        /*  53 */ 0x1EA6_608E_29B2_4CBBL, 0xFAA7_BB33_E966_0CD6L,
        /*  54 */ 0x1885_1A0B_548E_A3C9L, 0x9552_FC29_8784_D711L,
        /*  55 */ 0x139D_AE6F_76D8_8307L, 0xAAA8_C9BA_D2D0_AC0EL,
        /*  56 */ 0x1F62_B0B2_57C0_D1A5L, 0xDDDA_DC5E_1E1A_ACE3L,
        /*  57 */ 0x191B_C08E_AC9A_4151L, 0x7E48_B04B_4B48_8A4FL,
        /*  58 */ 0x1416_33A5_56E1_CDDAL, 0xCB6D_59D5_D5D3_A1D9L,
        /*  59 */ 0x1011_C2EA_ABE7_D7E2L, 0x3C57_7B11_77DC_817BL,
        /*  60 */ 0x19B6_04AA_ACA6_2636L, 0xC6F2_5E82_5960_CF2AL,
        /*  61 */ 0x1491_9D55_56EB_51C5L, 0x6BF5_1868_4780_A5BBL,
        /*  62 */ 0x1074_7DDD_DF22_A7D1L, 0x232A_79ED_0600_8496L,
        /*  63 */ 0x1A53_FC96_31D1_0C81L, 0xD1DD_8FE1_A334_0756L,
        /*  64 */ 0x150F_FD44_F4A7_3D34L, 0xA7E4_731A_E8F6_6C45L,
        /*  65 */ 0x10D9_976A_5D52_975DL, 0x531D_28E2_53F8_569EL,
        /*  66 */ 0x1AF5_BF10_9550_F22EL, 0xEB61_DB03_B98D_5762L,
        /*  67 */ 0x1591_65A6_DDDA_5B58L, 0xBC4E_48CF_C7A4_45E8L,
        /*  68 */ 0x1141_1E1F_17E1_E2ADL, 0x6371_D3D9_6C83_6B20L,
        /*  69 */ 0x1B9B_6364_F303_0448L, 0x9F1C_8628_AD9F_11CDL,
        /*  70 */ 0x1615_E91D_8F35_9D06L, 0xE5B0_6B53_BE18_DB0BL,
        /*  71 */ 0x11AB_20E4_7291_4A6BL, 0xEAF3_890F_CB47_15A2L,
        /*  72 */ 0x1C45_016D_841B_AA46L, 0x44B8_DB4C_7871_BC37L,
        /*  73 */ 0x169D_9ABE_0349_5505L, 0x03C7_15D6_C6C1_635FL,
        /*  74 */ 0x1217_AEFE_6907_7737L, 0x3638_DE45_6BCD_E919L,
        /*  75 */ 0x1CF2_B197_0E72_5858L, 0x56C1_63A2_4616_41C1L,
        /*  76 */ 0x1728_8E12_71F5_1379L, 0xDF01_1C81_D1AB_67CEL,
        /*  77 */ 0x1286_D80E_C190_DC61L, 0x7F34_16CE_4155_ECA5L,
        /*  78 */ 0x1DA4_8CE4_68E7_C702L, 0x6520_247D_3556_476EL,
        /*  79 */ 0x17B6_D71D_20B9_6C01L, 0xEA80_1D30_F778_3925L,
        /*  80 */ 0x12F8_AC17_4D61_2334L, 0xBB99_B0F3_F92C_FA84L,
        /*  81 */ 0x1E5A_ACF2_1568_3854L, 0x5F5C_4E53_2847_F739L,
        /*  82 */ 0x1848_8A5B_4453_6043L, 0x7F7D_0B75_B9D3_2C2EL,
        /*  83 */ 0x136D_3B7C_36A9_19CFL, 0x9930_D5F7_C7DC_2358L,
        /*  84 */ 0x1F15_2BF9_F10E_8FB2L, 0x8EB4_898C_72F9_D226L,
        /*  85 */ 0x18DD_BCC7_F40B_A628L, 0x722A_07A3_8F2E_41B8L,
        /*  86 */ 0x13E4_9706_5CD6_1E86L, 0xC1BB_394F_A5BE_9AFAL,
        /*  87 */ 0x1FD4_24D6_FAF0_30D7L, 0x9C5E_C219_0930_F7F6L,
        /*  88 */ 0x1976_83DF_2F26_8D79L, 0x49E5_6814_075A_5FF8L,
        /*  89 */ 0x145E_CFE5_BF52_0AC7L, 0x6E51_2010_05E1_E660L,
        /*  90 */ 0x104B_D984_990E_6F05L, 0xF1DA_800C_D181_851AL,
        /*  91 */ 0x1A12_F5A0_F4E3_E4D6L, 0x4FC4_0014_8268_D4F5L,
        /*  92 */ 0x14DB_F7B3_F71C_B711L, 0xD969_99AA_01ED_772BL,
        /*  93 */ 0x10AF_F95C_C5B0_9274L, 0xADEE_1488_018A_C5BCL,
        /*  94 */ 0x1AB3_2894_6F80_EA54L, 0x497C_EDA6_68DE_092CL,
        /*  95 */ 0x155C_2076_BF9A_5510L, 0x3ACA_57B8_53E4_D424L,
        /*  96 */ 0x1116_805E_FFAE_AA73L, 0x623B_7960_431D_7683L,
        /*  97 */ 0x1B57_33CB_32B1_10B8L, 0x9D2B_F566_D1C8_BD9EL,
        /*  98 */ 0x15DF_5CA2_8EF4_0D60L, 0x7DBC_C452_416D_647FL,
        /*  99 */ 0x117F_7D4E_D8C3_3DE6L, 0xCAFD_69DB_678A_B6CCL,
        /* 100 */ 0x1BFF_2EE4_8E05_2FD7L, 0xAB2F_0FC5_7277_8ADFL,
        /* 101 */ 0x1665_BF1D_3E6A_8CACL, 0x88F2_7304_5B92_D580L,
        /* 102 */ 0x11EA_FF4A_9855_3D56L, 0xD3F5_28D0_4942_4466L,
        /* 103 */ 0x1CAB_3210_F3BB_9557L, 0xB988_414D_4203_A0A3L,
        /* 104 */ 0x16EF_5B40_C2FC_7779L, 0x6139_CDD7_6802_E6E9L,
        /* 105 */ 0x1259_15CD_68C9_F92DL, 0xE761_7179_2002_5254L,
        /* 106 */ 0x1D5B_5615_7476_5B7CL, 0xA568_B58E_999D_5086L,
        /* 107 */ 0x177C_44DD_F6C5_15FDL, 0x5120_913E_E14A_A6D2L,
        /* 108 */ 0x12C9_D0B1_9237_44CAL, 0xA74D_40FF_1AA2_1F0EL,
        /* 109 */ 0x1E0F_B44F_5058_6E11L, 0x0BAE_CE64_F769_CB4AL,
        /* 110 */ 0x180C_903F_7379_F1A7L, 0x3C8B_D850_C5EE_3C3BL,
        /* 111 */ 0x133D_4032_C2C7_F485L, 0xCA09_79DA_37F1_C9C9L,
        /* 112 */ 0x1EC8_66B7_9E0C_BA6FL, 0xA9A8_C2F6_BFE9_42DBL,
        /* 113 */ 0x18A0_522C_7E70_9526L, 0x2153_CF2B_CCBA_9BE3L,
        /* 114 */ 0x13B3_74F0_6526_DDB8L, 0x1AA9_7289_7095_4982L,
        /* 115 */ 0x1F85_87E7_083E_2F8CL, 0xF775_840F_1A88_759DL,
        /* 116 */ 0x1937_9FEC_0698_260AL, 0x5F91_3672_7BA0_5E17L,
        /* 117 */ 0x142C_7FF0_0546_84D5L, 0x1940_F85B_9619_E4DFL,
        /* 118 */ 0x1023_998C_D105_3710L, 0xE100_C6AF_AB47_EA4CL,
        /* 119 */ 0x19D2_8F47_B4D5_24E7L, 0xCE67_A44C_453F_DD47L,
        /* 120 */ 0x14A8_729F_C3DD_B71FL, 0xD852_E9D6_9DCC_B106L,
        /* 121 */ 0x1086_C219_697E_2C19L, 0x79DB_EE45_4B0A_2738L,
        /* 122 */ 0x1A71_368F_0F30_468FL, 0x295F_E3A2_11A9_D859L,
        /* 123 */ 0x1527_5ED8_D8F3_6BA5L, 0xBAB3_1C81_A7BB_137AL,
        /* 124 */ 0x10EC_4BE0_AD8F_8951L, 0x6228_E39A_EC95_A92FL,
        /* 125 */ 0x1B13_AC9A_AF4C_0EE8L, 0x9D0E_38F7_E0EF_7517L,
        /* 126 */ 0x15A9_56E2_25D6_7253L, 0xB0D8_2D93_1A59_2A79L,
        /* 127 */ 0x1154_4581_B7DE_C1DCL, 0x8D79_BE0F_4847_552EL,
        /* 128 */ 0x1BBA_08CF_8C97_9C94L, 0x158F_967E_DA0B_BB7CL,
        /* 129 */ 0x162E_6D72_D6DF_B076L, 0x77A6_11FF_14D6_2F97L,
        /* 130 */ 0x11BE_BDF5_78B2_F391L, 0xF951_A7FF_43DE_8C79L,
        /* 131 */ 0x1C64_6322_5AB7_EC1CL, 0xC21C_3FFE_D2FD_AD8EL,
        /* 132 */ 0x16B6_B5B5_155F_F017L, 0x01B0_3332_4264_8AD8L,
        /* 133 */ 0x122B_C490_DDE6_59ACL, 0x0159_C28E_9B83_A246L,
        /* 134 */ 0x1D12_D41A_FCA3_C2ACL, 0xCEF6_0417_5F39_03A3L,
        /* 135 */ 0x1742_4348_CA1C_9BBDL, 0x725E_69AC_4C2D_9C83L,
        /* 136 */ 0x129B_6907_0816_E2FDL, 0xF518_5489_D68A_E39CL,
        /* 137 */ 0x1DC5_74D8_0CF1_6B2FL, 0xEE8D_540F_BDAB_05C6L,
        /* 138 */ 0x17D1_2A46_70C1_228CL, 0xBED7_7672_FE22_6B05L,
        /* 139 */ 0x130D_BB6B_8D67_4ED6L, 0xFF12_C528_CB4E_BC04L,
        /* 140 */ 0x1E7C_5F12_7BD8_7E24L, 0xCB51_3B74_787D_F9A0L,
        /* 141 */ 0x1863_7F41_FCAD_31B7L, 0x090D_C929_F9FE_614DL,
        /* 142 */ 0x1382_CC34_CA24_27C5L, 0xA0D7_D421_94CB_810AL,
        /* 143 */ 0x1F37_AD21_436D_0C6FL, 0x67BF_B9CF_5478_CE77L,
        /* 144 */ 0x18F9_574D_CF8A_7059L, 0x1FCC_94A5_DD2D_71F9L,
        /* 145 */ 0x13FA_AC3E_3FA1_F37AL, 0x7FD6_DD51_7DBD_F4C7L,
        /* 146 */ 0x1FF7_79FD_329C_B8C3L, 0xFFBE_2EE8_C92F_EE0BL,
        /* 147 */ 0x1992_C7FD_C216_FA36L, 0x6631_BF20_A0F3_24D6L,
        /* 148 */ 0x1475_6CCB_01AB_FB5EL, 0xB827_CC1A_1A5C_1D78L,
        /* 149 */ 0x105D_F0A2_67BC_C918L, 0x9353_09AE_7B7C_E460L,
        /* 150 */ 0x1A2F_E76A_3F94_74F4L, 0x1EEB_42B0_C594_A099L,
        /* 151 */ 0x14F3_1F88_32DD_2A5CL, 0xE589_0227_0476_E6E1L,
        /* 152 */ 0x10C2_7FA0_28B0_EEB0L, 0xB7A0_CE85_9D2B_EBE7L,
        /* 153 */ 0x1AD0_CC33_744E_4AB4L, 0x5901_4A6F_61DF_DFD8L,
        /* 154 */ 0x1573_D68F_903E_A229L, 0xE0CD_D525_E7E6_4CADL,
        /* 155 */ 0x1129_7872_D9CB_B4EEL, 0x4D71_7751_8651_D6F1L,
        /* 156 */ 0x1B75_8D84_8FAC_54B0L, 0x7BE8_BEE8_D6E9_57E8L,
        /* 157 */ 0x15F7_A46A_0C89_DD59L, 0xFCBA_3253_DF21_1320L,
        /* 158 */ 0x1192_E9EE_706E_4AAEL, 0x63C8_2843_18E7_4280L,
        /* 159 */ 0x1C1E_4317_1A4A_1117L, 0x060D_0D38_27D8_6A66L,
        /* 160 */ 0x167E_9C12_7B6E_7412L, 0x6B3D_A42C_ECAD_21EBL,
        /* 161 */ 0x11FE_E341_FC58_5CDBL, 0x88FE_1CF0_BD57_4E56L,
        /* 162 */ 0x1CCB_0536_608D_615FL, 0x4196_94B4_6225_4A23L,
        /* 163 */ 0x1708_D0F8_4D3D_E77FL, 0x67AB_AA29_E81D_D4E9L,
        /* 164 */ 0x126D_73F9_D764_B932L, 0xB956_21BB_2017_DD87L,
        /* 165 */ 0x1D7B_ECC2_F23A_C1EAL, 0xC223_692B_668C_95A5L,
        /* 166 */ 0x1796_5702_5B62_34BBL, 0xCE82_BA89_1ED6_DE1DL,
        /* 167 */ 0x12DE_AC01_E2B4_F6FCL, 0xA535_6207_4BDF_1818L,
        /* 168 */ 0x1E31_1336_3787_F194L, 0x3B88_9CD8_7964_F359L,
        /* 169 */ 0x1827_4291_C606_5ADCL, 0xFC6D_4A46_C783_F5E1L,
        /* 170 */ 0x1352_9BA7_D19E_AF17L, 0x3057_6E9F_0603_2B1AL,
        /* 171 */ 0x1EEA_92A6_1C31_1825L, 0x1A25_7DCB_3CD1_DE90L,
        /* 172 */ 0x18BB_A884_E35A_79B7L, 0x481D_FE3C_30A7_E540L,
        /* 173 */ 0x13C9_539D_82AE_C7C5L, 0xD34B_31C9_C086_5100L,
        /* 174 */ 0x1FA8_85C8_D117_A609L, 0x5211_E942_CDA3_B4CDL,
        /* 175 */ 0x1953_9E3A_40DF_B807L, 0x74DB_2102_3E1C_90A4L,
        /* 176 */ 0x1442_E4FB_6719_6005L, 0xF715_B401_CB4A_0D50L,
        /* 177 */ 0x1035_83FC_527A_B337L, 0xF8DE_299B_0908_0AA7L,
        /* 178 */ 0x19EF_3993_B72A_B859L, 0x8E30_4291_A80C_DDD7L,
        /* 179 */ 0x14BF_6142_F8EE_F9E1L, 0x3E8D_020E_200A_4B13L,
        /* 180 */ 0x1099_1A9B_FA58_C7E7L, 0x653D_9B3E_8008_3C0FL,
        /* 181 */ 0x1A8E_90F9_908E_0CA5L, 0x6EC8_F864_000D_2CE4L,
        /* 182 */ 0x153E_DA61_4071_A3B7L, 0x8BD3_F9E9_99A4_23EAL,
        /* 183 */ 0x10FF_151A_99F4_82F9L, 0x3CA9_94BA_E150_1CBBL,
        /* 184 */ 0x1B31_BB5D_C320_D18EL, 0xC775_BAC4_9BB3_612BL,
        /* 185 */ 0x15C1_62B1_68E7_0E0BL, 0xD2C4_956A_1629_1A89L,
        /* 186 */ 0x1167_8227_871F_3E6FL, 0xDBD0_7788_11BA_7BA1L,
        /* 187 */ 0x1BD8_D03F_3E98_63E6L, 0x2C80_BF40_1C5D_929BL,
        /* 188 */ 0x1647_0CFF_6546_B651L, 0xBD33_CC33_49E4_7549L,
        /* 189 */ 0x11D2_70CC_5105_5EA7L, 0xCA8F_D68F_6E50_5DD4L,
        /* 190 */ 0x1C83_E7AD_4E6E_FDD9L, 0x4419_574B_E3B3_C953L,
        /* 191 */ 0x16CF_EC8A_A525_97E1L, 0x0347_7909_82F6_3AA9L,
        /* 192 */ 0x123F_F06E_EA84_7980L, 0xCF6C_60D4_68C4_FBBAL,
        /* 193 */ 0x1D33_1A4B_10D3_F59AL, 0xE57A_3487_0E07_F92AL,
        /* 194 */ 0x175C_1508_DA43_2AE2L, 0x512E_906C_0B39_9422L,
        /* 195 */ 0x12B0_10D3_E1CF_5581L, 0xDA8B_A6BC_D5C7_A9B5L,
        /* 196 */ 0x1DE6_8153_02E5_559CL, 0x90DF_712E_22D9_0F87L,
        /* 197 */ 0x17EB_9AA8_CF1D_DE16L, 0xDA4C_5A8B_4F14_0C6CL,
        /* 198 */ 0x1322_E220_A5B1_7E78L, 0xAEA3_7BA2_A5A9_A38AL,
        /* 199 */ 0x1E9E_369A_A2B5_9727L, 0x7DD2_5F6A_A2A9_05A9L,
        /* 200 */ 0x187E_9215_4EF7_AC1FL, 0x97DB_7F88_8220_D154L,
        /* 201 */ 0x1398_74DD_D8C6_234CL, 0x797C_6606_CE80_A777L,
        /* 202 */ 0x1F5A_5496_27A3_6BADL, 0x8F2D_700A_E401_0BF1L,
        /* 203 */ 0x1915_1078_1FB5_EFBEL, 0x0C24_59A2_5000_D65AL,
        /* 204 */ 0x1410_D9F9_B2F7_F2FEL, 0x701D_1481_D99A_4515L,
        /* 205 */ 0x100D_7B2E_28C6_5BFEL, 0xC017_439B_147B_6A77L,
        /* 206 */ 0x19AF_2B7D_0E0A_2CCAL, 0xCCF2_05C4_ED92_43F2L,
        /* 207 */ 0x148C_22CA_71A1_BD6FL, 0x0A5B_37D0_BE0E_9CC2L,
        /* 208 */ 0x1070_1BD5_27B4_978CL, 0x0848_F973_CB3E_E3CEL,
        /* 209 */ 0x1A4C_F955_0C54_25ACL, 0xDA0E_5BEC_7864_9FB0L,
        /* 210 */ 0x150A_6110_D6A9_B7BDL, 0x7B3E_AFF0_6050_7FC0L,
        /* 211 */ 0x10D5_1A73_DEEE_2C97L, 0x95CB_BFF3_8040_6633L,
        /* 212 */ 0x1AEE_90B9_64B0_4758L, 0xEFAC_6652_66CD_7052L,
        /* 213 */ 0x158B_A6FA_B6F3_6C47L, 0x2623_850E_B8A4_59DBL,
        /* 214 */ 0x113C_8595_5F29_236CL, 0x1E82_D0D8_93B6_AE49L,
        /* 215 */ 0x1B94_08EE_FEA8_38ACL, 0xFD9E_1AF4_1F8A_B075L,
        /* 216 */ 0x1610_0725_9886_93BDL, 0x97B1_AF29_B2D5_59F7L,
        /* 217 */ 0x11A6_6C1E_139E_DC97L, 0xAC8E_25BA_F577_7B2CL,
        /* 218 */ 0x1C3D_79C9_B8FE_2DBFL, 0x7A7D_092B_2258_C513L,
        /* 219 */ 0x1697_94A1_60CB_57CCL, 0x61FD_A0EF_4EAD_6A76L,
        /* 220 */ 0x1212_DD4D_E709_1309L, 0xE7FE_1A59_0BBD_EEC5L,
        /* 221 */ 0x1CEA_FBAF_D80E_84DCL, 0xA663_5D5B_45FC_B13AL,
        /* 222 */ 0x1722_62F3_133E_D0B0L, 0x851C_4AAF_6B30_8DC8L,
        /* 223 */ 0x1281_E8C2_75CB_DA26L, 0xD0E3_6EF2_BC26_D7D4L,
        /* 224 */ 0x1D9C_A79D_8946_29D7L, 0xB49F_17EA_C6A4_8C86L,
        /* 225 */ 0x17B0_8617_A104_EE46L, 0x2A18_DFEF_0550_706BL,
        /* 226 */ 0x12F3_9E79_4D9D_8B6BL, 0x54E0_B325_9DD9_F389L,
        /* 227 */ 0x1E52_9728_7C2F_4578L, 0x87CD_EB6F_62F6_5274L,
        /* 228 */ 0x1842_1286_C9BF_6AC6L, 0xD30B_22BF_825E_A85DL,
        /* 229 */ 0x1368_0ED2_3AFF_889FL, 0x0F3C_1BCC_684B_B9E4L,
        /* 230 */ 0x1F0C_E483_9198_DA98L, 0x1860_2C7A_4079_296DL,
        /* 231 */ 0x18D7_1D36_0E13_E213L, 0x46B3_56C8_3394_2124L,
        /* 232 */ 0x13DF_4A91_A4DC_B4DCL, 0x388F_78A0_2943_4DB6L,
        /* 233 */ 0x1FCB_AA82_A161_2160L, 0x5A7F_2766_A86B_AF8AL,
        /* 234 */ 0x196F_BB9B_B44D_B44DL, 0x1532_85EB_B9EF_BFA2L,
        /* 235 */ 0x1459_62E2_F6A4_903DL, 0xAA8E_D189_618C_994EL,
        /* 236 */ 0x1047_824F_2BB6_D9CAL, 0xEED8_A7A1_1AD6_E10CL,
        /* 237 */ 0x1A0C_03B1_DF8A_F611L, 0x7E27_729B_5E24_9B45L,
        /* 238 */ 0x14D6_695B_193B_F80DL, 0xFE85_F549_181D_4904L,
        /* 239 */ 0x10AB_877C_142F_F9A4L, 0xCB9E_5DD4_134A_A0D0L,
        /* 240 */ 0x1AAC_0BF9_B9E6_5C3AL, 0xDF63_C953_5211_014DL,
        /* 241 */ 0x1556_6FFA_FB1E_B02FL, 0x191C_A10F_74DA_6771L,
        /* 242 */ 0x1111_F32F_2F4B_C025L, 0xADB0_80D9_2A48_52C1L,
        /* 243 */ 0x1B4F_EB7E_B212_CD09L, 0x15E7_348E_AA0D_5134L,
        /* 244 */ 0x15D9_8932_280F_0A6DL, 0xAB1F_5D3E_EE71_0DC4L,
        /* 245 */ 0x117A_D428_200C_0857L, 0xBC19_1765_8B8D_A49DL,
        /* 246 */ 0x1BF7_B9D9_CCE0_0D59L, 0x2CF4_F23C_127C_3A94L,
        /* 247 */ 0x165F_C7E1_70B3_3DE0L, 0xF0C3_F4FC_DB96_9543L,
        /* 248 */ 0x11E6_3981_26F5_CB1AL, 0x5A36_5D97_1612_1103L,
        /* 249 */ 0x1CA3_8F35_0B22_DE90L, 0x9056_FC24_F01C_E804L,
        /* 250 */ 0x16E9_3F5D_A282_4BA6L, 0xD9DF_301D_8CE3_ECD0L,
        /* 251 */ 0x1254_32B1_4ECE_A2EBL, 0xE17F_59B1_3D83_23DAL,
        /* 252 */ 0x1D53_844E_E47D_D179L, 0x68CB_C2B5_2F38_395CL,
        /* 253 */ 0x1776_0372_5064_A794L, 0x53D6_355D_BF60_2DE3L,
        /* 254 */ 0x12C4_CF8E_A6B6_EC76L, 0xA978_2AB1_65E6_8B1CL,
        /* 255 */ 0x1E07_B27D_D78B_13F1L, 0x0F26_AAB5_6FD7_44FAL,
        /* 256 */ 0x1806_2864_AC6F_4327L, 0x3F52_222A_BFDF_6A62L,
        /* 257 */ 0x1338_2050_89F2_9C1FL, 0x65DB_4E88_997F_884EL,
        /* 258 */ 0x1EC0_33B4_0FEA_9365L, 0x6FC5_4A74_28CC_0D4AL,
        /* 259 */ 0x1899_C2F6_7322_0F84L, 0x596A_A1F6_8709_A43BL,
        /* 260 */ 0x13AE_3591_F5B4_D936L, 0xADEE_E7F8_6C07_B696L,
        /* 261 */ 0x1F7D_2283_22BA_F524L, 0x497E_3FF3_E00C_5756L,
        /* 262 */ 0x1930_E868_E895_90E9L, 0xD464_FFF6_4CD6_AC45L,
        /* 263 */ 0x1427_2053_ED44_73EEL, 0x4383_FFF8_3D78_89D1L,
        /* 264 */ 0x101F_4D0F_F103_8FF1L, 0xCF9C_CCC6_9793_A174L,
        /* 265 */ 0x19CB_AE7F_E805_B31CL, 0x7F61_47A4_25B9_0252L,
        /* 266 */ 0x14A2_F1FF_ECD1_5C16L, 0xCC4D_D2E9_B7C7_350FL,
        /* 267 */ 0x1082_5B33_23DA_B012L, 0x3D0B_0F21_5FD2_90D9L,
        /* 268 */ 0x1A6A_2B85_062A_B350L, 0x61AB_4B68_9950_E7C1L,
        /* 269 */ 0x1521_BC6A_6B55_5C40L, 0x4E22_A2BA_1440_B967L,
        /* 270 */ 0x10E7_C9EE_BC44_49CDL, 0x0B4E_E894_DD00_9453L,
        /* 271 */ 0x1B0C_764A_C6D3_A948L, 0x1217_DA87_C800_ED51L,
        /* 272 */ 0x15A3_91D5_6BDC_876CL, 0xDB46_486C_A000_BDDAL,
        /* 273 */ 0x114F_A7DD_EFE3_9F8AL, 0x4905_06BD_4CCD_64AFL,
        /* 274 */ 0x1BB2_A62F_E638_FF43L, 0xA808_0AC8_7AE2_3AB1L,
        /* 275 */ 0x1628_84F3_1E93_FF69L, 0x5339_A239_FBE8_2EF4L,
        /* 276 */ 0x11BA_03F5_B20F_FF87L, 0x75C7_B4FB_2FEC_F25DL,
        /* 277 */ 0x1C5C_D322_B67F_FF3FL, 0x22D9_2191_E647_EA2EL,
        /* 278 */ 0x16B0_A8E8_91FF_FF65L, 0xB57A_8141_8506_54F2L,
        /* 279 */ 0x1226_ED86_DB33_32B7L, 0xC462_0101_3738_43F5L,
        /* 280 */ 0x1D0B_15A4_91EB_8459L, 0x3A36_6801_F1F3_9FEEL,
        /* 281 */ 0x173C_1150_74BC_69E0L, 0xFB5E_B99B_27F6_198BL,
        /* 282 */ 0x1296_7440_5D63_87E7L, 0x2F7E_FAE2_865E_7AD6L,
        /* 283 */ 0x1DBD_86CD_6238_D971L, 0xE597_F7D0_D6FD_9156L,
        /* 284 */ 0x17CA_D23D_E82D_7AC1L, 0x8479_930D_78CA_DAABL,
        /* 285 */ 0x1308_A831_868A_C89AL, 0xD061_4271_2D6F_1556L,
        /* 286 */ 0x1E74_404F_3DAA_DA91L, 0x4D68_6A4E_AF18_2222L,
        /* 287 */ 0x185D_003F_6488_AEDAL, 0xA453_883E_F279_B4E8L,
        /* 288 */ 0x137D_99CC_506D_58AEL, 0xE9DC_6CFF_2861_5D87L,
        /* 289 */ 0x1F2F_5C7A_1A48_8DE4L, 0xA960_AE65_0D68_95A4L,
        /* 290 */ 0x18F2_B061_AEA0_7183L, 0xBAB3_BEB7_3DED_4483L,
        /* 291 */ 0x13F5_59E7_BEE6_C136L, 0x2EF6_322C_318A_9D36L,
        /* 292 */ 0x1FEE_F63F_97D7_9B89L, 0xE4BD_1D13_8277_61F0L,
        /* 293 */ 0x198B_F832_DFDF_AFA1L, 0x83CA_7DA9_352C_4E5AL,
        /* 294 */ 0x146F_F9C2_4CB2_F2E7L, 0x9CA1_FE20_F756_A515L,
        /* 295 */ 0x1059_949B_708F_28B9L, 0x4A1B_31B3_F912_1DAAL,
        /* 296 */ 0x1A28_EDC5_80E5_0DF5L, 0x435E_B5EC_C1B6_95DDL,
        /* 297 */ 0x14ED_8B04_671D_A4C4L, 0x35E5_5E57_015E_DE4AL,
        /* 298 */ 0x10BE_08D0_527E_1D69L, 0xC4B7_7EAC_0118_B1D5L,
        /* 299 */ 0x1AC9_A7B3_B730_2F0FL, 0xA125_9779_9B5A_B622L,
        /* 300 */ 0x156E_1FC2_F8F3_58D9L, 0x4DB7_AC61_4915_5E81L,
        /* 301 */ 0x1124_E635_93F5_E0ADL, 0xD7C6_2381_0744_4B9BL,
        /* 302 */ 0x1B6E_3D22_8656_3449L, 0x593D_059B_3ED3_AC2BL,
        /* 303 */ 0x15F1_CA82_0511_C36DL, 0xE0FD_9E15_CBDC_89BCL,
        /* 304 */ 0x118E_3B9B_3741_6924L, 0xB3FE_1811_6FE3_A163L,
        /* 305 */ 0x1C16_C5C5_2535_7507L, 0x8663_59B5_7FD2_9BD1L,
        /* 306 */ 0x1678_9E37_50F7_90D2L, 0xD1E9_1491_330E_E30EL,
        /* 307 */ 0x11FA_182C_40C6_0D75L, 0x74BA_76DA_8F3F_1C0BL,
        /* 308 */ 0x1CC3_59E0_67A3_48BBL, 0xEDF7_2490_E531_C678L,
        /* 309 */ 0x1702_AE4D_1FB5_D3C9L, 0x8B2C_1D40_B75B_052DL,
        /* 310 */ 0x1268_8B70_E62B_0FD4L, 0x6F56_7DCD_5F7C_0424L,
        /* 311 */ 0x1D74_124E_3D11_B2EDL, 0x7EF0_C948_98C6_6D06L,
        /* 312 */ 0x1790_0EA4_FDA7_C257L, 0x98C0_A106_E09E_BD9FL,
        /* 313 */ 0x12D9_A550_CAEC_9B79L, 0x4700_80D2_4D4B_CAE6L,
        /* 314 */ 0x1E29_0881_44AD_C58EL, 0xD800_CE1D_4879_44A2L,
        /* 315 */ 0x1820_D39A_9D57_D13FL, 0x1333_D817_6D2D_D082L,
        /* 316 */ 0x134D_7615_4AAC_A765L, 0xA8F6_4679_2424_A6CEL,
        /* 317 */ 0x1EE2_5688_777A_A56FL, 0x74BD_3D8E_A03A_A47DL,
        /* 318 */ 0x18B5_1206_C5FB_B78CL, 0x5D64_313E_E695_5064L,
        /* 319 */ 0x13C4_0E6B_D196_2C70L, 0x4AB6_8DCB_EBAA_A6B7L,
        /* 320 */ 0x1FA0_1712_E8F0_471AL, 0x1124_1613_12AA_A457L,
        /* 321 */ 0x194C_DF42_53F3_6C14L, 0xDA83_44DC_0EEE_E9DFL,
        /* 322 */ 0x143D_7F68_4329_2343L, 0xE202_9D7C_D8BF_2180L,
        /* 323 */ 0x1031_32B9_CF54_1C36L, 0x4E68_7DFD_7A32_8133L,
        /* 324 */ 0x19E8_5129_4BB9_C6BDL, 0x4A40_C995_9050_CEB8L,
        /* 325 */ 0x14B9_DA87_6FC7_D231L, 0x0833_D477_A6A7_0BC6L,
        /* 326 */ 0x1094_AED2_BFD3_0E8DL, 0xA029_76C6_1EEC_096BL,
        /* 327 */ 0x1A87_7E1D_FFB8_1749L, 0x0042_57A3_64AC_DBDFL,
        /* 328 */ 0x1539_31B1_9960_12A0L, 0xCD01_DFB5_EA23_E319L,
        /* 329 */ 0x10FA_8E27_ADE6_754DL, 0x70CE_4C91_881C_B5AEL,
        /* 330 */ 0x1B2A_7D0C_4970_BBAFL, 0x1AE3_ADB5_A694_55E2L,
        /* 331 */ 0x15BB_973D_078D_62F2L, 0x7BE9_57C4_8543_77E8L,
        /* 332 */ 0x1162_DF64_060A_B58EL, 0xC987_796A_0435_F987L,
        /* 333 */ 0x1BD1_656C_D677_88E4L, 0x75A5_8F10_06BC_C271L,
        /* 334 */ 0x1641_1DF0_AB92_D3E9L, 0xF7B7_A5A6_6BCA_3527L,
        /* 335 */ 0x11CD_B18D_560F_0FEEL, 0x5FC6_1E1E_BCA1_C41FL,
        /* 336 */ 0x1C7C_4F48_89B1_B316L, 0xFFA3_6364_6102_D365L,
        /* 337 */ 0x16C9_D906_D48E_28DFL, 0x32E9_1C50_4D9B_DC51L,
        /* 338 */ 0x123B_1405_76D8_20B2L, 0x8F20_E373_7149_7D0EL,
        /* 339 */ 0x1D2B_533B_F159_CDEAL, 0x7E9B_0585_820F_2E7CL,
        /* 340 */ 0x1755_DC2F_F447_D7EEL, 0xCBAF_379E_01A5_BECAL,
        /* 341 */ 0x12AB_168C_C36C_ACBFL, 0x0958_F94B_3484_98A1L,
    };
}
