package com.syrup.shared.util;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 (Bitcoin 字母表) 編解碼，Solana 的 key 與簽名都用這個格式
 */
public final class Base58 {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);

    private Base58() {}

    public static String encode(byte[] input) {
        if (input.length == 0) {
            return "";
        }
        int leadingZeros = 0;
        while (leadingZeros < input.length && input[leadingZeros] == 0) {
            leadingZeros++;
        }

        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        sb.append("1".repeat(leadingZeros));
        return sb.reverse().toString();
    }

    /**
     * @throws IllegalArgumentException 含非 Base58 字元
     */
    public static byte[] decode(String input) {
        if (input == null || input.isEmpty()) {
            return new byte[0];
        }
        BigInteger value = BigInteger.ZERO;
        for (char c : input.toCharArray()) {
            int digit = ALPHABET.indexOf(c);
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid Base58 character: " + c);
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }

        byte[] raw = value.toByteArray();
        // BigInteger 可能帶一個正負號用的前導 0
        if (raw.length > 1 && raw[0] == 0) {
            raw = Arrays.copyOfRange(raw, 1, raw.length);
        }
        if (value.signum() == 0) {
            raw = new byte[0];
        }

        int leadingOnes = 0;
        while (leadingOnes < input.length() && input.charAt(leadingOnes) == '1') {
            leadingOnes++;
        }
        byte[] result = new byte[leadingOnes + raw.length];
        System.arraycopy(raw, 0, result, leadingOnes, raw.length);
        return result;
    }
}
