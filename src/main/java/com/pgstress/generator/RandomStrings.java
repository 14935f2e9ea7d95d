package com.pgstress.generator;

import java.util.Random;

/**
 * Random alphanumeric strings drawn from {@code [A-Za-z0-9]}.
 */
public final class RandomStrings {

    static final String ALPHANUMERIC =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private RandomStrings() {
    }

    /**
     * Builds a string of {@code length} characters, each chosen uniformly.
     *
     * @param random the random source
     * @param length number of characters
     * @return the generated string
     */
    public static String alphanumeric(Random random, int length) {
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length()));
        }
        return new String(chars);
    }
}
