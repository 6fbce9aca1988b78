package com.spellcheck.data;

/**
 * Soundex-like code used to bucket words that sound alike.
 *
 * <p>The code keeps the first letter (uppercased) and maps each later consonant to a sound class digit.
 * Vowels and any other character are skipped, consecutive equal digits are collapsed,
 * and the result is cut or zero-padded to {@value #LENGTH} characters.
 */
public final class PhoneticCode {

    public static final int LENGTH = 4;

    private PhoneticCode() {}

    /**
     * Returns the code for {@code word}, or an empty string for null/empty input.
     */
    public static String encode(String word) {
        if (word == null || word.isEmpty()) return "";

        StringBuilder code = new StringBuilder(LENGTH);
        code.append(Character.toUpperCase(word.charAt(0)));

        for (int i = 1; i < word.length() && code.length() < LENGTH; i++) {
            char digit = soundClass(Character.toLowerCase(word.charAt(i)));
            if (digit == 0) continue;
            if (code.charAt(code.length() - 1) != digit) {
                code.append(digit);
            }
        }

        while (code.length() < LENGTH) {
            code.append('0');
        }
        return code.toString();
    }

    private static char soundClass(char c) {
        switch (c) {
            case 'b': case 'f': case 'p': case 'v':
                return '1';
            case 'c': case 'g': case 'j': case 'k':
            case 'q': case 's': case 'x': case 'z':
                return '2';
            case 'd': case 't':
                return '3';
            case 'l':
                return '4';
            case 'm': case 'n':
                return '5';
            case 'r':
                return '6';
            default:
                return 0;
        }
    }
}
