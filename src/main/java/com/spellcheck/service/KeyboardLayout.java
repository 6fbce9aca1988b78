package com.spellcheck.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Key coordinates on a three-row QWERTY layout.
 * Not consulted by the suggestion score; kept for callers that weight substitutions by key proximity.
 */
public final class KeyboardLayout {

    /** Distance reported when either character has no key on the layout. */
    public static final double UNKNOWN_KEY_DISTANCE = 10.0;

    private static final String[] ROWS = {"qwertyuiop", "asdfghjkl", "zxcvbnm"};
    private static final Map<Character, int[]> POSITIONS = new HashMap<>();

    static {
        for (int row = 0; row < ROWS.length; row++) {
            for (int col = 0; col < ROWS[row].length(); col++) {
                POSITIONS.put(ROWS[row].charAt(col), new int[]{row, col});
            }
        }
    }

    private KeyboardLayout() {}

    /**
     * Euclidean distance between the two keys (row/column units), case-insensitive.
     */
    public static double distance(char a, char b) {
        int[] p = POSITIONS.get(Character.toLowerCase(a));
        int[] q = POSITIONS.get(Character.toLowerCase(b));
        if (p == null || q == null) return UNKNOWN_KEY_DISTANCE;
        int dx = p[0] - q[0];
        int dy = p[1] - q[1];
        return Math.sqrt(dx * dx + dy * dy);
    }
}
