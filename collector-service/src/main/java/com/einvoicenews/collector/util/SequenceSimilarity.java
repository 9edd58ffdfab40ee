package com.einvoicenews.collector.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity: twice the number of characters in matching blocks divided by
 * the combined length. The longest common block is taken first, then both sides are searched
 * recursively. The result is the larger of both argument orders, so ratio(a, b) == ratio(b, a).
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {}

    public static double ratio(String a, String b) {
        String x = a != null ? a : "";
        String y = b != null ? b : "";
        int total = x.length() + y.length();
        if (total == 0) {
            return 1.0;
        }
        int matches = Math.max(matchingCharacters(x, y), matchingCharacters(y, x));
        return Math.min(1.0, 2.0 * matches / total);
    }

    /**
     * ratio(a, b) >= threshold, rejecting early on the length and character-count upper bounds.
     */
    public static boolean isAtLeast(String a, String b, double threshold) {
        String x = a != null ? a : "";
        String y = b != null ? b : "";
        int total = x.length() + y.length();
        if (total == 0) {
            return threshold <= 1.0;
        }
        if (2.0 * Math.min(x.length(), y.length()) / total < threshold) {
            return false;
        }
        if (quickRatio(x, y) < threshold) {
            return false;
        }
        return ratio(x, y) >= threshold;
    }

    /**
     * Upper bound of the ratio from the shared character multiset, ignoring order.
     */
    static double quickRatio(String a, String b) {
        Map<Character, Integer> available = new HashMap<>();
        for (int i = 0; i < b.length(); i++) {
            available.merge(b.charAt(i), 1, Integer::sum);
        }
        int shared = 0;
        for (int i = 0; i < a.length(); i++) {
            Integer left = available.get(a.charAt(i));
            if (left != null && left > 0) {
                available.put(a.charAt(i), left - 1);
                shared++;
            }
        }
        return 2.0 * shared / (a.length() + b.length());
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});
        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int alo = r[0], ahi = r[1], blo = r[2], bhi = r[3];
            if (alo >= ahi || blo >= bhi) {
                continue;
            }
            int[] block = longestMatch(a, alo, ahi, b, blo, bhi);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            ranges.push(new int[]{alo, block[0], blo, block[1]});
            ranges.push(new int[]{block[0] + size, ahi, block[1] + size, bhi});
        }
        return matched;
    }

    // {startA, startB, size}; ties resolve to the lowest start in a, then in b
    private static int[] longestMatch(String a, int alo, int ahi, String b, int blo, int bhi) {
        int width = bhi - blo;
        int[] prev = new int[width + 1];
        int[] cur = new int[width + 1];
        int bestI = alo, bestJ = blo, bestSize = 0;
        for (int i = alo; i < ahi; i++) {
            char c = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                int col = j - blo + 1;
                if (c == b.charAt(j)) {
                    int k = prev[col - 1] + 1;
                    cur[col] = k;
                    if (k > bestSize) {
                        bestSize = k;
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                    }
                } else {
                    cur[col] = 0;
                }
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
