package com.harvest.jobcrawler.crawl.healing;

import java.util.Locale;

/**
 * Normalized Levenshtein similarity: {@code 1 - distance / max(len)}, case-insensitive.
 */
public final class TitleSimilarity {
    private TitleSimilarity() {
    }

    public static double similarity(String left, String right) {
        String a = left == null ? "" : left.toLowerCase(Locale.ROOT);
        String b = right == null ? "" : right.toLowerCase(Locale.ROOT);
        int longest = Math.max(Math.max(a.length(), b.length()), 1);
        return 1.0 - ((double) distance(a, b) / longest);
    }

    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
