package com.example.catalog_import.util;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Title normalization and a 0..1 similarity score used by the matcher and the validator.
 */
public final class TitleSimilarity {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private TitleSimilarity() {
    }

    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        String folded = MARKS.matcher(Normalizer.normalize(title, Normalizer.Form.NFD)).replaceAll("");
        String lower = folded.toLowerCase(Locale.ROOT).replace("&", " and ");
        return NON_ALNUM.matcher(lower).replaceAll(" ").trim();
    }

    /**
     * Best of edit-distance ratio and token overlap (Dice) on normalized titles.
     */
    public static double similarity(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return 0.0;
        }
        if (na.equals(nb)) {
            return 1.0;
        }
        int distance = levenshtein(na, nb);
        double editRatio = 1.0 - (double) distance / Math.max(na.length(), nb.length());
        return Math.max(editRatio, tokenDice(na, nb));
    }

    private static double tokenDice(String na, String nb) {
        Set<String> left = new HashSet<>(Arrays.asList(na.split(" ")));
        Set<String> right = new HashSet<>(Arrays.asList(nb.split(" ")));
        int total = left.size() + right.size();
        left.retainAll(right);
        return total == 0 ? 0.0 : (2.0 * left.size()) / total;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
