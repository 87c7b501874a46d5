package org.calista.kinda.transform;

import java.util.List;
import java.util.Set;

/**
 * Fixed marker vocabulary and "did you mean" lookup.
 */
public final class Vocabulary {

    public static final String SOMETIMES = "sometimes";
    public static final String MAYBE = "maybe";
    public static final String PROBABLY = "probably";
    public static final String RARELY = "rarely";
    public static final String SOMETIMES_WHILE = "sometimes_while";
    public static final String MAYBE_FOR = "maybe_for";
    public static final String KINDA_REPEAT = "kinda_repeat";
    public static final String EVENTUALLY_UNTIL = "eventually_until";
    public static final String KINDA = "kinda";
    public static final String SORTA = "sorta";
    public static final String ISH = "ish";
    public static final String TIME = "time";
    public static final String DRIFT = "drift";
    public static final String WELP = "welp";

    public static final List<String> KEYWORDS = List.of(
            SOMETIMES, MAYBE, PROBABLY, RARELY,
            SOMETIMES_WHILE, MAYBE_FOR, KINDA_REPEAT, EVENTUALLY_UNTIL,
            KINDA, SORTA, ISH, DRIFT, WELP);

    public static final Set<String> GATES = Set.of(SOMETIMES, MAYBE, PROBABLY, RARELY);
    public static final Set<String> LOOPS = Set.of(SOMETIMES_WHILE, MAYBE_FOR, KINDA_REPEAT, EVENTUALLY_UNTIL);
    public static final List<String> KINDA_TYPES = List.of("int", "float", "bool", "binary");
    public static final List<String> TIME_DRIFT_TYPES = List.of("float", "int");

    static final int MAX_SUGGESTION_DISTANCE = 3;

    private Vocabulary() {
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    /**
     * Closest entry of {@code candidates} within edit distance 3, or null.
     */
    public static String suggest(String word, List<String> candidates) {
        if (word == null || word.isEmpty()) return null;
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String c : candidates) {
            int d = levenshtein(word, c);
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return bestDistance <= MAX_SUGGESTION_DISTANCE && bestDistance < Math.max(word.length(), 2) ? best : null;
    }

    public static String suggest(String word) {
        return suggest(word, KEYWORDS);
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] t = prev;
            prev = cur;
            cur = t;
        }
        return prev[b.length()];
    }
}
