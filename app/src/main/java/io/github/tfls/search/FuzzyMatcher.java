package io.github.tfls.search;

import java.util.Arrays;

/**
 * Case-insensitive subsequence matcher for symbol names. Every pattern character must appear in the name, in order;
 * among all such alignments the best-rewarded one determines the score.
 *
 * <p>Rewards per matched character:
 *
 * <ul>
 *   <li>{@value #MATCH_WEIGHT} for the match itself
 *   <li>{@value #CONTIGUOUS_WEIGHT} when it directly follows the previous matched character
 *   <li>{@value #WORD_BOUNDARY_WEIGHT} when it starts a word (after a non-alphanumeric character, or an upper-case
 *       letter after a lower-case one)
 *   <li>{@value #START_MATCH_WEIGHT} when it is the first character of the name
 * </ul>
 *
 * Each name character skipped before the first match costs {@value #LEADING_GAP_PENALTY}.
 *
 * <p>Scores are negated rewards, so lower values indicate better matches. {@link Integer#MAX_VALUE} means no match.
 */
public class FuzzyMatcher {

    static final int MATCH_WEIGHT = 1;
    static final int CONTIGUOUS_WEIGHT = 5;
    static final int WORD_BOUNDARY_WEIGHT = 3;
    static final int START_MATCH_WEIGHT = 10;
    static final int LEADING_GAP_PENALTY = 1;

    private static final int UNREACHABLE = Integer.MIN_VALUE / 2;

    private final String pattern;
    private final char[] patternChars;

    public FuzzyMatcher(String pattern) {
        this.pattern = pattern;
        this.patternChars = pattern.strip().toCharArray();
        for (int i = 0; i < patternChars.length; i++) {
            patternChars[i] = Character.toLowerCase(patternChars[i]);
        }
    }

    public String getPattern() {
        return pattern;
    }

    public boolean matches(String name) {
        return score(name) != Integer.MAX_VALUE;
    }

    /** Lower is better; {@link Integer#MAX_VALUE} if the pattern is not a subsequence of {@code name}. */
    public int score(String name) {
        int n = patternChars.length;
        if (n == 0) {
            return 0;
        }
        int m = name.length();
        if (m < n) {
            return Integer.MAX_VALUE;
        }
        // per character, so indexes line up with name
        var lower = new char[m];
        for (int j = 0; j < m; j++) {
            lower[j] = Character.toLowerCase(name.charAt(j));
        }

        // previous[j]: best reward with pattern[0..i-1] aligned and pattern[i-1] matched at name[j]
        var previous = new int[m];
        var current = new int[m];
        for (int j = 0; j < m; j++) {
            previous[j] = lower[j] == patternChars[0] ? -LEADING_GAP_PENALTY * j + positionReward(name, j) : UNREACHABLE;
        }
        for (int i = 1; i < n; i++) {
            Arrays.fill(current, UNREACHABLE);
            int bestBefore = UNREACHABLE; // max of previous[0..j-2]
            for (int j = 1; j < m; j++) {
                if (j >= 2) {
                    bestBefore = Math.max(bestBefore, previous[j - 2]);
                }
                if (lower[j] != patternChars[i]) {
                    continue;
                }
                int viaGap = bestBefore;
                int viaContiguous = previous[j - 1] == UNREACHABLE ? UNREACHABLE : previous[j - 1] + CONTIGUOUS_WEIGHT;
                int best = Math.max(viaGap, viaContiguous);
                if (best != UNREACHABLE) {
                    current[j] = best + positionReward(name, j);
                }
            }
            var swap = previous;
            previous = current;
            current = swap;
        }

        int best = UNREACHABLE;
        for (int reward : previous) {
            best = Math.max(best, reward);
        }
        return best == UNREACHABLE ? Integer.MAX_VALUE : -best;
    }

    private static int positionReward(String name, int index) {
        int reward = MATCH_WEIGHT;
        if (index == 0) {
            reward += START_MATCH_WEIGHT;
        } else if (isWordStart(name, index)) {
            reward += WORD_BOUNDARY_WEIGHT;
        }
        return reward;
    }

    private static boolean isWordStart(String name, int index) {
        char prev = name.charAt(index - 1);
        char c = name.charAt(index);
        if (!Character.isLetterOrDigit(prev)) {
            return Character.isLetterOrDigit(c);
        }
        return Character.isLowerCase(prev) && Character.isUpperCase(c);
    }
}
