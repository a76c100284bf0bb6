package com.deeplog.deeplog.recent;

/**
 * Greedy, case-insensitive subsequence matcher used to rank timer descriptions.
 * <p>
 * The text is scanned once left to right; each text character equal to the next unconsumed
 * query character consumes it. A consumed character scores {@link RecentTimerConstants#MATCH_POINTS},
 * plus {@link RecentTimerConstants#WORD_START_BONUS} at a word start (index 0 or after a space or
 * hyphen), plus {@link RecentTimerConstants#CONSECUTIVE_BONUS} when the previous text character was
 * consumed too. The first eligible character always wins, so scores are not globally optimal.
 */
public final class FuzzyMatcher {

    private FuzzyMatcher() {
    }

    public static FuzzyMatch match(String query, String text) {
        if (query == null || query.isEmpty()) {
            return new FuzzyMatch(true, 0);
        }
        if (text == null || text.isEmpty()) {
            return FuzzyMatch.NO_MATCH;
        }

        int queryIndex = 0;
        int score = 0;
        int lastMatchIndex = -1;

        for (int i = 0; i < text.length() && queryIndex < query.length(); i++) {
            if (!sameIgnoringCase(text.charAt(i), query.charAt(queryIndex))) {
                continue;
            }
            score += RecentTimerConstants.MATCH_POINTS;
            if (isWordStart(text, i)) {
                score += RecentTimerConstants.WORD_START_BONUS;
            }
            if (lastMatchIndex >= 0 && lastMatchIndex == i - 1) {
                score += RecentTimerConstants.CONSECUTIVE_BONUS;
            }
            lastMatchIndex = i;
            queryIndex++;
        }

        return queryIndex == query.length() ? new FuzzyMatch(true, score) : FuzzyMatch.NO_MATCH;
    }

    static boolean isWordStart(String text, int index) {
        if (index == 0) {
            return true;
        }
        char previous = text.charAt(index - 1);
        return previous == ' ' || previous == '-';
    }

    private static boolean sameIgnoringCase(char a, char b) {
        return a == b || Character.toLowerCase(a) == Character.toLowerCase(b);
    }
}
