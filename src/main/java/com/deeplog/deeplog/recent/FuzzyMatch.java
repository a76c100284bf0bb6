package com.deeplog.deeplog.recent;

public record FuzzyMatch(boolean matches, int score) {

    public static final FuzzyMatch NO_MATCH = new FuzzyMatch(false, 0);
}
