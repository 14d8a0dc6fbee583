package com.cragmate.x.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    // a match needs strictly more than this
    public static final int MIN_MATCH_SCORE = 20;

    public static final String DESTINATION_ID = "destination_id";
    public static final String OUTCOME = "outcome";
}
