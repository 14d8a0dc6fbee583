package com.cragmate.x.dto;

public record ScoredCandidate(MatchParticipant candidate, CompatibilityBreakdown breakdown) {

    public int score() {
        return breakdown.getTotal();
    }
}
