package com.cragmate.x.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One ranked entry handed to the presentation layer.
 */
@Value
@Builder
public class MatchResult {
    MatchedUser user;
    MatchTrip trip;
    int score;
    List<String> reasons;
    OverlapWindow overlapDates;
}
