package com.cragmate.x.service;

import com.cragmate.x.dto.CompatibilityBreakdown;
import com.cragmate.x.dto.MatchParticipant;

public interface CompatibilityCalculator {
    CompatibilityBreakdown calculate(MatchParticipant viewer, MatchParticipant candidate);
}
