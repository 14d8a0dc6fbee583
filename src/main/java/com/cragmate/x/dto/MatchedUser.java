package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.RiskTolerance;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Public profile projection of a matched climber.
 */
@Value
@Builder
public class MatchedUser {
    UUID id;
    String displayName;
    String bio;
    String homeLocation;
    RiskTolerance riskTolerance;
    List<DisciplineSummary> disciplines;
}
