package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.Discipline;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class MatchDetail {
    MatchResult match;
    CompatibilityBreakdown breakdown;
    List<Discipline> sharedDisciplines;
    List<AvailabilityOverlap> availabilityOverlap;
    Map<Discipline, GradeCompatibility> gradeCompatibility;
}
