package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.Discipline;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable result of scoring one viewer trip against one candidate trip.
 */
@Value
@Builder
public class CompatibilityBreakdown {
    int locationScore;
    int dateScore;
    int disciplineScore;
    int gradeScore;
    int riskScore;
    int availabilityScore;
    List<String> reasons;
    OverlapWindow overlap;
    // shared by both trips and both profiles, sorted by code
    List<Discipline> sharedDisciplines;
    // null when no discipline qualified for grade comparison
    Discipline gradeDiscipline;

    public int getTotal() {
        return locationScore + dateScore + disciplineScore + gradeScore + riskScore + availabilityScore;
    }
}
