package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.GradeCompatibilityLevel;

public record GradeCompatibility(String overlapRange, GradeCompatibilityLevel compatibility) {
}
