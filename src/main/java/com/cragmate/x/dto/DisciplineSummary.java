package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.dto.enums.GradeSystem;

public record DisciplineSummary(
        Discipline discipline,
        GradeSystem gradeSystem,
        String comfortableGradeMin,
        String comfortableGradeMax,
        boolean canLead,
        boolean canBelay
) {
}
