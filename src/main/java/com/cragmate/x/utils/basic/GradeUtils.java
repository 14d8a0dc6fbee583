package com.cragmate.x.utils.basic;

import com.cragmate.x.dto.GradeCompatibility;
import com.cragmate.x.dto.enums.GradeCompatibilityLevel;
import com.cragmate.x.models.DisciplineProfile;
import lombok.experimental.UtilityClass;

/**
 * Comparisons between two comfortable grade ranges on the normalized score scale.
 */
@UtilityClass
public final class GradeUtils {
    private static final double HIGH_RATIO = 0.75;
    private static final double MEDIUM_RATIO = 0.4;

    /**
     * Overlap length divided by the average length of both ranges.
     * Disjoint ranges and a non-positive average give 0.
     */
    public static double overlapRatio(DisciplineProfile mine, DisciplineProfile theirs) {
        int overlapStart = Math.max(mine.getComfortableGradeMinScore(), theirs.getComfortableGradeMinScore());
        int overlapEnd = Math.min(mine.getComfortableGradeMaxScore(), theirs.getComfortableGradeMaxScore());
        if (overlapStart > overlapEnd) {
            return 0.0;
        }
        double avgRange = (rangeOf(mine) + rangeOf(theirs)) / 2.0;
        if (avgRange <= 0) {
            return 0.0;
        }
        return (overlapEnd - overlapStart) / avgRange;
    }

    public static GradeCompatibility compatibility(DisciplineProfile mine, DisciplineProfile theirs) {
        int overlapStart = Math.max(mine.getComfortableGradeMinScore(), theirs.getComfortableGradeMinScore());
        int overlapEnd = Math.min(mine.getComfortableGradeMaxScore(), theirs.getComfortableGradeMaxScore());
        if (overlapStart > overlapEnd) {
            return new GradeCompatibility("none", GradeCompatibilityLevel.LOW);
        }
        double ratio = overlapRatio(mine, theirs);
        GradeCompatibilityLevel level;
        if (ratio >= HIGH_RATIO) {
            level = GradeCompatibilityLevel.HIGH;
        } else if (ratio >= MEDIUM_RATIO) {
            level = GradeCompatibilityLevel.MEDIUM;
        } else {
            level = GradeCompatibilityLevel.LOW;
        }
        return new GradeCompatibility(overlapStart + "-" + overlapEnd, level);
    }

    private static int rangeOf(DisciplineProfile profile) {
        return profile.getComfortableGradeMaxScore() - profile.getComfortableGradeMinScore();
    }
}
