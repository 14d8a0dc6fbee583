package com.cragmate.x.dto.enums;

public enum GradeSystem {
    YDS,
    FRENCH,
    V_SCALE
}
