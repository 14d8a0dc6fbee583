package com.cragmate.x.dto.enums;

public enum TimeBlock {
    MORNING,
    AFTERNOON,
    FULL_DAY,
    REST
}
