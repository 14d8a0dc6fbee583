package com.cragmate.x.dto.enums;

public enum GradeCompatibilityLevel {
    HIGH,
    MEDIUM,
    LOW
}
