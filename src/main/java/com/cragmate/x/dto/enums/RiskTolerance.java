package com.cragmate.x.dto.enums;

import lombok.Getter;

@Getter
public enum RiskTolerance {
    CONSERVATIVE(0),
    BALANCED(1),
    AGGRESSIVE(2);

    private final int level;

    RiskTolerance(int level) {
        this.level = level;
    }
}
