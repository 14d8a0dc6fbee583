package com.cragmate.x.dto.enums;

import lombok.Getter;

@Getter
public enum Discipline {
    SPORT("sport"),
    TRAD("trad"),
    BOULDERING("bouldering"),
    MULTIPITCH("multipitch"),
    GYM("gym");

    private final String code;

    Discipline(String code) {
        this.code = code;
    }
}
