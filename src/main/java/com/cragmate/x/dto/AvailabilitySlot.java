package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.TimeBlock;

import java.time.LocalDate;

public record AvailabilitySlot(LocalDate date, TimeBlock timeBlock) {
}
