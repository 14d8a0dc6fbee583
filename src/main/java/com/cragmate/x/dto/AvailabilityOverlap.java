package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.TimeBlock;

import java.time.LocalDate;
import java.util.List;

public record AvailabilityOverlap(LocalDate date, List<TimeBlock> timeBlocks) {
}
