package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.Discipline;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class MatchTrip {
    UUID id;
    String destinationId;
    String destinationName;
    LocalDate startDate;
    LocalDate endDate;
    List<Discipline> preferredDisciplines;
}
