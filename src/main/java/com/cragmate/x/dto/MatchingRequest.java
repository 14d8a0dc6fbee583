package com.cragmate.x.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchingRequest {
    @NotNull
    private UUID viewerId;

    // null resolves to the viewer's soonest upcoming active trip
    private UUID tripId;

    @Min(value = 1, message = "limit should be positive")
    private Integer limit;
}
