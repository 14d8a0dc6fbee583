package com.cragmate.x.dto;

import java.time.LocalDate;

/**
 * Inclusive date intersection of two trips. {@code start} and {@code end} are null when the trips do not meet.
 */
public record OverlapWindow(LocalDate start, LocalDate end, int days) {

    public static OverlapWindow none() {
        return new OverlapWindow(null, null, 0);
    }

    public boolean isEmpty() {
        return days <= 0;
    }
}
