package com.cragmate.x.models;

import com.cragmate.x.dto.enums.TimeBlock;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Data
@Entity
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "availability_blocks",
        uniqueConstraints = @UniqueConstraint(columnNames = {"trip_id", "slot_date", "time_block"}))
public class AvailabilityBlock {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "time_block", nullable = false)
    private TimeBlock timeBlock;
}
