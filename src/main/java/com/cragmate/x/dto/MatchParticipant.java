package com.cragmate.x.dto;

import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.dto.enums.TimeBlock;
import com.cragmate.x.models.AvailabilityBlock;
import com.cragmate.x.models.DisciplineProfile;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;
import lombok.Builder;
import lombok.Getter;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A climber together with the trip being matched and the data the scorer reads.
 */
@Getter
@Builder
public class MatchParticipant {
    private final User user;
    private final Trip trip;
    private final String destinationName;
    @Builder.Default
    private final List<DisciplineProfile> disciplineProfiles = List.of();
    @Builder.Default
    private final List<AvailabilityBlock> availability = List.of();

    public Set<Discipline> profileDisciplines() {
        Set<Discipline> disciplines = EnumSet.noneOf(Discipline.class);
        disciplineProfiles.forEach(p -> disciplines.add(p.getDiscipline()));
        return disciplines;
    }

    public Optional<DisciplineProfile> profileFor(Discipline discipline) {
        return disciplineProfiles.stream()
                .filter(p -> p.getDiscipline() == discipline)
                .findFirst();
    }

    public Set<AvailabilitySlot> climbingSlots() {
        Set<AvailabilitySlot> slots = new LinkedHashSet<>();
        for (AvailabilityBlock block : availability) {
            if (block.getTimeBlock() != TimeBlock.REST) {
                slots.add(new AvailabilitySlot(block.getSlotDate(), block.getTimeBlock()));
            }
        }
        return slots;
    }
}
