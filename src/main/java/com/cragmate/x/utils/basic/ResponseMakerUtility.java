package com.cragmate.x.utils.basic;

import com.cragmate.x.dto.*;
import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.dto.enums.TimeBlock;
import com.cragmate.x.models.DisciplineProfile;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;

import java.time.LocalDate;
import java.util.*;


public final class ResponseMakerUtility {

    private ResponseMakerUtility() {
        throw new UnsupportedOperationException("Unsupported operation");
    }


    public static MatchResult buildMatchResult(ScoredCandidate scored) {
        MatchParticipant candidate = scored.candidate();
        return MatchResult.builder()
                .user(buildMatchedUser(candidate.getUser(), candidate.getDisciplineProfiles()))
                .trip(buildMatchTrip(candidate.getTrip(), candidate.getDestinationName()))
                .score(scored.score())
                .reasons(scored.breakdown().getReasons())
                .overlapDates(scored.breakdown().getOverlap())
                .build();
    }

    public static MatchedUser buildMatchedUser(User user, List<DisciplineProfile> profiles) {
        List<DisciplineSummary> disciplines = profiles.stream()
                .sorted(Comparator.comparing(p -> p.getDiscipline().getCode()))
                .map(p -> new DisciplineSummary(p.getDiscipline(), p.getGradeSystem(),
                        p.getComfortableGradeMinDisplay(), p.getComfortableGradeMaxDisplay(),
                        p.isCanLead(), p.isCanBelay()))
                .toList();
        return MatchedUser.builder()
                .id(user.getId())
                .displayName(user.getDisplayName())
                .bio(user.getBio())
                .homeLocation(user.getHomeLocation())
                .riskTolerance(user.getRiskTolerance())
                .disciplines(disciplines)
                .build();
    }

    public static MatchTrip buildMatchTrip(Trip trip, String destinationName) {
        List<Discipline> disciplines = trip.getPreferredDisciplines().stream()
                .sorted(Comparator.comparing(Discipline::getCode))
                .toList();
        return MatchTrip.builder()
                .id(trip.getId())
                .destinationId(trip.getDestinationId())
                .destinationName(destinationName)
                .startDate(trip.getStartDate())
                .endDate(trip.getEndDate())
                .preferredDisciplines(disciplines)
                .build();
    }

    public static MatchDetail buildMatchDetail(MatchParticipant viewer, ScoredCandidate scored) {
        MatchParticipant candidate = scored.candidate();
        CompatibilityBreakdown breakdown = scored.breakdown();

        Map<Discipline, GradeCompatibility> grades = new LinkedHashMap<>();
        for (Discipline discipline : breakdown.getSharedDisciplines()) {
            Optional<DisciplineProfile> mine = viewer.profileFor(discipline);
            Optional<DisciplineProfile> theirs = candidate.profileFor(discipline);
            if (mine.isPresent() && theirs.isPresent()) {
                grades.put(discipline, GradeUtils.compatibility(mine.get(), theirs.get()));
            }
        }

        return MatchDetail.builder()
                .match(buildMatchResult(scored))
                .breakdown(breakdown)
                .sharedDisciplines(breakdown.getSharedDisciplines())
                .availabilityOverlap(buildAvailabilityOverlap(viewer, candidate))
                .gradeCompatibility(Collections.unmodifiableMap(grades))
                .build();
    }

    public static List<AvailabilityOverlap> buildAvailabilityOverlap(MatchParticipant viewer, MatchParticipant candidate) {
        Set<AvailabilitySlot> theirs = candidate.climbingSlots();
        SortedMap<LocalDate, SortedSet<TimeBlock>> byDate = new TreeMap<>();
        for (AvailabilitySlot slot : viewer.climbingSlots()) {
            if (theirs.contains(slot)) {
                byDate.computeIfAbsent(slot.date(), d -> new TreeSet<>()).add(slot.timeBlock());
            }
        }
        return byDate.entrySet().stream()
                .map(e -> new AvailabilityOverlap(e.getKey(), List.copyOf(e.getValue())))
                .toList();
    }

    public static MatchNotice buildMatchNotice(User tripOwner, Trip trip, MatchResult match) {
        return MatchNotice.builder()
                .recipientId(match.getUser().getId())
                .matchedUserId(tripOwner.getId())
                .matchedUserDisplayName(tripOwner.getDisplayName())
                .tripId(trip.getId())
                .destinationName(match.getTrip().getDestinationName())
                .score(match.getScore())
                .build();
    }
}
