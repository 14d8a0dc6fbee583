package com.cragmate.x.processors;

import com.cragmate.x.dto.CompatibilityBreakdown;
import com.cragmate.x.dto.MatchParticipant;
import com.cragmate.x.dto.OverlapWindow;
import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.models.DisciplineProfile;
import com.cragmate.x.models.Trip;
import com.cragmate.x.service.CompatibilityCalculator;
import com.cragmate.x.utils.basic.GradeUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scores a candidate trip against the viewer's trip as the sum of six independent parts:
 * location (0-30), date overlap (0-20), discipline (0-20), grade (0-15),
 * risk tolerance (-10..10) and availability (0-5).
 */
@Slf4j
@Component
public class TripCompatibilityCalculator implements CompatibilityCalculator {
    static final int CRAG_MATCH_SCORE = 30;
    static final int FLEXIBLE_CRAG_SCORE = 25;
    static final int DIFFERENT_CRAG_SCORE = 20;
    static final int POINTS_PER_OVERLAP_DAY = 4;
    static final int MAX_DATE_SCORE = 20;
    static final int SHARED_DISCIPLINE_SCORE = 20;
    static final int PREFERENCE_ONLY_DISCIPLINE_SCORE = 5;
    static final int MAX_GRADE_SCORE = 15;
    static final int SIMILAR_GRADE_THRESHOLD = 10;
    static final int SAME_RISK_SCORE = 10;
    static final int ADJACENT_RISK_SCORE = 3;
    static final int OPPOSITE_RISK_SCORE = -10;
    static final int MAX_AVAILABILITY_SCORE = 5;

    private static final Comparator<Discipline> BY_CODE = Comparator.comparing(Discipline::getCode);

    @Override
    public CompatibilityBreakdown calculate(MatchParticipant viewer, MatchParticipant candidate) {
        Trip myTrip = viewer.getTrip();
        Trip theirTrip = candidate.getTrip();
        ImmutableList.Builder<String> reasons = ImmutableList.builder();

        int location = scoreLocation(myTrip, theirTrip);
        if (location > 0) {
            reasons.add("Both in " + viewer.getDestinationName());
        }

        OverlapWindow overlap = overlapOf(myTrip, theirTrip);
        int date = scoreDateOverlap(overlap);
        if (date > 0) {
            reasons.add(overlap.days() + " day overlap");
        }

        Set<Discipline> tripShared = sharedTripDisciplines(myTrip, theirTrip);
        List<Discipline> shared = sortedByCode(
                Sets.intersection(tripShared, Sets.intersection(viewer.profileDisciplines(), candidate.profileDisciplines())));
        int discipline = scoreDiscipline(tripShared, shared);
        if (discipline > 0) {
            List<Discipline> named = shared.isEmpty() ? sortedByCode(tripShared) : shared;
            reasons.add("Both climb " + named.stream().map(Discipline::getCode).collect(Collectors.joining(", ")));
        }

        Discipline gradeDiscipline = shared.isEmpty() ? null : shared.get(0);
        int grade = scoreGrade(viewer, candidate, gradeDiscipline);
        if (grade > SIMILAR_GRADE_THRESHOLD) {
            reasons.add("Similar grades");
        } else if (grade > 0) {
            reasons.add("Compatible grades");
        }

        int risk = scoreRiskTolerance(viewer, candidate);
        if (risk == SAME_RISK_SCORE) {
            reasons.add("Same risk tolerance");
        }

        int sharedSlots = Sets.intersection(viewer.climbingSlots(), candidate.climbingSlots()).size();
        int availability = Math.min(MAX_AVAILABILITY_SCORE, sharedSlots);
        if (availability > 0) {
            reasons.add(sharedSlots == 1 ? "1 shared availability slot" : sharedSlots + " shared availability slots");
        }

        CompatibilityBreakdown breakdown = CompatibilityBreakdown.builder()
                .locationScore(location)
                .dateScore(date)
                .disciplineScore(discipline)
                .gradeScore(grade)
                .riskScore(risk)
                .availabilityScore(availability)
                .reasons(reasons.build())
                .overlap(overlap)
                .sharedDisciplines(shared)
                .gradeDiscipline(gradeDiscipline)
                .build();

        log.debug("Score breakdown for candidate={} trip={}: total={}, location={}, date={}, discipline={}, grade={}, risk={}, availability={}",
                candidate.getUser().getId(), theirTrip.getId(), breakdown.getTotal(),
                location, date, discipline, grade, risk, availability);
        return breakdown;
    }

    int scoreLocation(Trip myTrip, Trip theirTrip) {
        if (myTrip.getDestinationId() == null || !myTrip.getDestinationId().equals(theirTrip.getDestinationId())) {
            return 0;
        }
        Set<UUID> myCrags = myTrip.getPreferredCragIds();
        Set<UUID> theirCrags = theirTrip.getPreferredCragIds();
        if (myCrags == null || theirCrags == null || myCrags.isEmpty() || theirCrags.isEmpty()) {
            return FLEXIBLE_CRAG_SCORE;
        }
        return Sets.intersection(myCrags, theirCrags).isEmpty() ? DIFFERENT_CRAG_SCORE : CRAG_MATCH_SCORE;
    }

    static OverlapWindow overlapOf(Trip myTrip, Trip theirTrip) {
        LocalDate start = myTrip.getStartDate().isAfter(theirTrip.getStartDate())
                ? myTrip.getStartDate() : theirTrip.getStartDate();
        LocalDate end = myTrip.getEndDate().isBefore(theirTrip.getEndDate())
                ? myTrip.getEndDate() : theirTrip.getEndDate();
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        if (days <= 0) {
            return OverlapWindow.none();
        }
        return new OverlapWindow(start, end, (int) days);
    }

    int scoreDateOverlap(OverlapWindow overlap) {
        if (overlap.isEmpty()) {
            return 0;
        }
        return Math.min(MAX_DATE_SCORE, overlap.days() * POINTS_PER_OVERLAP_DAY);
    }

    int scoreDiscipline(Set<Discipline> tripShared, List<Discipline> shared) {
        if (tripShared.isEmpty()) {
            return 0;
        }
        return shared.isEmpty() ? PREFERENCE_ONLY_DISCIPLINE_SCORE : SHARED_DISCIPLINE_SCORE;
    }

    int scoreGrade(MatchParticipant viewer, MatchParticipant candidate, Discipline discipline) {
        if (discipline == null) {
            return 0;
        }
        Optional<DisciplineProfile> mine = viewer.profileFor(discipline);
        Optional<DisciplineProfile> theirs = candidate.profileFor(discipline);
        if (mine.isEmpty() || theirs.isEmpty()) {
            return 0;
        }
        double ratio = GradeUtils.overlapRatio(mine.get(), theirs.get());
        int score = (int) Math.floor(MAX_GRADE_SCORE * ratio);
        if (score < 0 || score > MAX_GRADE_SCORE) {
            log.warn("Clamping grade score {} for users {} and {} in {}", score,
                    viewer.getUser().getId(), candidate.getUser().getId(), discipline.getCode());
            return Math.max(0, Math.min(MAX_GRADE_SCORE, score));
        }
        return score;
    }

    int scoreRiskTolerance(MatchParticipant viewer, MatchParticipant candidate) {
        int diff = Math.abs(viewer.getUser().getRiskTolerance().getLevel()
                - candidate.getUser().getRiskTolerance().getLevel());
        if (diff == 0) {
            return SAME_RISK_SCORE;
        }
        return diff == 1 ? ADJACENT_RISK_SCORE : OPPOSITE_RISK_SCORE;
    }

    private static Set<Discipline> sharedTripDisciplines(Trip myTrip, Trip theirTrip) {
        Set<Discipline> shared = EnumSet.noneOf(Discipline.class);
        if (myTrip.getPreferredDisciplines() == null || theirTrip.getPreferredDisciplines() == null) {
            return shared;
        }
        shared.addAll(myTrip.getPreferredDisciplines());
        shared.retainAll(theirTrip.getPreferredDisciplines());
        return shared;
    }

    private static List<Discipline> sortedByCode(Set<Discipline> disciplines) {
        List<Discipline> sorted = new ArrayList<>(disciplines);
        sorted.sort(BY_CODE);
        return List.copyOf(sorted);
    }
}
