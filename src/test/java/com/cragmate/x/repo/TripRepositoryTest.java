package com.cragmate.x.repo;

import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.dto.enums.RiskTolerance;
import com.cragmate.x.models.Block;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.cragmate.x.MatchFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class TripRepositoryTest {
    private static final LocalDate START = LocalDate.of(2026, 1, 16);
    private static final LocalDate END = LocalDate.of(2026, 1, 20);

    @Autowired
    private TestEntityManager entityManager;
    @Autowired
    private TripRepository tripRepository;
    @Autowired
    private BlockRepository blockRepository;

    private User viewer;

    @BeforeEach
    void setUp() {
        viewer = persistUser(RiskTolerance.BALANCED);
    }

    @Test
    void candidateQueryReturnsOnlyEligibleTrips() {
        User eligible = persistUser(RiskTolerance.BALANCED);
        Trip eligibleTrip = persistTrip(eligible, RRG, START.plusDays(1), END.plusDays(3));

        User hidden = persistUser(RiskTolerance.BALANCED);
        hidden.setProfileVisible(false);
        persistTrip(hidden, RRG, START, END);

        User unverified = persistUser(RiskTolerance.BALANCED);
        unverified.setEmailVerified(false);
        persistTrip(unverified, RRG, START, END);

        User inactive = persistUser(RiskTolerance.BALANCED);
        Trip cancelled = trip(inactive, RRG, START, END);
        cancelled.setActive(false);
        persist(cancelled);

        User elsewhere = persistUser(RiskTolerance.BALANCED);
        persistTrip(elsewhere, YOSEMITE, START, END);

        User later = persistUser(RiskTolerance.BALANCED);
        persistTrip(later, RRG, END.plusDays(1), END.plusDays(5));

        persistTrip(viewer, RRG, START, END);
        entityManager.flush();

        List<Trip> candidates = tripRepository.findCandidateTrips(RRG, START, END, Set.of(viewer.getId()));

        assertThat(candidates).extracting(Trip::getId).containsExactly(eligibleTrip.getId());
    }

    @Test
    void dateBoundariesAreInclusive() {
        User before = persistUser(RiskTolerance.BALANCED);
        Trip endsOnStart = persistTrip(before, RRG, START.minusDays(5), START);
        User after = persistUser(RiskTolerance.BALANCED);
        Trip startsOnEnd = persistTrip(after, RRG, END, END.plusDays(2));
        entityManager.flush();

        List<Trip> candidates = tripRepository.findCandidateTrips(RRG, START, END, Set.of(viewer.getId()));

        assertThat(candidates).extracting(Trip::getId).containsExactly(endsOnStart.getId(), startsOnEnd.getId());
    }

    @Test
    void excludedUsersAreLeftOutOfTheQuery() {
        User blocked = persistUser(RiskTolerance.BALANCED);
        persistTrip(blocked, RRG, START, END);
        User free = persistUser(RiskTolerance.BALANCED);
        Trip freeTrip = persistTrip(free, RRG, START, END);
        entityManager.flush();

        List<Trip> candidates = tripRepository.findCandidateTrips(RRG, START, END, Set.of(viewer.getId(), blocked.getId()));

        assertThat(candidates).extracting(Trip::getId).containsExactly(freeTrip.getId());
    }

    @Test
    void candidatesAreOrderedByStartDate() {
        User a = persistUser(RiskTolerance.BALANCED);
        Trip late = persistTrip(a, RRG, START.plusDays(2), END);
        Trip early = persistTrip(a, RRG, START.minusDays(1), END);
        entityManager.flush();

        List<Trip> candidates = tripRepository.findCandidateTrips(RRG, START, END, Set.of(viewer.getId()));

        assertThat(candidates).extracting(Trip::getId).containsExactly(early.getId(), late.getId());
        assertThat(candidates.get(0).getPreferredDisciplines()).containsExactly(Discipline.SPORT);
    }

    @Test
    void ownedTripLookupRequiresOwnership() {
        Trip mine = persistTrip(viewer, RRG, START, END);
        User other = persistUser(RiskTolerance.BALANCED);
        entityManager.flush();

        assertThat(tripRepository.findByIdAndUserId(mine.getId(), viewer.getId())).isPresent();
        assertThat(tripRepository.findByIdAndUserId(mine.getId(), other.getId())).isEmpty();
    }

    @Test
    void soonestUpcomingActiveTripIsChosen() {
        LocalDate today = LocalDate.of(2026, 1, 10);
        persistTrip(viewer, RRG, today.minusDays(3), today.plusDays(1));
        Trip cancelled = trip(viewer, YOSEMITE, today.plusDays(1), today.plusDays(2));
        cancelled.setActive(false);
        persist(cancelled);
        Trip soonest = persistTrip(viewer, RRG, today.plusDays(2), today.plusDays(4));
        persistTrip(viewer, YOSEMITE, today.plusDays(30), today.plusDays(34));
        entityManager.flush();

        assertThat(tripRepository
                .findFirstByUserIdAndActiveTrueAndStartDateGreaterThanEqualOrderByStartDateAscIdAsc(viewer.getId(), today))
                .hasValueSatisfying(t -> assertThat(t.getId()).isEqualTo(soonest.getId()));
    }

    @Test
    void blockLookupsReadBothDirections() {
        User other = persistUser(RiskTolerance.BALANCED);
        entityManager.persist(Block.builder().blockerId(viewer.getId()).blockedId(other.getId()).build());
        entityManager.flush();

        assertThat(blockRepository.findBlockedIdsByBlocker(viewer.getId())).containsExactly(other.getId());
        assertThat(blockRepository.findBlockerIdsByBlocked(other.getId())).containsExactly(viewer.getId());
        assertThat(blockRepository.findBlockedIdsByBlocker(other.getId())).isEmpty();
    }

    private User persistUser(RiskTolerance risk) {
        User user = user(UUID.randomUUID(), risk);
        user.setId(null);
        return entityManager.persist(user);
    }

    private Trip persistTrip(User owner, String destinationId, LocalDate start, LocalDate end) {
        return persist(trip(owner, destinationId, start, end, Discipline.SPORT));
    }

    private Trip persist(Trip trip) {
        trip.setId(null);
        return entityManager.persist(trip);
    }
}
