package com.cragmate.x.service;

import com.cragmate.x.dto.MatchParticipant;
import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.dto.enums.RiskTolerance;
import com.cragmate.x.dto.enums.TimeBlock;
import com.cragmate.x.models.Destination;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;
import com.cragmate.x.repo.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.*;

import static com.cragmate.x.MatchFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CandidateFetchServiceTest {
    private static final LocalDate START = LocalDate.of(2026, 4, 10);
    private static final LocalDate END = LocalDate.of(2026, 4, 14);

    @Mock
    private TripRepository tripRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private DisciplineProfileRepository disciplineProfileRepository;
    @Mock
    private AvailabilityBlockRepository availabilityBlockRepository;
    @Mock
    private DestinationRepository destinationRepository;
    @Captor
    private ArgumentCaptor<Collection<UUID>> excludedCaptor;

    private SimpleMeterRegistry meterRegistry;
    private CandidateFetchService service;
    private MatchParticipant viewer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new CandidateFetchService(tripRepository, userRepository, disciplineProfileRepository,
                availabilityBlockRepository, destinationRepository, meterRegistry, 2);
        User me = user(RiskTolerance.BALANCED);
        viewer = participant(me, trip(me, RRG, START, END, Discipline.SPORT));
    }

    @Test
    void loadParticipantHydratesProfilesAvailabilityAndDestinationName() {
        User me = viewer.getUser();
        Trip trip = viewer.getTrip();
        when(destinationRepository.findById(RRG)).thenReturn(Optional.of(new Destination(RRG, RRG_NAME, "USA")));
        when(disciplineProfileRepository.findByUserId(me.getId()))
                .thenReturn(List.of(profile(me, Discipline.SPORT, 40, 60)));
        when(availabilityBlockRepository.findByTripIdOrderBySlotDateAscTimeBlockAsc(trip.getId()))
                .thenReturn(List.of(slot(trip, START, TimeBlock.MORNING)));

        MatchParticipant loaded = service.loadParticipant(me, trip);

        assertThat(loaded.getDestinationName()).isEqualTo(RRG_NAME);
        assertThat(loaded.profileDisciplines()).containsExactly(Discipline.SPORT);
        assertThat(loaded.getAvailability()).hasSize(1);
    }

    @Test
    void unknownDestinationFallsBackToItsSlug() {
        when(destinationRepository.findById(YOSEMITE)).thenReturn(Optional.empty());
        User me = viewer.getUser();

        MatchParticipant loaded = service.loadParticipant(me, trip(me, YOSEMITE, START, END));

        assertThat(loaded.getDestinationName()).isEqualTo(YOSEMITE);
    }

    @Test
    void viewerIsAlwaysPartOfTheExclusionSet() {
        UUID blocked = UUID.randomUUID();
        when(tripRepository.findCandidateTrips(eq(RRG), eq(START), eq(END), anyCollection())).thenReturn(List.of());

        assertThat(service.fetchCandidates(viewer, Set.of(blocked))).isEmpty();

        verify(tripRepository).findCandidateTrips(eq(RRG), eq(START), eq(END), excludedCaptor.capture());
        assertThat(excludedCaptor.getValue()).containsExactlyInAnyOrder(blocked, viewer.getUser().getId());
    }

    @Test
    void firstTripPerUserIsKeptAndLookupsAreBatched() {
        User a = user(RiskTolerance.BALANCED);
        User b = user(RiskTolerance.AGGRESSIVE);
        User c = user(RiskTolerance.CONSERVATIVE);
        Trip aFirst = trip(a, RRG, START, END, Discipline.SPORT);
        Trip aSecond = trip(a, RRG, START.plusDays(1), END, Discipline.TRAD);
        Trip bTrip = trip(b, RRG, START.plusDays(2), END);
        Trip cTrip = trip(c, RRG, START.plusDays(3), END);
        when(tripRepository.findCandidateTrips(eq(RRG), eq(START), eq(END), anyCollection()))
                .thenReturn(List.of(aFirst, aSecond, bTrip, cTrip));
        Map<UUID, User> users = Map.of(a.getId(), a, b.getId(), b, c.getId(), c);
        when(userRepository.findAllById(any())).thenAnswer(inv -> {
            Iterable<UUID> ids = inv.getArgument(0);
            List<User> found = new ArrayList<>();
            ids.forEach(id -> found.add(users.get(id)));
            return found;
        });
        when(disciplineProfileRepository.findByUserIdIn(anyCollection()))
                .thenReturn(List.of())
                .thenReturn(List.of(profile(c, Discipline.SPORT, 10, 20)));
        when(availabilityBlockRepository.findByTripIdIn(anyCollection()))
                .thenReturn(List.of(slot(aFirst, START, TimeBlock.FULL_DAY)))
                .thenReturn(List.of());

        List<MatchParticipant> candidates = service.fetchCandidates(viewer, Set.of());

        assertThat(candidates).extracting(p -> p.getTrip().getId())
                .containsExactly(aFirst.getId(), bTrip.getId(), cTrip.getId());
        assertThat(candidates.get(0).getAvailability()).hasSize(1);
        assertThat(candidates.get(2).getDisciplineProfiles()).hasSize(1);
        assertThat(candidates).allSatisfy(p -> assertThat(p.getDestinationName()).isEqualTo(viewer.getDestinationName()));
        verify(userRepository, times(2)).findAllById(any());
        verify(availabilityBlockRepository, times(2)).findByTripIdIn(anyCollection());
    }

    @Test
    void candidateWithMissingUserIsSkipped() {
        User ghost = user(RiskTolerance.BALANCED);
        when(tripRepository.findCandidateTrips(eq(RRG), eq(START), eq(END), anyCollection()))
                .thenReturn(List.of(trip(ghost, RRG, START, END)));
        when(userRepository.findAllById(any())).thenReturn(List.of());
        when(disciplineProfileRepository.findByUserIdIn(anyCollection())).thenReturn(List.of());
        when(availabilityBlockRepository.findByTripIdIn(anyCollection())).thenReturn(List.of());

        assertThat(service.fetchCandidates(viewer, Set.of())).isEmpty();
    }

    @Test
    void repositoryFailureIsCountedAndRethrown() {
        when(tripRepository.findCandidateTrips(eq(RRG), eq(START), eq(END), anyCollection()))
                .thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> service.fetchCandidates(viewer, Set.of()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(meterRegistry.get("candidate_fetch_errors").counter().count()).isEqualTo(1.0);
    }
}
