package com.cragmate.x.service;

import com.cragmate.x.dto.MatchParticipant;
import com.cragmate.x.models.AvailabilityBlock;
import com.cragmate.x.models.Destination;
import com.cragmate.x.models.DisciplineProfile;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;
import com.cragmate.x.repo.AvailabilityBlockRepository;
import com.cragmate.x.repo.DestinationRepository;
import com.cragmate.x.repo.DisciplineProfileRepository;
import com.cragmate.x.repo.TripRepository;
import com.cragmate.x.repo.UserRepository;
import com.cragmate.x.utils.basic.Constant;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Loads the candidates for one viewer trip and hydrates them with the profile and
 * availability data the scorer needs.
 */
@Slf4j
@Service
public class CandidateFetchService {
    private final TripRepository tripRepository;
    private final UserRepository userRepository;
    private final DisciplineProfileRepository disciplineProfileRepository;
    private final AvailabilityBlockRepository availabilityBlockRepository;
    private final DestinationRepository destinationRepository;
    private final MeterRegistry meterRegistry;
    private final int lookupBatchSize;

    public CandidateFetchService(
            TripRepository tripRepository,
            UserRepository userRepository,
            DisciplineProfileRepository disciplineProfileRepository,
            AvailabilityBlockRepository availabilityBlockRepository,
            DestinationRepository destinationRepository,
            MeterRegistry meterRegistry,
            @Value("${matching.lookup-batch-size:500}") int lookupBatchSize
    ) {
        this.tripRepository = tripRepository;
        this.userRepository = userRepository;
        this.disciplineProfileRepository = disciplineProfileRepository;
        this.availabilityBlockRepository = availabilityBlockRepository;
        this.destinationRepository = destinationRepository;
        this.meterRegistry = meterRegistry;
        this.lookupBatchSize = lookupBatchSize;
    }

    public MatchParticipant loadParticipant(User user, Trip trip) {
        return MatchParticipant.builder()
                .user(user)
                .trip(trip)
                .destinationName(destinationName(trip.getDestinationId()))
                .disciplineProfiles(disciplineProfileRepository.findByUserId(user.getId()))
                .availability(availabilityBlockRepository.findByTripIdOrderBySlotDateAscTimeBlockAsc(trip.getId()))
                .build();
    }

    /**
     * One participant per eligible user, in the order the candidate query returns their first
     * eligible trip. The viewer and every id in {@code excludedUserIds} are left out by the query.
     */
    public List<MatchParticipant> fetchCandidates(MatchParticipant viewer, Set<UUID> excludedUserIds) {
        Trip viewerTrip = viewer.getTrip();
        UUID viewerId = viewer.getUser().getId();

        Set<UUID> excluded = new HashSet<>(excludedUserIds);
        excluded.add(viewerId);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<Trip> trips = tripRepository.findCandidateTrips(
                    viewerTrip.getDestinationId(), viewerTrip.getStartDate(), viewerTrip.getEndDate(), excluded);

            Map<UUID, Trip> firstTripByUser = new LinkedHashMap<>();
            for (Trip trip : trips) {
                if (!excluded.contains(trip.getUserId())) {
                    firstTripByUser.putIfAbsent(trip.getUserId(), trip);
                }
            }
            if (firstTripByUser.isEmpty()) {
                log.info("No candidate trips for trip={} destination={}", viewerTrip.getId(), viewerTrip.getDestinationId());
                return List.of();
            }

            List<UUID> userIds = new ArrayList<>(firstTripByUser.keySet());
            List<UUID> tripIds = firstTripByUser.values().stream().map(Trip::getId).toList();

            Map<UUID, User> users = new HashMap<>();
            Map<UUID, List<DisciplineProfile>> profiles = new HashMap<>();
            for (List<UUID> batch : Lists.partition(userIds, lookupBatchSize)) {
                userRepository.findAllById(batch).forEach(u -> users.put(u.getId(), u));
                disciplineProfileRepository.findByUserIdIn(batch)
                        .forEach(p -> profiles.computeIfAbsent(p.getUserId(), k -> new ArrayList<>()).add(p));
            }

            Map<UUID, List<AvailabilityBlock>> availability = new HashMap<>();
            for (List<UUID> batch : Lists.partition(tripIds, lookupBatchSize)) {
                availabilityBlockRepository.findByTripIdIn(batch)
                        .forEach(a -> availability.computeIfAbsent(a.getTripId(), k -> new ArrayList<>()).add(a));
            }

            String destinationName = viewer.getDestinationName();
            List<MatchParticipant> candidates = new ArrayList<>(firstTripByUser.size());
            firstTripByUser.forEach((userId, trip) -> {
                User user = users.get(userId);
                if (user == null) {
                    log.warn("Candidate trip={} references missing user={}, skipping", trip.getId(), userId);
                    return;
                }
                candidates.add(MatchParticipant.builder()
                        .user(user)
                        .trip(trip)
                        .destinationName(destinationName)
                        .disciplineProfiles(profiles.getOrDefault(userId, List.of()))
                        .availability(availability.getOrDefault(trip.getId(), List.of()))
                        .build());
            });

            log.debug("Fetched {} candidates from {} trips for trip={}", candidates.size(), trips.size(), viewerTrip.getId());
            return candidates;
        } catch (RuntimeException e) {
            log.error("Failed to fetch candidates for trip={}", viewerTrip.getId(), e);
            meterRegistry.counter("candidate_fetch_errors", Constant.DESTINATION_ID, viewerTrip.getDestinationId()).increment();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("candidate_fetch_duration", Constant.DESTINATION_ID, viewerTrip.getDestinationId()));
        }
    }

    private String destinationName(String destinationId) {
        return destinationRepository.findById(destinationId)
                .map(Destination::getName)
                .orElse(destinationId);
    }
}
