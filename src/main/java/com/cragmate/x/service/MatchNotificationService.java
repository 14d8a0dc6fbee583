package com.cragmate.x.service;

import com.cragmate.x.dto.MatchNotice;
import com.cragmate.x.dto.MatchResult;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;
import com.cragmate.x.repo.TripRepository;
import com.cragmate.x.repo.UserRepository;
import com.cragmate.x.utils.basic.ResponseMakerUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds the new-match notices for a freshly created trip. Delivery belongs to the
 * notification layer.
 */
@Slf4j
@Service
public class MatchNotificationService {
    private final TripRepository tripRepository;
    private final UserRepository userRepository;
    private final MatchingService matchingService;
    private final int topN;

    public MatchNotificationService(
            TripRepository tripRepository,
            UserRepository userRepository,
            MatchingService matchingService,
            @Value("${matching.notification.top-n:3}") int topN
    ) {
        this.tripRepository = tripRepository;
        this.userRepository = userRepository;
        this.matchingService = matchingService;
        this.topN = topN;
    }

    @Transactional(readOnly = true)
    public List<MatchNotice> noticesForNewTrip(UUID tripId) {
        Optional<Trip> found = tripRepository.findById(tripId);
        if (found.isEmpty() || !found.get().isActive()) {
            log.debug("Skipping notices for missing or inactive trip={}", tripId);
            return List.of();
        }
        Trip trip = found.get();
        Optional<User> owner = userRepository.findById(trip.getUserId());
        if (owner.isEmpty()) {
            log.warn("Trip={} references missing owner={}, no notices built", tripId, trip.getUserId());
            return List.of();
        }

        List<MatchResult> matches = matchingService.getMatches(owner.get().getId(), trip.getId(), topN);
        if (matches.isEmpty()) {
            log.info("No matches found for new trip={}", tripId);
            return List.of();
        }

        List<MatchNotice> notices = matches.stream()
                .map(match -> ResponseMakerUtility.buildMatchNotice(owner.get(), trip, match))
                .toList();
        log.info("Built {} new_match notices for trip={}", notices.size(), tripId);
        return notices;
    }
}
