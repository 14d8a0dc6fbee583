package com.cragmate.x.service;

import com.cragmate.x.dto.*;
import com.cragmate.x.exceptions.BadRequestException;
import com.cragmate.x.exceptions.NotFoundException;
import com.cragmate.x.models.Trip;
import com.cragmate.x.models.User;
import com.cragmate.x.repo.UserRepository;
import com.cragmate.x.utils.basic.Constant;
import com.cragmate.x.utils.basic.ResponseMakerUtility;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Slf4j
@Service
public class MatchingServiceImpl implements MatchingService {
    private static final int MIN_LIMIT = 1;
    private static final Comparator<ScoredCandidate> RANKING =
            Comparator.comparingInt(ScoredCandidate::score).reversed()
                    .thenComparing(s -> s.candidate().getUser().getId().toString());

    private final UserRepository userRepository;
    private final TripResolver tripResolver;
    private final PrivacyFilter privacyFilter;
    private final CandidateFetchService candidateFetchService;
    private final CompatibilityCalculator compatibilityCalculator;
    private final MeterRegistry meterRegistry;
    private final int maxLimit;
    private final int defaultLimit;

    public MatchingServiceImpl(
            UserRepository userRepository,
            TripResolver tripResolver,
            PrivacyFilter privacyFilter,
            CandidateFetchService candidateFetchService,
            CompatibilityCalculator compatibilityCalculator,
            MeterRegistry meterRegistry,
            @Value("${matching.max-limit:50}") int maxLimit,
            @Value("${matching.default-limit:10}") int defaultLimit
    ) {
        this.userRepository = userRepository;
        this.tripResolver = tripResolver;
        this.privacyFilter = privacyFilter;
        this.candidateFetchService = candidateFetchService;
        this.compatibilityCalculator = compatibilityCalculator;
        this.meterRegistry = meterRegistry;
        this.maxLimit = maxLimit;
        this.defaultLimit = defaultLimit;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MatchResult> getMatches(UUID viewerId, UUID tripId, int limit) {
        int clamped = clampLimit(limit);
        User viewer = findViewer(viewerId);
        Trip trip = tripResolver.ownedTrip(viewerId, tripId);
        return toResults(rank(viewer, trip, clamped).scored());
    }

    @Override
    @Transactional(readOnly = true)
    public List<MatchResult> getMatches(MatchingRequest request) {
        int clamped = getLimitValue(request);
        User viewer = findViewer(request.getViewerId());
        Trip trip = tripResolver.resolve(viewer.getId(), request.getTripId());
        return toResults(rank(viewer, trip, clamped).scored());
    }

    @Override
    @Transactional(readOnly = true)
    public MatchDetail getMatchDetail(MatchingRequest request, UUID matchedUserId) {
        User viewer = findViewer(request.getViewerId());
        Trip trip = tripResolver.resolve(viewer.getId(), request.getTripId());
        Ranking ranking = rank(viewer, trip, maxLimit);

        return ranking.scored().stream()
                .filter(s -> s.candidate().getUser().getId().equals(matchedUserId))
                .findFirst()
                .map(s -> ResponseMakerUtility.buildMatchDetail(ranking.viewer(), s))
                .orElseThrow(() -> {
                    meterRegistry.counter("matching_not_found_total", Constant.OUTCOME, "match").increment();
                    return new NotFoundException("Match not found");
                });
    }

    private Ranking rank(User viewer, Trip trip, int limit) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String destinationId = trip.getDestinationId();
        try {
            MatchParticipant me = candidateFetchService.loadParticipant(viewer, trip);
            Set<UUID> excluded = privacyFilter.exclusionsFor(viewer.getId());
            List<MatchParticipant> candidates = candidateFetchService.fetchCandidates(me, excluded);

            List<ScoredCandidate> scored = new ArrayList<>();
            for (MatchParticipant candidate : candidates) {
                UUID candidateId = candidate.getUser().getId();
                if (candidateId.equals(viewer.getId()) || excluded.contains(candidateId)) {
                    log.warn("Dropping excluded candidate={} returned for trip={}", candidateId, trip.getId());
                    continue;
                }
                if (!Objects.equals(destinationId, candidate.getTrip().getDestinationId())) {
                    log.warn("Dropping candidate trip={} with destination={} for trip={} at {}",
                            candidate.getTrip().getId(), candidate.getTrip().getDestinationId(), trip.getId(), destinationId);
                    continue;
                }
                CompatibilityBreakdown breakdown = compatibilityCalculator.calculate(me, candidate);
                if (breakdown.getTotal() > Constant.MIN_MATCH_SCORE) {
                    scored.add(new ScoredCandidate(candidate, breakdown));
                }
            }
            meterRegistry.counter("matching_candidates_scored_total", Constant.DESTINATION_ID, destinationId)
                    .increment(candidates.size());

            scored.sort(RANKING);
            logSummary(viewer, trip, scored);

            List<ScoredCandidate> top = List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
            meterRegistry.counter("matching_results_total", Constant.DESTINATION_ID, destinationId).increment(top.size());
            return new Ranking(me, top);
        } finally {
            sample.stop(meterRegistry.timer("matching_duration", Constant.DESTINATION_ID, destinationId));
        }
    }

    private void logSummary(User viewer, Trip trip, List<ScoredCandidate> scored) {
        if (scored.isEmpty()) {
            log.info("No matches found for trip={} viewer={}", trip.getId(), viewer.getId());
            return;
        }
        double avg = scored.stream().mapToInt(ScoredCandidate::score).average().orElse(0);
        log.info("Generated {} matches for trip={} viewer={}. Avg score: {}, top score: {}",
                scored.size(), trip.getId(), viewer.getId(), String.format("%.1f", avg), scored.get(0).score());
    }

    private User findViewer(UUID viewerId) {
        if (viewerId == null) {
            throw new NotFoundException("User not found");
        }
        return userRepository.findById(viewerId)
                .orElseThrow(() -> {
                    meterRegistry.counter("matching_not_found_total", Constant.OUTCOME, "viewer").increment();
                    return new NotFoundException("User not found");
                });
    }

    private int getLimitValue(MatchingRequest request) {
        return request.getLimit() != null ? clampLimit(request.getLimit()) : Math.min(defaultLimit, maxLimit);
    }

    private int clampLimit(int limit) {
        if (limit < MIN_LIMIT) {
            throw new BadRequestException("limit should be positive");
        }
        return Math.min(limit, maxLimit);
    }

    private static List<MatchResult> toResults(List<ScoredCandidate> scored) {
        return scored.stream().map(ResponseMakerUtility::buildMatchResult).toList();
    }

    private record Ranking(MatchParticipant viewer, List<ScoredCandidate> scored) {
    }
}
