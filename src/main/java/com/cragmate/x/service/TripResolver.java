package com.cragmate.x.service;

import com.cragmate.x.exceptions.NotFoundException;
import com.cragmate.x.models.Trip;
import com.cragmate.x.repo.TripRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class TripResolver {
    private final TripRepository tripRepository;
    private final Clock clock;

    /**
     * The given trip when the viewer owns it, otherwise the viewer's soonest upcoming active trip
     * when {@code tripId} is null.
     */
    public Trip resolve(UUID viewerId, UUID tripId) {
        if (tripId != null) {
            return ownedTrip(viewerId, tripId);
        }
        return tripRepository
                .findFirstByUserIdAndActiveTrueAndStartDateGreaterThanEqualOrderByStartDateAscIdAsc(viewerId, LocalDate.now(clock))
                .orElseThrow(() -> new NotFoundException("No upcoming trips"));
    }

    public Trip ownedTrip(UUID viewerId, UUID tripId) {
        return tripRepository.findByIdAndUserId(tripId, viewerId)
                .orElseThrow(() -> new NotFoundException("Trip not found"));
    }
}
