package com.cragmate.x.repo;

import com.cragmate.x.models.Trip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<Trip, UUID> {

    // Ownership is part of the lookup so a foreign trip and a missing trip look the same
    Optional<Trip> findByIdAndUserId(UUID id, UUID userId);

    Optional<Trip> findFirstByUserIdAndActiveTrueAndStartDateGreaterThanEqualOrderByStartDateAscIdAsc(
            UUID userId, LocalDate today);

    /**
     * Active trips to the same destination whose inclusive date range intersects
     * {@code [startDate, endDate]}, owned by visible and verified users outside
     * {@code excludedUserIds}. Ordered so the first row per owner is that owner's
     * candidate trip.
     */
    @Query("""
        SELECT t FROM Trip t, User u
        WHERE u.id = t.userId
          AND t.active = true
          AND u.profileVisible = true
          AND u.emailVerified = true
          AND t.destinationId = :destinationId
          AND t.startDate <= :endDate
          AND t.endDate >= :startDate
          AND t.userId NOT IN :excludedUserIds
        ORDER BY t.startDate ASC, t.id ASC
        """)
    List<Trip> findCandidateTrips(
            @Param("destinationId") String destinationId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("excludedUserIds") Collection<UUID> excludedUserIds);
}
