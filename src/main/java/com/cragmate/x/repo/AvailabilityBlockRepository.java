package com.cragmate.x.repo;

import com.cragmate.x.models.AvailabilityBlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface AvailabilityBlockRepository extends JpaRepository<AvailabilityBlock, UUID> {
    List<AvailabilityBlock> findByTripIdOrderBySlotDateAscTimeBlockAsc(UUID tripId);

    List<AvailabilityBlock> findByTripIdIn(Collection<UUID> tripIds);
}
