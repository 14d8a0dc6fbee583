package com.cragmate.x.repo;

import com.cragmate.x.models.DisciplineProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface DisciplineProfileRepository extends JpaRepository<DisciplineProfile, UUID> {
    List<DisciplineProfile> findByUserId(UUID userId);

    List<DisciplineProfile> findByUserIdIn(Collection<UUID> userIds);
}
