package com.cragmate.x.repo;

import com.cragmate.x.models.Block;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Set;
import java.util.UUID;

@Repository
public interface BlockRepository extends JpaRepository<Block, UUID> {

    @Query("SELECT b.blockedId FROM Block b WHERE b.blockerId = :userId")
    Set<UUID> findBlockedIdsByBlocker(@Param("userId") UUID userId);

    @Query("SELECT b.blockerId FROM Block b WHERE b.blockedId = :userId")
    Set<UUID> findBlockerIdsByBlocked(@Param("userId") UUID userId);
}
