package com.cragmate.x.service;

import com.cragmate.x.repo.BlockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BlockPrivacyFilter implements PrivacyFilter {
    private final BlockRepository blockRepository;

    @Override
    public Set<UUID> exclusionsFor(UUID viewerId) {
        Set<UUID> excluded = new HashSet<>(blockRepository.findBlockedIdsByBlocker(viewerId));
        excluded.addAll(blockRepository.findBlockerIdsByBlocked(viewerId));
        log.debug("Excluding {} blocked users for viewer={}", excluded.size(), viewerId);
        return excluded;
    }
}
