package com.cragmate.x.service;

import java.util.Set;
import java.util.UUID;

public interface PrivacyFilter {
    /**
     * Users that must never be offered to {@code viewerId} as candidates: everyone the viewer
     * blocked and everyone who blocked the viewer.
     */
    Set<UUID> exclusionsFor(UUID viewerId);
}
