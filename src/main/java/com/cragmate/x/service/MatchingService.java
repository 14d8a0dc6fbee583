package com.cragmate.x.service;

import com.cragmate.x.dto.MatchDetail;
import com.cragmate.x.dto.MatchResult;
import com.cragmate.x.dto.MatchingRequest;

import java.util.List;
import java.util.UUID;

public interface MatchingService {

    /**
     * Ranked partners for one of the viewer's trips. {@code limit} must be positive and is clamped
     * to the configured maximum.
     *
     * @throws com.cragmate.x.exceptions.NotFoundException when the viewer or the trip is missing,
     *                                                     or the trip belongs to someone else
     */
    List<MatchResult> getMatches(UUID viewerId, UUID tripId, int limit);

    List<MatchResult> getMatches(MatchingRequest request);

    MatchDetail getMatchDetail(MatchingRequest request, UUID matchedUserId);
}
