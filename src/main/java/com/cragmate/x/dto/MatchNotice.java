package com.cragmate.x.dto;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Data handed to the notification layer when a new trip produces a match.
 * The recipient is the matched climber; the matched user is the trip owner.
 */
@Value
@Builder
public class MatchNotice {
    UUID recipientId;
    UUID matchedUserId;
    String matchedUserDisplayName;
    UUID tripId;
    String destinationName;
    int score;
}
