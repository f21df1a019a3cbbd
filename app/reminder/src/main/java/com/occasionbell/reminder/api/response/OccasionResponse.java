package com.occasionbell.reminder.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.occasionbell.reminder.model.LocationType;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OccasionResponse(
    String occasionId,
    String name,
    Instant startAt,
    String locationRef,
    LocationType locationType,
    String hostName,
    String locationLink,
    String occasionLink) {}
