package com.occasionbell.reminder.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.occasionbell.reminder.model.LocationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OccasionUpsertRequest(
    @NotBlank String name,
    @NotNull Instant startAt,
    String locationRef,
    LocationType locationType,
    String groupRef,
    String hostName) {}
