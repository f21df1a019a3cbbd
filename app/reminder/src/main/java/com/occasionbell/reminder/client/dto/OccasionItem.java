package com.occasionbell.reminder.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One occasion as returned by the chat platform; timestamps stay raw until validated. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OccasionItem(
    String id,
    String name,
    String startAt,
    String locationRef,
    String locationType,
    String groupRef,
    String hostName) {}
