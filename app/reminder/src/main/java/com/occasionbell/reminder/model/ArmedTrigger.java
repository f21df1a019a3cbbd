package com.occasionbell.reminder.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Read-only view of one registry entry. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArmedTrigger(
    String id, TriggerKind kind, Instant fireAt, String recurrence, long epoch, boolean fired) {}
