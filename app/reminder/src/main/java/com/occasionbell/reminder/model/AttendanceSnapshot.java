package com.occasionbell.reminder.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** Copy of the tracker state; {@code notificationRef} is {@code null} before the first cycle. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceSnapshot(
    String notificationRef, Instant openedAt, CycleState state, List<String> optedIn) {

  public AttendanceSnapshot {
    optedIn = List.copyOf(optedIn);
  }
}
