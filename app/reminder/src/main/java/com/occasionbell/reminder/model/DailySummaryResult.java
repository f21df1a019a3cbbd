package com.occasionbell.reminder.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code messageRef} is {@code null} when nothing was sent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailySummaryResult(boolean sent, int occasionCount, String messageRef) {

  public static DailySummaryResult nothingToSend() {
    return new DailySummaryResult(false, 0, null);
  }
}
