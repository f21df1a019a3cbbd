package com.occasionbell.reminder.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconcileOutcome(long epoch, int armed, int cancelled, int unchanged, boolean applied) {

  public static ReconcileOutcome skipped(long epoch) {
    return new ReconcileOutcome(epoch, 0, 0, 0, false);
  }
}
