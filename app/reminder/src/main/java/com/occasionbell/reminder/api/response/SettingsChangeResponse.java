package com.occasionbell.reminder.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.occasionbell.reminder.model.ReconcileOutcome;
import com.occasionbell.reminder.model.SettingsChange;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettingsChangeResponse(
    String message, SettingsResponse settings, ReconcileOutcome reconcile) {

  public static SettingsChangeResponse from(String message, SettingsChange change) {
    return new SettingsChangeResponse(
        message, SettingsResponse.from(change.settings()), change.reconcile());
  }
}
