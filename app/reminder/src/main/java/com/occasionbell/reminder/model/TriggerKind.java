package com.occasionbell.reminder.model;

import java.util.Locale;

public enum TriggerKind {
  LEAD_NOTIFICATION(TriggerScope.OCCASION),
  START_NOTIFICATION(TriggerScope.OCCASION),
  PRESENCE_AUDIT(TriggerScope.OCCASION),
  DAILY_SUMMARY(TriggerScope.DURABLE),
  DAILY_RECONCILE(TriggerScope.DURABLE);

  private final TriggerScope scope;

  TriggerKind(TriggerScope scope) {
    this.scope = scope;
  }

  public TriggerScope scope() {
    return scope;
  }

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
