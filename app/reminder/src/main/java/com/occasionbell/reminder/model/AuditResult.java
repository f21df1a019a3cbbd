package com.occasionbell.reminder.model;

import java.util.List;

/** Outcome of one presence audit; {@code missing} is sorted and distinct. */
public record AuditResult(Outcome outcome, List<String> missing) {

  public enum Outcome {
    REPORTED,
    ALL_PRESENT,
    NO_ATTENDEES,
    UNSUPPORTED_LOCATION,
    OCCASION_GONE
  }

  public AuditResult {
    missing = List.copyOf(missing);
  }

  public static AuditResult of(Outcome outcome) {
    return new AuditResult(outcome, List.of());
  }
}
