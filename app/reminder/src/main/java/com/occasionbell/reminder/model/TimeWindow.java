package com.occasionbell.reminder.model;

import java.time.Instant;

/** Half-open interval {@code [from, to)}. */
public record TimeWindow(Instant from, Instant to) {

  public boolean contains(Instant instant) {
    return instant != null && !instant.isBefore(from) && instant.isBefore(to);
  }
}
