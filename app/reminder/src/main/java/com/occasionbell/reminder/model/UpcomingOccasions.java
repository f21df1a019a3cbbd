package com.occasionbell.reminder.model;

import java.time.Instant;
import java.util.List;

/** Listing over {@code [from, to)} with its rendered message body. */
public record UpcomingOccasions(Instant from, Instant to, List<Occasion> occasions, String content) {

  public UpcomingOccasions {
    occasions = List.copyOf(occasions);
  }
}
