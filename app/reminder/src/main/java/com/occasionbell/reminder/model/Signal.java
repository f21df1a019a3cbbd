package com.occasionbell.reminder.model;

import java.util.Locale;
import java.util.Optional;

public enum Signal {
  OPT_IN,
  OPT_OUT;

  /** Accepts {@code OPT_IN}, {@code opt-in}, {@code opt_in} and the like. */
  public static Optional<Signal> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    final String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (Signal signal : values()) {
      if (signal.name().equals(normalized)) {
        return Optional.of(signal);
      }
    }
    return Optional.empty();
  }
}
