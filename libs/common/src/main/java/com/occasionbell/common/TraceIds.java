package com.occasionbell.common;

import java.util.Locale;
import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  // W3C trace-context と同じ 32 桁 hex
  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "").toLowerCase(Locale.ROOT);
  }
}
