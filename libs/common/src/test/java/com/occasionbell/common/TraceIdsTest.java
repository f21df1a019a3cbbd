package com.occasionbell.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdIsLowerHexOf32Chars() {
    final String traceId = TraceIds.newTraceId();

    assertThat(traceId).hasSize(32).matches("[0-9a-f]{32}");
    assertThat(TraceIds.newTraceId()).isNotEqualTo(traceId);
  }
}
