package com.occasionbell.reminder.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpcomingOccasionsResponse(
    Instant from, Instant to, List<OccasionResponse> occasions, String content) {

  public UpcomingOccasionsResponse {
    occasions = List.copyOf(occasions);
  }
}
