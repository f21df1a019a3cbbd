package com.occasionbell.reminder.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendMessageRequest(String content, String audienceRef, List<String> reactions) {

  public SendMessageRequest {
    reactions = reactions == null ? List.of() : List.copyOf(reactions);
  }
}
