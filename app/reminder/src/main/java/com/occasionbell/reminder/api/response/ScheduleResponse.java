package com.occasionbell.reminder.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.occasionbell.reminder.model.ArmedTrigger;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleResponse(long appliedEpoch, List<ArmedTrigger> triggers) {

  public ScheduleResponse {
    triggers = List.copyOf(triggers);
  }
}
