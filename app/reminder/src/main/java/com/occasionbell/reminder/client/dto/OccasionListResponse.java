package com.occasionbell.reminder.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "外部 API 応答 DTO は受け取り専用であり、防御的コピーを行わないため")
public record OccasionListResponse(List<OccasionItem> items) {}
