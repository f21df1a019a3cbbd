package com.occasionbell.reminder.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.occasionbell.reminder.client.PlatformIntegrationException;
import com.occasionbell.reminder.model.ArmedTrigger;
import com.occasionbell.reminder.model.DailySummaryResult;
import com.occasionbell.reminder.model.LocationType;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.ReconcileOutcome;
import com.occasionbell.reminder.model.ReminderSettings;
import com.occasionbell.reminder.model.SettingsChange;
import com.occasionbell.reminder.model.TriggerKind;
import com.occasionbell.reminder.model.UpcomingOccasions;
import com.occasionbell.reminder.service.AdminCommandService;
import com.occasionbell.reminder.service.MessageFormatter;
import com.occasionbell.reminder.service.NotificationSendException;
import com.occasionbell.reminder.service.SettingsStoreException;
import com.occasionbell.reminder.service.SettingsValidationException;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AdminControllerTest {

  private static final Instant START = Instant.parse("2024-05-01T03:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AdminCommandService adminCommandService;
  @MockitoBean private MessageFormatter messageFormatter;

  @Test
  void pingReturnsPong() throws Exception {
    mockMvc
        .perform(get("/v1/admin/ping"))
        .andExpect(status().isOk())
        .andExpect(content().string("Pong!"));
  }

  @Test
  void settingsReturnsCurrentValues() throws Exception {
    when(adminCommandService.settings()).thenReturn(ReminderSettings.defaults());

    mockMvc
        .perform(get("/v1/admin/settings"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.daily_time").value("07:00"))
        .andExpect(jsonPath("$.lead_offsets[0]").value(60))
        .andExpect(jsonPath("$.start_notification_enabled").value(false))
        .andExpect(jsonPath("$.audit_delay_minutes").value(10));
  }

  @Test
  void setDailyTimeConfirmsChange() throws Exception {
    when(adminCommandService.setDailyTime("08:30"))
        .thenReturn(
            new SettingsChange(
                ReminderSettings.defaults().withDailyTime(LocalTime.of(8, 30)),
                new ReconcileOutcome(4, 1, 1, 3, true)));

    mockMvc
        .perform(
            put("/v1/admin/settings/daily-time")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"time":"08:30"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("daily summary time set to 08:30"))
        .andExpect(jsonPath("$.settings.daily_time").value("08:30"))
        .andExpect(jsonPath("$.reconcile.epoch").value(4));
  }

  @Test
  void invalidDailyTimeReturns400WithoutChange() throws Exception {
    when(adminCommandService.setDailyTime("25:00"))
        .thenThrow(new SettingsValidationException("daily time is out of range: 25:00"));

    mockMvc
        .perform(
            put("/v1/admin/settings/daily-time")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"time":"25:00"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("REMINDER_VALIDATION_ERROR"));
  }

  @Test
  void missingBodyFieldReturns400() throws Exception {
    mockMvc
        .perform(
            put("/v1/admin/settings/audit-delay")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("REMINDER_VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("request validation failed"));
    verify(adminCommandService, never()).setAuditDelay(any());
  }

  @Test
  void malformedBodyReturns400() throws Exception {
    mockMvc
        .perform(
            put("/v1/admin/settings/start-notification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"enabled\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is malformed"));
  }

  @Test
  void leadOffsetsAcceptsList() throws Exception {
    when(adminCommandService.setLeadOffsets(List.of(30, 5)))
        .thenReturn(
            new SettingsChange(
                ReminderSettings.defaults().withLeadOffsets(List.of(30, 5)),
                new ReconcileOutcome(2, 2, 2, 2, true)));

    mockMvc
        .perform(
            put("/v1/admin/settings/lead-offsets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"minutes":[30,5]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.settings.lead_offsets[1]").value(5));
  }

  @Test
  void forcedSummaryFailureReturns502() throws Exception {
    when(adminCommandService.forceDailySummary())
        .thenThrow(new NotificationSendException("notification send failed"));

    mockMvc
        .perform(post("/v1/admin/daily-summary"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("REMINDER_SEND_FAILED"));
  }

  @Test
  void forcedSummaryReturnsResult() throws Exception {
    when(adminCommandService.forceDailySummary())
        .thenReturn(new DailySummaryResult(true, 2, "msg-1"));

    mockMvc
        .perform(post("/v1/admin/daily-summary"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sent").value(true))
        .andExpect(jsonPath("$.occasion_count").value(2))
        .andExpect(jsonPath("$.message_ref").value("msg-1"));
  }

  @Test
  void upcomingRendersLinks() throws Exception {
    final Occasion occasion =
        new Occasion("o-1", "raid", START, "vc-1", LocationType.VOICE, "g-1", "ann");
    when(adminCommandService.upcoming())
        .thenReturn(new UpcomingOccasions(START, START.plusSeconds(3600), List.of(occasion), "x"));
    when(messageFormatter.locationLink(occasion)).thenReturn("https://chat/vc-1");
    when(messageFormatter.occasionLink(occasion)).thenReturn("https://chat/o-1");

    mockMvc
        .perform(get("/v1/admin/occasions/upcoming"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.occasions[0].occasion_id").value("o-1"))
        .andExpect(jsonPath("$.occasions[0].start_at").value("2024-05-01T03:00:00Z"))
        .andExpect(jsonPath("$.occasions[0].location_link").value("https://chat/vc-1"))
        .andExpect(jsonPath("$.content").value("x"));
  }

  @Test
  void upcomingPlatformTimeoutReturns504() throws Exception {
    when(adminCommandService.upcoming())
        .thenThrow(
            new PlatformIntegrationException(
                PlatformIntegrationException.Reason.TIMEOUT, "platform listOccasions timeout"));

    mockMvc
        .perform(get("/v1/admin/occasions/upcoming"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("REMINDER_PLATFORM_TIMEOUT"));
  }

  @Test
  void scheduleListsArmedTriggers() throws Exception {
    when(adminCommandService.appliedEpoch()).thenReturn(7L);
    when(adminCommandService.schedule())
        .thenReturn(
            List.of(
                new ArmedTrigger(
                    "daily-summary", TriggerKind.DAILY_SUMMARY, START, "0 0 12 1 5 *", 7, false)));

    mockMvc
        .perform(get("/v1/admin/schedule"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.applied_epoch").value(7))
        .andExpect(jsonPath("$.triggers[0].id").value("daily-summary"))
        .andExpect(jsonPath("$.triggers[0].kind").value("DAILY_SUMMARY"));
  }

  @Test
  void settingsWriteFailureReturns500() throws Exception {
    when(adminCommandService.setStartNotification(true))
        .thenThrow(new SettingsStoreException("failed", new IOException("disk full")));

    mockMvc
        .perform(
            put("/v1/admin/settings/start-notification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"enabled\":true}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("REMINDER_SETTINGS_WRITE_FAILED"));
  }
}
