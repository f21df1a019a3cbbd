/*
 * どこで: Reminder デバッグ API
 * 何を: ローカル実装の予定/在室/参加シグナルを操作する
 * なぜ: チャット基盤なしでスケジュールと在室監査の動作確認をするため
 */
package com.occasionbell.reminder.api;

import com.occasionbell.common.event.AttendanceSignalPayload;
import com.occasionbell.reminder.api.request.OccasionUpsertRequest;
import com.occasionbell.reminder.api.request.PresenceUpdateRequest;
import com.occasionbell.reminder.model.LocationType;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.OutboundMessage;
import com.occasionbell.reminder.service.AttendanceSignalHandler;
import com.occasionbell.reminder.service.LocalNotificationSender;
import com.occasionbell.reminder.service.LocalOccasionSource;
import com.occasionbell.reminder.service.LocalPresenceSource;
import com.occasionbell.reminder.service.ReconciliationService;
import jakarta.validation.Valid;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "platform.enabled", havingValue = "false", matchIfMissing = true)
public class DebugController {

  private final LocalOccasionSource occasionSource;
  private final LocalPresenceSource presenceSource;
  private final LocalNotificationSender notificationSender;
  private final AttendanceSignalHandler signalHandler;
  private final ReconciliationService reconciliationService;

  @PutMapping("/occasions/{occasionId}")
  public ResponseEntity<Occasion> putOccasion(
      @PathVariable("occasionId") String occasionId,
      @Valid @RequestBody OccasionUpsertRequest request) {
    final Occasion occasion =
        new Occasion(
            occasionId,
            request.name(),
            request.startAt(),
            request.locationRef(),
            request.locationType() == null ? LocationType.VOICE : request.locationType(),
            request.groupRef(),
            request.hostName());
    occasionSource.put(occasion);
    reconciliationService.requestReconcile("local-occasion-upsert");
    return ResponseEntity.ok(occasion);
  }

  @DeleteMapping("/occasions/{occasionId}")
  public ResponseEntity<Void> deleteOccasion(@PathVariable("occasionId") String occasionId) {
    if (!occasionSource.remove(occasionId)) {
      return ResponseEntity.notFound().build();
    }
    reconciliationService.requestReconcile("local-occasion-delete");
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/presence/{locationRef}")
  public ResponseEntity<Void> putPresence(
      @PathVariable("locationRef") String locationRef,
      @Valid @RequestBody PresenceUpdateRequest request) {
    presenceSource.update(locationRef, new HashSet<>(request.memberIds()));
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/signals")
  public ResponseEntity<Map<String, Boolean>> postSignal(
      @RequestBody AttendanceSignalPayload payload) {
    return ResponseEntity.ok(Map.of("applied", signalHandler.handle(payload)));
  }

  @GetMapping("/messages")
  public List<OutboundMessage> messages() {
    return notificationSender.recent();
  }
}
