/*
 * どこで: Reminder サービス層
 * 何を: 開催場所ごとの在室メンバーをメモリで保持するローカル実装
 * なぜ: チャット基盤なしで在室監査を確認するため
 */
package com.occasionbell.reminder.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "platform.enabled", havingValue = "false", matchIfMissing = true)
public class LocalPresenceSource implements PresenceSource {

  private final ConcurrentMap<String, Set<String>> members = new ConcurrentHashMap<>();

  @Override
  public Set<String> membersPresent(String locationRef) {
    return members.getOrDefault(locationRef, Set.of());
  }

  public void update(String locationRef, Set<String> present) {
    members.put(locationRef, Set.copyOf(present));
  }
}
