/*
 * どこで: Reminder サービス層
 * 何を: 開催場所に現在いるメンバーの取得 (Presence Snapshot) の抽象化
 * なぜ: 在室監査をチャット基盤から切り離してテスト可能にするため
 */
package com.occasionbell.reminder.service;

import java.util.Set;

public interface PresenceSource {
  Set<String> membersPresent(String locationRef);
}
