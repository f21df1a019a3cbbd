/*
 * どこで: Reminder サービス層
 * 何を: 通知設定を JSON ファイルへ読み書きし、欠けた項目を既定値で補う
 * なぜ: 再起動後も管理コマンドで変更した設定を維持するため
 */
package com.occasionbell.reminder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.ReminderSettings;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JSON file backed settings store.
 *
 * <p>Each field is merged on its own: a missing or invalid field falls back to its documented
 * default while the other fields are kept, and the merged record is written back immediately. An
 * unreadable file yields the defaults and is left in place for inspection.
 */
@Component
public class SettingsStore {

  private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

  static final String FIELD_DAILY_TIME = "dailyTime";
  static final String FIELD_LEAD_OFFSETS = "leadOffsets";
  static final String FIELD_START_NOTIFICATION_ENABLED = "startNotificationEnabled";
  static final String FIELD_AUDIT_DELAY_MINUTES = "auditDelayMinutes";

  private final ObjectMapper objectMapper;
  private final Path file;
  private final ReentrantLock lock = new ReentrantLock();

  @Autowired
  public SettingsStore(ObjectMapper objectMapper, ReminderProperties properties) {
    this(objectMapper, Path.of(properties.settingsFile()));
  }

  SettingsStore(ObjectMapper objectMapper, Path file) {
    this.objectMapper = objectMapper;
    this.file = file;
  }

  public ReminderSettings load() {
    lock.lock();
    try {
      if (!Files.exists(file)) {
        final ReminderSettings defaults = ReminderSettings.defaults();
        logger.info("settings file not found, writing defaults path={}", file);
        persistQuietly(defaults);
        return defaults;
      }
      final JsonNode root;
      try {
        root = objectMapper.readTree(file.toFile());
      } catch (IOException ex) {
        logger.error("settings file is unreadable, using defaults path={}", file, ex);
        return ReminderSettings.defaults();
      }
      if (root == null || !root.isObject()) {
        logger.error("settings file is not a JSON object, using defaults path={}", file);
        return ReminderSettings.defaults();
      }
      final ReminderSettings merged = merge((ObjectNode) root);
      if (!toJson(merged).equals(root)) {
        logger.info("settings merged with defaults and written back path={}", file);
        persistQuietly(merged);
      }
      return merged;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @throws SettingsStoreException when the file could not be written; the previous file is kept
   */
  public void save(ReminderSettings settings) {
    lock.lock();
    try {
      write(settings);
      logger.info("settings saved path={} dailyTime={} leadOffsets={} start={} auditDelay={}",
          file, settings.formattedDailyTime(), settings.leadOffsets(),
          settings.startNotificationEnabled(), settings.auditDelayMinutes());
    } finally {
      lock.unlock();
    }
  }

  private ReminderSettings merge(ObjectNode root) {
    final ReminderSettings defaults = ReminderSettings.defaults();
    return new ReminderSettings(
        readDailyTime(root, defaults.dailyTime()),
        readLeadOffsets(root, defaults.leadOffsets()),
        readBoolean(root, FIELD_START_NOTIFICATION_ENABLED, defaults.startNotificationEnabled()),
        readAuditDelay(root, defaults.auditDelayMinutes()));
  }

  private LocalTime readDailyTime(ObjectNode root, LocalTime fallback) {
    final JsonNode node = root.get(FIELD_DAILY_TIME);
    if (node == null || !node.isTextual()) {
      return fallback;
    }
    try {
      return ReminderSettings.parseDailyTime(node.asText());
    } catch (SettingsValidationException ex) {
      logger.warn("stored {} is invalid, using default value={}", FIELD_DAILY_TIME, node.asText());
      return fallback;
    }
  }

  private List<Integer> readLeadOffsets(ObjectNode root, List<Integer> fallback) {
    final JsonNode node = root.get(FIELD_LEAD_OFFSETS);
    if (node == null || !node.isArray()) {
      return fallback;
    }
    final List<Integer> offsets = new ArrayList<>();
    for (JsonNode item : node) {
      if (!item.canConvertToInt() || !item.isIntegralNumber()) {
        logger.warn("stored {} is invalid, using default value={}", FIELD_LEAD_OFFSETS, node);
        return fallback;
      }
      offsets.add(item.intValue());
    }
    try {
      return ReminderSettings.validateLeadOffsets(offsets);
    } catch (SettingsValidationException ex) {
      logger.warn("stored {} is invalid, using default value={}", FIELD_LEAD_OFFSETS, node);
      return fallback;
    }
  }

  private boolean readBoolean(ObjectNode root, String field, boolean fallback) {
    final JsonNode node = root.get(field);
    return node != null && node.isBoolean() ? node.booleanValue() : fallback;
  }

  private int readAuditDelay(ObjectNode root, int fallback) {
    final JsonNode node = root.get(FIELD_AUDIT_DELAY_MINUTES);
    if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
      return fallback;
    }
    try {
      ReminderSettings.validateAuditDelay(node.intValue());
      return node.intValue();
    } catch (SettingsValidationException ex) {
      logger.warn("stored {} is invalid, using default value={}",
          FIELD_AUDIT_DELAY_MINUTES, node.intValue());
      return fallback;
    }
  }

  private ObjectNode toJson(ReminderSettings settings) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_DAILY_TIME, settings.formattedDailyTime());
    final ArrayNode offsets = node.putArray(FIELD_LEAD_OFFSETS);
    for (int offset : settings.leadOffsets()) {
      offsets.add(offset);
    }
    node.put(FIELD_START_NOTIFICATION_ENABLED, settings.startNotificationEnabled());
    node.put(FIELD_AUDIT_DELAY_MINUTES, settings.auditDelayMinutes());
    return node;
  }

  // 読み込み時の書き戻し失敗は致命的にしない
  private void persistQuietly(ReminderSettings settings) {
    try {
      write(settings);
    } catch (SettingsStoreException ex) {
      logger.warn("settings write-back failed path={}", file, ex);
    }
  }

  private void write(ReminderSettings settings) {
    try {
      final Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), toJson(settings));
      try {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      throw new SettingsStoreException("failed to write settings file " + file, ex);
    }
  }
}
