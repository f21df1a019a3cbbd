/*
 * どこで: Reminder サービス層
 * 何を: 朝の一覧/リード通知/開始通知/在室監査/一覧表示の本文を組み立てる
 * なぜ: 文面とリンク形式を 1 箇所に集めてトリガー処理から切り離すため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.Occasion;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class MessageFormatter {

  public static final String OPT_IN_MARKER = "✅";
  public static final String OPT_OUT_MARKER = "❌";

  private static final String UNKNOWN_HOST = "不明";
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
  private static final DateTimeFormatter LISTING_FORMAT =
      DateTimeFormatter.ofPattern("M/d(E) HH:mm", Locale.JAPAN);

  private final ReminderProperties properties;
  private final ZoneId zone;

  public MessageFormatter(ReminderProperties properties, Clock clock) {
    this.properties = properties;
    this.zone = clock.getZone();
  }

  public String dailySummary(Collection<Occasion> occasions) {
    final StringBuilder builder = new StringBuilder("📅 本日のイベント一覧:\n");
    for (Occasion occasion : occasions) {
      builder
          .append("• ")
          .append(occasion.name())
          .append(" / ")
          .append(TIME_FORMAT.format(occasion.startAt().atZone(zone)))
          .append(" / ")
          .append(host(occasion))
          .append('\n');
      appendLinks(builder, occasion, "  ");
    }
    builder
        .append('\n')
        .append(OPT_IN_MARKER)
        .append(" 出席／")
        .append(OPT_OUT_MARKER)
        .append(" 欠席 で参加表明お願いします！");
    return builder.toString();
  }

  public String leadNotification(Occasion occasion, int offsetMinutes) {
    final StringBuilder builder =
        new StringBuilder("⏰ **")
            .append(offsetMinutes)
            .append("分前リマインド** 「")
            .append(occasion.name())
            .append("」\n");
    appendLinks(builder, occasion, "");
    return builder.toString().stripTrailing();
  }

  public String startNotification(Occasion occasion) {
    final StringBuilder builder =
        new StringBuilder("🔔 「").append(occasion.name()).append("」が始まります！\n");
    appendLinks(builder, occasion, "");
    return builder.toString().stripTrailing();
  }

  public String presenceReport(Occasion occasion, List<String> missingSubscribers) {
    final StringBuilder builder =
        new StringBuilder("👀 「")
            .append(occasion.name())
            .append("」に出席予定でまだ来ていない人: ");
    for (int i = 0; i < missingSubscribers.size(); i++) {
      if (i > 0) {
        builder.append(' ');
      }
      builder.append("<@").append(missingSubscribers.get(i)).append('>');
    }
    return builder.toString();
  }

  public String upcomingListing(Collection<Occasion> occasions) {
    if (occasions.isEmpty()) {
      return "📭 今後のイベントはありません";
    }
    final StringBuilder builder = new StringBuilder("🗓 今後のイベント一覧:\n");
    for (Occasion occasion : occasions) {
      builder
          .append("• ")
          .append(LISTING_FORMAT.format(occasion.startAt().atZone(zone)))
          .append(" ")
          .append(occasion.name())
          .append(" / ")
          .append(host(occasion))
          .append('\n');
      appendLinks(builder, occasion, "  ");
    }
    return builder.toString().stripTrailing();
  }

  public String locationLink(Occasion occasion) {
    return properties
        .locationLinkTemplate()
        .replace("{groupRef}", groupRef(occasion))
        .replace("{locationRef}", nullToEmpty(occasion.locationRef()));
  }

  public String occasionLink(Occasion occasion) {
    return properties
        .occasionLinkTemplate()
        .replace("{groupRef}", groupRef(occasion))
        .replace("{occasionId}", occasion.occasionId());
  }

  private void appendLinks(StringBuilder builder, Occasion occasion, String indent) {
    if (occasion.locationRef() != null) {
      builder.append(indent).append("📍 チャンネル: <").append(locationLink(occasion)).append(">\n");
    }
    builder.append(indent).append("🔗 イベント:   <").append(occasionLink(occasion)).append(">\n");
  }

  private String groupRef(Occasion occasion) {
    return occasion.groupRef() == null || occasion.groupRef().isBlank()
        ? properties.groupRef()
        : occasion.groupRef();
  }

  private static String host(Occasion occasion) {
    return occasion.hostName() == null || occasion.hostName().isBlank()
        ? UNKNOWN_HOST
        : occasion.hostName();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
