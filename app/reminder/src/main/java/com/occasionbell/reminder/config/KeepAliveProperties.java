/*
 * Where: Reminder application configuration binding
 * What: Holds the keep-alive self ping settings
 * Why: Hosting platforms that idle out quiet services need a periodic request
 */
package com.occasionbell.reminder.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.keep-alive")
public record KeepAliveProperties(boolean enabled, String url, Duration interval) {

  public KeepAliveProperties {
    url = url == null || url.isBlank() ? "http://localhost:8080/" : url;
    interval = interval == null ? Duration.ofMinutes(10) : interval;
  }
}
