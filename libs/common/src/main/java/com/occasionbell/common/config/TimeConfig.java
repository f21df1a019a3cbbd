/*
 * どこで: Common 共通設定
 * 何を: アプリのタイムゾーン付き Clock を DI 可能にする
 * なぜ: 暦計算 (今日/日付境界) を全コンポーネントで同じゾーンに揃えるため
 */
package com.occasionbell.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time-zone:UTC}") String timeZone) {
    return Clock.system(ZoneId.of(timeZone));
  }
}
