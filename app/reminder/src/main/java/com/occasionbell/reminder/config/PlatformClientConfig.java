/*
 * どこで: Reminder 設定
 * 何を: チャット基盤呼び出し専用 RestClient を提供する
 * なぜ: baseUrl 設定責務をクライアント実装から分離するため
 */
package com.occasionbell.reminder.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "platform.enabled", havingValue = "true")
public class PlatformClientConfig {

  @Bean
  RestClient platformRestClient(RestClient.Builder builder, PlatformClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
