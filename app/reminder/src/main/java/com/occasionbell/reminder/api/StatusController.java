/*
 * どこで: Reminder API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 外部の死活監視と keep-alive の疎通先にするため
 */
package com.occasionbell.reminder.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "reminder: ok";
  }
}
