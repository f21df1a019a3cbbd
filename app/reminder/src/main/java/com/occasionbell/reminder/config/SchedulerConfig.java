/*
 * どこで: Reminder アプリのインフラ設定
 * 何を: タイマー用 TaskScheduler とトリガー実行用ワーカープールを提供する
 * なぜ: 発火の待ち合わせとアクション実行 (外部 I/O) を別プールに分けるため
 */
package com.occasionbell.reminder.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  private static final int WORKER_QUEUE_CAPACITY = 256;

  @Bean
  public ThreadPoolTaskScheduler taskScheduler(ReminderProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.timerPoolSize());
    scheduler.setThreadNamePrefix("reminder-timer-");
    // cancel 済みタイマーをキューに残さない
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean
  public ThreadPoolTaskExecutor triggerWorkerExecutor(ReminderProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerPoolSize());
    executor.setMaxPoolSize(properties.workerPoolSize());
    executor.setQueueCapacity(WORKER_QUEUE_CAPACITY);
    executor.setThreadNamePrefix("reminder-worker-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
