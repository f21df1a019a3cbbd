package com.occasionbell.reminder.config;

import java.time.Duration;

/** Subscription settings shared by every JetStream consumer of this service. */
public interface JetStreamConsumerProperties {

  String subject();

  String stream();

  String durable();

  Duration duplicateWindow();

  Duration ackWait();

  Integer maxDeliver();
}
