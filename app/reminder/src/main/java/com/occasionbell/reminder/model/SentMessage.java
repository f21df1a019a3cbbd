package com.occasionbell.reminder.model;

import java.time.Instant;

/** Result of a successful send; {@code messageRef} is what reaction signals later point at. */
public record SentMessage(String messageRef, Instant sentAt) {}
