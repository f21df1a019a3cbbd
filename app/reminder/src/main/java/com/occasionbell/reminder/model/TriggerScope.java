package com.occasionbell.reminder.model;

/** Identity namespace of a trigger inside the job registry. */
public enum TriggerScope {
  /** Daily summary and daily boundary jobs; survive across cycles. */
  DURABLE,
  /** Lead, start and audit jobs; replaced whenever the occasion list is re-queried. */
  OCCASION
}
