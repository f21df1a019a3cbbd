package com.occasionbell.reminder.service;

import java.time.Instant;

/**
 * Published when a trigger asks for a schedule rebuild at the daily boundary.
 *
 * @param notBefore the rebuild compiles as if the time were at least this instant
 */
public record ReconcileRequestedEvent(String reason, Instant notBefore) {}
