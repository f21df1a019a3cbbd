package com.occasionbell.reminder.model;

/** Settings as persisted by an administrative command plus the reconcile that followed. */
public record SettingsChange(ReminderSettings settings, ReconcileOutcome reconcile) {}
