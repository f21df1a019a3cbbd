package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.Trigger;

/** Receives a trigger from the registry's timer callback. Must not block the timer thread. */
public interface TriggerDispatcher {
  void dispatch(Trigger trigger);
}
