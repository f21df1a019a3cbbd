package com.occasionbell.reminder.model;

public enum CycleState {
  OPEN,
  CLOSED
}
