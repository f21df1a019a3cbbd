package com.occasionbell.reminder.service;

/** Settings could not be written; the previously stored settings stay in effect. */
public class SettingsStoreException extends RuntimeException {

  public SettingsStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
