/*
 * どこで: Reminder クライアント層
 * 何を: RestClient の例外を PlatformIntegrationException の理由へ写像する
 * なぜ: 予定/在室/送信の各クライアントで同じ判定を使うため
 */
package com.occasionbell.reminder.client;

import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class PlatformCallErrors {

  private static final Logger logger = LoggerFactory.getLogger(PlatformCallErrors.class);

  private PlatformCallErrors() {}

  static PlatformIntegrationException fromResponse(String operation, RestClientResponseException ex) {
    logger.warn("platform {} failed with http status={} statusText={}",
        operation, ex.getStatusCode().value(), ex.getStatusText());
    if (ex.getStatusCode().value() == 404) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.NOT_FOUND, "platform " + operation + " not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.BAD_GATEWAY,
          "platform " + operation + " server error",
          ex);
    }
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.BAD_GATEWAY, "platform " + operation + " failed", ex);
  }

  static PlatformIntegrationException fromResource(String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("platform {} timed out", operation);
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.TIMEOUT, "platform " + operation + " timeout", ex);
    }
    logger.warn("platform {} connection failed", operation, ex);
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.BAD_GATEWAY,
        "platform " + operation + " connection failed",
        ex);
  }

  static PlatformIntegrationException invalid(String operation, Throwable cause) {
    logger.warn("platform {} response parse failed", operation, cause);
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.INVALID_RESPONSE,
        "platform " + operation + " response is invalid",
        cause);
  }

  static PlatformIntegrationException invalid(String operation) {
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.INVALID_RESPONSE,
        "platform " + operation + " response is invalid");
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
