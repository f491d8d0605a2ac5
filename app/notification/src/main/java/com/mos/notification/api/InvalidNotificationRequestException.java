package com.mos.notification.api;

public class InvalidNotificationRequestException extends RuntimeException {

  public InvalidNotificationRequestException(String message) {
    super(message);
  }
}
