package com.mos.notification.model;

public enum DeliveryStatus {
  SENT("sent"),
  FAILED("failed");

  private final String dbValue;

  DeliveryStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }
}
