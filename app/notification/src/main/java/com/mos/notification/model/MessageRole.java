package com.mos.notification.model;

public enum MessageRole {
  USER("user"),
  ASSISTANT("assistant"),
  SYSTEM("system");

  private final String dbValue;

  MessageRole(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }
}
