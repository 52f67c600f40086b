package com.example.devicestore.core;

/** Raised when a store is requested for a driver other than {@code postgres}. Never retried. */
public class UnknownDriverException extends IllegalArgumentException {

  private final String driver;

  public UnknownDriverException(final String driver) {
    super("unknown driver: " + driver);
    this.driver = driver;
  }

  public String getDriver() {
    return driver;
  }
}
