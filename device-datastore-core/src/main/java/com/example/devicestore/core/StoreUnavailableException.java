package com.example.devicestore.core;

import java.sql.SQLException;

/**
 * The backing store did not become reachable within the configured number of connection attempts.
 * Callers must not proceed to use the store.
 */
public class StoreUnavailableException extends RuntimeException {

  private final int attempts;

  public StoreUnavailableException(final int attempts, final SQLException cause) {
    super(
        "device datastore unreachable after %d attempts: %s"
            .formatted(attempts, cause.getMessage()),
        cause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
