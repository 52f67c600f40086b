package com.example.devicestore.core;

/** Schema creation failed. Indicates a structural or permission problem; never retried. */
public class SchemaMigrationException extends RuntimeException {

  public SchemaMigrationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
