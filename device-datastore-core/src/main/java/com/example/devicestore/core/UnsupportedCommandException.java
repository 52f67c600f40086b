package com.example.devicestore.core;

/**
 * Raised when a merge is requested with a source tag other than {@code fetch} or {@code
 * authenticate}. This is a programming error on the caller's side, not a condition to retry.
 */
public class UnsupportedCommandException extends IllegalArgumentException {

  private final String command;

  public UnsupportedCommandException(final String command) {
    super("datastore command not supported \"%s\"".formatted(command));
    this.command = command;
  }

  public String getCommand() {
    return command;
  }
}
