package com.example.devicestore.core.device;

import com.example.devicestore.core.UnsupportedCommandException;

/** Origin of a set of device facts; decides which columns a merge may overwrite. */
public enum FactSource {
  /** Provisioning feed: device assignment and profile data. */
  FETCH("fetch"),
  /** Enrollment handshake: identity reported by the device itself. */
  AUTHENTICATE("authenticate");

  private final String tag;

  FactSource(final String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /**
   * Resolves a source tag.
   *
   * @param tag {@code fetch} or {@code authenticate}
   * @return matching source
   * @throws UnsupportedCommandException for any other tag
   */
  public static FactSource fromTag(final String tag) {
    for (final var source : values()) if (source.tag.equals(tag)) return source;
    throw new UnsupportedCommandException(tag);
  }
}
