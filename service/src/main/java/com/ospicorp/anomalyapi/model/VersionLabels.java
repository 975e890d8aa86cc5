package com.ospicorp.anomalyapi.model;

import java.util.Locale;

public final class VersionLabels {
  private static final String PREFIX = "v";

  private VersionLabels() {
  }

  public static String format(int version) {
    return PREFIX + version;
  }

  /**
   * Accepts {@code "v3"}, {@code "V3"} or {@code "3"}.
   *
   * @throws IllegalArgumentException when the label is not a positive version number
   */
  public static int parse(String label) {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("version label must be provided");
    }
    String trimmed = label.trim().toLowerCase(Locale.ROOT);
    String digits = trimmed.startsWith(PREFIX) ? trimmed.substring(PREFIX.length()) : trimmed;
    try {
      int version = Integer.parseInt(digits);
      if (version < 1) {
        throw new IllegalArgumentException("version must be positive: " + label);
      }
      return version;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid version label: " + label, ex);
    }
  }
}
