package com.ospicorp.anomalyapi.model;

/**
 * Which version of a series to consult: the active one, or an explicitly pinned version.
 */
public record VersionSelector(Integer pinnedVersion) {
  private static final String ACTIVE_LABEL = "active";
  private static final VersionSelector ACTIVE = new VersionSelector(null);

  public static VersionSelector active() {
    return ACTIVE;
  }

  public static VersionSelector pinned(int version) {
    if (version < 1) {
      throw new IllegalArgumentException("version must be positive");
    }
    return new VersionSelector(version);
  }

  // null, blank and "active" all mean the active version
  public static VersionSelector fromLabel(String label) {
    if (label == null || label.isBlank() || ACTIVE_LABEL.equalsIgnoreCase(label.trim())) {
      return ACTIVE;
    }
    return pinned(VersionLabels.parse(label));
  }

  public boolean isActive() {
    return pinnedVersion == null;
  }

  @Override
  public String toString() {
    return isActive() ? ACTIVE_LABEL : VersionLabels.format(pinnedVersion);
  }
}
