package com.ospicorp.anomalyapi.support;

import java.time.Duration;

/**
 * Absolute point in time by which a store or cache call has to finish. Measured on the
 * monotonic clock.
 */
public final class Deadline {
  private final long expiresAtNanos;
  private final Duration budget;

  private Deadline(long expiresAtNanos, Duration budget) {
    this.expiresAtNanos = expiresAtNanos;
    this.budget = budget;
  }

  public static Deadline after(Duration budget) {
    if (budget.isNegative()) {
      throw new IllegalArgumentException("deadline budget must not be negative");
    }
    return new Deadline(System.nanoTime() + budget.toNanos(), budget);
  }

  public static Deadline afterMillis(long millis) {
    return after(Duration.ofMillis(millis));
  }

  public long remainingMillis() {
    long remainingNanos = expiresAtNanos - System.nanoTime();
    return remainingNanos <= 0 ? 0L : Math.max(1L, remainingNanos / 1_000_000L);
  }

  public boolean isExpired() {
    return expiresAtNanos - System.nanoTime() <= 0;
  }

  public Duration budget() {
    return budget;
  }

  @Override
  public String toString() {
    return "Deadline[budget=" + budget.toMillis() + "ms, remaining=" + remainingMillis() + "ms]";
  }
}
