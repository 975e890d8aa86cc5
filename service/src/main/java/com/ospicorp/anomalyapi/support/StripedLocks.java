package com.ospicorp.anomalyapi.support;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of locks addressed by key hash. Keys that share a stripe contend; everything
 * else proceeds in parallel. Memory stays constant however many series exist.
 */
public final class StripedLocks {
  private final ReentrantLock[] stripes;

  public StripedLocks(int stripeCount) {
    if (stripeCount < 1 || Integer.bitCount(stripeCount) != 1) {
      throw new IllegalArgumentException("stripe count must be a positive power of two");
    }
    stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  private int indexFor(String key) {
    int h = key.hashCode();
    h ^= (h >>> 16);
    return h & (stripes.length - 1);
  }

  public ReentrantLock lockFor(String key) {
    return stripes[indexFor(key)];
  }
}
