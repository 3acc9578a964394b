package com.codeheadsystems.kemtls.common;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Deterministic randomness for tests: the n-th call to nextBytes fills the whole array with
 * the byte value {@code start + n}.
 */
public final class TestRandom extends SecureRandom {

  private int next;

  private TestRandom(int start) {
    this.next = start;
  }

  public static RandomProvider counting(int start) {
    return new RandomProvider(new TestRandom(start));
  }

  @Override
  public synchronized void nextBytes(byte[] bytes) {
    Arrays.fill(bytes, (byte) next++);
  }
}
