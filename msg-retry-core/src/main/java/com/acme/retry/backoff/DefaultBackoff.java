package com.acme.retry.backoff;

import java.util.Random;
import java.util.function.Supplier;

/**
 * Polynomial backoff with jitter: {@code base = attempt^4 + 5} seconds, plus a random jitter in
 * {@code [-2, base - 3]}. The resulting delay lies in {@code [base - 2, 2 * base - 3]}.
 *
 * <p>Jitter keeps messages that failed together from coming back together. The random source is
 * obtained per call from the supplied factory; the default factory seeds a new {@link Random} from
 * {@link System#nanoTime()} each time, so nothing is shared between threads.
 */
public class DefaultBackoff implements BackoffFunction {

  /** Caps the base so that {@code 2 * base - 3} still fits in an int. */
  static final int MAX_BASE_SECONDS = Integer.MAX_VALUE / 2;

  private static final int JITTER_OFFSET = 2;

  private final Supplier<Random> randomSource;

  public DefaultBackoff() {
    this(() -> new Random(System.nanoTime()));
  }

  public DefaultBackoff(Supplier<Random> randomSource) {
    this.randomSource = randomSource;
  }

  /** A backoff using a single seeded generator, for reproducible schedules. */
  public static DefaultBackoff seeded(long seed) {
    Random random = new Random(seed);
    return new DefaultBackoff(() -> random);
  }

  /** {@code attempt^4 + 5}, capped at {@link #MAX_BASE_SECONDS}. */
  public static int baseDelaySeconds(int attempt) {
    double base = Math.pow(attempt, 4) + 5;
    return base >= MAX_BASE_SECONDS ? MAX_BASE_SECONDS : (int) base;
  }

  public static int minDelaySeconds(int attempt) {
    return baseDelaySeconds(attempt) - JITTER_OFFSET;
  }

  public static int maxDelaySeconds(int attempt) {
    return 2 * baseDelaySeconds(attempt) - 1 - JITTER_OFFSET;
  }

  @Override
  public int delaySeconds(int attempt) {
    int base = baseDelaySeconds(attempt);
    int jitter = randomSource.get().nextInt(base) - JITTER_OFFSET;
    return base + jitter;
  }
}
