package dev.henneberger.vertx.realtime.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential reconnect backoff for a single listener. Attempts are counted from 1 and reset
 * once a session reaches the listening state.
 */
public final class BackoffPolicy {
  private Duration initialDelay = Duration.ofMillis(500);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts;

  public static BackoffPolicy exponential() {
    return new BackoffPolicy();
  }

  public BackoffPolicy copy() {
    return new BackoffPolicy()
      .setInitialDelay(initialDelay)
      .setMaxDelay(maxDelay)
      .setMultiplier(multiplier)
      .setJitter(jitter)
      .setMaxAttempts(maxAttempts);
  }

  public BackoffPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public BackoffPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public BackoffPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public BackoffPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  /**
   * @param maxAttempts consecutive failed attempts before the listener gives up, 0 for never
   */
  public BackoffPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  public boolean shouldReconnect(long attempt) {
    return maxAttempts == 0 || attempt < maxAttempts;
  }

  public long delayMillis(long attempt) {
    double raw = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, attempt - 1));
    long capped = (long) Math.min(raw, (double) maxDelay.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return capped;
    }
    long spread = (long) (capped * jitter);
    return ThreadLocalRandom.current().nextLong(Math.max(0L, capped - spread), capped + spread + 1);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    OptionValidation.requireMin("maxAttempts", maxAttempts, 0L);
  }
}
