/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.decay;


import static io.crums.escrow.EscrowConstants.SECONDS_PER_DAY;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

import io.crums.escrow.DayClock;

/**
 * Day index counted in whole days since a fixed day-zero instant.
 */
public class EpochDayClock implements DayClock {
  
  private final Clock clock;
  private final long dayZero;
  
  /**
   * @param clock     wall clock
   * @param dayZero   instant of day index 0
   */
  public EpochDayClock(Clock clock, Instant dayZero) {
    this.clock = Objects.requireNonNull(clock, "null clock");
    this.dayZero = dayZero.getEpochSecond();
  }
  
  
  /** Returns the day index of the given instant. */
  public long dayOf(Instant instant) {
    long secs = instant.getEpochSecond() - dayZero;
    if (secs < 0)
      throw new IllegalStateException(
          "instant " + instant + " precedes day zero " + Instant.ofEpochSecond(dayZero));
    return secs / SECONDS_PER_DAY;
  }

  @Override
  public long today() {
    return dayOf(clock.instant());
  }

}
