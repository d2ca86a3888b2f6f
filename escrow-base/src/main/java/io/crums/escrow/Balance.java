/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Current (decayed) amount of an escrow and the number of days since
 * it was anchored.
 */
public record Balance(BigInteger amount, long days) {
  
  /** Reported for a pair with no active escrow. */
  public final static Balance NONE = new Balance(BigInteger.ZERO, 0);
  
  public Balance {
    Objects.requireNonNull(amount, "null amount");
    if (amount.signum() < 0)
      throw new IllegalArgumentException("negative amount: " + amount);
    if (days < 0)
      throw new IllegalArgumentException("negative days: " + days);
  }

}
