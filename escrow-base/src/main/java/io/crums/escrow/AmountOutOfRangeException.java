/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;

import java.math.BigInteger;

/**
 * Thrown when a locked amount falls outside the configured
 * {@code [min, max]} range. Carries the amount actually supplied.
 */
@SuppressWarnings("serial")
public class AmountOutOfRangeException extends EscrowException {
  
  private final BigInteger amount;
  private final BigInteger min;
  private final BigInteger max;

  public AmountOutOfRangeException(BigInteger amount, BigInteger min, BigInteger max) {
    super(
        Fault.AMOUNT_OUT_OF_RANGE,
        "amount %s not in range [%s, %s]".formatted(amount, min, max));
    this.amount = amount;
    this.min = min;
    this.max = max;
  }
  
  
  /** The amount supplied. */
  public BigInteger amount() {
    return amount;
  }
  
  public BigInteger min() {
    return min;
  }
  
  public BigInteger max() {
    return max;
  }

}
