/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;


import java.math.BigInteger;

/**
 * Day-granular value decay (demurrage).
 * 
 * <h2>Contract</h2>
 * <p>
 * Implementations must be deterministic, must not increase with
 * {@code elapsedDays}, and must satisfy {@code project(v, 0) == v}.
 * The ledger only ever projects from an escrow's original face value; it
 * never compounds projections.
 * </p>
 */
@FunctionalInterface
public interface DecayFunction {
  
  /** Decay function that never decays. */
  DecayFunction NONE = (initialValue, elapsedDays) -> initialValue;
  
  
  /**
   * Returns the value {@code initialValue} decays to after
   * {@code elapsedDays}.
   * 
   * @param initialValue  non-negative
   * @param elapsedDays   &ge; 0
   * 
   * @return a value in the range [0, {@code initialValue}]
   */
  BigInteger project(BigInteger initialValue, long elapsedDays);

}
