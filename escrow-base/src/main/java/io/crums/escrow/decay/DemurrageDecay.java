/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.decay;


import java.math.BigInteger;
import java.util.Objects;

import io.crums.escrow.DecayFunction;

/**
 * Demurrage applied per day: {@code project(v, d) = floor(v * gamma^d)}.
 * 
 * <h2>Arithmetic</h2>
 * <p>
 * The daily factor {@code gamma} is given as a 64.64 fixed-point number.
 * Powers are computed by squaring in {@value #FRACTION_BITS}-bit fixed
 * point, truncating at each step, which keeps results deterministic and
 * non-increasing in {@code d}.
 * </p>
 * 
 * @see #STANDARD
 */
public class DemurrageDecay implements DecayFunction {
  
  /** Fractional bits used in intermediate powers. */
  public final static int FRACTION_BITS = 256;
  
  /**
   * 7% per year, compounded daily: {@code 0.93^(1/365.25)} in 64.64
   * fixed point.
   */
  public final static BigInteger GAMMA_64x64 = new BigInteger("18443079296116538654");
  
  /** Standard 7%-per-year instance. */
  public final static DemurrageDecay STANDARD = new DemurrageDecay(GAMMA_64x64);
  
  
  private final static BigInteger ONE_64x64 = BigInteger.ONE.shiftLeft(64);
  
  private final BigInteger gamma;
  
  
  /**
   * @param gamma64x64  daily factor as a 64.64 fixed-point number, in the
   *                    range (0, 1]
   */
  public DemurrageDecay(BigInteger gamma64x64) {
    Objects.requireNonNull(gamma64x64, "null gamma64x64");
    if (gamma64x64.signum() <= 0 || gamma64x64.compareTo(ONE_64x64) > 0)
      throw new IllegalArgumentException("gamma out of range (0, 1]: " + gamma64x64);
    this.gamma = gamma64x64.shiftLeft(FRACTION_BITS - 64);
  }
  

  @Override
  public BigInteger project(BigInteger initialValue, long elapsedDays) {
    if (initialValue.signum() < 0)
      throw new IllegalArgumentException("negative initialValue: " + initialValue);
    if (elapsedDays < 0)
      throw new IllegalArgumentException("negative elapsedDays: " + elapsedDays);
    if (elapsedDays == 0 || initialValue.signum() == 0)
      return initialValue;
    
    return initialValue.multiply(factor(elapsedDays)).shiftRight(FRACTION_BITS);
  }
  
  
  /**
   * Returns {@code gamma^days} in {@value #FRACTION_BITS}-bit fixed point.
   */
  BigInteger factor(long days) {
    BigInteger result = BigInteger.ONE.shiftLeft(FRACTION_BITS);
    BigInteger base = gamma;
    for (long d = days; d != 0; d >>>= 1) {
      if ((d & 1) != 0)
        result = mul(result, base);
      if (d > 1) {
        base = mul(base, base);
        if (base.signum() == 0)
          return BigInteger.ZERO;
      }
    }
    return result;
  }
  
  
  private static BigInteger mul(BigInteger a, BigInteger b) {
    return a.multiply(b).shiftRight(FRACTION_BITS);
  }

}
