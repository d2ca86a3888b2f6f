/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;


import java.math.BigInteger;
import java.util.Objects;

/**
 * The locked-value record for one (inviter, invitee) pair. Never mutated:
 * the current value is always projected from the original face value
 * anchored at {@code lastUpdatedDay}.
 * 
 * @param faceValue       amount locked at creation; positive, at most
 *                        {@linkplain EscrowConstants#MAX_FACE_VALUE}
 * @param lastUpdatedDay  day index the face value is anchored at; &ge; 0
 * 
 * @see #project(DecayFunction, long)
 */
public record Escrow(BigInteger faceValue, long lastUpdatedDay) {
  
  public Escrow {
    Objects.requireNonNull(faceValue, "null faceValue");
    // a zero face value is indistinguishable from no escrow at all
    if (faceValue.signum() <= 0)
      throw new IllegalArgumentException("non-positive faceValue: " + faceValue);
    if (faceValue.compareTo(EscrowConstants.MAX_FACE_VALUE) > 0)
      throw new IllegalArgumentException(
          "faceValue exceeds %d bits: %s"
          .formatted(EscrowConstants.AMOUNT_BITS, faceValue));
    if (lastUpdatedDay < 0)
      throw new IllegalArgumentException("negative lastUpdatedDay: " + lastUpdatedDay);
  }
  
  
  /**
   * Returns the number of days elapsed since the anchor day.
   * 
   * @param today &ge; {@code lastUpdatedDay}
   */
  public long age(long today) {
    if (today < lastUpdatedDay)
      throw new IllegalArgumentException(
          "today (%d) < lastUpdatedDay (%d)".formatted(today, lastUpdatedDay));
    return today - lastUpdatedDay;
  }
  
  
  /**
   * Returns the decayed value of this escrow on the given day.
   */
  public BigInteger project(DecayFunction decay, long today) {
    return decay.project(faceValue, age(today));
  }
  
  
  /**
   * Returns the decayed value and age of this escrow on the given day.
   */
  public Balance balance(DecayFunction decay, long today) {
    return new Balance(project(decay, today), age(today));
  }

}
