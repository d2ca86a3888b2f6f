/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import static io.crums.escrow.EscrowConstants.MAX_FACE_VALUE;
import static io.crums.escrow.EscrowConstants.UNIT;

import java.math.BigInteger;
import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.escrow.Address;
import io.crums.escrow.AmountOutOfRangeException;
import io.crums.escrow.json.JsonEntityParser;
import io.crums.escrow.json.JsonParsingException;
import io.crums.escrow.json.JsonUtils;

/**
 * Fixed ledger configuration.
 * 
 * @param hub         the only address allowed to deliver
 *                    {@linkplain LockNotice lock notices}
 * @param minAmount   smallest amount that may be escrowed (inclusive)
 * @param maxAmount   largest amount that may be escrowed (inclusive)
 * 
 * @see #PARSER
 * @see #withHub(Address)
 */
public record EscrowPolicy(Address hub, BigInteger minAmount, BigInteger maxAmount) {
  
  /** Default minimum: 96 whole units. */
  public final static BigInteger DEFAULT_MIN = UNIT.multiply(BigInteger.valueOf(96));
  /** Default maximum: 100 whole units. */
  public final static BigInteger DEFAULT_MAX = UNIT.multiply(BigInteger.valueOf(100));
  
  /** JSON parser. */
  public final static JsonEntityParser<EscrowPolicy> PARSER = new Parser();
  
  
  /**
   * Full constructor.
   * 
   * @param hub         a {@linkplain Address#isPrincipal() principal} address
   * @param minAmount   positive
   * @param maxAmount   &ge; {@code minAmount}, at most
   *                    {@linkplain io.crums.escrow.EscrowConstants#MAX_FACE_VALUE}
   */
  public EscrowPolicy {
    Objects.requireNonNull(hub, "null hub");
    if (!hub.isPrincipal())
      throw new IllegalArgumentException("reserved hub address: " + hub);
    if (minAmount.signum() <= 0)
      throw new IllegalArgumentException("non-positive minAmount: " + minAmount);
    if (maxAmount.compareTo(minAmount) < 0)
      throw new IllegalArgumentException(
          "maxAmount (%s) < minAmount (%s)".formatted(maxAmount, minAmount));
    if (maxAmount.compareTo(MAX_FACE_VALUE) > 0)
      throw new IllegalArgumentException("maxAmount too large: " + maxAmount);
  }
  
  
  /**
   * Returns an instance with default bounds.
   */
  public static EscrowPolicy withHub(Address hub) {
    return new EscrowPolicy(hub, DEFAULT_MIN, DEFAULT_MAX);
  }
  
  
  /**
   * Returns {@code true} iff the given amount is in range.
   */
  public boolean inRange(BigInteger amount) {
    return amount.compareTo(minAmount) >= 0 && amount.compareTo(maxAmount) <= 0;
  }
  
  
  /**
   * @throws AmountOutOfRangeException if not {@linkplain #inRange(BigInteger) in range}
   */
  public void checkRange(BigInteger amount) throws AmountOutOfRangeException {
    if (!inRange(amount))
      throw new AmountOutOfRangeException(amount, minAmount, maxAmount);
  }
  
  
  
  
  static class Parser implements JsonEntityParser<EscrowPolicy> {
    
    final static String HUB = "hub";
    final static String MIN_AMOUNT = "min_amount";
    final static String MAX_AMOUNT = "max_amount";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(EscrowPolicy policy, JSONObject jObj) {
      jObj.put(HUB, policy.hub().toString());
      jObj.put(MIN_AMOUNT, policy.minAmount().toString());
      jObj.put(MAX_AMOUNT, policy.maxAmount().toString());
      return jObj;
    }

    /**
     * {@inheritDoc}
     * <p>Missing bounds take their default values.</p>
     */
    @Override
    public EscrowPolicy toEntity(JSONObject jObj) throws JsonParsingException {
      Address hub = JsonUtils.getAddress(jObj, HUB, true);
      BigInteger min = JsonUtils.getBigInteger(jObj, MIN_AMOUNT, false);
      BigInteger max = JsonUtils.getBigInteger(jObj, MAX_AMOUNT, false);
      try {
        return new EscrowPolicy(
            hub,
            min == null ? DEFAULT_MIN : min,
            max == null ? DEFAULT_MAX : max);
      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax);
      }
    }
    
  }

}
