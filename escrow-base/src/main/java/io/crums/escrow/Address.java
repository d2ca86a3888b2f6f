/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;


import java.math.BigInteger;
import java.util.Objects;

/**
 * A 160-bit principal address. Immutable value type.
 * 
 * <h2>Reserved Values</h2>
 * <p>
 * {@linkplain #ZERO} (the null address) and {@linkplain #SENTINEL} are never
 * valid principals. The sentinel is used by {@linkplain LinkedAddressIndex}
 * as both list head and list terminator.
 * </p>
 */
public record Address(BigInteger value) implements Comparable<Address> {
  
  /** Address width in bytes. */
  public final static int WIDTH = 20;
  
  /** Address width in bits. */
  public final static int BITS = WIDTH * 8;
  
  private final static BigInteger MAX_VALUE =
      BigInteger.ONE.shiftLeft(BITS).subtract(BigInteger.ONE);
  
  /** The null address (0x0). */
  public final static Address ZERO = new Address(BigInteger.ZERO);
  
  /** Reserved list marker (0x1). */
  public final static Address SENTINEL = new Address(BigInteger.ONE);
  
  
  /**
   * @param value in the range [0, 2<sup>160</sup>)
   */
  public Address {
    Objects.requireNonNull(value, "null value");
    if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0)
      throw new IllegalArgumentException("out of 160-bit range: " + value);
  }
  
  
  /**
   * Parses the given hex string, with or without the {@code 0x} prefix.
   * Leading zeroes may be omitted.
   * 
   * @param hex  at most 40 hex digits (after the optional prefix)
   */
  public static Address of(String hex) {
    Objects.requireNonNull(hex, "null hex");
    String digits =
        hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    if (digits.isEmpty() || digits.length() > WIDTH * 2)
      throw new IllegalArgumentException("malformed address: " + hex);
    try {
      return new Address(new BigInteger(digits, 16));
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException("malformed address: " + hex, nfx);
    }
  }
  
  
  public static Address of(long value) {
    return new Address(BigInteger.valueOf(value));
  }
  
  
  /**
   * Returns the address owning the given asset class. The asset
   * class identifier carries its owner's address in its low 160 bits.
   * 
   * @param assetId non-negative
   */
  public static Address ofAssetId(BigInteger assetId) {
    if (assetId.signum() < 0)
      throw new IllegalArgumentException("negative assetId: " + assetId);
    return new Address(assetId.and(MAX_VALUE));
  }
  
  
  /**
   * Returns this address as a big-endian 20-byte array.
   */
  public byte[] toBytes() {
    byte[] raw = value.toByteArray();
    byte[] out = new byte[WIDTH];
    // raw may carry a leading sign byte, or be shorter than WIDTH
    int len = Math.min(raw.length, WIDTH);
    System.arraycopy(raw, raw.length - len, out, WIDTH - len, len);
    return out;
  }
  
  
  /** Returns the asset class identifier owned by this address. */
  public BigInteger assetId() {
    return value;
  }
  
  
  /**
   * Returns {@code true} iff this is neither {@linkplain #ZERO}
   * nor {@linkplain #SENTINEL}.
   */
  public boolean isPrincipal() {
    return value.compareTo(BigInteger.ONE) > 0;
  }
  
  
  @Override
  public int compareTo(Address other) {
    return value.compareTo(other.value);
  }
  
  
  /** Returns the 0x-prefixed, 40 hex digit, lowercase form. */
  @Override
  public String toString() {
    String hex = value.toString(16);
    return "0x" + "0".repeat(WIDTH * 2 - hex.length()) + hex;
  }

}
