/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import io.crums.escrow.Address;
import io.crums.escrow.EscrowException;
import io.crums.escrow.Fault;

/**
 * Notification that value was transferred into escrow custody. Delivered by
 * the hub to {@linkplain EscrowLedger#onLock(Address, LockNotice)}.
 * 
 * @param operator  the principal that initiated the transfer
 * @param from      the source of the transferred value
 * @param assetId   asset class identifier; its low 160 bits are the owner's address
 * @param amount    amount transferred
 * @param payload   counterpart (invitee) address, encoded as one 32-byte word
 * 
 * @see #encodePayload(Address)
 */
public record LockNotice(
    Address operator, Address from, BigInteger assetId, BigInteger amount, byte[] payload) {
  
  /** Payload word width in bytes. */
  public final static int WORD = 32;
  
  
  public LockNotice {
    Objects.requireNonNull(operator, "null operator");
    Objects.requireNonNull(from, "null from");
    Objects.requireNonNull(assetId, "null assetId");
    Objects.requireNonNull(amount, "null amount");
    payload = payload == null ? new byte[0] : payload.clone();
  }
  
  
  /**
   * Returns a notice for {@code inviter} locking {@code amount} of its own
   * asset for {@code invitee}.
   */
  public static LockNotice of(Address inviter, BigInteger amount, Address invitee) {
    return new LockNotice(
        inviter, inviter, inviter.assetId(), amount, encodePayload(invitee));
  }
  
  
  /**
   * Encodes the given address as a 32-byte, left-zero-padded word.
   */
  public static byte[] encodePayload(Address counterpart) {
    byte[] word = new byte[WORD];
    System.arraycopy(counterpart.toBytes(), 0, word, WORD - Address.WIDTH, Address.WIDTH);
    return word;
  }
  
  
  /**
   * Decodes the counterpart address from the payload.
   * 
   * @throws EscrowException {@linkplain Fault#MALFORMED_PAYLOAD} if the payload
   *         is not exactly one word, or if its 12 high bytes are not zero
   */
  public Address counterpart() throws EscrowException {
    if (payload.length != WORD)
      throw new EscrowException(
          Fault.MALFORMED_PAYLOAD,
          "expected %d-byte payload; actual %d".formatted(WORD, payload.length));
    for (int index = WORD - Address.WIDTH; index-- > 0; )
      if (payload[index] != 0)
        throw new EscrowException(
            Fault.MALFORMED_PAYLOAD, "dirty high bytes in address payload");
    return new Address(new BigInteger(1, Arrays.copyOfRange(payload, WORD - Address.WIDTH, WORD)));
  }
  
  
  /** Returns the owner of the {@linkplain #assetId() asset class}. */
  public Address assetOwner() {
    return Address.ofAssetId(assetId);
  }
  
  
  @Override
  public byte[] payload() {
    return payload.clone();
  }
  
  
  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof LockNotice other &&
        operator.equals(other.operator) &&
        from.equals(other.from) &&
        assetId.equals(other.assetId) &&
        amount.equals(other.amount) &&
        Arrays.equals(payload, other.payload);
  }
  
  
  @Override
  public int hashCode() {
    return Objects.hash(operator, from, assetId, amount) * 31 + Arrays.hashCode(payload);
  }
  
  
  @Override
  public String toString() {
    return "LockNotice[operator=%s, from=%s, assetId=%s, amount=%s, payload=%d bytes]"
        .formatted(operator, from, assetId, amount, payload.length);
  }

}
