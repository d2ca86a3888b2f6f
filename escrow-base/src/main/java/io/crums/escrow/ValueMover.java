/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;


import java.math.BigInteger;
import java.util.Optional;

/**
 * Moves escrowed value out of the ledger's custody. The asset moved is always
 * the one owned by the recipient (an inviter only ever escrows its own asset).
 * 
 * <p>Exceptions thrown by these methods abort the ledger operation that
 * triggered them.</p>
 */
public interface ValueMover {
  
  /**
   * Transfers {@code amount} of the original (non-wrapped) asset
   * to {@code to}.
   * 
   * @param amount positive
   */
  void transferOriginal(Address to, BigInteger amount);
  
  /**
   * Wraps {@code amount} into the decaying representation and transfers
   * the result to {@code to}.
   * 
   * @param amount positive
   */
  void convertAndTransfer(Address to, BigInteger amount);
  
  
  /**
   * Returns the amount of {@code assetOwner}'s asset actually held in
   * escrow custody, if known. The default returns empty (unknown).
   */
  default Optional<BigInteger> heldBalance(Address assetOwner) {
    return Optional.empty();
  }

}
