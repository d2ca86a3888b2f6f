/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;

/**
 * Observer of committed ledger state changes.
 * 
 * @see EscrowLedger#addListener(EscrowListener)
 */
@FunctionalInterface
public interface EscrowListener {
  
  /**
   * Invoked once per event, in order, after the operation that produced
   * it has committed. Exceptions thrown here are logged and otherwise
   * ignored; they do not undo the operation.
   */
  void onEvent(EscrowEvent event);

}
