/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import io.crums.escrow.Address;
import io.crums.escrow.ValueMover;

/**
 * Records transfers in order.
 */
class RecordingMover implements ValueMover {
  
  enum Kind { ORIGINAL, WRAPPED }
  
  record Transfer(Kind kind, Address to, BigInteger amount) {  }
  
  final List<Transfer> transfers = new ArrayList<>();
  
  final Map<Address, BigInteger> held = new HashMap<>();
  
  /** Invoked (if set) before each transfer is recorded. May throw. */
  Consumer<Transfer> beforeTransfer;
  

  @Override
  public void transferOriginal(Address to, BigInteger amount) {
    record(new Transfer(Kind.ORIGINAL, to, amount));
  }

  @Override
  public void convertAndTransfer(Address to, BigInteger amount) {
    record(new Transfer(Kind.WRAPPED, to, amount));
  }

  @Override
  public Optional<BigInteger> heldBalance(Address assetOwner) {
    return Optional.ofNullable(held.get(assetOwner));
  }
  
  
  private void record(Transfer transfer) {
    if (beforeTransfer != null)
      beforeTransfer.accept(transfer);
    transfers.add(transfer);
  }

}
