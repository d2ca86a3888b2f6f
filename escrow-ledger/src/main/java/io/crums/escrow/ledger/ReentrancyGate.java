/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import io.crums.escrow.EscrowException;
import io.crums.escrow.Fault;

/**
 * Call-scoped mutual exclusion flag. At most one {@linkplain Pass} is open
 * at any time; attempting to {@linkplain #enter(String) enter} while one is
 * open fails immediately. Use with try-with-resources so the flag is cleared
 * on every exit path:
 * <pre>{@code
 *   try (var pass = gate.enter("redeem")) {
 *     ...
 *   }
 * }</pre>
 * <p>
 * Not thread-safe: callers serialize top-level requests (the ledger
 * synchronizes on itself), so the only contender is a re-entrant call on
 * the same call chain.
 * </p>
 */
public class ReentrancyGate {
  
  private String holder;
  
  
  /**
   * Opens a pass.
   * 
   * @param operation   name of the guarded operation (for diagnostics)
   * 
   * @throws EscrowException {@linkplain Fault#REENTRANT_CALL} if a pass
   *         is already open
   */
  public Pass enter(String operation) throws EscrowException {
    if (holder != null)
      throw new EscrowException(
          Fault.REENTRANT_CALL,
          "'%s' attempted while '%s' in progress".formatted(operation, holder));
    holder = operation;
    return new Pass();
  }
  
  
  /** Returns {@code true} iff a pass is open. */
  public boolean isHeld() {
    return holder != null;
  }
  
  
  /**
   * An open pass. Closing it (more than once is harmless) clears the gate.
   */
  public final class Pass implements AutoCloseable {
    
    private boolean closed;
    
    private Pass() {  }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        holder = null;
      }
    }
  }

}
