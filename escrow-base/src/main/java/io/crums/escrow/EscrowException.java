/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;

import java.util.Objects;

/**
 * Base exception in the <code>escrow</code> modules. Every instance
 * names its {@linkplain Fault kind}. When thrown from a ledger operation,
 * no state was changed by that operation.
 */
@SuppressWarnings("serial")
public class EscrowException extends RuntimeException {
  
  private final Fault fault;

  public EscrowException(Fault fault, String message) {
    super(message);
    this.fault = Objects.requireNonNull(fault, "null fault");
  }

  public EscrowException(Fault fault, String message, Throwable cause) {
    super(message, cause);
    this.fault = Objects.requireNonNull(fault, "null fault");
  }
  
  
  /** Returns the error kind. Never {@code null}. */
  public final Fault fault() {
    return fault;
  }
  

  @Override
  public String getMessage() {
    return "[" + fault + "] " + super.getMessage();
  }

}
