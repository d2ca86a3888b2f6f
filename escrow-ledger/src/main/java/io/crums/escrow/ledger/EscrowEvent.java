/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import java.math.BigInteger;
import java.util.Objects;

import io.crums.escrow.Address;

/**
 * Notification published by the ledger on a committed state change.
 * 
 * @param type      what happened
 * @param inviter   the escrow's inviter
 * @param invitee   the escrow's invitee
 * @param amount    the face value (on {@linkplain Type#ESCROWED}), or the
 *                  settled amount
 */
public record EscrowEvent(Type type, Address inviter, Address invitee, BigInteger amount) {
  
  public enum Type {
    /** Value locked for an invitee. */
    ESCROWED,
    /** The invitee redeemed this inviter's escrow. */
    REDEEMED,
    /** Another inviter's escrow was redeemed; this one was returned. */
    REFUNDED,
    /** The inviter took the escrow back. */
    REVOKED;
  }
  
  
  public EscrowEvent {
    Objects.requireNonNull(type, "null type");
    Objects.requireNonNull(inviter, "null inviter");
    Objects.requireNonNull(invitee, "null invitee");
    Objects.requireNonNull(amount, "null amount");
  }

}
