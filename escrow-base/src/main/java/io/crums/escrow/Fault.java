/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;

/**
 * Error kinds raised by the escrow ledger. Each precondition that can fail
 * has its own kind; none is silently coerced.
 * 
 * @see EscrowException#fault()
 */
public enum Fault {
  
  /** A lock notice was delivered by something other than the hub. */
  UNAUTHORIZED_CALLER,
  /** The inviter is not an eligible (registered) principal. */
  INELIGIBLE_PRINCIPAL,
  /** The transfer's operator or source is not the inviter. */
  OPERATOR_MISMATCH,
  /** The locked amount lies outside the configured closed range. */
  AMOUNT_OUT_OF_RANGE,
  /** The counterpart payload does not decode to a single address. */
  MALFORMED_PAYLOAD,
  /** The invitee is already onboarded. */
  COUNTERPART_ALREADY_ONBOARDED,
  /** The invitee is the zero address or the sentinel. */
  INVALID_COUNTERPART,
  /** An active escrow already exists for the (inviter, invitee) pair. */
  DUPLICATE_RELATIONSHIP,
  /** No active escrow exists for the (inviter, invitee) pair. */
  NO_SUCH_RELATIONSHIP,
  /** The inviter does not (or no longer) trusts the invitee. */
  TRUST_MISSING_OR_EXPIRED,
  /** A guarded operation was entered while another was in progress. */
  REENTRANT_CALL;

}
