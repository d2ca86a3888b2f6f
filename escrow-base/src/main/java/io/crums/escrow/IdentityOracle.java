/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;

/**
 * Identity and trust registry consulted by the ledger. Its answers are
 * authoritative at the moment they are asked; the ledger caches none of them.
 */
public interface IdentityOracle {
  
  /**
   * Returns {@code true} iff the given address may sponsor invitations.
   */
  boolean isEligiblePrincipal(Address address);
  
  /**
   * Returns {@code true} iff the given address has already completed
   * onboarding (and so can no longer be invited).
   */
  boolean isOnboarded(Address address);
  
  /**
   * Returns {@code true} iff {@code truster} currently trusts {@code trustee}.
   */
  boolean trusts(Address truster, Address trustee);

}
