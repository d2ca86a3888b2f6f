/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.crums.escrow.Address;
import io.crums.escrow.IdentityOracle;

/**
 * Mutable in-memory identity registry.
 */
class MockIdentity implements IdentityOracle {
  
  final Set<Address> eligible = new HashSet<>();
  final Set<Address> onboarded = new HashSet<>();
  final Set<List<Address>> trust = new HashSet<>();
  
  /** Invoked (if set) on every {@linkplain #trusts(Address, Address)} query. */
  Runnable onTrustQuery;
  
  
  MockIdentity eligible(Address... addresses) {
    eligible.addAll(List.of(addresses));
    return this;
  }
  
  MockIdentity trust(Address truster, Address trustee) {
    trust.add(List.of(truster, trustee));
    return this;
  }
  
  MockIdentity untrust(Address truster, Address trustee) {
    trust.remove(List.of(truster, trustee));
    return this;
  }

  @Override
  public boolean isEligiblePrincipal(Address address) {
    return eligible.contains(address);
  }

  @Override
  public boolean isOnboarded(Address address) {
    return onboarded.contains(address);
  }

  @Override
  public boolean trusts(Address truster, Address trustee) {
    if (onTrustQuery != null)
      onTrustQuery.run();
    return trust.contains(List.of(truster, trustee));
  }

}
