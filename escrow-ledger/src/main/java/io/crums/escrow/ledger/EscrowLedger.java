/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import static io.crums.escrow.EscrowConstants.logDebug;
import static io.crums.escrow.EscrowConstants.logWarning;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import io.crums.escrow.Address;
import io.crums.escrow.AmountOutOfRangeException;
import io.crums.escrow.Balance;
import io.crums.escrow.DayClock;
import io.crums.escrow.DecayFunction;
import io.crums.escrow.Escrow;
import io.crums.escrow.EscrowException;
import io.crums.escrow.Fault;
import io.crums.escrow.IdentityOracle;
import io.crums.escrow.LinkedAddressIndex;
import io.crums.escrow.ValueMover;
import io.crums.escrow.ledger.EscrowEvent.Type;

/**
 * Demurrage-adjusted invitation escrow ledger.
 * 
 * <h2>State</h2>
 * <p>
 * At most one {@linkplain Escrow} per (inviter, invitee) pair, plus two
 * {@linkplain LinkedAddressIndex} instances: inviter &rarr; invitees, and
 * invitee &rarr; inviters. A pair is listed in both indexes iff it has an
 * escrow. The escrow's current value is projected from its face value by the
 * {@linkplain DecayFunction}.
 * </p>
 * <h3>Zero-valued Escrows</h3>
 * <p>
 * An escrow whose value has decayed to zero is treated as absent by
 * {@linkplain #redeem(Address, Address) redeem} and
 * {@linkplain #revokeOne(Address, Address) revokeOne} (both fail with
 * {@linkplain Fault#NO_SUCH_RELATIONSHIP}), and a new lock notice for the pair
 * replaces it. Until then it stays listed in both indexes,
 * {@linkplain #hasEscrow(Address, Address) hasEscrow} reports it, and
 * {@linkplain #currentBalanceAndAge(Address, Address) currentBalanceAndAge}
 * reports a zero amount with its age. Other than re-creation, it is cleared only
 * by {@linkplain #revokeAll(Address) revokeAll} or by the invitee redeeming
 * another inviter's escrow.
 * </p>
 * <h2>Operations</h2>
 * <p>
 * Four mutating entry points, each passing through the same
 * {@linkplain ReentrancyGate}:
 * </p>
 * <ul>
 * <li>{@linkplain #onLock(Address, LockNotice)}: creates an escrow from a
 * lock notice delivered by the hub.</li>
 * <li>{@linkplain #redeem(Address, Address)}: the invitee redeems one
 * inviter's escrow; every other inviter's escrow for that invitee is
 * refunded in the same step.</li>
 * <li>{@linkplain #revokeOne(Address, Address)}: the inviter takes back
 * one escrow.</li>
 * <li>{@linkplain #revokeAll(Address)}: the inviter takes back all its
 * escrows in one transfer.</li>
 * </ul>
 * <h2>Atomicity</h2>
 * <p>
 * Preconditions are checked before any state changes. State is then
 * changed <em>before</em> any value is moved out. If a collaborator throws
 * while value is being moved, every change made by the call is undone before
 * the exception propagates. Events are published only after the call commits.
 * </p>
 * <p>
 * Top-level requests are serialized (methods are {@code synchronized}).
 * </p>
 */
public class EscrowLedger {
  
  private final EscrowPolicy policy;
  private final IdentityOracle identity;
  private final ValueMover mover;
  private final DecayFunction decay;
  private final DayClock clock;
  
  private final Map<Pair, Escrow> escrows = new HashMap<>();
  private final LinkedAddressIndex inviteesByInviter = new LinkedAddressIndex();
  private final LinkedAddressIndex invitersByInvitee = new LinkedAddressIndex();
  
  private final ReentrancyGate gate = new ReentrancyGate();
  
  private final List<EscrowListener> listeners = new CopyOnWriteArrayList<>();
  
  
  /**
   * Full constructor.
   * 
   * @param policy    amount bounds and hub address
   * @param identity  eligibility and trust registry
   * @param mover     moves value out of custody
   * @param decay     demurrage
   * @param clock     day index source
   */
  public EscrowLedger(
      EscrowPolicy policy, IdentityOracle identity, ValueMover mover,
      DecayFunction decay, DayClock clock) {
    
    this.policy = Objects.requireNonNull(policy, "null policy");
    this.identity = Objects.requireNonNull(identity, "null identity");
    this.mover = Objects.requireNonNull(mover, "null mover");
    this.decay = Objects.requireNonNull(decay, "null decay");
    this.clock = Objects.requireNonNull(clock, "null clock");
  }
  
  
  public EscrowPolicy policy() {
    return policy;
  }
  
  
  public void addListener(EscrowListener listener) {
    listeners.add(Objects.requireNonNull(listener, "null listener"));
  }
  
  
  public boolean removeListener(EscrowListener listener) {
    return listeners.remove(listener);
  }
  
  
  
  //    - -   R E A D S   - -
  
  
  /**
   * Returns the inviters with an escrow for the given invitee, most recent
   * first.
   */
  public synchronized List<Address> listInviters(Address invitee) {
    return invitersByInvitee.enumerate(invitee);
  }
  
  
  /**
   * Returns the invitees the given inviter has an escrow for, most recent
   * first.
   */
  public synchronized List<Address> listInvitees(Address inviter) {
    return inviteesByInviter.enumerate(inviter);
  }
  
  
  /**
   * Returns the current (decayed) balance of the given pair's escrow, and
   * its age in days.
   * 
   * @return {@linkplain Balance#NONE} if there is no escrow for the pair
   */
  public synchronized Balance currentBalanceAndAge(Address inviter, Address invitee) {
    Escrow escrow = escrows.get(new Pair(inviter, invitee));
    return escrow == null ? Balance.NONE : escrow.balance(decay, clock.today());
  }
  
  
  /** Returns {@code true} iff the pair has an escrow. */
  public synchronized boolean hasEscrow(Address inviter, Address invitee) {
    return escrows.containsKey(new Pair(inviter, invitee));
  }
  
  
  /** Returns the number of escrows. */
  public synchronized int size() {
    return escrows.size();
  }
  
  
  
  //    - -   W R I T E S   - -
  
  
  /**
   * Creates an escrow from a lock notice. The locked value is the notice's
   * amount of the inviter's own asset; the invitee is decoded from the
   * notice's payload. Checks, in order, failing on the first:
   * <ol>
   * <li>{@code caller} is the hub: {@linkplain Fault#UNAUTHORIZED_CALLER}</li>
   * <li>the asset owner (inviter) is eligible: {@linkplain Fault#INELIGIBLE_PRINCIPAL}</li>
   * <li>operator, source and asset owner agree: {@linkplain Fault#OPERATOR_MISMATCH}</li>
   * <li>amount is in range: {@linkplain AmountOutOfRangeException}</li>
   * <li>payload decodes: {@linkplain Fault#MALFORMED_PAYLOAD}</li>
   * <li>invitee is not onboarded: {@linkplain Fault#COUNTERPART_ALREADY_ONBOARDED}</li>
   * <li>invitee is a principal: {@linkplain Fault#INVALID_COUNTERPART}</li>
   * <li>no escrow for the pair: {@linkplain Fault#DUPLICATE_RELATIONSHIP}</li>
   * <li>inviter trusts invitee: {@linkplain Fault#TRUST_MISSING_OR_EXPIRED}</li>
   * </ol>
   * 
   * @param caller  the address delivering the notice
   * @param notice  the lock notice
   * 
   * @throws EscrowException on any failed check (state is unchanged)
   */
  public synchronized void onLock(Address caller, LockNotice notice)
      throws EscrowException {
    
    Objects.requireNonNull(notice, "null notice");
    try (var pass = gate.enter("create")) {
      
      if (!policy.hub().equals(caller))
        throw new EscrowException(
            Fault.UNAUTHORIZED_CALLER, "caller " + caller + " is not the hub");
      
      final Address inviter = notice.assetOwner();
      if (!identity.isEligiblePrincipal(inviter))
        throw new EscrowException(
            Fault.INELIGIBLE_PRINCIPAL, "inviter " + inviter + " not eligible");
      
      if (!notice.operator().equals(notice.from()) || !notice.from().equals(inviter))
        throw new EscrowException(
            Fault.OPERATOR_MISMATCH,
            "operator %s / from %s / asset owner %s"
            .formatted(notice.operator(), notice.from(), inviter));
      
      policy.checkRange(notice.amount());
      
      final Address invitee = notice.counterpart();
      
      create(inviter, invitee, notice.amount(), clock.today());
    }
  }
  
  
  private void create(Address inviter, Address invitee, BigInteger amount, long today) {
    
    if (identity.isOnboarded(invitee))
      throw new EscrowException(
          Fault.COUNTERPART_ALREADY_ONBOARDED, "invitee " + invitee + " already onboarded");
    
    if (!invitee.isPrincipal())
      throw new EscrowException(
          Fault.INVALID_COUNTERPART, "invalid invitee " + invitee);
    
    final Pair pair = new Pair(inviter, invitee);
    final Escrow spent = escrows.get(pair);
    if (spent != null && spent.project(decay, today).signum() != 0)
      throw new EscrowException(
          Fault.DUPLICATE_RELATIONSHIP, "escrow exists for " + pair);
    
    if (!identity.trusts(inviter, invitee))
      throw new EscrowException(
          Fault.TRUST_MISSING_OR_EXPIRED, inviter + " does not trust " + invitee);
    
    if (spent != null) {
      // decayed to zero: same as absent
      inviteesByInviter.remove(inviter, invitee);
      invitersByInvitee.remove(invitee, inviter);
      escrows.remove(pair);
      logDebug("replacing zero-valued escrow " + spent + " for " + pair);
    }
    
    escrows.put(pair, new Escrow(amount, today));
    inviteesByInviter.insert(inviter, invitee);
    invitersByInvitee.insert(invitee, inviter);
    
    logDebug("escrowed " + amount + " for " + pair + " on day " + today);
    publish(List.of(new EscrowEvent(Type.ESCROWED, inviter, invitee, amount)));
  }
  
  
  /**
   * Redeems {@code chosenInviter}'s escrow for {@code invitee}. Every
   * escrow for the invitee is settled in this one step: the chosen inviter's
   * in the original asset, the others' in the wrapped (decaying) form.
   * 
   * @param invitee       the caller
   * @param chosenInviter the inviter credited with the onboarding
   * 
   * @return the amount settled to {@code chosenInviter}
   * 
   * @throws EscrowException {@linkplain Fault#NO_SUCH_RELATIONSHIP} if there is
   *         no escrow (or only a zero-valued one) for the chosen pair;
   *         {@linkplain Fault#TRUST_MISSING_OR_EXPIRED} if the chosen inviter
   *         no longer trusts the invitee. State is unchanged on failure.
   */
  public synchronized BigInteger redeem(Address invitee, Address chosenInviter)
      throws EscrowException {
    
    Objects.requireNonNull(invitee, "null invitee");
    Objects.requireNonNull(chosenInviter, "null chosenInviter");
    try (var pass = gate.enter("redeem")) {
      
      final long today = clock.today();
      checkActive(chosenInviter, invitee, today);
      
      if (!identity.trusts(chosenInviter, invitee))
        throw new EscrowException(
            Fault.TRUST_MISSING_OR_EXPIRED,
            chosenInviter + " no longer trusts " + invitee);
      
      var txn = new Txn();
      BigInteger redeemed = BigInteger.ZERO;
      try {
        var settlements = new ArrayList<EscrowEvent>();
        for (Address inviter : invitersByInvitee.enumerate(invitee)) {
          BigInteger settled = destroy(txn, inviter, invitee, today);
          Type type = inviter.equals(chosenInviter) ? Type.REDEEMED : Type.REFUNDED;
          settlements.add(new EscrowEvent(type, inviter, invitee, settled));
        }
        for (var settlement : settlements) {
          if (settlement.type() == Type.REDEEMED) {
            redeemed = settlement.amount();
            mover.transferOriginal(settlement.inviter(), redeemed);
          } else if (settlement.amount().signum() > 0)
            mover.convertAndTransfer(settlement.inviter(), settlement.amount());
          txn.events.add(settlement);
        }
      } catch (Throwable x) {
        txn.rollback("redeem by " + invitee, x);
        throw x;
      }
      
      txn.commit();
      return redeemed;
    }
  }
  
  
  /**
   * Revokes the inviter's escrow for the given invitee, returning its
   * current value to the inviter in the wrapped (decaying) form.
   * 
   * @param inviter   the caller
   * @param invitee   the invitee
   * 
   * @return the amount settled
   * 
   * @throws EscrowException {@linkplain Fault#NO_SUCH_RELATIONSHIP} if there is
   *         no escrow (or only a zero-valued one) for the pair
   */
  public synchronized BigInteger revokeOne(Address inviter, Address invitee)
      throws EscrowException {
    
    Objects.requireNonNull(inviter, "null inviter");
    Objects.requireNonNull(invitee, "null invitee");
    try (var pass = gate.enter("revokeOne")) {
      
      final long today = clock.today();
      checkActive(inviter, invitee, today);
      
      var txn = new Txn();
      BigInteger settled;
      try {
        settled = destroy(txn, inviter, invitee, today);
        mover.convertAndTransfer(inviter, settled);
      } catch (Throwable x) {
        txn.rollback("revokeOne by " + inviter, x);
        throw x;
      }
      txn.events.add(new EscrowEvent(Type.REVOKED, inviter, invitee, settled));
      txn.commit();
      return settled;
    }
  }
  
  
  /**
   * Revokes all the inviter's escrows, returning their combined current value
   * in one wrapped (decaying) transfer. One {@linkplain Type#REVOKED} event is
   * published per escrow. If the {@linkplain ValueMover#heldBalance(Address)
   * held balance} is known and less than the combined value, only the held
   * balance is transferred.
   * <p>
   * An inviter with no escrows is a no-op: nothing is transferred or published.
   * </p>
   * 
   * @param inviter   the caller
   * 
   * @return the amount transferred
   */
  public synchronized BigInteger revokeAll(Address inviter) throws EscrowException {
    
    Objects.requireNonNull(inviter, "null inviter");
    try (var pass = gate.enter("revokeAll")) {
      
      List<Address> invitees = inviteesByInviter.enumerate(inviter);
      if (invitees.isEmpty())
        return BigInteger.ZERO;
      
      final long today = clock.today();
      var txn = new Txn();
      BigInteger total = BigInteger.ZERO;
      try {
        for (Address invitee : invitees) {
          BigInteger settled = destroy(txn, inviter, invitee, today);
          total = total.add(settled);
          txn.events.add(new EscrowEvent(Type.REVOKED, inviter, invitee, settled));
        }
        var held = mover.heldBalance(inviter);
        if (held.isPresent() && held.get().signum() < 0)
          throw new IllegalStateException(
              "negative held balance for " + inviter + ": " + held.get());
        if (held.isPresent() && held.get().compareTo(total) < 0) {
          logWarning(
              "capping revokeAll by %s to held balance %s (projected %s)"
              .formatted(inviter, held.get(), total));
          total = held.get();
        }
        if (total.signum() > 0)
          mover.convertAndTransfer(inviter, total);
      } catch (Throwable x) {
        txn.rollback("revokeAll by " + inviter, x);
        throw x;
      }
      
      txn.commit();
      return total;
    }
  }
  
  
  
  //    - -   I N T E R N A L S   - -
  
  
  /**
   * Checks the pair has an escrow with a non-zero value today.
   * 
   * @throws EscrowException {@linkplain Fault#NO_SUCH_RELATIONSHIP} o.w.
   */
  private void checkActive(Address inviter, Address invitee, long today) {
    final Pair pair = new Pair(inviter, invitee);
    Escrow escrow = escrows.get(pair);
    if (escrow == null)
      throw new EscrowException(Fault.NO_SUCH_RELATIONSHIP, "no escrow for " + pair);
    if (escrow.project(decay, today).signum() == 0)
      throw new EscrowException(
          Fault.NO_SUCH_RELATIONSHIP, "escrow for " + pair + " decayed to zero");
  }
  
  
  /**
   * Removes the pair's escrow from the map and both indexes, journaling
   * the undo steps, and returns its projected value.
   */
  private BigInteger destroy(Txn txn, Address inviter, Address invitee, long today) {
    final Pair pair = new Pair(inviter, invitee);
    final Escrow escrow = escrows.get(pair);
    if (escrow == null)
      throw new IllegalStateException("index lists " + pair + " but no escrow");
    final BigInteger settled = escrow.project(decay, today);
    
    final Address inviteePred = inviteesByInviter.unlink(inviter, invitee);
    final Address inviterPred = invitersByInvitee.unlink(invitee, inviter);
    escrows.remove(pair);
    
    txn.undo.push(() -> {
      escrows.put(pair, escrow);
      if (inviteePred != null)
        inviteesByInviter.relink(inviter, inviteePred, invitee);
      if (inviterPred != null)
        invitersByInvitee.relink(invitee, inviterPred, inviter);
    });
    
    if (inviteePred == null || inviterPred == null)
      throw new IllegalStateException("indexes out of sync on " + pair);
    return settled;
  }
  
  
  private void publish(List<EscrowEvent> events) {
    for (var event : events) {
      logDebug(event.toString());
      for (var listener : listeners) {
        try {
          listener.onEvent(event);
        } catch (RuntimeException x) {
          logWarning("listener " + listener + " failed on " + event + ": " + x);
        }
      }
    }
  }
  
  
  /** Undo journal and pending events of one mutating call. */
  private class Txn {
    
    final Deque<Runnable> undo = new ArrayDeque<>();
    final List<EscrowEvent> events = new ArrayList<>();
    
    void rollback(String operation, Throwable cause) {
      logWarning("rolling back " + operation + " on " + cause);
      while (!undo.isEmpty())
        undo.pop().run();
      events.clear();
    }
    
    void commit() {
      undo.clear();
      publish(events);
    }
  }
  
  
  /** Escrow map key. */
  private record Pair(Address inviter, Address invitee) {
    
    @Override
    public String toString() {
      return "(" + inviter + " -> " + invitee + ")";
    }
  }

}
