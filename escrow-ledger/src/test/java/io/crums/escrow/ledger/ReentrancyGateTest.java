/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.crums.escrow.EscrowException;
import io.crums.escrow.Fault;


public class ReentrancyGateTest {
  
  
  @Test
  public void testEnterExit() {
    var gate = new ReentrancyGate();
    assertFalse(gate.isHeld());
    try (var pass = gate.enter("a")) {
      assertTrue(gate.isHeld());
    }
    assertFalse(gate.isHeld());
    try (var pass = gate.enter("b")) {
      assertTrue(gate.isHeld());
    }
  }
  
  
  @Test
  public void testReenter() {
    var gate = new ReentrancyGate();
    try (var pass = gate.enter("outer")) {
      var x = assertThrows(EscrowException.class, () -> gate.enter("inner"));
      assertEquals(Fault.REENTRANT_CALL, x.fault());
      assertTrue(x.getMessage().contains("outer"));
      // a failed entry does not release the outer pass
      assertTrue(gate.isHeld());
    }
    assertFalse(gate.isHeld());
  }
  
  
  @Test
  public void testReleasedOnFailure() {
    var gate = new ReentrancyGate();
    assertThrows(IllegalStateException.class, () -> {
      try (var pass = gate.enter("failing")) {
        throw new IllegalStateException("mock");
      }
    });
    assertFalse(gate.isHeld());
  }
  
  
  @Test
  public void testDoubleClose() {
    var gate = new ReentrancyGate();
    var first = gate.enter("first");
    first.close();
    var second = gate.enter("second");
    first.close();
    assertTrue(gate.isHeld());
    second.close();
    assertFalse(gate.isHeld());
  }

}
