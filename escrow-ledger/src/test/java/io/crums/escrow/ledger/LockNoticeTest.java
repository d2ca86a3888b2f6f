/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import io.crums.escrow.Address;
import io.crums.escrow.EscrowException;
import io.crums.escrow.Fault;


public class LockNoticeTest {
  
  final static Address INVITER = Address.of("0x5a5a5a5a5a5a5a5a5a5a5a5a5a5a5a5a5a5a5a5a");
  final static Address INVITEE = Address.of("0xffeeddccbbaa99887766554433221100ffeeddcc");
  
  
  @Test
  public void testPayload() {
    byte[] payload = LockNotice.encodePayload(INVITEE);
    assertEquals(LockNotice.WORD, payload.length);
    for (int index = 0; index < 12; ++index)
      assertEquals(0, payload[index]);
    assertEquals((byte) 0xff, payload[12]);
    assertEquals((byte) 0xcc, payload[31]);
    
    var notice = LockNotice.of(INVITER, BigInteger.TEN, INVITEE);
    assertEquals(INVITEE, notice.counterpart());
    assertEquals(INVITER, notice.assetOwner());
    assertEquals(INVITER, notice.operator());
    assertEquals(INVITER, notice.from());
  }
  
  
  @Test
  public void testPayloadCopied() {
    byte[] payload = LockNotice.encodePayload(INVITEE);
    var notice = new LockNotice(INVITER, INVITER, INVITER.assetId(), BigInteger.TEN, payload);
    payload[31] = 0;
    notice.payload()[30] = 0;
    assertEquals(INVITEE, notice.counterpart());
    assertEquals(notice, LockNotice.of(INVITER, BigInteger.TEN, INVITEE));
    assertEquals(notice.hashCode(), LockNotice.of(INVITER, BigInteger.TEN, INVITEE).hashCode());
  }
  
  
  @Test
  public void testMalformed() {
    var tooLong = new LockNotice(INVITER, INVITER, INVITER.assetId(), BigInteger.TEN, new byte[64]);
    var x = assertThrows(EscrowException.class, tooLong::counterpart);
    assertEquals(Fault.MALFORMED_PAYLOAD, x.fault());
    
    byte[] dirty = LockNotice.encodePayload(INVITEE);
    dirty[11] = 1;
    var dirtyNotice = new LockNotice(INVITER, INVITER, INVITER.assetId(), BigInteger.TEN, dirty);
    x = assertThrows(EscrowException.class, dirtyNotice::counterpart);
    assertEquals(Fault.MALFORMED_PAYLOAD, x.fault());
  }

}
