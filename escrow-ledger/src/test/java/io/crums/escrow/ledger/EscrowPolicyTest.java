/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.ledger;


import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.escrow.Address;
import io.crums.escrow.json.JsonParsingException;


public class EscrowPolicyTest {
  
  final static Address HUB = Address.of("0xc12c");
  
  
  @Test
  public void testDefaults() {
    var policy = EscrowPolicy.withHub(HUB);
    assertTrue(policy.inRange(EscrowPolicy.DEFAULT_MIN));
    assertTrue(policy.inRange(EscrowPolicy.DEFAULT_MAX));
    assertFalse(policy.inRange(EscrowPolicy.DEFAULT_MAX.add(BigInteger.ONE)));
    assertFalse(policy.inRange(EscrowPolicy.DEFAULT_MIN.subtract(BigInteger.ONE)));
  }
  
  
  @Test
  public void testBadBounds() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new EscrowPolicy(HUB, BigInteger.ZERO, BigInteger.TEN));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EscrowPolicy(HUB, BigInteger.TEN, BigInteger.ONE));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EscrowPolicy(Address.SENTINEL, BigInteger.ONE, BigInteger.TEN));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EscrowPolicy(HUB, BigInteger.ONE, BigInteger.ONE.shiftLeft(192)));
  }
  
  
  @Test
  public void testParseString() {
    String json = "{\"hub\": \"0xc12c\", \"min_amount\": 5, \"max_amount\": \"100000000000000000000\"}";
    var policy = EscrowPolicy.PARSER.toEntity(json);
    assertEquals(HUB, policy.hub());
    assertEquals(BigInteger.valueOf(5), policy.minAmount());
    assertEquals(EscrowPolicy.DEFAULT_MAX, policy.maxAmount());
  }
  
  
  @Test
  public void testParseDefaults() {
    var policy = EscrowPolicy.PARSER.toEntity("{\"hub\": \"0xc12c\"}");
    assertEquals(EscrowPolicy.withHub(HUB), policy);
  }
  
  
  @Test
  public void testParseResource() throws Exception {
    try (var in = getClass().getResourceAsStream("/escrow-policy.json")) {
      assertNotNull(in);
      var policy = EscrowPolicy.PARSER.toEntity(new InputStreamReader(in, StandardCharsets.UTF_8));
      assertEquals(Address.of("0xc12c00000000000000000000000000000000c12c"), policy.hub());
      assertEquals(EscrowPolicy.DEFAULT_MIN, policy.minAmount());
      assertEquals(EscrowPolicy.DEFAULT_MAX, policy.maxAmount());
    }
  }
  
  
  @Test
  public void testParseFile(@TempDir Path dir) throws Exception {
    var policy = new EscrowPolicy(HUB, EscrowPolicy.DEFAULT_MIN, EscrowPolicy.DEFAULT_MAX);
    var file = dir.resolve("policy.json");
    Files.writeString(file, EscrowPolicy.PARSER.toJsonObject(policy).toJSONString());
    
    assertEquals(policy, EscrowPolicy.PARSER.toEntity(file.toFile()));
    
    var missing = dir.resolve("missing.json").toFile();
    assertThrows(UncheckedIOException.class, () -> EscrowPolicy.PARSER.toEntity(missing));
  }
  
  
  @Test
  public void testUnquotedLargeAmount() {
    String json = "{\"hub\": \"0xc12c\", \"min_amount\": 96000000000000000000}";
    var x = assertThrows(JsonParsingException.class, () -> EscrowPolicy.PARSER.toEntity(json));
    assertTrue(x.getMessage().contains("quote"), x.getMessage());
    assertThrows(
        JsonParsingException.class,
        () -> EscrowPolicy.PARSER.toEntity(new StringReader(json)));
    
    // quoted, the same bound parses
    var policy = EscrowPolicy.PARSER.toEntity(
        "{\"hub\": \"0xc12c\", \"min_amount\": \"96000000000000000000\"}");
    assertEquals(EscrowPolicy.DEFAULT_MIN, policy.minAmount());
  }
  
  
  @Test
  public void testToJson() {
    var policy = new EscrowPolicy(HUB, BigInteger.ONE, BigInteger.TEN);
    var jObj = EscrowPolicy.PARSER.toJsonObject(policy);
    assertEquals(HUB.toString(), jObj.get("hub"));
    assertEquals("1", jObj.get("min_amount"));
    assertEquals(policy, EscrowPolicy.PARSER.toEntity(jObj.toJSONString()));
  }
  
  
  @Test
  public void testParseErrors() {
    assertThrows(JsonParsingException.class, () -> EscrowPolicy.PARSER.toEntity("{}"));
    assertThrows(JsonParsingException.class, () -> EscrowPolicy.PARSER.toEntity("{\"hub\": 7}"));
    assertThrows(JsonParsingException.class, () -> EscrowPolicy.PARSER.toEntity("{\"hub\": \"0xq\"}"));
    assertThrows(
        JsonParsingException.class,
        () -> EscrowPolicy.PARSER.toEntity("{\"hub\": \"0xc12c\", \"min_amount\": 1.5}"));
    assertThrows(
        JsonParsingException.class,
        () -> EscrowPolicy.PARSER.toEntity("{\"hub\": \"0xc12c\", \"min_amount\": \"10\", \"max_amount\": \"9\"}"));
    assertThrows(JsonParsingException.class, () -> EscrowPolicy.PARSER.toEntity("[1, 2]"));
    assertThrows(JsonParsingException.class, () -> EscrowPolicy.PARSER.toEntity("{\"hub\": "));
  }

}
