/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.json;


import java.math.BigInteger;

import org.json.simple.JSONObject;

import io.crums.escrow.Address;

/**
 * Typed getters over {@code json.simple} objects.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  /**
   * Returns the named integral value. Accepts either a JSON integer, or
   * a decimal string (for values that overflow a {@code long}).
   */
  public static BigInteger getBigInteger(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected integral '" + name + "' missing");
      return null;
    }
    if (value instanceof Long || value instanceof Integer)
      return BigInteger.valueOf(((Number) value).longValue());
    if (value instanceof String) {
      try {
        return new BigInteger((String) value);
      } catch (NumberFormatException nfx) {
        throw new JsonParsingException("'" + name + "' expects an integral string: " + value, nfx);
      }
    }
    throw new JsonParsingException("'" + name + "' expects an integral value: " + value);
  }
  
  
  public static Address getAddress(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    String hex = getString(jObj, name, require);
    if (hex == null)
      return null;
    try {
      return Address.of(hex);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("'" + name + "' expects an address: " + hex, iax);
    }
  }


}
