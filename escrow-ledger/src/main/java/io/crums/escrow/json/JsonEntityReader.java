/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.json;


import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON read-interface for an entity.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {

  
  /**
   * Returns the given JSON as the typed instance.
   * 
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  /**
   * Returns the given JSON input as a typed entity.
   * 
   * @throws JsonParsingException if the given JSON is malformed, is not
   *         a single object, or has an integer literal beyond 64 bits
   */
  default T toEntity(String json) throws JsonParsingException {
    try {
      return toEntity(asObject(new JSONParser().parse(json)));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    } catch (NumberFormatException nfx) {
      throw numberOverflow(nfx);
    }
  }
  

  /**
   * Returns the given JSON input as a typed entity.
   * 
   * @throws JsonParsingException if the given JSON is malformed, or is not
   *         a single object
   * 
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    try {
      return toEntity(asObject(new JSONParser().parse(reader)));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json", px);
    } catch (NumberFormatException nfx) {
      throw numberOverflow(nfx);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }
  
  
  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = new FileReader(file, StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }
  
  
  /**
   * {@code json.simple} lexes every integer literal as a {@code long}; larger
   * literals fail in the lexer itself.
   */
  private static JsonParsingException numberOverflow(NumberFormatException nfx) {
    return new JsonParsingException(
        "integer literal overflows 64 bits (quote large amounts as decimal strings): " +
        nfx.getMessage(), nfx);
  }
  
  
  private static JSONObject asObject(Object parsed) throws JsonParsingException {
    if (parsed instanceof JSONObject)
      return (JSONObject) parsed;
    throw new JsonParsingException("expected a JSON object: " + parsed);
  }
  
}
