/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow.json;

/**
 * Unchecked exception for illegal JSON input: malformed syntax, a missing
 * or mistyped field, or a value the entity itself rejects. When the entity
 * rejected the value, the cause is the entity's own exception.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RuntimeException {

  public JsonParsingException(String message) {
    super(message);
  }

  /** Wraps the entity's rejection of an otherwise well-formed value. */
  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
