/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;

/**
 * Source of the absolute, monotonic day index.
 */
@FunctionalInterface
public interface DayClock {
  
  /** Returns today's day index (&ge; 0). */
  long today();

}
