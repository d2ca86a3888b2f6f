/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Concrete decay function and day clock.
 */
package io.crums.escrow.decay;
