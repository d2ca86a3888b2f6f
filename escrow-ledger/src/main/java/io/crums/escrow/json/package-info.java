/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JSON reading and writing, built on {@code json.simple}.
 */
package io.crums.escrow.json;
