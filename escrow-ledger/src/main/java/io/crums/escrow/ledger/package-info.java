/*
 * Copyright 2026 Babak Farhang
 */
/**
 * The invitation escrow ledger and its hook, gate, events and configuration.
 * 
 * @see io.crums.escrow.ledger.EscrowLedger EscrowLedger, the main entry point
 */
package io.crums.escrow.ledger;
