/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Value types, the relationship index, and the collaborator interfaces
 * of the invitation escrow ledger.
 * 
 * @see io.crums.escrow.LinkedAddressIndex LinkedAddressIndex, the
 *      bidirectional relationship index building block
 */
package io.crums.escrow;
