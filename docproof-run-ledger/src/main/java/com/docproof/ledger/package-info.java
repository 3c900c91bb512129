/**
 * Run ledger: an append-only record of which plan snapshot each run executed, how each step ended,
 * and the fingerprint the run produced.
 * <ul>
 *   <li>{@link com.docproof.ledger.RunLedger} – fail-safe facade used by the engine</li>
 *   <li>{@link com.docproof.ledger.LedgerStore} – storage seam; {@link com.docproof.ledger.NoOpLedgerStore}
 *       and {@link com.docproof.ledger.InMemoryLedgerStore}</li>
 * </ul>
 */
package com.docproof.ledger;
