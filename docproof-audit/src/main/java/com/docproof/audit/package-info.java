/**
 * Audit trail of a run.
 *
 * <ul>
 *   <li>{@link com.docproof.audit.snapshot} – plan snapshot, engine versions and {@code planHash}</li>
 *   <li>{@link com.docproof.audit.config} – effective runtime configuration (defaults, tenant, request)</li>
 *   <li>{@link com.docproof.audit.fingerprint} – status, checks, risk notes and the compliance fingerprint</li>
 *   <li>{@link com.docproof.audit.score} – 0..100 compliance score</li>
 * </ul>
 */
package com.docproof.audit;
