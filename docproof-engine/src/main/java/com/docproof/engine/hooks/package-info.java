/**
 * Lifecycle observers. Hook failures are logged and never affect a run.
 */
package com.docproof.engine.hooks;
