/**
 * Per-run state: {@link com.docproof.executioncontext.ValidationContext} created from a
 * {@link com.docproof.executioncontext.ContextInit}, with injectable id generation and clock.
 */
package com.docproof.executioncontext;
