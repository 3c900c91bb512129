/**
 * Validation report model and its JSON form.
 */
package com.docproof.engine.report;
