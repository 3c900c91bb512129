/**
 * Engine configuration: process-wide defaults read from {@code DOCPROOF_*} environment variables
 * ({@link com.docproof.config.EngineSettings}) and per-tenant overrides
 * ({@link com.docproof.config.TenantSettings}).
 */
package com.docproof.config;
