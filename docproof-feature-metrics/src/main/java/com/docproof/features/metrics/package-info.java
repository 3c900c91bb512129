/**
 * Micrometer metrics for pipeline runs, plugged in as {@link com.docproof.engine.hooks.PipelineHooks}.
 */
package com.docproof.features.metrics;
