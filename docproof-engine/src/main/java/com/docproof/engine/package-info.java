/**
 * Pipeline engine: runs an execution plan's steps against one document and assembles the report.
 * <ul>
 *   <li>{@link com.docproof.engine.PipelineEngine} – entry point; validates the request, runs the plan,
 *       always cleans up temp data and returns a {@link com.docproof.engine.report.ValidationReport}</li>
 *   <li>{@link com.docproof.engine.PipelineInput} – document, plan, tenant and request overrides</li>
 *   <li>Ordering, failure policies, step and pipeline deadlines and the in-flight cap are applied per run</li>
 * </ul>
 */
package com.docproof.engine;
