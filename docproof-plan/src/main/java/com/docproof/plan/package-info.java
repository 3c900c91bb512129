/**
 * Execution plans: model, JSON serialization, hashing and validation.
 *
 * <ul>
 *   <li>{@link com.docproof.plan.model} – {@link com.docproof.plan.model.ExecutionPlan},
 *       {@link com.docproof.plan.model.ExecutionStep}, conditions and failure policies</li>
 *   <li>{@link com.docproof.plan.hash} – canonical JSON and {@code sha256:} hashing</li>
 *   <li>{@link com.docproof.plan.build} – {@link com.docproof.plan.build.PlanBuilder} and the built-in plans</li>
 *   <li>{@link com.docproof.plan.timeout} – step deadline resolution (step → ancestor → plan → global)</li>
 *   <li>{@link com.docproof.plan.policy} – effective failure policy of a step</li>
 *   <li>{@link com.docproof.plan.PlanConfig} – {@code fromJson}/{@code toJson};
 *       {@link com.docproof.plan.PlanValidator} – structural checks before a run</li>
 * </ul>
 */
package com.docproof.plan;
