/**
 * Filter contract and registry.
 *
 * <ul>
 *   <li>{@link com.docproof.filter.Filter} – a single validation check; {@link com.docproof.filter.FilterContext}
 *       is what it sees while running</li>
 *   <li>{@link com.docproof.filter.result} – {@link com.docproof.filter.result.StepResult} and
 *       {@link com.docproof.filter.result.Diagnostic}, the data every check produces</li>
 *   <li>{@link com.docproof.filter.registry} – {@link com.docproof.filter.registry.FilterRegistry}
 *       (id and alias lookup, listing, lifecycle hooks)</li>
 * </ul>
 */
package com.docproof.filter;
