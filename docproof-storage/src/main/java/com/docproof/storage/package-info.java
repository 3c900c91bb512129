/**
 * Temporary document storage and guaranteed cleanup.
 *
 * <ul>
 *   <li>{@link com.docproof.storage.TempStore} – TTL key-value contract with secure deletion;
 *       {@link com.docproof.storage.memory.InMemoryTempStore} is the process-local implementation</li>
 *   <li>{@link com.docproof.storage.cleanup.RunCleanupEnforcer} – removes a run's entries when it ends;
 *       failures go to a {@link com.docproof.storage.cleanup.CleanupQueue} for bounded retries</li>
 * </ul>
 */
package com.docproof.storage;
