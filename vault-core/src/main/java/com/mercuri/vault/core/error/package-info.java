/**
 * Vault error taxonomy.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.error.VaultErrorCode} - Distinguishable failure reasons</li>
 *   <li>{@link com.mercuri.vault.core.error.VaultException} - Unchecked exception carrying an error code</li>
 * </ul>
 *
 * <h2>Propagation Policy</h2>
 * <ul>
 *   <li><strong>All-or-nothing:</strong> Every error aborts and reverts the in-flight operation</li>
 *   <li><strong>No local recovery:</strong> Errors are never caught and retried inside the vault</li>
 *   <li><strong>Setup errors:</strong> CONFIGURATION_ERROR prevents the vault from being created</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.error;
