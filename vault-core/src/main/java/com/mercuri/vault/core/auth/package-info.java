/**
 * Two-tier authorization package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.auth.Role} - OWNER / MANAGER / DENIED classification</li>
 *   <li>{@link com.mercuri.vault.core.auth.OperationClass} - DELEGATED vs OWNER_ONLY operations</li>
 *   <li>{@link com.mercuri.vault.core.auth.AuthorizationGate} - Live classification of a caller</li>
 * </ul>
 *
 * <h2>Trust Model</h2>
 * <ul>
 *   <li><strong>Owner:</strong> Unconditionally authorized for every operation</li>
 *   <li><strong>Manager:</strong> Delegated operations only, and only while the registry reports approval</li>
 *   <li><strong>Capital:</strong> No manager-accessible withdrawal path exists</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.auth;
