/**
 * No-operation implementations of protection SPIs.
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.protection.noop;
