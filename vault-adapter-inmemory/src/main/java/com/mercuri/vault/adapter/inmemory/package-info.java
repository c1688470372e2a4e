/**
 * In-memory adapters that simulate the external world a vault operates in.
 *
 * <p>Everything here is single-process and intended for tests and local experimentation:</p>
 * <ul>
 *   <li>{@code asset} - token and native balances, wrapped native asset</li>
 *   <li>{@code exchange} - pool directory, position manager, swap router</li>
 *   <li>{@code registry} - global manager approvals</li>
 *   <li>{@code factory} - vault deployment and protocol fees</li>
 *   <li>{@code event} - committed event log</li>
 *   <li>{@code world} - the container tying them together, with checkpoint and revert</li>
 * </ul>
 */
package com.mercuri.vault.adapter.inmemory;
