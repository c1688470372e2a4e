package com.mercuri.vault.core.spi;

/**
 * Collaborator-state journal SPI for all-or-nothing operations.
 *
 * <p>A vault operation opens a checkpoint before touching any collaborator and either releases it on
 * success or reverts to it on failure, so a failed operation leaves balances and positions exactly as
 * they were before the call.</p>
 *
 * <p><strong>Transaction Boundary:</strong></p>
 * <pre>
 * Checkpoint cp = journal.checkpoint();
 * try {
 *     ... operation ...
 *     journal.release(cp);
 * } catch (RuntimeException e) {
 *     journal.revertTo(cp);
 *     throw e;
 * }
 * </pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface StateJournal {

    /**
     * Opens a checkpoint.
     *
     * @return checkpoint handle
     */
    Checkpoint checkpoint();

    /**
     * Restores collaborator state captured by the checkpoint.
     *
     * @param checkpoint checkpoint to revert to
     */
    void revertTo(Checkpoint checkpoint);

    /**
     * Discards the checkpoint after a successful operation.
     *
     * @param checkpoint checkpoint to release
     */
    void release(Checkpoint checkpoint);

    /**
     * Checkpoint handle.
     *
     * @param sequence monotonically increasing checkpoint number
     */
    record Checkpoint(long sequence) {
    }
}
